package com.parallax.core.planning;

import com.parallax.core.model.TaskCategory;
import com.parallax.core.model.TaskGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions task descriptions into prioritized, inter-dependent {@link TaskGroup}s.
 * <p>
 * Group shape for one call:
 * <ul>
 *   <li>{@code group-setup}: every setup task, no predecessors</li>
 *   <li>{@code group-feature-N}: feature tasks in chunks of {@value #FEATURE_CHUNK_SIZE},
 *       each depending on the setup group when there is one</li>
 *   <li>{@code group-bugfix}: every bug fix, no predecessors</li>
 *   <li>{@code group-tests}: every test task, depending on all feature groups</li>
 *   <li>{@code group-docs}: every documentation task, no predecessors</li>
 *   <li>{@code group-optimization}: every optimization task, depending on all groups above</li>
 * </ul>
 * Predecessors always point to groups emitted earlier, so the graph is acyclic.
 */
@Service
public class TaskGrouper {

    private static final Logger log = LoggerFactory.getLogger(TaskGrouper.class);

    static final int FEATURE_CHUNK_SIZE = 2;

    public static final String SETUP_GROUP_ID = "group-setup";
    public static final String FEATURE_GROUP_PREFIX = "group-feature-";
    public static final String BUG_FIX_GROUP_ID = "group-bugfix";
    public static final String TEST_GROUP_ID = "group-tests";
    public static final String DOCS_GROUP_ID = "group-docs";
    public static final String OPTIMIZATION_GROUP_ID = "group-optimization";

    /**
     * Builds the group list for {@code descriptions}. Deterministic; an empty input yields
     * an empty list.
     */
    public List<TaskGroup> group(List<String> descriptions) {
        if (descriptions == null || descriptions.isEmpty()) {
            log.info("No tasks to group");
            return List.of();
        }

        Map<TaskCategory, List<String>> buckets = new EnumMap<>(TaskCategory.class);
        for (String description : descriptions) {
            TaskCategory category = TaskClassifier.classify(description);
            buckets.computeIfAbsent(category, k -> new ArrayList<>()).add(description);
            log.debug("Classified '{}' as {}", description, category.tag());
        }

        var groups = new ArrayList<TaskGroup>();

        List<String> setup = buckets.getOrDefault(TaskCategory.SETUP, List.of());
        if (!setup.isEmpty()) {
            groups.add(new TaskGroup(SETUP_GROUP_ID, setup, TaskCategory.SETUP,
                    TaskCategory.SETUP.groupPriority(), List.of(), 15));
        }

        List<String> features = buckets.getOrDefault(TaskCategory.FEATURE, List.of());
        List<String> featureGroupIds = new ArrayList<>();
        List<String> featureDeps = setup.isEmpty() ? List.of() : List.of(SETUP_GROUP_ID);
        for (int i = 0, chunk = 0; i < features.size(); i += FEATURE_CHUNK_SIZE, chunk++) {
            String id = FEATURE_GROUP_PREFIX + chunk;
            List<String> members = features.subList(i, Math.min(i + FEATURE_CHUNK_SIZE, features.size()));
            groups.add(new TaskGroup(id, members, TaskCategory.FEATURE,
                    TaskCategory.FEATURE.groupPriority(), featureDeps, 30));
            featureGroupIds.add(id);
        }

        List<String> bugs = buckets.getOrDefault(TaskCategory.BUG_FIX, List.of());
        if (!bugs.isEmpty()) {
            groups.add(new TaskGroup(BUG_FIX_GROUP_ID, bugs, TaskCategory.BUG_FIX,
                    TaskCategory.BUG_FIX.groupPriority(), List.of(), 20));
        }

        List<String> tests = buckets.getOrDefault(TaskCategory.TEST, List.of());
        if (!tests.isEmpty()) {
            groups.add(new TaskGroup(TEST_GROUP_ID, tests, TaskCategory.TEST,
                    TaskCategory.TEST.groupPriority(), featureGroupIds, 25));
        }

        List<String> docs = buckets.getOrDefault(TaskCategory.DOCS, List.of());
        if (!docs.isEmpty()) {
            groups.add(new TaskGroup(DOCS_GROUP_ID, docs, TaskCategory.DOCS,
                    TaskCategory.DOCS.groupPriority(), List.of(), 10));
        }

        List<String> optimizations = buckets.getOrDefault(TaskCategory.OPTIMIZATION, List.of());
        if (!optimizations.isEmpty()) {
            List<String> everything = groups.stream().map(TaskGroup::id).toList();
            groups.add(new TaskGroup(OPTIMIZATION_GROUP_ID, optimizations, TaskCategory.OPTIMIZATION,
                    TaskCategory.OPTIMIZATION.groupPriority(), everything, 20));
        }

        log.info("Grouped {} tasks into {} groups", descriptions.size(), groups.size());
        return List.copyOf(groups);
    }
}
