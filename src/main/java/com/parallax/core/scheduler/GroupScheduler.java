package com.parallax.core.scheduler;

import com.parallax.core.model.TaskGroup;
import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Tracks the registered {@link TaskGroup}s of one run and their completion state, and
 * computes which groups are ready to start.
 * <p>
 * {@link #register(List)} validates the predecessor graph up front, so a group whose
 * predecessors can never complete is rejected before anything is scheduled instead of
 * waiting forever.
 */
public class GroupScheduler {

    private static final Logger log = LoggerFactory.getLogger(GroupScheduler.class);

    private final Map<String, TaskGroup> groups = new LinkedHashMap<>();
    private final Set<String> completed = new HashSet<>();
    private Graph<String, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);

    /**
     * Replaces the registered set and clears completion state.
     *
     * @throws SchedulingException     with {@code UNKNOWN_DEPENDENCY} for a dangling predecessor id
     * @throws CycleDetectedException  when the predecessor relation has a cycle
     */
    public synchronized void register(List<TaskGroup> newGroups) {
        var byId = new LinkedHashMap<String, TaskGroup>();
        for (TaskGroup group : newGroups) {
            if (byId.putIfAbsent(group.id(), group) != null) {
                throw new SchedulingException(SchedulingException.DUPLICATE_GROUP,
                        "Group " + group.id() + " registered twice");
            }
        }

        Graph<String, DefaultEdge> candidate = new DefaultDirectedGraph<>(DefaultEdge.class);
        byId.keySet().forEach(candidate::addVertex);
        for (TaskGroup group : byId.values()) {
            for (String dep : group.dependencies()) {
                if (!byId.containsKey(dep)) {
                    throw new SchedulingException(SchedulingException.UNKNOWN_DEPENDENCY,
                            "Group '" + group.id() + "' depends on unknown group '" + dep + "'");
                }
                // predecessor -> dependent
                candidate.addEdge(dep, group.id());
            }
        }

        CycleDetector<String, DefaultEdge> detector = new CycleDetector<>(candidate);
        if (detector.detectCycles()) {
            Set<String> cycle = new TreeSet<>(detector.findCycles());
            log.error("Dependency cycle detected between groups {}", cycle);
            throw new CycleDetectedException(cycle);
        }

        groups.clear();
        groups.putAll(byId);
        completed.clear();
        graph = candidate;
        log.debug("Registered {} groups, {} dependency edges", groups.size(), graph.edgeSet().size());
    }

    /**
     * Groups not yet completed whose predecessors are all completed, by descending priority
     * (registration order breaks ties), truncated to {@code maxCount}.
     */
    public synchronized List<TaskGroup> readyGroups(int maxCount) {
        if (maxCount <= 0) return List.of();
        var ready = new ArrayList<TaskGroup>();
        for (TaskGroup group : groups.values()) {
            if (completed.contains(group.id())) continue;
            if (completed.containsAll(group.dependencies())) {
                ready.add(group);
            } else {
                log.debug("  {} blocked on {}", group.id(), group.dependencies());
            }
        }
        ready.sort(Comparator.comparingInt(TaskGroup::priority).reversed());
        return ready.size() > maxCount ? List.copyOf(ready.subList(0, maxCount)) : List.copyOf(ready);
    }

    /**
     * Marks a group completed. Idempotent; unknown ids are ignored.
     */
    public synchronized void markCompleted(String groupId) {
        if (!groups.containsKey(groupId)) {
            log.warn("Ignoring completion of unknown group {}", groupId);
            return;
        }
        if (completed.add(groupId)) {
            log.info("Task group completed: {} ({}%)", groupId, progressPercent());
        }
    }

    public synchronized boolean isCompleted(String groupId) {
        return completed.contains(groupId);
    }

    public synchronized boolean isAllCompleted() {
        return completed.size() == groups.size();
    }

    /** 100 for an empty set, otherwise the rounded share of completed groups. */
    public synchronized int progressPercent() {
        if (groups.isEmpty()) return 100;
        return (int) Math.round(completed.size() * 100.0 / groups.size());
    }

    public synchronized List<TaskGroup> pendingGroups() {
        return groups.values().stream().filter(g -> !completed.contains(g.id())).toList();
    }

    public synchronized List<TaskGroup> allGroups() {
        return List.copyOf(groups.values());
    }

    /** A dependency-respecting order over all registered groups. */
    public synchronized List<String> topologicalOrder() {
        var order = new ArrayList<String>();
        new TopologicalOrderIterator<>(graph).forEachRemaining(order::add);
        return order;
    }

    public synchronized String summary() {
        var sb = new StringBuilder();
        sb.append(String.format("Groups: %d total, %d completed (%d%%)%n",
                groups.size(), completed.size(), progressPercent()));
        for (TaskGroup group : groups.values()) {
            sb.append(String.format("  [%s] %s priority=%d tasks=%d est=%dm deps=%s%n",
                    completed.contains(group.id()) ? "x" : " ",
                    group.id(), group.priority(), group.tasks().size(),
                    group.estimatedMinutes(), group.dependencies()));
        }
        return sb.toString();
    }

    public synchronized void reset() {
        groups.clear();
        completed.clear();
        graph = new DefaultDirectedGraph<>(DefaultEdge.class);
    }
}
