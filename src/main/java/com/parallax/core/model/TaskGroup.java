package com.parallax.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A batch of task descriptions sharing a category, scheduled as one unit.
 *
 * @param id                unique group identifier (e.g., "group-feature-0")
 * @param tasks             ordered member task descriptions
 * @param category          category shared by all member tasks
 * @param priority          scheduling priority, higher runs sooner
 * @param dependencies      IDs of groups that must complete before this group is ready
 * @param estimatedMinutes  informational duration estimate
 * @param resumeBranch      existing branch to re-attach to instead of creating one, nullable
 */
public record TaskGroup(
    String id,
    List<String> tasks,
    TaskCategory category,
    int priority,
    List<String> dependencies,
    int estimatedMinutes,
    String resumeBranch
) implements Serializable {

    public TaskGroup {
        tasks = List.copyOf(tasks);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public TaskGroup(String id, List<String> tasks, TaskCategory category, int priority,
                     List<String> dependencies, int estimatedMinutes) {
        this(id, tasks, category, priority, dependencies, estimatedMinutes, null);
    }

    public boolean isResume() {
        return resumeBranch != null && !resumeBranch.isBlank();
    }
}
