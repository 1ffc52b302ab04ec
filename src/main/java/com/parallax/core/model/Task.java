package com.parallax.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * An atomic unit of work executed inside a workspace.
 *
 * @param id           unique identifier (e.g., "WS-001-task-1")
 * @param description  free-text description of the work
 * @param category     category assigned by the classifier
 * @param priority     execution priority within the workspace
 * @param status       current execution status
 * @param dependencies IDs of tasks that must complete first
 * @param tool         assigned tool tag ("implement" or "evolve"), nullable
 * @param createdAt    when the task was recorded
 * @param startedAt    when execution started, nullable
 * @param completedAt  when execution reached a terminal status, nullable
 * @param output       tool output of a completed task, nullable
 * @param error        failure message of a failed task, nullable
 */
public record Task(
    String id,
    String description,
    TaskCategory category,
    TaskPriority priority,
    TaskStatus status,
    List<String> dependencies,
    String tool,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    String output,
    String error
) implements Serializable {

    public Task {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public boolean isTerminal() {
        return status == TaskStatus.COMPLETED || status == TaskStatus.FAILED;
    }
}
