package com.parallax.core.planning;

import com.parallax.core.model.Task;
import com.parallax.core.model.TaskCategory;
import com.parallax.core.model.TaskPriority;
import com.parallax.core.model.TaskStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-workspace task bookkeeping. Tasks are added in order and move through
 * PENDING, IN_PROGRESS and then COMPLETED or FAILED; every other move is rejected.
 */
public class TaskLedger {

    public static final String TOOL_IMPLEMENT = "implement";
    public static final String TOOL_EVOLVE = "evolve";

    private final String ownerId;
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private int counter;

    public TaskLedger(String ownerId) {
        this.ownerId = ownerId;
    }

    /**
     * Records a classified task with inferred priority and tool tag.
     */
    public Task addTask(String description) {
        TaskCategory category = TaskClassifier.classify(description);
        return addTask(description, category, TaskPriority.inferFor(category), List.of(), toolFor(category));
    }

    public synchronized Task addTask(String description, TaskCategory category, TaskPriority priority,
                                     List<String> dependencies, String tool) {
        String id = ownerId + "-task-" + (++counter);
        Task task = new Task(id, description, category, priority, TaskStatus.PENDING,
                dependencies, tool, Instant.now(), null, null, null, null);
        tasks.put(id, task);
        return task;
    }

    public synchronized Task startTask(String taskId) {
        Task task = require(taskId, TaskStatus.PENDING);
        return put(new Task(task.id(), task.description(), task.category(), task.priority(),
                TaskStatus.IN_PROGRESS, task.dependencies(), task.tool(), task.createdAt(),
                Instant.now(), null, null, null));
    }

    public synchronized Task completeTask(String taskId, String output) {
        Task task = require(taskId, TaskStatus.IN_PROGRESS);
        return put(new Task(task.id(), task.description(), task.category(), task.priority(),
                TaskStatus.COMPLETED, task.dependencies(), task.tool(), task.createdAt(),
                task.startedAt(), Instant.now(), output, null));
    }

    public synchronized Task failTask(String taskId, String error) {
        Task task = require(taskId, TaskStatus.IN_PROGRESS);
        return put(new Task(task.id(), task.description(), task.category(), task.priority(),
                TaskStatus.FAILED, task.dependencies(), task.tool(), task.createdAt(),
                task.startedAt(), Instant.now(), null, error));
    }

    public synchronized Task getTask(String taskId) {
        return tasks.get(taskId);
    }

    public synchronized List<Task> allTasks() {
        return List.copyOf(tasks.values());
    }

    public synchronized List<Task> tasksByStatus(TaskStatus status) {
        return tasks.values().stream().filter(t -> t.status() == status).toList();
    }

    /** Pending tasks whose dependencies have all completed. */
    public synchronized List<Task> executableTasks() {
        var result = new ArrayList<Task>();
        for (Task task : tasks.values()) {
            if (task.status() != TaskStatus.PENDING) continue;
            boolean ready = task.dependencies().stream().allMatch(dep -> {
                Task d = tasks.get(dep);
                return d != null && d.status() == TaskStatus.COMPLETED;
            });
            if (ready) result.add(task);
        }
        return result;
    }

    /** {@link #executableTasks()} ordered HIGH, MEDIUM, LOW; insertion order within a priority. */
    public List<Task> prioritizedExecutableTasks() {
        var executable = new ArrayList<>(executableTasks());
        executable.sort(Comparator.comparing(Task::priority));
        return executable;
    }

    public synchronized Statistics statistics() {
        int total = tasks.size();
        int pending = 0, inProgress = 0, completed = 0, failed = 0;
        for (Task task : tasks.values()) {
            switch (task.status()) {
                case PENDING -> pending++;
                case IN_PROGRESS -> inProgress++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
            }
        }
        double rate = total > 0 ? completed * 100.0 / total : 0.0;
        return new Statistics(total, pending, inProgress, completed, failed, rate);
    }

    public synchronized void clear() {
        tasks.clear();
    }

    public static String toolFor(TaskCategory category) {
        return category == TaskCategory.OPTIMIZATION ? TOOL_EVOLVE : TOOL_IMPLEMENT;
    }

    private Task require(String taskId, TaskStatus expected) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new IllegalStateException("Unknown task " + taskId);
        }
        if (task.status() != expected) {
            throw new IllegalStateException(String.format(
                    "Task %s is %s, expected %s", taskId, task.status(), expected));
        }
        return task;
    }

    private Task put(Task task) {
        tasks.put(task.id(), task);
        return task;
    }

    /**
     * Counts per status plus the completion rate as a percentage.
     */
    public record Statistics(int total, int pending, int inProgress, int completed, int failed,
                             double completionRate) {}
}
