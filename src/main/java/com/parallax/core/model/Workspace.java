package com.parallax.core.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * An isolated unit of mutable project state bound to one {@link TaskGroup}.
 * <p>
 * Status and counters are mutated by exactly one lifecycle worker at a time; the only
 * foreign writer is {@link #stop()}, which is why every accessor is synchronized.
 */
public class Workspace {

    public static final String STOPPED = "stopped";

    private final String id;
    private final String name;
    private final String groupId;
    private final TaskCategory category;
    private final int priority;
    private final List<String> tasks;
    private final boolean resumed;
    private final Instant createdAt;

    private WorkspaceStatus status = WorkspaceStatus.IDLE;
    private Instant lastUpdate;
    private Path path;
    private int tasksCompleted;
    private int tasksFailed;
    private int evolutionGeneration;
    private boolean verificationPassed;
    private WorkspaceStatus failedPhase;
    private String error;
    private boolean stopRequested;
    private Runnable stopListener;

    public Workspace(String id, String name, TaskGroup group) {
        this.id = id;
        this.name = name;
        this.groupId = group.id();
        this.category = group.category();
        this.priority = group.priority();
        this.tasks = group.tasks();
        this.resumed = group.isResume();
        this.createdAt = Instant.now();
        this.lastUpdate = createdAt;
    }

    /**
     * Moves to {@code next}, rejecting any move the state machine does not allow.
     *
     * @throws InvalidStateTransitionException if the transition is illegal
     */
    public synchronized void transitionTo(WorkspaceStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new InvalidStateTransitionException(id, status, next);
        }
        status = next;
        touch();
    }

    /**
     * Marks the workspace FAILED, recording the phase it failed in. Returns false when the
     * workspace already reached a terminal state, in which case nothing changes.
     */
    public synchronized boolean fail(WorkspaceStatus phase, String message) {
        if (status.isTerminal()) {
            return false;
        }
        failedPhase = phase;
        error = message;
        status = WorkspaceStatus.FAILED;
        touch();
        return true;
    }

    /**
     * External stop: forces a non-terminal workspace to FAILED with error "stopped", then
     * notifies the stop listener so in-flight work can be abandoned.
     */
    public boolean stop() {
        Runnable listener;
        synchronized (this) {
            if (status.isTerminal()) {
                return false;
            }
            stopRequested = true;
            fail(status, STOPPED);
            listener = stopListener;
        }
        if (listener != null) {
            listener.run();
        }
        return true;
    }

    /** Registers the callback run by {@link #stop()}; the lifecycle uses it to cancel hook calls. */
    public synchronized void onStop(Runnable listener) {
        this.stopListener = listener;
    }

    public synchronized boolean isStopRequested() {
        return stopRequested;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    public synchronized boolean isReadyToMerge() {
        return status == WorkspaceStatus.TESTING && verificationPassed;
    }

    public synchronized void recordTaskCompleted() {
        tasksCompleted++;
        touch();
    }

    public synchronized void recordTaskFailed() {
        tasksFailed++;
        touch();
    }

    public synchronized int nextEvolutionGeneration() {
        evolutionGeneration++;
        touch();
        return evolutionGeneration;
    }

    public synchronized void markVerified(boolean passed) {
        verificationPassed = passed;
        touch();
    }

    public synchronized void attach(Path path) {
        this.path = path;
        touch();
    }

    private void touch() {
        lastUpdate = Instant.now();
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getGroupId() { return groupId; }
    public TaskCategory getCategory() { return category; }
    public int getPriority() { return priority; }
    public List<String> getTasks() { return tasks; }
    public boolean isResumed() { return resumed; }
    public Instant getCreatedAt() { return createdAt; }

    public synchronized WorkspaceStatus getStatus() { return status; }
    public synchronized Instant getLastUpdate() { return lastUpdate; }
    public synchronized Path getPath() { return path; }
    public synchronized int getTasksCompleted() { return tasksCompleted; }
    public synchronized int getTasksFailed() { return tasksFailed; }
    public synchronized int getEvolutionGeneration() { return evolutionGeneration; }
    public synchronized boolean isVerificationPassed() { return verificationPassed; }
    public synchronized WorkspaceStatus getFailedPhase() { return failedPhase; }
    public synchronized String getError() { return error; }

    @Override
    public synchronized String toString() {
        return "Workspace[" + id + " " + name + " " + status + "]";
    }
}
