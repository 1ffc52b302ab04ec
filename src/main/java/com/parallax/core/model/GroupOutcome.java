package com.parallax.core.model;

/**
 * Final result of one admitted group: the state its workspace ended in, with the failing
 * phase and message when it did not complete.
 */
public record GroupOutcome(
    String groupId,
    TaskCategory category,
    int priority,
    String workspaceId,
    String workspaceName,
    WorkspaceStatus status,
    int tasksCompleted,
    int tasksFailed,
    WorkspaceStatus failedPhase,
    String error,
    long elapsedMs
) {

    public static GroupOutcome of(Workspace workspace, long elapsedMs) {
        return new GroupOutcome(
                workspace.getGroupId(),
                workspace.getCategory(),
                workspace.getPriority(),
                workspace.getId(),
                workspace.getName(),
                workspace.getStatus(),
                workspace.getTasksCompleted(),
                workspace.getTasksFailed(),
                workspace.getFailedPhase(),
                workspace.getError(),
                elapsedMs);
    }

    public boolean succeeded() {
        return status == WorkspaceStatus.COMPLETED;
    }
}
