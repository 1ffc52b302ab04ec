package com.parallax.core.model;

/**
 * Thrown when a workspace is asked to move to a state its current state cannot reach.
 */
public class InvalidStateTransitionException extends RuntimeException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    private final WorkspaceStatus currentState;
    private final WorkspaceStatus targetState;

    public InvalidStateTransitionException(String workspaceId, WorkspaceStatus currentState,
                                           WorkspaceStatus targetState) {
        super(String.format("Cannot transition workspace %s from %s to %s",
                workspaceId, currentState, targetState));
        this.currentState = currentState;
        this.targetState = targetState;
    }

    public WorkspaceStatus getCurrentState() {
        return currentState;
    }

    public WorkspaceStatus getTargetState() {
        return targetState;
    }

    public String getErrorCode() {
        return ERROR_CODE;
    }
}
