package com.parallax.core.model;

/**
 * Lifecycle states of a workspace.
 * IDLE -> PLANNING -> IMPLEMENTING -> EVOLVING -> TESTING -> MERGING -> COMPLETED.
 * FAILED is reachable from every non-terminal state. Terminal states are absorbing.
 */
public enum WorkspaceStatus {
    IDLE,
    PLANNING,
    IMPLEMENTING,
    EVOLVING,
    TESTING,
    MERGING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(WorkspaceStatus target) {
        if (target == FAILED) {
            return !isTerminal();
        }
        return switch (this) {
            case IDLE -> target == PLANNING;
            case PLANNING -> target == IMPLEMENTING;
            case IMPLEMENTING -> target == EVOLVING;
            case EVOLVING -> target == TESTING;
            case TESTING -> target == MERGING;
            case MERGING -> target == COMPLETED;
            case COMPLETED, FAILED -> false;
        };
    }

    public String phaseName() {
        return name().toLowerCase();
    }
}
