package com.parallax.core.model;

/**
 * Priority of a single task inside a workspace. Execution order is HIGH, MEDIUM, LOW.
 */
public enum TaskPriority {
    HIGH,
    MEDIUM,
    LOW;

    public static TaskPriority inferFor(TaskCategory category) {
        return switch (category) {
            case BUG_FIX -> HIGH;
            case DOCS -> LOW;
            default -> MEDIUM;
        };
    }
}
