package com.parallax.core.model;

/**
 * Status of an individual task inside a workspace.
 */
public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
