package com.parallax.core.model;

/**
 * Outcome of one task execution hook call.
 */
public record TaskResult(boolean success, String output) {

    public static TaskResult success(String output) {
        return new TaskResult(true, output);
    }

    public static TaskResult failure(String output) {
        return new TaskResult(false, output);
    }
}
