package com.parallax.core.model;

/**
 * Snapshot of the dispatcher's concurrency budget.
 *
 * @param current   workspaces currently active
 * @param max       configured ceiling
 * @param available {@code max - current}, never negative
 */
public record Capacity(int current, int max, int available) {

    public static Capacity of(int current, int max) {
        return new Capacity(current, max, Math.max(0, max - current));
    }
}
