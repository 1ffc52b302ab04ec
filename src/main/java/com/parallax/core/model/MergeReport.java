package com.parallax.core.model;

import java.util.List;

/**
 * Result of one serial merge batch, in the order the merges were attempted.
 */
public record MergeReport(List<Entry> entries) {

    public MergeReport {
        entries = List.copyOf(entries);
    }

    public static MergeReport empty() {
        return new MergeReport(List.of());
    }

    public List<Entry> merged() {
        return entries.stream().filter(Entry::success).toList();
    }

    public List<Entry> failed() {
        return entries.stream().filter(e -> !e.success()).toList();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * @param workspaceId workspace that was merged
     * @param branch      source branch name
     * @param priority    priority used for ordering
     * @param success     whether integration succeeded
     * @param error       failure message, null on success
     * @param elapsedMs   time spent in the merge critical section
     */
    public record Entry(String workspaceId, String branch, int priority,
                        boolean success, String error, long elapsedMs) {}
}
