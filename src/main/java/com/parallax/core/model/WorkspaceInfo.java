package com.parallax.core.model;

import java.time.Instant;

/**
 * Inventory entry for an existing non-mainline workspace, produced by the resume scanner.
 *
 * @param name              branch name
 * @param lastCommit        hash of the most recent commit
 * @param lastCommitMessage subject of the most recent commit
 * @param lastActivity      committer date of the most recent commit
 * @param intent            human-readable intent derived from the name
 * @param category          category implied by the name prefix, nullable
 * @param resumable         whether the workspace qualifies for automatic resumption
 */
public record WorkspaceInfo(
    String name,
    String lastCommit,
    String lastCommitMessage,
    Instant lastActivity,
    String intent,
    TaskCategory category,
    boolean resumable
) {}
