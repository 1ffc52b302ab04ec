package com.parallax.workspace;

import java.time.Instant;

/**
 * Latest activity on one local branch.
 */
public record BranchActivity(String name, String lastCommit, String subject, Instant committedAt) {}
