package com.parallax.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Category assigned to a free-text task by {@link com.parallax.core.planning.TaskClassifier}.
 * Each category carries the scheduling priority of its task group and the branch prefix
 * used when a workspace is materialized for it.
 */
public enum TaskCategory {
    SETUP("setup", 10, "feature"),
    FEATURE("feature", 7, "feature"),
    BUG_FIX("bug_fix", 9, "fix"),
    TEST("test", 6, "test"),
    DOCS("docs", 4, "docs"),
    OPTIMIZATION("optimization", 3, "refactor");

    private final String tag;
    private final int groupPriority;
    private final String branchPrefix;

    TaskCategory(String tag, int groupPriority, String branchPrefix) {
        this.tag = tag;
        this.groupPriority = groupPriority;
        this.branchPrefix = branchPrefix;
    }

    public String tag() {
        return tag;
    }

    public int groupPriority() {
        return groupPriority;
    }

    public String branchPrefix() {
        return branchPrefix;
    }

    /**
     * Maps a branch prefix back to the category that produces it. {@code feature} resolves to
     * {@link #FEATURE}; {@link #SETUP} branches are indistinguishable once created.
     */
    public static Optional<TaskCategory> fromBranchPrefix(String prefix) {
        if (prefix == null) return Optional.empty();
        if (FEATURE.branchPrefix.equals(prefix)) return Optional.of(FEATURE);
        return Arrays.stream(values())
                .filter(c -> c.branchPrefix.equals(prefix))
                .findFirst();
    }
}
