package com.parallax.core.planning;

import com.parallax.core.model.TaskCategory;

import java.util.List;

/**
 * Maps a free-text task description to a {@link TaskCategory} with an ordered keyword table.
 * <p>
 * Rules are evaluated top to bottom and the first rule with a matching keyword wins;
 * matching is a case-insensitive substring test. Setup and bug-fix rules come first
 * because their keywords often appear next to feature-sounding text. Anything left
 * unmatched is a {@link TaskCategory#FEATURE}.
 */
public final class TaskClassifier {

    private record Rule(TaskCategory category, List<String> keywords) {}

    private static final List<Rule> RULES = List.of(
            new Rule(TaskCategory.SETUP, List.of("create", "initialize", "setup", "scaffold")),
            new Rule(TaskCategory.BUG_FIX, List.of("fix", "bug", "resolve", "repair")),
            new Rule(TaskCategory.TEST, List.of("test", "coverage", "spec")),
            new Rule(TaskCategory.DOCS, List.of("document", "readme", "docs", "comment")),
            new Rule(TaskCategory.OPTIMIZATION, List.of("optimi", "refactor", "improve", "enhance", "performance"))
    );

    private TaskClassifier() {} // utility class

    /**
     * Classifies one task description. Total: null or blank input yields FEATURE.
     */
    public static TaskCategory classify(String description) {
        if (description == null || description.isBlank()) {
            return TaskCategory.FEATURE;
        }
        String lower = description.toLowerCase();
        for (Rule rule : RULES) {
            for (String keyword : rule.keywords()) {
                if (lower.contains(keyword)) {
                    return rule.category();
                }
            }
        }
        return TaskCategory.FEATURE;
    }
}
