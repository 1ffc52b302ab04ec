package com.parallax.core.planning;

import com.parallax.core.model.TaskGroup;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Derives git branch names for workspaces: {@code <category prefix>/<slug>--<sequence>}.
 * Slugs never contain a double dash, so the sequence can be read back unambiguously.
 */
public final class BranchNameGenerator {

    static final int MAX_SLUG_LENGTH = 50;
    private static final int SLUG_WORDS = 4;
    public static final String SEQUENCE_SEPARATOR = "--";

    private BranchNameGenerator() {}

    /**
     * Lowercases, replaces anything outside {@code [a-z0-9-]} with a dash, collapses dash
     * runs, trims leading and trailing dashes, and caps the result at 50 characters.
     */
    public static String sanitize(String text) {
        if (text == null) return "";
        String slug = text.toLowerCase()
                .replaceAll("[^a-z0-9-]", "-")
                .replaceAll("-+", "-")
                .replaceAll("^-|-$", "");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH).replaceAll("-$", "");
        }
        return slug;
    }

    /**
     * Branch name for the {@code sequence}-th workspace of a run. Resumed groups keep their
     * existing branch.
     */
    public static String forGroup(TaskGroup group, int sequence) {
        if (group.isResume()) {
            return group.resumeBranch();
        }
        String first = group.tasks().isEmpty() ? group.id() : group.tasks().get(0);
        String words = Arrays.stream(first.trim().split("\\s+"))
                .limit(SLUG_WORDS)
                .collect(Collectors.joining(" "));
        String slug = sanitize(words);
        if (slug.isEmpty()) {
            slug = sanitize(group.id());
        }
        return group.category().branchPrefix() + "/" + slug + SEQUENCE_SEPARATOR + sequence;
    }
}
