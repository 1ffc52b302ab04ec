package com.parallax.core.resume;

import com.parallax.core.model.TaskCategory;
import com.parallax.core.model.WorkspaceInfo;
import com.parallax.core.planning.BranchNameGenerator;
import com.parallax.workspace.BranchActivity;
import com.parallax.workspace.WorkspaceException;
import com.parallax.workspace.WorkspaceInventory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inventories existing non-mainline workspaces at startup and decides which ones can be
 * resumed automatically.
 * <p>
 * A workspace is resumable when its name carries a known category prefix
 * ({@code feature}, {@code fix}, {@code docs}, {@code test}, {@code refactor}) and its last
 * commit is strictly newer than the recency window.
 */
public class ResumeScanner {

    private static final Logger log = LoggerFactory.getLogger(ResumeScanner.class);

    static final Pattern INTENT_PREFIX = Pattern.compile("^(feature|fix|docs|test|refactor|config|ui)[/-]");
    private static final Pattern SEQUENCE_SUFFIX = Pattern.compile(BranchNameGenerator.SEQUENCE_SEPARATOR + "\\d+$");
    static final Set<String> RESUMABLE_PREFIXES = Set.of("feature", "fix", "docs", "test", "refactor");
    private static final Set<String> ALWAYS_EXCLUDED = Set.of("master");

    private final WorkspaceInventory inventory;
    private final Clock clock;
    private final Duration recencyWindow;

    public ResumeScanner(WorkspaceInventory inventory, Clock clock, Duration recencyWindow) {
        this.inventory = inventory;
        this.clock = clock;
        this.recencyWindow = recencyWindow;
    }

    /** Same inventory and clock, different recency window. */
    public ResumeScanner withRecencyWindow(Duration window) {
        return new ResumeScanner(inventory, clock, window);
    }

    public Duration getRecencyWindow() {
        return recencyWindow;
    }

    /**
     * Lists every non-mainline workspace with its derived intent and resumability.
     * An inventory failure is logged and yields an empty list.
     */
    public List<WorkspaceInfo> scan() {
        List<BranchActivity> branches;
        try {
            branches = inventory.listBranches();
        } catch (WorkspaceException e) {
            log.warn("Could not list existing workspaces: {}", e.getMessage());
            return List.of();
        }

        String mainline = inventory.mainline();
        Instant cutoff = clock.instant().minus(recencyWindow);
        var result = new ArrayList<WorkspaceInfo>();
        for (BranchActivity branch : branches) {
            if (branch.name().equals(mainline) || ALWAYS_EXCLUDED.contains(branch.name())) {
                continue;
            }
            String prefix = prefixOf(branch.name());
            boolean recent = branch.committedAt() != null && branch.committedAt().isAfter(cutoff);
            boolean resumable = prefix != null && RESUMABLE_PREFIXES.contains(prefix) && recent;
            TaskCategory category = prefix == null ? null : TaskCategory.fromBranchPrefix(prefix).orElse(null);

            var info = new WorkspaceInfo(branch.name(), branch.lastCommit(), branch.subject(),
                    branch.committedAt(), extractIntent(branch.name()), category, resumable);
            log.debug("Found workspace {} intent='{}' resumable={}", info.name(), info.intent(), resumable);
            result.add(info);
        }
        log.info("Found {} existing workspaces, {} resumable", result.size(),
                result.stream().filter(WorkspaceInfo::resumable).count());
        return result;
    }

    /** True when the workspace has at least one commit the mainline does not. */
    public boolean hasUnmergedWork(WorkspaceInfo info) {
        try {
            return inventory.commitsAhead(info.name(), inventory.mainline()) > 0;
        } catch (WorkspaceException e) {
            log.warn("Could not compare {} with {}: {}", info.name(), inventory.mainline(), e.getMessage());
            return false;
        }
    }

    public List<WorkspaceInfo> resumable(List<WorkspaceInfo> infos) {
        return infos.stream().filter(WorkspaceInfo::resumable).toList();
    }

    /**
     * Strips the category prefix and the generator's {@code --<sequence>} suffix, turns dashes
     * and underscores into spaces and capitalizes the first letter:
     * {@code feature/add-login--3} becomes {@code Add login}, while a number that is part of
     * the name stays ({@code feature/oauth-2} becomes {@code Oauth 2}).
     */
    static String extractIntent(String branchName) {
        String stripped = INTENT_PREFIX.matcher(branchName).replaceFirst("");
        stripped = SEQUENCE_SUFFIX.matcher(stripped).replaceFirst("");
        String words = stripped.replace('-', ' ').replace('_', ' ').replace('/', ' ').trim();
        if (words.isEmpty()) {
            return branchName;
        }
        return Character.toUpperCase(words.charAt(0)) + words.substring(1);
    }

    private static String prefixOf(String branchName) {
        Matcher m = INTENT_PREFIX.matcher(branchName);
        return m.find() ? m.group(1) : null;
    }
}
