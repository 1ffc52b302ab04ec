package com.parallax.dispatch.cli;

import com.parallax.core.events.ParallaxEvent;
import com.parallax.core.model.ExecutionReport;
import com.parallax.core.model.GroupOutcome;
import com.parallax.core.model.MergeReport;
import com.parallax.core.model.TaskGroup;
import com.parallax.core.model.WorkspaceInfo;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Parallax CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PARALLAX v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PARALLAX]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void group(TaskGroup group) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "@|bold %s|@ [%s] priority %d, ~%dm%s",
                group.id(), group.category().tag(), group.priority(), group.estimatedMinutes(),
                group.dependencies().isEmpty() ? "" : ", after " + String.join(", ", group.dependencies()))));
        for (String task : group.tasks()) {
            System.out.println("    - " + task);
        }
    }

    public static void workspaceInfo(WorkspaceInfo info) {
        String badge = info.resumable() ? "@|fg(green) resumable|@" : "@|fg(yellow) stale|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(cyan) >|@ " + info.name() + " " + badge));
        System.out.println("    Intent: " + info.intent());
        System.out.println("    Last commit: " + truncate(info.lastCommitMessage(), 60)
                + " (" + info.lastActivity() + ")");
    }

    /** One progress line per lifecycle or merge event. */
    public static void event(ParallaxEvent event) {
        String subject = event.workspaceId() != null ? event.workspaceId() : String.valueOf(event.groupId());
        switch (event.eventType()) {
            case ParallaxEvent.GROUP_READY -> info("admitted " + event.groupId() + " as " + subject
                    + " on " + event.payload().get("branch"));
            case ParallaxEvent.WORKSPACE_PHASE -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(blue) [" + subject + "]|@ " + event.payload().get("phase")));
            case ParallaxEvent.MERGE_SUCCEEDED -> success("merged " + event.payload().get("branch"));
            case ParallaxEvent.MERGE_FAILED -> error("merge of " + event.payload().get("branch")
                    + " failed: " + event.payload().get("error"));
            case ParallaxEvent.WORKSPACE_FAILED -> error(subject + " failed in "
                    + event.payload().get("phase") + ": " + event.payload().get("error"));
            default -> {
                // run-level events are summarized by the final report
            }
        }
    }

    public static void report(ExecutionReport report) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "@|bold RUN %s|@ %ds, peak %d active", report.runId(), report.elapsed().toSeconds(),
                report.peakActive())));
        for (GroupOutcome outcome : report.outcomes()) {
            if (outcome.succeeded()) {
                success(String.format("%-20s %-12s %s (%d/%d tasks)", outcome.groupId(),
                        outcome.workspaceId(), outcome.workspaceName(), outcome.tasksCompleted(),
                        outcome.tasksCompleted() + outcome.tasksFailed()));
            } else {
                error(String.format("%-20s %-12s %s failed in %s: %s", outcome.groupId(),
                        outcome.workspaceId(), outcome.workspaceName(), outcome.failedPhase(),
                        outcome.error()));
            }
        }
        int merged = report.merges().stream().mapToInt(m -> m.merged().size()).sum();
        int mergeFailures = report.merges().stream().mapToInt(m -> m.failed().size()).sum();
        System.out.println();
        System.out.printf("Groups: %d/%d finished, %d completed, %d failed | Merges: %d ok, %d failed%n",
                report.outcomes().size(), report.totalGroups(), report.completed().size(),
                report.failed().size(), merged, mergeFailures);
        for (MergeReport batch : report.merges()) {
            for (MergeReport.Entry entry : batch.failed()) {
                error("merge " + entry.branch() + ": " + entry.error());
            }
        }
        if (report.isStalled()) {
            error("Stalled groups: " + String.join(", ", report.stalledGroups()));
        }
    }

    private static String truncate(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
