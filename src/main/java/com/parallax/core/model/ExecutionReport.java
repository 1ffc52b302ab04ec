package com.parallax.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Final report of one dispatcher run.
 *
 * @param runId          identifier of the run
 * @param startedAt      when the run began
 * @param finishedAt     when the run ended (normally or by stall)
 * @param totalGroups    number of groups registered for the run
 * @param outcomes       per-group outcomes in completion order
 * @param merges         merge batches in the order they ran
 * @param peakActive     highest number of simultaneously active workspaces
 * @param stalledGroups  groups left unsatisfiable when the run stalled, empty otherwise
 */
public record ExecutionReport(
    String runId,
    Instant startedAt,
    Instant finishedAt,
    int totalGroups,
    List<GroupOutcome> outcomes,
    List<MergeReport> merges,
    int peakActive,
    List<String> stalledGroups
) {

    public ExecutionReport {
        outcomes = List.copyOf(outcomes);
        merges = List.copyOf(merges);
        stalledGroups = stalledGroups == null ? List.of() : List.copyOf(stalledGroups);
    }

    public List<GroupOutcome> completed() {
        return outcomes.stream().filter(GroupOutcome::succeeded).toList();
    }

    public List<GroupOutcome> failed() {
        return outcomes.stream().filter(o -> !o.succeeded()).toList();
    }

    public boolean isStalled() {
        return !stalledGroups.isEmpty();
    }

    /** True when every registered group finished, regardless of individual workspace failures. */
    public boolean allGroupsFinished() {
        return !isStalled() && outcomes.size() == totalGroups;
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }
}
