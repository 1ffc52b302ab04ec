package com.parallax.core.scheduler;

import com.parallax.core.model.ExecutionReport;

import java.util.List;

/**
 * Raised by the dispatcher when capacity is free, nothing is active, nothing is ready and
 * incomplete groups remain. Carries everything the run produced before it stalled.
 */
public class StallException extends SchedulingException {

    public static final String STALL = "STALL";

    private final transient ExecutionReport partialReport;
    private final List<String> stuckGroups;

    public StallException(List<String> stuckGroups, ExecutionReport partialReport) {
        super(STALL, "Run stalled with unsatisfiable groups " + stuckGroups);
        this.stuckGroups = List.copyOf(stuckGroups);
        this.partialReport = partialReport;
    }

    public List<String> getStuckGroups() {
        return stuckGroups;
    }

    public ExecutionReport getPartialReport() {
        return partialReport;
    }
}
