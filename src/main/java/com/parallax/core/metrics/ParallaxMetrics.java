package com.parallax.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for dispatch, lifecycle and merge activity.
 */
@Service
public class ParallaxMetrics {

    private final MeterRegistry registry;

    public ParallaxMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordGroupAdmitted(String category) {
        Counter.builder("parallax.groups.admitted")
                .description("Task groups admitted into a workspace")
                .tag("category", category)
                .register(registry)
                .increment();
    }

    public void recordWorkspaceResult(String status) {
        Counter.builder("parallax.workspaces.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordPhaseDuration(String phase, long ms) {
        Timer.builder("parallax.phase.duration")
                .tag("phase", phase)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskExecution(String category, boolean success, long ms) {
        Timer.builder("parallax.task.duration")
                .tag("category", category)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records one merge attempt into the mainline.
     *
     * @param success whether the merge integrated cleanly
     */
    public void recordMerge(boolean success) {
        Counter.builder("parallax.merges.total")
                .description("Serial merges into the mainline")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    /**
     * Records the number of simultaneously active workspaces after each admission.
     *
     * @param count number of active workspaces
     */
    public void recordActiveWorkspaces(int count) {
        DistributionSummary.builder("parallax.active_workspaces")
                .description("Number of simultaneously active workspaces")
                .register(registry)
                .record(count);
    }

    public void recordRunResult(String result) {
        Counter.builder("parallax.runs.total")
                .tag("result", result)
                .register(registry)
                .increment();
    }
}
