package com.parallax.core.merge;

import com.parallax.core.events.EventBus;
import com.parallax.core.events.ParallaxEvent;
import com.parallax.core.logging.MdcContext;
import com.parallax.core.metrics.ParallaxMetrics;
import com.parallax.core.model.InvalidStateTransitionException;
import com.parallax.core.model.MergeReport;
import com.parallax.core.model.Workspace;
import com.parallax.core.model.WorkspaceStatus;
import com.parallax.workspace.MergeHook;
import com.parallax.workspace.WorkspaceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes reintegration of verified workspaces into the single shared mainline.
 *
 * <p>Workspaces are merged one at a time in descending priority, whoever calls in. After
 * each merge attempt the coordinator waits out a settling delay before the next one starts.
 * A failed merge fails only its own workspace; the batch carries on.
 */
public class MergeCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MergeCoordinator.class);

    private final WorkspaceProvider provider;
    private final MergeHook mergeHook;
    private final EventBus events;
    private final ParallaxMetrics metrics;
    private volatile long settleDelayMs;

    private final ReentrantLock mergeLock = new ReentrantLock(true);
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();

    public MergeCoordinator(WorkspaceProvider provider, MergeHook mergeHook, long settleDelayMs,
                            EventBus events, ParallaxMetrics metrics) {
        this.provider = provider;
        this.mergeHook = mergeHook;
        this.settleDelayMs = settleDelayMs;
        this.events = events;
        this.metrics = metrics;
    }

    /**
     * Merges every workspace in {@code workspaces} that passed verification, highest priority
     * first. Workspaces that are not ready to merge are skipped and left untouched.
     */
    public MergeReport mergeAllCompleted(List<Workspace> workspaces) {
        var ready = new ArrayList<Workspace>();
        for (Workspace ws : workspaces) {
            if (ws.isReadyToMerge()) {
                ready.add(ws);
            } else {
                log.debug("Skipping {} for merge: status {}", ws.getId(), ws.getStatus());
            }
        }
        if (ready.isEmpty()) {
            return MergeReport.empty();
        }
        ready.sort(Comparator.comparingInt(Workspace::getPriority).reversed());
        log.info("Merging {} workspaces into {}", ready.size(), provider.mainline());

        var entries = new ArrayList<MergeReport.Entry>();
        mergeLock.lock();
        try {
            for (Workspace ws : ready) {
                entries.add(mergeOne(ws));
                settle();
            }
        } finally {
            mergeLock.unlock();
        }
        return new MergeReport(entries);
    }

    private MergeReport.Entry mergeOne(Workspace ws) {
        int concurrent = inFlight.incrementAndGet();
        peakInFlight.accumulateAndGet(concurrent, Math::max);
        long start = System.currentTimeMillis();
        try {
            try {
                ws.transitionTo(WorkspaceStatus.MERGING);
            } catch (InvalidStateTransitionException e) {
                // stopped between verification and merge
                return new MergeReport.Entry(ws.getId(), ws.getName(), ws.getPriority(), false,
                        String.valueOf(ws.getError()), 0);
            }

            String error = null;
            try {
                provider.release(ws);
                MergeHook.Result result = mergeHook.merge(ws.getName(), provider.mainline());
                if (!result.success()) {
                    error = result.message();
                }
            } catch (Exception e) {
                error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            }

            long elapsed = System.currentTimeMillis() - start;
            if (error == null) {
                ws.transitionTo(WorkspaceStatus.COMPLETED);
                log.info("Merged {} ({}) into {} in {}ms", ws.getId(), ws.getName(), provider.mainline(), elapsed);
                publish(ParallaxEvent.MERGE_SUCCEEDED, ws, Map.of("branch", ws.getName()));
                publish(ParallaxEvent.WORKSPACE_COMPLETED, ws, Map.of("branch", ws.getName()));
            } else {
                ws.fail(WorkspaceStatus.MERGING, error);
                log.warn("Merge of {} ({}) failed: {}", ws.getId(), ws.getName(), error);
                publish(ParallaxEvent.MERGE_FAILED, ws, Map.of("branch", ws.getName(), "error", error));
                publish(ParallaxEvent.WORKSPACE_FAILED, ws, Map.of("phase", WorkspaceStatus.MERGING.name(), "error", error));
            }
            if (metrics != null) {
                metrics.recordMerge(error == null);
            }
            return new MergeReport.Entry(ws.getId(), ws.getName(), ws.getPriority(), error == null, error, elapsed);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void settle() {
        if (settleDelayMs <= 0) return;
        try {
            Thread.sleep(settleDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted during merge settle delay");
        }
    }

    public void setSettleDelayMs(long settleDelayMs) {
        this.settleDelayMs = Math.max(0, settleDelayMs);
    }

    public long getSettleDelayMs() {
        return settleDelayMs;
    }

    /** Highest number of merges ever observed inside the critical section at once. */
    public int peakConcurrentMerges() {
        return peakInFlight.get();
    }

    private void publish(String type, Workspace ws, Map<String, Object> payload) {
        if (events != null) {
            // runId travels on the caller's MDC
            events.publish(ParallaxEvent.of(type, MdcContext.currentRunId(), ws.getGroupId(), ws.getId(), payload));
        }
    }
}
