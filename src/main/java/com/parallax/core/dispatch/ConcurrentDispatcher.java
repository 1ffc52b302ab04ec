package com.parallax.core.dispatch;

import com.parallax.core.events.EventBus;
import com.parallax.core.events.ParallaxEvent;
import com.parallax.core.lifecycle.LifecycleHooks;
import com.parallax.core.lifecycle.WorkspaceLifecycle;
import com.parallax.core.logging.MdcContext;
import com.parallax.core.merge.MergeCoordinator;
import com.parallax.core.metrics.ParallaxMetrics;
import com.parallax.core.model.Capacity;
import com.parallax.core.model.ExecutionReport;
import com.parallax.core.model.GroupOutcome;
import com.parallax.core.model.MergeReport;
import com.parallax.core.model.TaskCategory;
import com.parallax.core.model.TaskGroup;
import com.parallax.core.model.Workspace;
import com.parallax.core.model.WorkspaceInfo;
import com.parallax.core.model.WorkspaceStatus;
import com.parallax.core.planning.BranchNameGenerator;
import com.parallax.core.scheduler.GroupScheduler;
import com.parallax.core.scheduler.SchedulingException;
import com.parallax.core.scheduler.StallException;
import com.parallax.workspace.WorkspaceException;
import com.parallax.workspace.WorkspaceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Admits ready task groups into workspaces under a concurrency budget and drives their
 * lifecycles in parallel.
 *
 * <p>The dispatcher thread owns the run loop: it admits as many ready groups as capacity
 * allows, waits for at least one workspace to finish, merges every finished workspace that
 * passed verification, then marks the groups completed so dependents become ready. Merging
 * before marking completion means a dependent group always branches from a mainline that
 * already contains its predecessors.
 *
 * <p>Workspace failures are collected as outcomes and never cancel siblings. The run ends
 * when every group is completed, or with a {@link StallException} when nothing is active,
 * nothing is ready and groups remain.
 */
public class ConcurrentDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentDispatcher.class);

    private final GroupScheduler scheduler;
    private final LifecycleHooks hooks;
    private final MergeCoordinator mergeCoordinator;
    private final EventBus events;
    private final ParallaxMetrics metrics;

    private volatile int maxParallel;
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger peakActive = new AtomicInteger();
    private final AtomicInteger sequence = new AtomicInteger();

    /** Every workspace created and not yet cleaned up, in creation order. */
    private final Map<String, Workspace> workspaces = new LinkedHashMap<>();

    public ConcurrentDispatcher(GroupScheduler scheduler, LifecycleHooks hooks, MergeCoordinator mergeCoordinator,
                                int maxParallel, EventBus events, ParallaxMetrics metrics) {
        this.scheduler = scheduler;
        this.hooks = hooks;
        this.mergeCoordinator = mergeCoordinator;
        this.maxParallel = WorkspaceProperties.clampParallel(maxParallel);
        this.events = events;
        this.metrics = metrics;
    }

    /**
     * Runs {@code groups} to completion.
     *
     * @throws SchedulingException if the group graph is cyclic or references unknown groups
     * @throws StallException     if the run can make no further progress
     */
    public synchronized ExecutionReport admitAndRun(List<TaskGroup> groups) {
        String runId = "run-" + UUID.randomUUID().toString().substring(0, 8);
        Instant startedAt = Instant.now();
        MdcContext.setRun(runId);
        peakActive.set(0);
        active.set(0);

        try {
            scheduler.register(groups);
            log.info("Run {} started: {} groups, max parallel {}", runId, groups.size(), maxParallel);
            publish(ParallaxEvent.RUN_STARTED, runId, null, null, Map.of("groups", groups.size()));

            var outcomes = new ArrayList<GroupOutcome>();
            var merges = new ArrayList<MergeReport>();
            if (groups.isEmpty()) {
                log.info("Nothing to do");
                return finish(runId, startedAt, groups.size(), outcomes, merges);
            }

            ExecutorService workers = Executors.newFixedThreadPool(WorkspaceProperties.MAX_PARALLEL,
                    daemonThreads("workspace-" + runId));
            ExecutorService hookExecutor = Executors.newCachedThreadPool(daemonThreads("hook-" + runId));
            CompletionService<Workspace> completions = new ExecutorCompletionService<>(workers);
            Set<String> admitted = new HashSet<>();
            Map<String, Long> startTimes = new HashMap<>();

            try {
                while (!scheduler.isAllCompleted()) {
                    admitReady(runId, admitted, startTimes, completions, hookExecutor);

                    if (active.get() == 0) {
                        List<String> stuck = scheduler.pendingGroups().stream().map(TaskGroup::id).toList();
                        log.error("Run {} stalled: nothing active, nothing ready, pending {}", runId, stuck);
                        publish(ParallaxEvent.RUN_STALLED, runId, null, null, Map.of("stuckGroups", stuck));
                        recordRun("stalled");
                        throw new StallException(stuck, new ExecutionReport(runId, startedAt, Instant.now(),
                                groups.size(), outcomes, merges, peakActive.get(), stuck));
                    }

                    List<Workspace> finished = awaitFinished(completions);
                    MergeReport merge = mergeCoordinator.mergeAllCompleted(finished);
                    if (!merge.isEmpty()) {
                        merges.add(merge);
                    }
                    for (Workspace ws : finished) {
                        long elapsed = System.currentTimeMillis() - startTimes.getOrDefault(ws.getId(), 0L);
                        outcomes.add(GroupOutcome.of(ws, elapsed));
                        scheduler.markCompleted(ws.getGroupId());
                        active.decrementAndGet();
                        if (metrics != null) {
                            metrics.recordWorkspaceResult(ws.getStatus().name());
                        }
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stopAll();
                recordRun("interrupted");
                throw new SchedulingException(SchedulingException.INTERRUPTED, "Run " + runId + " interrupted");
            } finally {
                workers.shutdownNow();
                hookExecutor.shutdownNow();
            }

            return finish(runId, startedAt, groups.size(), outcomes, merges);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Re-admits resumable workspaces: one group per workspace, with its intent as the single
     * task and its existing branch re-attached instead of a new one.
     */
    public ExecutionReport resume(List<WorkspaceInfo> infos) {
        var groups = new ArrayList<TaskGroup>();
        for (WorkspaceInfo info : infos) {
            if (!info.resumable()) {
                continue;
            }
            TaskCategory category = info.category() == null ? TaskCategory.FEATURE : info.category();
            groups.add(new TaskGroup("resume-" + BranchNameGenerator.sanitize(info.name()),
                    List.of(info.intent()), category, category.groupPriority(), List.of(), 30, info.name()));
        }
        log.info("Resuming {} of {} workspaces", groups.size(), infos.size());
        return admitAndRun(groups);
    }

    private void admitReady(String runId, Set<String> admitted, Map<String, Long> startTimes,
                            CompletionService<Workspace> completions, ExecutorService hookExecutor) {
        int available = maxParallel - active.get();
        if (available <= 0) {
            return;
        }
        for (TaskGroup group : scheduler.readyGroups(Integer.MAX_VALUE)) {
            if (available <= 0) {
                break;
            }
            if (!admitted.add(group.id())) {
                continue;
            }
            available--;

            int seq = sequence.incrementAndGet();
            var workspace = new Workspace(String.format("WS-%03d", seq), BranchNameGenerator.forGroup(group, seq), group);
            synchronized (workspaces) {
                workspaces.put(workspace.getId(), workspace);
            }
            var lifecycle = new WorkspaceLifecycle(workspace, runId, hooks, hookExecutor, events, metrics);

            int now = active.incrementAndGet();
            peakActive.accumulateAndGet(now, Math::max);
            startTimes.put(workspace.getId(), System.currentTimeMillis());

            log.info("Admitted group {} as {} ({}), active {}/{}", group.id(), workspace.getId(),
                    workspace.getName(), now, maxParallel);
            publish(ParallaxEvent.GROUP_READY, runId, group.id(), workspace.getId(),
                    Map.of("branch", workspace.getName(), "priority", group.priority()));
            if (metrics != null) {
                metrics.recordGroupAdmitted(group.category().tag());
                metrics.recordActiveWorkspaces(now);
            }

            completions.submit(() -> {
                MdcContext.setWorkspace(runId, group.id(), workspace.getId());
                try {
                    return lifecycle.run();
                } catch (Throwable e) {
                    // every admitted workspace comes back as an outcome, Errors included
                    String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                    log.error("Lifecycle of {} crashed: {}", workspace.getId(), message, e);
                    workspace.fail(workspace.getStatus(), message);
                    return workspace;
                } finally {
                    MdcContext.clear();
                }
            });
        }
    }

    /** Blocks for one finished workspace, then drains any others that finished meanwhile. */
    private List<Workspace> awaitFinished(CompletionService<Workspace> completions) throws InterruptedException {
        var finished = new ArrayList<Workspace>();
        finished.add(resultOf(completions.take()));
        Future<Workspace> next;
        while ((next = completions.poll()) != null) {
            finished.add(resultOf(next));
        }
        return finished;
    }

    private static Workspace resultOf(Future<Workspace> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // the worker wrapper converts every exception into a failed workspace
            throw new IllegalStateException("Workspace worker failed unexpectedly", e.getCause());
        }
    }

    private ExecutionReport finish(String runId, Instant startedAt, int totalGroups,
                                   List<GroupOutcome> outcomes, List<MergeReport> merges) {
        var report = new ExecutionReport(runId, startedAt, Instant.now(), totalGroups, outcomes, merges,
                peakActive.get(), List.of());
        log.info("Run {} finished in {}s: {} completed, {} failed, peak {} active",
                runId, report.elapsed().toSeconds(), report.completed().size(), report.failed().size(),
                report.peakActive());
        publish(ParallaxEvent.RUN_COMPLETED, runId, null, null, Map.of(
                "completed", report.completed().size(),
                "failed", report.failed().size()));
        recordRun(report.failed().isEmpty() ? "success" : "partial");
        return report;
    }

    // -- capacity and control --

    public Capacity capacity() {
        return Capacity.of(active.get(), maxParallel);
    }

    /** Clamped to 1..10; applies to subsequent admissions. */
    public void setMaxParallel(int requested) {
        this.maxParallel = WorkspaceProperties.clampParallel(requested);
        log.info("Max parallel workspaces set to {}", this.maxParallel);
    }

    public int getMaxParallel() {
        return maxParallel;
    }

    /** Highest number of simultaneously active workspaces in the current or last run. */
    public int peakActive() {
        return peakActive.get();
    }

    /**
     * Forces an active workspace to FAILED and cancels its running hook call, so its worker
     * returns and frees the slot right away. Siblings are unaffected.
     */
    public boolean stop(String workspaceId) {
        Workspace ws;
        synchronized (workspaces) {
            ws = workspaces.get(workspaceId);
        }
        if (ws == null || !ws.stop()) {
            return false;
        }
        log.info("Stopped workspace {}", workspaceId);
        return true;
    }

    public int stopAll() {
        int stopped = 0;
        for (Workspace ws : activeWorkspaces()) {
            if (ws.stop()) stopped++;
        }
        log.info("Stopped {} active workspaces", stopped);
        return stopped;
    }

    public List<Workspace> allWorkspaces() {
        synchronized (workspaces) {
            return List.copyOf(workspaces.values());
        }
    }

    public List<Workspace> activeWorkspaces() {
        return allWorkspaces().stream().filter(ws -> !ws.isTerminal()).toList();
    }

    public List<Workspace> completedWorkspaces() {
        return allWorkspaces().stream().filter(ws -> ws.getStatus() == WorkspaceStatus.COMPLETED).toList();
    }

    public List<Workspace> failedWorkspaces() {
        return allWorkspaces().stream().filter(ws -> ws.getStatus() == WorkspaceStatus.FAILED).toList();
    }

    /**
     * Destroys the working tree and branch of every failed workspace and stops tracking it.
     *
     * @return number of workspaces cleaned up
     */
    public int cleanupFailedWorkspaces() {
        int cleaned = 0;
        for (Workspace ws : failedWorkspaces()) {
            try {
                hooks.provider().destroy(ws);
                synchronized (workspaces) {
                    workspaces.remove(ws.getId());
                }
                cleaned++;
                log.info("Cleaned up {}", ws.getName());
            } catch (WorkspaceException e) {
                log.warn("Failed to clean up {}: {}", ws.getName(), e.getMessage());
            }
        }
        return cleaned;
    }

    public String summary() {
        List<Workspace> all = allWorkspaces();
        List<Workspace> running = activeWorkspaces();
        var sb = new StringBuilder();
        sb.append(String.format("Workspaces: %d total, %d active, %d completed, %d failed, capacity %d/%d%n",
                all.size(), running.size(), completedWorkspaces().size(), failedWorkspaces().size(),
                running.size(), maxParallel));
        Instant now = Instant.now();
        for (Workspace ws : running) {
            sb.append(String.format("  %s %s [%s] tasks %d/%d, running %dm%n",
                    ws.getId(), ws.getName(), ws.getStatus(), ws.getTasksCompleted(), ws.getTasks().size(),
                    Duration.between(ws.getCreatedAt(), now).toMinutes()));
        }
        return sb.toString();
    }

    public MergeCoordinator mergeCoordinator() {
        return mergeCoordinator;
    }

    private void publish(String type, String runId, String groupId, String workspaceId, Map<String, Object> payload) {
        if (events != null) {
            events.publish(ParallaxEvent.of(type, runId, groupId, workspaceId, payload));
        }
    }

    private void recordRun(String result) {
        if (metrics != null) {
            metrics.recordRunResult(result);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
