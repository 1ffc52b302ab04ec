package com.parallax.core.lifecycle;

import com.parallax.core.events.EventBus;
import com.parallax.core.events.ParallaxEvent;
import com.parallax.core.logging.MdcContext;
import com.parallax.core.merge.MergeCoordinator;
import com.parallax.core.metrics.ParallaxMetrics;
import com.parallax.core.model.InvalidStateTransitionException;
import com.parallax.core.model.MergeReport;
import com.parallax.core.model.Task;
import com.parallax.core.model.TaskResult;
import com.parallax.core.model.VerificationResult;
import com.parallax.core.model.Workspace;
import com.parallax.core.model.WorkspaceStatus;
import com.parallax.core.planning.TaskLedger;
import com.parallax.workspace.WorkspaceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Drives one {@link Workspace} through PLANNING, IMPLEMENTING, EVOLVING and TESTING.
 * MERGING is handed to the {@link MergeCoordinator}.
 *
 * <p>Phases and tasks run strictly sequentially on the calling thread. Any exception inside
 * a phase moves the workspace to FAILED with the phase name and message recorded; nothing is
 * thrown to the caller and nothing is retried. A single task failure is not a phase failure.
 *
 * <p>Stopping the workspace from outside cancels the hook call in flight, which interrupts
 * the hook thread; the worker then ends at the task boundary and frees its slot.
 */
public class WorkspaceLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceLifecycle.class);

    static final String NO_TASK_COMPLETED = "no task completed";

    @FunctionalInterface
    private interface PhaseBody {
        void run() throws Exception;
    }

    private final Workspace workspace;
    private final String runId;
    private final LifecycleHooks hooks;
    private final ExecutorService hookExecutor;
    private final EventBus events;
    private final ParallaxMetrics metrics;
    private final TaskLedger ledger;
    private volatile Future<?> inFlight;

    public WorkspaceLifecycle(Workspace workspace, String runId, LifecycleHooks hooks,
                              ExecutorService hookExecutor, EventBus events, ParallaxMetrics metrics) {
        this.workspace = workspace;
        this.runId = runId;
        this.hooks = hooks;
        this.hookExecutor = hookExecutor;
        this.events = events;
        this.metrics = metrics;
        this.ledger = new TaskLedger(workspace.getId());
        workspace.onStop(this::cancelInFlight);
    }

    public Workspace workspace() {
        return workspace;
    }

    public TaskLedger ledger() {
        return ledger;
    }

    /**
     * Runs every phase up to and including TESTING. On return the workspace is either
     * TESTING with verification passed (ready to merge) or FAILED.
     */
    public Workspace run() {
        boolean ok = enterPlanning()
                && enterImplementing()
                && enterEvolving()
                && enterTesting();
        if (!ok) {
            onFailure();
        }
        return workspace;
    }

    /** Materializes the isolated working tree and records the assigned tasks. */
    public boolean enterPlanning() {
        return runPhase(WorkspaceStatus.PLANNING, () -> {
            Path path = hooks.provider().materialize(workspace);
            workspace.attach(path);
            for (String description : workspace.getTasks()) {
                ledger.addTask(description);
            }
            log.info("Workspace {} planned {} tasks on {}", workspace.getId(),
                    workspace.getTasks().size(), workspace.getName());
        });
    }

    /** Runs every implement-tagged task, committing after each success. */
    public boolean enterImplementing() {
        return runPhase(WorkspaceStatus.IMPLEMENTING,
                () -> runTasks(t -> !TaskLedger.TOOL_EVOLVE.equals(t.tool())));
    }

    /** Runs the optimization tasks, if any, as the next evolution generation. */
    public boolean enterEvolving() {
        return runPhase(WorkspaceStatus.EVOLVING, () -> {
            boolean hasEvolveTasks = ledger.executableTasks().stream()
                    .anyMatch(t -> TaskLedger.TOOL_EVOLVE.equals(t.tool()));
            if (!hasEvolveTasks) {
                log.debug("Workspace {} has nothing to evolve", workspace.getId());
                return;
            }
            int generation = workspace.nextEvolutionGeneration();
            log.info("Workspace {} evolving, generation {}", workspace.getId(), generation);
            runTasks(t -> TaskLedger.TOOL_EVOLVE.equals(t.tool()));
        });
    }

    /** Runs the verification hook; a failing verification fails the workspace. */
    public boolean enterTesting() {
        return runPhase(WorkspaceStatus.TESTING, () -> {
            VerificationResult result;
            try {
                result = callWithTimeout(() -> hooks.verifier().verify(workspace), hooks.verifyTimeout());
            } catch (TimeoutException e) {
                result = VerificationResult.fail("verification timed out after "
                        + hooks.verifyTimeout().toSeconds() + "s");
            }
            workspace.markVerified(result.passed());
            if (!result.passed()) {
                String diagnostics = result.diagnostics() == null || result.diagnostics().isBlank()
                        ? "verification failed" : result.diagnostics();
                throw new PhaseFailedException(diagnostics);
            }
            log.info("Workspace {} passed verification", workspace.getId());
        });
    }

    /**
     * Hands a verified workspace to the coordinator. The coordinator owns the MERGING
     * transition and the final state.
     */
    public MergeReport enterMerging(MergeCoordinator coordinator) {
        return coordinator.mergeAllCompleted(List.of(workspace));
    }

    private void runTasks(Predicate<Task> selector) throws Exception {
        int attempted = 0;
        int succeeded = 0;
        while (true) {
            if (workspace.isStopRequested()) {
                return;
            }
            Task next = ledger.prioritizedExecutableTasks().stream()
                    .filter(selector)
                    .findFirst()
                    .orElse(null);
            if (next == null) {
                break;
            }
            attempted++;
            if (runTask(next)) {
                succeeded++;
            }
        }
        if (attempted > 0 && succeeded == 0) {
            throw new PhaseFailedException(NO_TASK_COMPLETED);
        }
    }

    private boolean runTask(Task task) throws InterruptedException, WorkspaceException {
        ledger.startTask(task.id());
        long start = System.currentTimeMillis();
        boolean success;
        String message;
        try {
            TaskResult result = callWithTimeout(() -> hooks.taskHook().execute(task, workspace),
                    hooks.taskTimeout());
            success = result.success();
            message = result.output();
        } catch (TimeoutException e) {
            success = false;
            message = "timed out after " + hooks.taskTimeout().toSeconds() + "s";
        } catch (CancellationException e) {
            success = false;
            message = Workspace.STOPPED;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            success = false;
            message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        }

        long elapsed = System.currentTimeMillis() - start;
        if (metrics != null) {
            metrics.recordTaskExecution(task.category().tag(), success, elapsed);
        }

        if (success) {
            ledger.completeTask(task.id(), message);
            workspace.recordTaskCompleted();
            hooks.provider().commit(workspace, task.category().tag() + ": " + task.description());
            log.info("Task {} completed in {}ms", task.id(), elapsed);
        } else {
            ledger.failTask(task.id(), message);
            workspace.recordTaskFailed();
            log.warn("Task {} failed: {}", task.id(), message);
        }
        return success;
    }

    /**
     * Runs a hook call on the hook executor, bounded by {@code timeout}. The caller's MDC
     * travels with the call.
     */
    private <T> T callWithTimeout(Callable<T> call, Duration timeout)
            throws InterruptedException, ExecutionException, TimeoutException {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<T> future = hookExecutor.submit(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                return call.call();
            } finally {
                MDC.clear();
            }
        });
        inFlight = future;
        if (workspace.isStopRequested()) {
            future.cancel(true);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        } finally {
            inFlight = null;
        }
    }

    private void cancelInFlight() {
        Future<?> current = inFlight;
        if (current != null && current.cancel(true)) {
            log.info("Cancelled running hook of stopped workspace {}", workspace.getId());
        }
    }

    private boolean runPhase(WorkspaceStatus phase, PhaseBody body) {
        if (!advance(phase)) {
            return false;
        }
        MdcContext.setPhase(phase.phaseName());
        publish(ParallaxEvent.WORKSPACE_PHASE, Map.of("phase", phase.name(), "branch", workspace.getName()));
        log.info("Workspace {} entered {}", workspace.getId(), phase);

        long start = System.currentTimeMillis();
        try {
            body.run();
            if (workspace.isStopRequested()) {
                log.info("Workspace {} stopped during {}", workspace.getId(), phase);
                return false;
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workspace.fail(phase, "interrupted");
            return false;
        } catch (Exception e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            if (workspace.fail(phase, message)) {
                log.warn("Workspace {} failed in {}: {}", workspace.getId(), phase, message);
            }
            return false;
        } finally {
            if (metrics != null) {
                metrics.recordPhaseDuration(phase.phaseName(), System.currentTimeMillis() - start);
            }
        }
    }

    private boolean advance(WorkspaceStatus next) {
        try {
            workspace.transitionTo(next);
            return true;
        } catch (InvalidStateTransitionException e) {
            if (workspace.isStopRequested()) {
                log.info("Workspace {} was stopped before {}", workspace.getId(), next);
                return false;
            }
            throw e;
        }
    }

    private void onFailure() {
        log.warn("Workspace {} ended FAILED in {}: {}", workspace.getId(),
                workspace.getFailedPhase(), workspace.getError());
        publish(ParallaxEvent.WORKSPACE_FAILED, Map.of(
                "phase", String.valueOf(workspace.getFailedPhase()),
                "error", String.valueOf(workspace.getError())));
        // Keep the branch so the work can be resumed; only the tree goes
        try {
            hooks.provider().release(workspace);
        } catch (WorkspaceException e) {
            log.warn("Could not release worktree of failed workspace {}: {}", workspace.getId(), e.getMessage());
        }
    }

    private void publish(String type, Map<String, Object> payload) {
        if (events != null) {
            events.publish(ParallaxEvent.of(type, runId, workspace.getGroupId(), workspace.getId(), payload));
        }
    }

    /**
     * Signals a phase outcome that is a failure without being an error in the code.
     */
    static class PhaseFailedException extends Exception {
        PhaseFailedException(String message) {
            super(message);
        }
    }
}
