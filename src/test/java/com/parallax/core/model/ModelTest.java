package com.parallax.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    private static TaskGroup group() {
        return new TaskGroup("group-feature-0", List.of("Add login"), TaskCategory.FEATURE, 7, List.of(), 30);
    }

    private static Workspace workspace() {
        return new Workspace("WS-001", "feature/add-login-1", group());
    }

    @Nested
    @DisplayName("WorkspaceStatus")
    class WorkspaceStatusTests {

        @Test
        @DisplayName("allows only the forward chain")
        void forwardChain() {
            assertTrue(WorkspaceStatus.IDLE.canTransitionTo(WorkspaceStatus.PLANNING));
            assertTrue(WorkspaceStatus.EVOLVING.canTransitionTo(WorkspaceStatus.TESTING));
            assertTrue(WorkspaceStatus.MERGING.canTransitionTo(WorkspaceStatus.COMPLETED));
            assertFalse(WorkspaceStatus.IDLE.canTransitionTo(WorkspaceStatus.TESTING));
            assertFalse(WorkspaceStatus.TESTING.canTransitionTo(WorkspaceStatus.IMPLEMENTING));
        }

        @Test
        @DisplayName("FAILED is reachable from every non-terminal state and terminal states are absorbing")
        void failureAndTerminals() {
            for (WorkspaceStatus status : WorkspaceStatus.values()) {
                assertEquals(!status.isTerminal(), status.canTransitionTo(WorkspaceStatus.FAILED), status.name());
            }
            for (WorkspaceStatus target : WorkspaceStatus.values()) {
                assertFalse(WorkspaceStatus.COMPLETED.canTransitionTo(target));
                assertFalse(WorkspaceStatus.FAILED.canTransitionTo(target));
            }
        }
    }

    @Nested
    @DisplayName("Workspace")
    class WorkspaceTests {

        @Test
        @DisplayName("copies identity from its group")
        void identity() {
            Workspace ws = workspace();
            assertEquals("group-feature-0", ws.getGroupId());
            assertEquals(7, ws.getPriority());
            assertEquals(WorkspaceStatus.IDLE, ws.getStatus());
            assertFalse(ws.isResumed());
        }

        @Test
        @DisplayName("illegal transitions throw with both states")
        void illegalTransition() {
            Workspace ws = workspace();
            var e = assertThrows(InvalidStateTransitionException.class,
                    () -> ws.transitionTo(WorkspaceStatus.MERGING));
            assertEquals(WorkspaceStatus.IDLE, e.getCurrentState());
            assertEquals(WorkspaceStatus.MERGING, e.getTargetState());
            assertEquals(InvalidStateTransitionException.ERROR_CODE, e.getErrorCode());
        }

        @Test
        @DisplayName("fail records phase and error once")
        void failOnce() {
            Workspace ws = workspace();
            ws.transitionTo(WorkspaceStatus.PLANNING);
            assertTrue(ws.fail(WorkspaceStatus.PLANNING, "no tree"));
            assertFalse(ws.fail(WorkspaceStatus.TESTING, "later"));
            assertEquals(WorkspaceStatus.PLANNING, ws.getFailedPhase());
            assertEquals("no tree", ws.getError());
        }

        @Test
        @DisplayName("stop forces FAILED with error stopped, but not after completion")
        void stop() {
            Workspace ws = workspace();
            ws.transitionTo(WorkspaceStatus.PLANNING);
            assertTrue(ws.stop());
            assertTrue(ws.isStopRequested());
            assertEquals(WorkspaceStatus.FAILED, ws.getStatus());
            assertEquals(Workspace.STOPPED, ws.getError());
            assertFalse(ws.stop());
        }

        @Test
        @DisplayName("ready to merge only in TESTING with verification passed")
        void readyToMerge() {
            Workspace ws = workspace();
            ws.transitionTo(WorkspaceStatus.PLANNING);
            ws.transitionTo(WorkspaceStatus.IMPLEMENTING);
            ws.transitionTo(WorkspaceStatus.EVOLVING);
            ws.transitionTo(WorkspaceStatus.TESTING);
            assertFalse(ws.isReadyToMerge());
            ws.markVerified(true);
            assertTrue(ws.isReadyToMerge());
        }
    }

    @Nested
    @DisplayName("reports and value types")
    class ValueTests {

        @Test
        @DisplayName("capacity never reports negative availability")
        void capacity() {
            assertEquals(2, Capacity.of(1, 3).available());
            assertEquals(0, Capacity.of(5, 3).available());
        }

        @Test
        @DisplayName("category maps branch prefixes back")
        void categoryFromPrefix() {
            assertEquals(TaskCategory.FEATURE, TaskCategory.fromBranchPrefix("feature").orElseThrow());
            assertEquals(TaskCategory.BUG_FIX, TaskCategory.fromBranchPrefix("fix").orElseThrow());
            assertEquals(TaskCategory.OPTIMIZATION, TaskCategory.fromBranchPrefix("refactor").orElseThrow());
            assertTrue(TaskCategory.fromBranchPrefix("ui").isEmpty());
        }

        @Test
        @DisplayName("execution report splits outcomes and knows when every group finished")
        void executionReport() {
            var ok = new GroupOutcome("g1", TaskCategory.FEATURE, 7, "WS-001", "feature/a-1",
                    WorkspaceStatus.COMPLETED, 1, 0, null, null, 10);
            var bad = new GroupOutcome("g2", TaskCategory.BUG_FIX, 9, "WS-002", "fix/b-2",
                    WorkspaceStatus.FAILED, 0, 1, WorkspaceStatus.IMPLEMENTING, "no task completed", 10);
            Instant now = Instant.now();
            var report = new ExecutionReport("run-1", now, now.plusSeconds(3), 2, List.of(ok, bad),
                    List.of(), 2, null);

            assertEquals(List.of(ok), report.completed());
            assertEquals(List.of(bad), report.failed());
            assertTrue(report.allGroupsFinished());
            assertFalse(report.isStalled());
            assertEquals(3, report.elapsed().toSeconds());
        }
    }
}
