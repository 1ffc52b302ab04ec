package com.parallax.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parallax.core.dispatch.ConcurrentDispatcher;
import com.parallax.core.events.EventBus;
import com.parallax.core.merge.MergeCoordinator;
import com.parallax.core.model.ExecutionReport;
import com.parallax.core.model.GroupOutcome;
import com.parallax.core.model.MergeReport;
import com.parallax.core.model.TaskCategory;
import com.parallax.core.model.WorkspaceStatus;
import com.parallax.core.planning.TaskGrouper;
import com.parallax.core.resume.ResumeScanner;
import com.parallax.core.scheduler.CycleDetectedException;
import com.parallax.core.scheduler.StallException;
import com.parallax.workspace.BranchActivity;
import com.parallax.workspace.WorkspaceInventory;
import com.parallax.workspace.WorkspaceProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the Parallax CLI command structure.
 * These tests exercise picocli directly without Spring context,
 * validating command parsing, help output, and exit codes.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private static final Instant NOW = Instant.parse("2026-03-15T12:00:00Z");

    private ConcurrentDispatcher dispatcher;
    private MergeCoordinator mergeCoordinator;
    private ResumeScanner scanner;

    @BeforeEach
    void setUp() {
        dispatcher = mock(ConcurrentDispatcher.class);
        mergeCoordinator = mock(MergeCoordinator.class);
        when(dispatcher.mergeCoordinator()).thenReturn(mergeCoordinator);
        when(dispatcher.getMaxParallel()).thenReturn(3);
        scanner = new ResumeScanner(inventory(List.of(
                new BranchActivity("main", "aaa", "Initial commit", NOW),
                new BranchActivity("feature/add-login--3", "bbb", "Add login form", NOW.minus(Duration.ofDays(2))),
                new BranchActivity("feature/old-thing", "ccc", "Old work", NOW.minus(Duration.ofDays(30))))),
                Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofDays(7));
    }

    private static WorkspaceInventory inventory(List<BranchActivity> branches) {
        return new WorkspaceInventory() {
            @Override
            public List<BranchActivity> listBranches() {
                return branches;
            }

            @Override
            public int commitsAhead(String branch, String mainline) {
                return 1;
            }

            @Override
            public String mainline() {
                return "main";
            }
        };
    }

    private static ExecutionReport report(int totalGroups, GroupOutcome... outcomes) {
        return new ExecutionReport("run-1234abcd", NOW, NOW.plusSeconds(42), totalGroups, List.of(outcomes),
                List.of(new MergeReport(List.of(new MergeReport.Entry("WS-001", "feature/add-login-1", 7,
                        true, null, 12)))), 2, List.of());
    }

    private static GroupOutcome completed(String groupId) {
        return new GroupOutcome(groupId, TaskCategory.FEATURE, 7, "WS-001", "feature/add-login-1",
                WorkspaceStatus.COMPLETED, 2, 0, null, null, 1000);
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(new TaskGrouper(), dispatcher, EventBus.direct(),
                            new ObjectMapper().findAndRegisterModules());
                }
                if (cls == PlanCommand.class) {
                    return (K) new PlanCommand(new TaskGrouper(), new WorkspaceProperties());
                }
                if (cls == ResumeCommand.class) {
                    return (K) new ResumeCommand(scanner, dispatcher);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new ParallaxCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("run"));
            assertTrue(result.output().contains("plan"));
            assertTrue(result.output().contains("resume"));
            assertTrue(result.output().contains("help"));
        }

        @Test
        @DisplayName("--version shows version")
        void version() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Parallax 0.1.0"));
        }

        @Test
        @DisplayName("no subcommand prints the banner and usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("PARALLAX"));
            assertTrue(result.output().contains("Usage"));
        }

        @Test
        @DisplayName("an unknown option is a usage error")
        void unknownOption() {
            CliResult result = execute("run", "--bogus", "Add login");
            assertEquals(2, result.exitCode());
        }
    }

    // =====================================================================
    //  run
    // =====================================================================

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("exits 1 without tasks")
        void noTasks() {
            CliResult result = execute("run");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("No tasks given"));
            verify(dispatcher, never()).admitAndRun(anyList());
        }

        @Test
        @DisplayName("exits 0 and prints the report when every group finished")
        void success() {
            when(dispatcher.admitAndRun(anyList())).thenReturn(report(1, completed("group-feature-0")));

            CliResult result = execute("run", "Add login feature");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("run-1234abcd"));
            assertTrue(result.output().contains("group-feature-0"));
            assertTrue(result.output().contains("Merges: 1 ok, 0 failed"));
        }

        @Test
        @DisplayName("applies --max-parallel and --settle-delay-ms before dispatching")
        void options() {
            when(dispatcher.admitAndRun(anyList())).thenReturn(report(1, completed("group-feature-0")));

            CliResult result = execute("run", "--max-parallel", "5", "--settle-delay-ms", "0", "Add login");

            assertEquals(0, result.exitCode());
            verify(dispatcher).setMaxParallel(5);
            verify(mergeCoordinator).setSettleDelayMs(0L);
        }

        @Test
        @DisplayName("--json prints the report as JSON")
        void json() {
            when(dispatcher.admitAndRun(anyList())).thenReturn(report(1, completed("group-feature-0")));

            CliResult result = execute("run", "--json", "Add login");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("\"runId\" : \"run-1234abcd\""));
            assertFalse(result.output().contains("PARALLAX v"));
        }

        @Test
        @DisplayName("--cleanup-failed cleans up after the run")
        void cleanup() {
            when(dispatcher.admitAndRun(anyList())).thenReturn(report(1, completed("group-feature-0")));

            execute("run", "--cleanup-failed", "Add login");

            verify(dispatcher).cleanupFailedWorkspaces();
        }

        @Test
        @DisplayName("exits 2 on a scheduling error")
        void schedulingError() {
            when(dispatcher.admitAndRun(anyList())).thenThrow(new CycleDetectedException(Set.of("a", "b")));

            CliResult result = execute("run", "Add login");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("CYCLIC_DEPENDENCY"));
        }

        @Test
        @DisplayName("exits 2 on a stall and still prints the partial report")
        void stall() {
            var partial = new ExecutionReport("run-stall", NOW, NOW, 2, List.of(), List.of(), 0,
                    List.of("group-tests"));
            when(dispatcher.admitAndRun(anyList())).thenThrow(new StallException(List.of("group-tests"), partial));

            CliResult result = execute("run", "Add login");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Stalled groups: group-tests"));
        }
    }

    // =====================================================================
    //  plan
    // =====================================================================

    @Nested
    @DisplayName("plan")
    class PlanTests {

        @Test
        @DisplayName("shows groups, order and the initial ready set")
        void plan() {
            CliResult result = execute("plan", "Create project scaffold", "Add login feature",
                    "Add logout feature", "Write tests", "Fix crash on startup");

            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("group-setup"));
            assertTrue(output.contains("group-feature-0"));
            assertTrue(output.contains("after group-setup"));
            assertTrue(output.contains("Ready (capacity 3): [group-setup, group-bugfix]"));
            verify(dispatcher, never()).admitAndRun(anyList());
        }

        @Test
        @DisplayName("--max-parallel limits the ready set")
        void capacityOne() {
            CliResult result = execute("plan", "-p", "1", "Create project scaffold", "Fix crash on startup");
            assertTrue(result.output().contains("Ready (capacity 1): [group-setup]"));
        }

        @Test
        @DisplayName("exits 1 without tasks")
        void noTasks() {
            assertEquals(1, execute("plan").exitCode());
        }
    }

    // =====================================================================
    //  resume
    // =====================================================================

    @Nested
    @DisplayName("resume")
    class ResumeTests {

        @Test
        @DisplayName("lists workspaces with intent and resumability without running them")
        void listOnly() {
            CliResult result = execute("resume");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("feature/add-login--3"));
            assertTrue(result.output().contains("Intent: Add login"));
            assertTrue(result.output().contains("1 of 2 workspaces resumable"));
            verify(dispatcher, never()).resume(anyList());
        }

        @Test
        @DisplayName("--run resumes the resumable workspaces")
        void run() {
            when(dispatcher.resume(anyList())).thenReturn(report(1, completed("resume-feature-add-login-3")));

            CliResult result = execute("resume", "--run");

            assertEquals(0, result.exitCode());
            verify(dispatcher).resume(any());
        }

        @Test
        @DisplayName("--days widens the recency window")
        void days() {
            CliResult result = execute("resume", "--days", "60");
            assertTrue(result.output().contains("2 of 2 workspaces resumable"));
        }

        @Test
        @DisplayName("negative --days is rejected")
        void negativeDays() {
            assertEquals(1, execute("resume", "--days", "-1").exitCode());
        }
    }
}
