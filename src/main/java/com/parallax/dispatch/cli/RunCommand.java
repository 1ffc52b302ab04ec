package com.parallax.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.parallax.core.dispatch.ConcurrentDispatcher;
import com.parallax.core.events.EventBus;
import com.parallax.core.model.ExecutionReport;
import com.parallax.core.model.TaskGroup;
import com.parallax.core.planning.TaskGrouper;
import com.parallax.core.scheduler.SchedulingException;
import com.parallax.core.scheduler.StallException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: parallax run "&lt;task&gt;" ...
 * <p>
 * Groups the tasks, dispatches the groups across isolated workspaces, merges the verified
 * ones into the mainline and prints the final report.
 */
@Command(name = "run", mixinStandardHelpOptions = true,
        description = "Group, dispatch and merge a list of free-text tasks")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(arity = "0..*", paramLabel = "TASK", description = "Free-text task descriptions")
    private List<String> tasks = new ArrayList<>();

    @Option(names = {"--max-parallel", "-p"}, description = "Maximum concurrently active workspaces (1-10)")
    private Integer maxParallel;

    @Option(names = "--settle-delay-ms", description = "Delay after each merge, in milliseconds")
    private Long settleDelayMs;

    @Option(names = "--json", description = "Print the final report as JSON")
    private boolean json;

    @Option(names = "--cleanup-failed", description = "Delete worktrees and branches of failed workspaces afterwards")
    private boolean cleanupFailed;

    private final TaskGrouper grouper;
    private final ConcurrentDispatcher dispatcher;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;

    public RunCommand(TaskGrouper grouper, ConcurrentDispatcher dispatcher, EventBus eventBus,
                      ObjectMapper objectMapper) {
        this.grouper = grouper;
        this.dispatcher = dispatcher;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        if (tasks == null || tasks.isEmpty()) {
            ConsoleOutput.error("No tasks given");
            return ExitCodes.INVALID_INPUT;
        }
        if (!json) {
            ConsoleOutput.printBanner();
        }

        List<TaskGroup> groups = grouper.group(tasks);
        if (maxParallel != null) {
            dispatcher.setMaxParallel(maxParallel);
        }
        if (settleDelayMs != null) {
            dispatcher.mergeCoordinator().setSettleDelayMs(settleDelayMs);
        }

        if (!json) {
            ConsoleOutput.info(String.format("%d tasks in %d groups, max parallel %d",
                    tasks.size(), groups.size(), dispatcher.getMaxParallel()));
        }

        EventBus.Subscription progress = json ? null : eventBus.subscribeAll(ConsoleOutput::event);
        ExecutionReport report;
        try {
            report = dispatcher.admitAndRun(groups);
        } catch (StallException e) {
            ConsoleOutput.error(e.getMessage());
            print(e.getPartialReport());
            return ExitCodes.SCHEDULING_ERROR;
        } catch (SchedulingException e) {
            ConsoleOutput.error("Scheduling error [" + e.getErrorCode() + "]: " + e.getMessage());
            return ExitCodes.SCHEDULING_ERROR;
        } finally {
            if (progress != null) {
                progress.unsubscribe();
            }
        }

        print(report);

        if (cleanupFailed) {
            int cleaned = dispatcher.cleanupFailedWorkspaces();
            if (!json) {
                ConsoleOutput.info("Cleaned up " + cleaned + " failed workspaces");
            }
        }
        return report.allGroupsFinished() ? ExitCodes.OK : ExitCodes.SCHEDULING_ERROR;
    }

    private void print(ExecutionReport report) {
        if (report == null) return;
        if (!json) {
            ConsoleOutput.report(report);
            return;
        }
        try {
            System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
        } catch (JsonProcessingException e) {
            ConsoleOutput.error("Could not render report as JSON: " + e.getOriginalMessage());
        }
    }
}
