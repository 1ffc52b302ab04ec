package com.parallax.dispatch.cli;

import com.parallax.core.model.TaskGroup;
import com.parallax.core.planning.TaskGrouper;
import com.parallax.core.scheduler.GroupScheduler;
import com.parallax.core.scheduler.SchedulingException;
import com.parallax.workspace.WorkspaceProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: parallax plan "&lt;task&gt;" ...
 * <p>
 * Shows how the tasks would be grouped and scheduled without touching the repository.
 */
@Command(name = "plan", mixinStandardHelpOptions = true,
        description = "Show task groups, their dependencies and the initial ready set")
@Component
public class PlanCommand implements Callable<Integer> {

    @Parameters(arity = "0..*", paramLabel = "TASK", description = "Free-text task descriptions")
    private List<String> tasks = new ArrayList<>();

    @Option(names = {"--max-parallel", "-p"}, description = "Capacity used for the initial ready set")
    private Integer maxParallel;

    private final TaskGrouper grouper;
    private final WorkspaceProperties properties;

    public PlanCommand(TaskGrouper grouper, WorkspaceProperties properties) {
        this.grouper = grouper;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        if (tasks == null || tasks.isEmpty()) {
            ConsoleOutput.error("No tasks given");
            return ExitCodes.INVALID_INPUT;
        }
        int capacity = maxParallel != null
                ? WorkspaceProperties.clampParallel(maxParallel)
                : properties.getMaxParallel();

        List<TaskGroup> groups = grouper.group(tasks);
        var scheduler = new GroupScheduler();
        try {
            scheduler.register(groups);
        } catch (SchedulingException e) {
            ConsoleOutput.error("Scheduling error [" + e.getErrorCode() + "]: " + e.getMessage());
            return ExitCodes.SCHEDULING_ERROR;
        }

        ConsoleOutput.printBanner();
        for (TaskGroup group : groups) {
            ConsoleOutput.group(group);
        }
        System.out.println();
        System.out.println("Order: " + String.join(" -> ", scheduler.topologicalOrder()));
        System.out.println("Ready (capacity " + capacity + "): " + scheduler.readyGroups(capacity).stream()
                .map(TaskGroup::id)
                .toList());
        return ExitCodes.OK;
    }
}
