package com.parallax.workspace;

import com.parallax.core.model.Task;
import com.parallax.core.model.TaskResult;
import com.parallax.core.model.Workspace;
import com.parallax.core.planning.TaskLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Task execution hook that pipes the task prompt into a configured command running in the
 * workspace tree. Exit code zero means the task succeeded.
 */
public class CommandTaskExecutor implements TaskExecutionHook {

    private static final Logger log = LoggerFactory.getLogger(CommandTaskExecutor.class);

    private final ProcessRunner runner;
    private final List<String> command;
    private final Duration timeout;

    public CommandTaskExecutor(ProcessRunner runner, String commandLine, Duration timeout) {
        this.runner = runner;
        this.command = ProcessRunner.split(commandLine);
        this.timeout = timeout;
    }

    @Override
    public TaskResult execute(Task task, Workspace workspace) throws Exception {
        if (workspace.getPath() == null) {
            return TaskResult.failure("workspace " + workspace.getId() + " has no working tree");
        }
        log.info("Executing task {} [{}] via {}", task.id(), task.tool(), command.get(0));
        var result = runner.run(command, workspace.getPath(), prompt(task), timeout);
        if (result.timedOut()) {
            return TaskResult.failure("timed out after " + timeout.toSeconds() + "s");
        }
        if (result.exitCode() != 0) {
            log.warn("Task {} exited with code {}", task.id(), result.exitCode());
            return TaskResult.failure(result.output());
        }
        return TaskResult.success(result.output());
    }

    static String prompt(Task task) {
        String verb = TaskLedger.TOOL_EVOLVE.equals(task.tool())
                ? "Improve the existing implementation"
                : "Implement the following change";
        return verb + " (" + task.category().tag() + "):\n" + task.description() + "\n";
    }
}
