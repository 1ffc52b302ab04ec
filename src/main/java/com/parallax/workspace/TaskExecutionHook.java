package com.parallax.workspace;

import com.parallax.core.model.Task;
import com.parallax.core.model.TaskResult;
import com.parallax.core.model.Workspace;

/**
 * Invokes the external implementation tool for one task inside a workspace.
 * The caller bounds each call with a timeout.
 */
@FunctionalInterface
public interface TaskExecutionHook {

    TaskResult execute(Task task, Workspace workspace) throws Exception;
}
