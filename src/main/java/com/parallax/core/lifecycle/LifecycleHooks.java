package com.parallax.core.lifecycle;

import com.parallax.workspace.TaskExecutionHook;
import com.parallax.workspace.VerificationHook;
import com.parallax.workspace.WorkspaceProvider;

import java.time.Duration;

/**
 * External collaborators a workspace lifecycle drives, with the timeouts bounding each call.
 *
 * @param provider      materializes, commits and releases isolated working trees
 * @param taskHook      runs one task against a workspace
 * @param verifier      verifies a workspace before merge
 * @param taskTimeout   upper bound for one task hook call
 * @param verifyTimeout upper bound for one verification call
 */
public record LifecycleHooks(
    WorkspaceProvider provider,
    TaskExecutionHook taskHook,
    VerificationHook verifier,
    Duration taskTimeout,
    Duration verifyTimeout
) {}
