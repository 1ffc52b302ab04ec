package com.parallax.workspace;

import com.parallax.core.model.VerificationResult;
import com.parallax.core.model.Workspace;

/**
 * Runs the external test/verification procedure against a workspace.
 */
@FunctionalInterface
public interface VerificationHook {

    VerificationResult verify(Workspace workspace) throws Exception;
}
