package com.parallax.workspace;

/**
 * Failure to materialize, commit, release or inspect an isolated workspace.
 */
public class WorkspaceException extends Exception {

    public WorkspaceException(String message) {
        super(message);
    }

    public WorkspaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
