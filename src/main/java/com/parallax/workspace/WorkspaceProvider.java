package com.parallax.workspace;

import com.parallax.core.model.Workspace;

import java.nio.file.Path;

/**
 * Produces isolated working trees for workspaces.
 * Implementation: {@link com.parallax.workspace.git.WorktreeWorkspaceProvider}.
 */
public interface WorkspaceProvider {

    /**
     * Creates an isolated copy of the current mainline on a branch named after the workspace,
     * or re-attaches to the existing branch of a resumed workspace.
     *
     * @return the directory holding the workspace's working tree
     * @throws WorkspaceException if the name collides with an active workspace or git fails
     */
    Path materialize(Workspace workspace) throws WorkspaceException;

    /**
     * Records all pending changes in the workspace tree as one commit.
     *
     * @return false when there was nothing to commit
     */
    boolean commit(Workspace workspace, String message) throws WorkspaceException;

    /**
     * Tears down the working tree but keeps the branch, so it can still be merged or resumed.
     */
    void release(Workspace workspace) throws WorkspaceException;

    /**
     * Tears down the working tree and deletes the branch.
     */
    void destroy(Workspace workspace) throws WorkspaceException;

    /** Name of the mainline branch workspaces start from and merge into. */
    String mainline();
}
