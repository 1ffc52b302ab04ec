package com.parallax.workspace;

import java.util.List;

/**
 * Read-only view of the workspaces that already exist in the repository.
 */
public interface WorkspaceInventory {

    /** All local branches with their latest commit, mainline included. */
    List<BranchActivity> listBranches() throws WorkspaceException;

    /** Number of commits on {@code branch} that are not on {@code mainline}. */
    int commitsAhead(String branch, String mainline) throws WorkspaceException;

    String mainline();
}
