package com.parallax.workspace.git;

import com.parallax.workspace.BranchActivity;
import com.parallax.workspace.WorkspaceException;
import com.parallax.workspace.WorkspaceInventory;

import java.util.List;
import java.util.function.Supplier;

/**
 * Branch inventory read straight from the local repository.
 */
public class GitBranchInventory implements WorkspaceInventory {

    private final GitWorkspaceManager git;
    private final Supplier<String> mainline;

    public GitBranchInventory(GitWorkspaceManager git, Supplier<String> mainline) {
        this.git = git;
        this.mainline = mainline;
    }

    @Override
    public List<BranchActivity> listBranches() throws WorkspaceException {
        try {
            return git.listBranches();
        } catch (IllegalStateException e) {
            throw new WorkspaceException(e.getMessage(), e);
        }
    }

    @Override
    public int commitsAhead(String branch, String mainline) throws WorkspaceException {
        try {
            return git.commitsAhead(branch, mainline);
        } catch (IllegalStateException e) {
            throw new WorkspaceException(e.getMessage(), e);
        }
    }

    @Override
    public String mainline() {
        return mainline.get();
    }
}
