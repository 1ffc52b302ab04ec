package com.parallax.workspace.git;

import com.parallax.workspace.MergeHook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges a workspace branch into the mainline with {@code --no-ff} and deletes the branch
 * once it is integrated.
 */
public class GitMergeHook implements MergeHook {

    private static final Logger log = LoggerFactory.getLogger(GitMergeHook.class);

    private final GitWorkspaceManager git;

    public GitMergeHook(GitWorkspaceManager git) {
        this.git = git;
    }

    @Override
    public Result merge(String sourceBranch, String mainline) {
        var result = git.merge(sourceBranch, mainline);
        if (!result.ok()) {
            return Result.rejected(result.output());
        }
        if (!git.deleteBranch(sourceBranch, false)) {
            log.warn("Merged '{}' but could not delete it", sourceBranch);
        }
        return Result.merged("merged " + sourceBranch + " into " + mainline);
    }
}
