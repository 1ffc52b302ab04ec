package com.parallax.workspace.git;

import com.parallax.core.model.Workspace;
import com.parallax.core.planning.BranchNameGenerator;
import com.parallax.workspace.WorkspaceException;
import com.parallax.workspace.WorkspaceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Workspace provider backed by git worktrees: one worktree directory and one branch per
 * active workspace, all under a common worktree root.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #materialize}: new branch from the mainline (or the existing branch when
 *       resuming) checked out in a fresh worktree</li>
 *   <li>{@link #commit}: records task output on the workspace branch</li>
 *   <li>{@link #release}: removes the worktree, keeps the branch for merge or resume</li>
 *   <li>{@link #destroy}: removes the worktree and force-deletes the branch</li>
 * </ol>
 */
public class WorktreeWorkspaceProvider implements WorkspaceProvider {

    private static final Logger log = LoggerFactory.getLogger(WorktreeWorkspaceProvider.class);

    private final GitWorkspaceManager git;
    private final Path worktreeRoot;
    private final String configuredMainline;
    private volatile String mainline;

    /** Active workspace branch name to worktree path. */
    private final Map<String, Path> active = new ConcurrentHashMap<>();

    public WorktreeWorkspaceProvider(GitWorkspaceManager git, Path worktreeRoot, String mainline) {
        this.git = git;
        this.worktreeRoot = worktreeRoot;
        this.configuredMainline = mainline;
    }

    @Override
    public Path materialize(Workspace workspace) throws WorkspaceException {
        String branch = workspace.getName();
        Path path = worktreePath(branch);
        if (active.putIfAbsent(branch, path) != null) {
            throw new WorkspaceException("Workspace name '" + branch + "' collides with an active workspace");
        }

        try {
            Files.createDirectories(worktreeRoot);
            GitWorkspaceManager.WorktreeResult result;
            if (workspace.isResumed()) {
                result = git.attachWorktree(path, branch);
            } else if (git.branchExists(branch)) {
                throw new WorkspaceException("Branch '" + branch + "' already exists");
            } else {
                result = git.addWorktree(path, branch, mainline());
            }
            if (!result.success()) {
                throw new WorkspaceException(result.error());
            }
        } catch (IOException e) {
            active.remove(branch);
            throw new WorkspaceException("Cannot create worktree root " + worktreeRoot, e);
        } catch (WorkspaceException e) {
            active.remove(branch);
            throw e;
        } catch (RuntimeException e) {
            active.remove(branch);
            throw new WorkspaceException("Cannot materialize " + branch + ": " + e.getMessage(), e);
        }
        log.info("Materialized workspace {} at {}", workspace.getId(), path);
        return path;
    }

    @Override
    public boolean commit(Workspace workspace, String message) throws WorkspaceException {
        Path path = active.get(workspace.getName());
        if (path == null) {
            throw new WorkspaceException("Workspace " + workspace.getId() + " has no active worktree");
        }
        try {
            return git.commitAll(path, message);
        } catch (IllegalStateException e) {
            throw new WorkspaceException(e.getMessage(), e);
        }
    }

    @Override
    public void release(Workspace workspace) throws WorkspaceException {
        Path path = active.remove(workspace.getName());
        if (path == null) {
            log.debug("Workspace {} has no worktree to release", workspace.getId());
            return;
        }
        boolean removed = git.removeWorktree(path);
        if (!removed) {
            throw new WorkspaceException("Could not remove worktree " + path);
        }
        log.info("Released worktree for {}", workspace.getId());
    }

    @Override
    public void destroy(Workspace workspace) throws WorkspaceException {
        release(workspace);
        if (!git.deleteBranch(workspace.getName(), true)) {
            throw new WorkspaceException("Could not delete branch " + workspace.getName());
        }
        log.info("Destroyed workspace {} ({})", workspace.getId(), workspace.getName());
    }

    /** The configured mainline, or the repository's current branch when none is configured. */
    @Override
    public String mainline() {
        String resolved = mainline;
        if (resolved == null) {
            synchronized (this) {
                if (mainline == null) {
                    mainline = configuredMainline == null || configuredMainline.isBlank()
                            ? git.detectMainline() : configuredMainline;
                }
                resolved = mainline;
            }
        }
        return resolved;
    }

    public int activeCount() {
        return active.size();
    }

    Path worktreePath(String branch) {
        return worktreeRoot.resolve(BranchNameGenerator.sanitize(branch.replace('/', '-')));
    }
}
