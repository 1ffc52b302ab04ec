package com.parallax.workspace.git;

import com.parallax.core.model.TaskCategory;
import com.parallax.core.model.TaskGroup;
import com.parallax.core.model.Workspace;
import com.parallax.workspace.WorkspaceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorktreeWorkspaceProviderTest {

    @TempDir
    Path worktreeRoot;

    private ScriptedGitWorkspaceManager git;
    private WorktreeWorkspaceProvider provider;

    @BeforeEach
    void setUp() {
        git = new ScriptedGitWorkspaceManager().respond("show-ref", 1, "");
        provider = new WorktreeWorkspaceProvider(git, worktreeRoot, "main");
    }

    private static Workspace workspace(String id, String branch) {
        var group = new TaskGroup("group-feature-0", List.of("Add login"), TaskCategory.FEATURE, 7, List.of(), 30);
        return new Workspace(id, branch, group);
    }

    private static Workspace resumed(String branch) {
        var group = new TaskGroup("resume-x", List.of("Login"), TaskCategory.FEATURE, 7, List.of(), 30, branch);
        return new Workspace("WS-009", branch, group);
    }

    @Test
    @DisplayName("materialize creates a new branch from the mainline in its own worktree")
    void materialize() throws WorkspaceException {
        Path path = provider.materialize(workspace("WS-001", "feature/add-login-1"));

        assertEquals(worktreeRoot.resolve("feature-add-login-1"), path);
        assertTrue(git.ran("worktree add " + path + " -b feature/add-login-1 main"));
        assertEquals(1, provider.activeCount());
    }

    @Test
    @DisplayName("a name colliding with an active workspace is rejected")
    void collision() throws WorkspaceException {
        provider.materialize(workspace("WS-001", "feature/add-login-1"));

        var e = assertThrows(WorkspaceException.class,
                () -> provider.materialize(workspace("WS-002", "feature/add-login-1")));
        assertTrue(e.getMessage().contains("collides"));
        assertEquals(1, provider.activeCount());
    }

    @Test
    @DisplayName("an existing branch is rejected unless the workspace is resumed")
    void existingBranch() {
        git.respond("show-ref", 0, "");
        assertThrows(WorkspaceException.class,
                () -> provider.materialize(workspace("WS-001", "feature/add-login-1")));
        assertEquals(0, provider.activeCount());
    }

    @Test
    @DisplayName("a resumed workspace re-attaches its existing branch")
    void resume() throws WorkspaceException {
        Path path = provider.materialize(resumed("fix/crash-2"));

        assertTrue(git.ran("worktree add " + path + " fix/crash-2"));
        assertFalse(git.ran("worktree add " + path + " -b"));
    }

    @Test
    @DisplayName("a git failure leaves nothing active")
    void gitFailure() {
        git.respond("worktree add", 128, "fatal");
        assertThrows(WorkspaceException.class,
                () -> provider.materialize(workspace("WS-001", "feature/add-login-1")));
        assertEquals(0, provider.activeCount());
    }

    @Test
    @DisplayName("commit stages in the workspace tree")
    void commit() throws WorkspaceException {
        Workspace ws = workspace("WS-001", "feature/add-login-1");
        provider.materialize(ws);
        git.respond("diff --cached --quiet", 1, "");

        assertTrue(provider.commit(ws, "feature: Add login"));
        assertThrows(WorkspaceException.class,
                () -> provider.commit(workspace("WS-002", "feature/other-2"), "x"));
    }

    @Test
    @DisplayName("release keeps the branch, destroy deletes it")
    void releaseAndDestroy() throws WorkspaceException {
        Workspace ws = workspace("WS-001", "feature/add-login-1");
        provider.materialize(ws);

        provider.release(ws);
        assertTrue(git.ran("worktree remove --force"));
        assertFalse(git.ran("branch -D"));
        assertEquals(0, provider.activeCount());

        provider.destroy(ws);
        assertTrue(git.ran("branch -D feature/add-login-1"));
    }

    @Test
    @DisplayName("the mainline is detected lazily when none is configured")
    void lazyMainline() {
        git.respond("rev-parse", 0, "trunk\n");
        var detecting = new WorktreeWorkspaceProvider(git, worktreeRoot, "");

        assertFalse(git.ran("rev-parse"));
        assertEquals("trunk", detecting.mainline());
        assertEquals("main", provider.mainline());
    }
}
