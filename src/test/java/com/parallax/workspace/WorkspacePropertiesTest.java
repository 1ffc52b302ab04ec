package com.parallax.workspace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class WorkspacePropertiesTest {

    @Test
    @DisplayName("defaults match the documented configuration")
    void defaults() {
        var props = new WorkspaceProperties();

        assertEquals(3, props.getMaxParallel());
        assertEquals(45, props.getTask().getTimeoutSeconds());
        assertEquals(300, props.getVerify().getTimeoutSeconds());
        assertEquals("", props.getVerify().getCommand());
        assertEquals(1000, props.getSettleDelayMs());
        assertEquals(7, props.getRecencyDays());
        assertEquals(Path.of(".").toAbsolutePath().normalize(), props.getRepositoryPath());
    }

    @Test
    @DisplayName("max parallel is clamped to 1..10")
    void clamp() {
        var props = new WorkspaceProperties();
        props.getWorkspace().setMaxParallel(25);
        assertEquals(10, props.getMaxParallel());
        props.getWorkspace().setMaxParallel(-1);
        assertEquals(1, props.getMaxParallel());
    }

    @Test
    @DisplayName("worktree root defaults to a sibling of the repository")
    void worktreeRoot(@TempDir Path tmp) {
        var props = new WorkspaceProperties();
        props.getWorkspace().setRepositoryPath(tmp.resolve("app").toString());
        assertEquals(tmp.resolve("app-worktrees"), props.getWorktreeRoot());

        props.getWorkspace().setWorktreeRoot(tmp.resolve("trees").toString());
        assertEquals(tmp.resolve("trees"), props.getWorktreeRoot());
    }

    @Test
    @DisplayName("a negative settle delay reads as zero")
    void settleDelay() {
        var props = new WorkspaceProperties();
        props.getMerge().setSettleDelayMs(-10);
        assertEquals(0, props.getSettleDelayMs());
    }
}
