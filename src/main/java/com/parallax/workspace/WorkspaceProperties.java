package com.parallax.workspace;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "parallax")
public class WorkspaceProperties {

    public static final int MIN_PARALLEL = 1;
    public static final int MAX_PARALLEL = 10;

    private Workspace workspace = new Workspace();
    private Task task = new Task();
    private Verify verify = new Verify();
    private Merge merge = new Merge();
    private Resume resume = new Resume();

    // -- flattened accessors --
    public int getMaxParallel() { return clampParallel(workspace.maxParallel); }
    public Path getRepositoryPath() { return Path.of(workspace.repositoryPath).toAbsolutePath().normalize(); }
    public long getSettleDelayMs() { return Math.max(0, merge.settleDelayMs); }
    public int getRecencyDays() { return resume.recencyDays; }

    /**
     * Parent directory for worktrees; defaults to {@code <repo>-worktrees} next to the repository.
     */
    public Path getWorktreeRoot() {
        if (workspace.worktreeRoot != null && !workspace.worktreeRoot.isBlank()) {
            return Path.of(workspace.worktreeRoot).toAbsolutePath().normalize();
        }
        Path repo = getRepositoryPath();
        return repo.resolveSibling(repo.getFileName() + "-worktrees");
    }

    public static int clampParallel(int requested) {
        return Math.max(MIN_PARALLEL, Math.min(MAX_PARALLEL, requested));
    }

    public Workspace getWorkspace() { return workspace; }
    public void setWorkspace(Workspace workspace) { this.workspace = workspace; }
    public Task getTask() { return task; }
    public void setTask(Task task) { this.task = task; }
    public Verify getVerify() { return verify; }
    public void setVerify(Verify verify) { this.verify = verify; }
    public Merge getMerge() { return merge; }
    public void setMerge(Merge merge) { this.merge = merge; }
    public Resume getResume() { return resume; }
    public void setResume(Resume resume) { this.resume = resume; }

    public static class Workspace {
        private int maxParallel = 3;
        private String repositoryPath = ".";
        private String worktreeRoot = "";
        private String mainline = "";

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public String getRepositoryPath() { return repositoryPath; }
        public void setRepositoryPath(String repositoryPath) { this.repositoryPath = repositoryPath; }
        public String getWorktreeRoot() { return worktreeRoot; }
        public void setWorktreeRoot(String worktreeRoot) { this.worktreeRoot = worktreeRoot; }
        public String getMainline() { return mainline; }
        public void setMainline(String mainline) { this.mainline = mainline; }
    }

    public static class Task {
        private String command = "claude --print --dangerously-skip-permissions";
        private int timeoutSeconds = 45;

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Verify {
        private String command = "";
        private int timeoutSeconds = 300;

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Merge {
        private long settleDelayMs = 1000;

        public long getSettleDelayMs() { return settleDelayMs; }
        public void setSettleDelayMs(long settleDelayMs) { this.settleDelayMs = settleDelayMs; }
    }

    public static class Resume {
        private int recencyDays = 7;

        public int getRecencyDays() { return recencyDays; }
        public void setRecencyDays(int recencyDays) { this.recencyDays = recencyDays; }
    }
}
