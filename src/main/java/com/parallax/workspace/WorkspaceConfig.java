package com.parallax.workspace;

import com.parallax.workspace.git.GitBranchInventory;
import com.parallax.workspace.git.GitMergeHook;
import com.parallax.workspace.git.GitWorkspaceManager;
import com.parallax.workspace.git.WorktreeWorkspaceProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class WorkspaceConfig {

    @Bean
    public ProcessRunner processRunner() {
        return new ProcessRunner();
    }

    @Bean
    public GitWorkspaceManager gitWorkspaceManager(WorkspaceProperties properties) {
        return new GitWorkspaceManager(properties.getRepositoryPath());
    }

    /**
     * One git worktree per active workspace, so parallel workspaces never share a working tree.
     */
    @Bean
    public WorktreeWorkspaceProvider workspaceProvider(GitWorkspaceManager git, WorkspaceProperties properties) {
        return new WorktreeWorkspaceProvider(git, properties.getWorktreeRoot(),
                properties.getWorkspace().getMainline());
    }

    @Bean
    public MergeHook mergeHook(GitWorkspaceManager git) {
        return new GitMergeHook(git);
    }

    @Bean
    public WorkspaceInventory workspaceInventory(GitWorkspaceManager git, WorktreeWorkspaceProvider provider) {
        return new GitBranchInventory(git, provider::mainline);
    }

    @Bean
    public TaskExecutionHook taskExecutionHook(ProcessRunner runner, WorkspaceProperties properties) {
        // the lifecycle enforces the same timeout and interrupts the runner, which kills the process
        return new CommandTaskExecutor(runner, properties.getTask().getCommand(),
                Duration.ofSeconds(properties.getTask().getTimeoutSeconds()));
    }

    @Bean
    public VerificationHook verificationHook(ProcessRunner runner, WorkspaceProperties properties) {
        return new CommandVerifier(runner, properties.getVerify().getCommand(),
                Duration.ofSeconds(properties.getVerify().getTimeoutSeconds()));
    }
}
