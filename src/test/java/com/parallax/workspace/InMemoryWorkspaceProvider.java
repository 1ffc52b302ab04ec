package com.parallax.workspace;

import com.parallax.core.model.Workspace;
import com.parallax.core.planning.BranchNameGenerator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Workspace provider that keeps everything in memory and records every call, for tests that
 * drive lifecycles without a git repository.
 */
public class InMemoryWorkspaceProvider implements WorkspaceProvider {

    private final Set<String> active = ConcurrentHashMap.newKeySet();
    private final Set<String> failMaterializing = ConcurrentHashMap.newKeySet();
    private final List<String> materialized = new CopyOnWriteArrayList<>();
    private final List<String> commits = new CopyOnWriteArrayList<>();
    private final List<String> released = new CopyOnWriteArrayList<>();
    private final List<String> destroyed = new CopyOnWriteArrayList<>();
    private final List<Workspace> resumed = new CopyOnWriteArrayList<>();
    private Path root = Path.of("target", "worktrees");

    /** Hands out paths under {@code root}, creating each directory, for hooks that run real processes. */
    public InMemoryWorkspaceProvider rootedAt(Path root) {
        this.root = root;
        return this;
    }

    @Override
    public Path materialize(Workspace workspace) throws WorkspaceException {
        String name = workspace.getName();
        if (failMaterializing.contains(name)) {
            throw new WorkspaceException("cannot materialize " + name);
        }
        if (!active.add(name)) {
            throw new WorkspaceException("Workspace name '" + name + "' collides with an active workspace");
        }
        materialized.add(name);
        if (workspace.isResumed()) {
            resumed.add(workspace);
        }
        Path path = root.resolve(BranchNameGenerator.sanitize(name.replace('/', '-')));
        if (Files.isDirectory(root)) {
            try {
                Files.createDirectories(path);
            } catch (IOException e) {
                throw new WorkspaceException("cannot create " + path, e);
            }
        }
        return path;
    }

    @Override
    public boolean commit(Workspace workspace, String message) {
        commits.add(workspace.getName() + " " + message);
        return true;
    }

    @Override
    public void release(Workspace workspace) {
        if (active.remove(workspace.getName())) {
            released.add(workspace.getName());
        }
    }

    @Override
    public void destroy(Workspace workspace) {
        release(workspace);
        destroyed.add(workspace.getName());
    }

    @Override
    public String mainline() {
        return "main";
    }

    public void failMaterializing(String name) {
        failMaterializing.add(name);
    }

    public List<String> materialized() { return materialized; }
    public List<String> commits() { return commits; }
    public List<String> released() { return released; }
    public List<String> destroyed() { return destroyed; }
    public List<Workspace> resumed() { return resumed; }
    public int activeCount() { return active.size(); }
}
