package com.actionguard.gateway.workspace;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Maps an environment to its workspace root, creating it on first use.
 */
@Component
public class WorkspaceResolver {

    private final Path base;

    public WorkspaceResolver(WorkspaceProperties properties) {
        this.base = properties.rootPath();
    }

    /** Workspace path without touching the filesystem. */
    public Path path(TargetEnvironment env) {
        return base.resolve(env.id());
    }

    /** Workspace path, created if it does not exist yet. */
    public Path root(TargetEnvironment env) {
        Path root = path(env);
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create workspace for " + env.id() + " at " + root, e);
        }
        return root;
    }
}
