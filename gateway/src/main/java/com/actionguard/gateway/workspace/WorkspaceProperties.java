package com.actionguard.gateway.workspace;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;

/**
 * Filesystem locations owned by the gateway.
 *
 * @param root          parent of the per-environment workspaces ({@code root/dev}, ...)
 * @param snapshotRoot  single directory holding every environment's snapshots
 * @param auditLog      append-only JSON-lines audit file
 */
@ConfigurationProperties("actionguard.workspace")
public record WorkspaceProperties(
        @DefaultValue("data/workspaces")         String root,
        @DefaultValue("data/snapshots")          String snapshotRoot,
        @DefaultValue("data/logs/actions.jsonl") String auditLog) {

    public Path rootPath()         { return Path.of(root).toAbsolutePath().normalize(); }
    public Path snapshotRootPath() { return Path.of(snapshotRoot).toAbsolutePath().normalize(); }
    public Path auditLogPath()     { return Path.of(auditLog).toAbsolutePath().normalize(); }
}
