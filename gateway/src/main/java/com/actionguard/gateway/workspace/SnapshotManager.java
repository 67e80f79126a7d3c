package com.actionguard.gateway.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Full-copy snapshots of environment workspaces, for rollback.
 *
 * Snapshots live side by side under one snapshot root, named
 * {@code {env}-{yyyyMMdd'T'HHmmss'Z'}}. The timestamp format makes
 * lexicographic order chronological, so listing is a plain sort.
 *
 * Both directions are full copies: no diffing, no deduplication. A restore
 * wipes the live workspace and copies the snapshot back in its place.
 * Callers serialise snapshot/restore per environment; this class does no
 * locking of its own.
 */
@Component
public class SnapshotManager {

    private static final Logger log = LoggerFactory.getLogger(SnapshotManager.class);

    static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private final WorkspaceResolver workspaces;
    private final Path              snapshotRoot;
    private final Clock             clock;

    public SnapshotManager(WorkspaceResolver workspaces,
                           WorkspaceProperties properties,
                           Clock clock) {
        this.workspaces   = workspaces;
        this.snapshotRoot = properties.snapshotRootPath();
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Snapshot / restore
    // ------------------------------------------------------------------

    /**
     * Copy the live workspace of {@code env} into a new snapshot directory.
     *
     * @return absolute path of the snapshot
     * @throws SnapshotException if the copy fails; a partial snapshot is removed
     */
    public Path snapshot(TargetEnvironment env) {
        Path source = workspaces.root(env);
        Path target = null;
        try {
            Files.createDirectories(snapshotRoot);
            target = freshName(env.id() + "-" + STAMP.format(clock.instant()));
            FileTrees.copy(source, target);
            log.info("Snapshot '{}' taken of {} workspace", target.getFileName(), env.id());
            return target;
        } catch (IOException e) {
            discardPartial(target);
            throw new SnapshotException("Snapshot of " + env.id() + " workspace failed", e);
        }
    }

    /**
     * Replace the live workspace of {@code env} with the content of {@code snapshot}.
     *
     * @throws SnapshotNotFoundException if the snapshot belongs to another environment
     * @throws SnapshotException if the snapshot is not a directory under the
     *                           snapshot root, or the wipe/copy fails
     */
    public void restore(TargetEnvironment env, Path snapshot) {
        Path source = snapshot.toAbsolutePath().normalize();
        if (!source.startsWith(snapshotRoot) || source.equals(snapshotRoot) || !Files.isDirectory(source)) {
            throw new SnapshotException("Not a snapshot: " + snapshot);
        }
        // a workspace is only ever restored from its own snapshots
        if (!source.getFileName().toString().startsWith(env.id() + "-")) {
            throw new SnapshotNotFoundException(source.getFileName().toString());
        }
        Path live = workspaces.path(env);
        try {
            FileTrees.delete(live);
            FileTrees.copy(source, live);
        } catch (IOException e) {
            throw new SnapshotException("Restore of " + env.id() + " from '"
                    + source.getFileName() + "' failed", e);
        }
        log.info("Restored {} workspace from snapshot '{}'", env.id(), source.getFileName());
    }

    // ------------------------------------------------------------------
    // Listing
    // ------------------------------------------------------------------

    /** Snapshots of {@code env}, newest first. */
    public List<SnapshotInfo> list(TargetEnvironment env) {
        String prefix = env.id() + "-";
        return listAll().stream()
                .filter(s -> s.name().startsWith(prefix))
                .toList();
    }

    /** Every snapshot of every environment, newest first. */
    public List<SnapshotInfo> listAll() {
        if (!Files.isDirectory(snapshotRoot)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(snapshotRoot)) {
            return children
                    .filter(Files::isDirectory)
                    .map(p -> new SnapshotInfo(p.getFileName().toString(), p))
                    .sorted(Comparator.comparing(SnapshotInfo::name).reversed())
                    .toList();
        } catch (IOException e) {
            throw new SnapshotException("Cannot list snapshots in " + snapshotRoot, e);
        }
    }

    /**
     * Look up a snapshot by the name a caller picked from {@link #list}.
     *
     * @throws SnapshotNotFoundException if the name escapes the snapshot root or does not exist
     */
    public Path resolve(String name) {
        if (name == null || name.isBlank()) {
            throw new SnapshotNotFoundException(String.valueOf(name));
        }
        Path candidate;
        try {
            candidate = snapshotRoot.resolve(name).normalize();
        } catch (InvalidPathException e) {
            throw new SnapshotNotFoundException(name);
        }
        if (!snapshotRoot.equals(candidate.getParent()) || !Files.isDirectory(candidate)) {
            throw new SnapshotNotFoundException(name);
        }
        return candidate;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Two batches in the same second would collide on the timestamp; suffix
     * the later one rather than merge into an existing snapshot. The suffix
     * is zero-padded so names keep sorting chronologically up to 999 snapshots
     * per second.
     */
    private Path freshName(String base) {
        Path candidate = snapshotRoot.resolve(base);
        for (int n = 1; Files.exists(candidate); n++) {
            candidate = snapshotRoot.resolve(base + "-%03d".formatted(n));
        }
        return candidate;
    }

    private void discardPartial(Path target) {
        if (target == null) return;
        try {
            FileTrees.delete(target);
        } catch (IOException e) {
            log.warn("Could not remove partial snapshot {}: {}", target, e.getMessage());
        }
    }
}
