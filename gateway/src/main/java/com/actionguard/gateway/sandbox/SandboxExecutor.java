package com.actionguard.gateway.sandbox;

import com.actionguard.gateway.plan.Action;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Applies a single {@link Action} inside a workspace root.
 *
 * Every path argument goes through {@link PathConfinement} before the
 * filesystem is touched. {@link #execute} never throws: confinement
 * violations, malformed arguments and I/O errors all come back as a failed
 * {@link ActionOutcome}, so a batch runs every action regardless of earlier
 * failures.
 *
 * <p>Vocabulary:
 * <ul>
 *   <li>{@code write path | content}: create or truncate, content verbatim</li>
 *   <li>{@code append path | content}: appends {@code "\n" + content}, also when
 *       the file is new</li>
 *   <li>{@code delete_file path}: regular files only, never directories</li>
 *   <li>{@code move src dst}: into {@code dst} if it is a directory; an existing
 *       destination file is replaced</li>
 *   <li>{@code make_dir path}: with parents, idempotent</li>
 * </ul>
 */
@Component
public class SandboxExecutor {

    public ActionOutcome execute(Path workspaceRoot, Action action) {
        try {
            return switch (action.kind()) {
                case WRITE       -> write(workspaceRoot, action);
                case APPEND      -> append(workspaceRoot, action);
                case DELETE_FILE -> deleteFile(workspaceRoot, action);
                case MOVE        -> move(workspaceRoot, action);
                case MAKE_DIR    -> makeDir(workspaceRoot, action);
                case UNKNOWN     -> ActionOutcome.failure(SandboxException.Kind.NOT_ALLOWED,
                        "Action not allowed: " + action.name());
            };
        } catch (SandboxException e) {
            return ActionOutcome.failure(e.getKind(), e.getDetail());
        } catch (IOException | RuntimeException e) {
            return ActionOutcome.failure(SandboxException.Kind.IO_ERROR, "Error: " + describe(e));
        }
    }

    // ------------------------------------------------------------------
    // Per-kind handlers
    // ------------------------------------------------------------------

    private ActionOutcome write(Path root, Action action) throws IOException {
        String rel     = arg(action, 0);
        String content = arg(action, 1);
        Path target = PathConfinement.confine(root, rel);
        createParents(target);
        Files.writeString(target, content, StandardCharsets.UTF_8);
        return ActionOutcome.success("Wrote " + rel);
    }

    private ActionOutcome append(Path root, Action action) throws IOException {
        String rel     = arg(action, 0);
        String content = arg(action, 1);
        Path target = PathConfinement.confine(root, rel);
        createParents(target);
        Files.writeString(target, "\n" + content, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        return ActionOutcome.success("Appended " + rel);
    }

    private ActionOutcome deleteFile(Path root, Action action) throws IOException {
        String rel = arg(action, 0);
        Path target = PathConfinement.confine(root, rel);
        if (Files.isDirectory(target)) {
            throw new SandboxException(SandboxException.Kind.DIRECTORY_REFUSED, "Refusing to delete directories");
        }
        if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            throw new SandboxException(SandboxException.Kind.NOT_FOUND, "Not found: " + rel);
        }
        Files.delete(target);
        return ActionOutcome.success("Deleted " + rel);
    }

    private ActionOutcome move(Path root, Action action) throws IOException {
        String src = arg(action, 0);
        String dst = arg(action, 1);
        Path source      = PathConfinement.confine(root, src);
        Path destination = PathConfinement.confine(root, dst);
        if (!Files.exists(source, LinkOption.NOFOLLOW_LINKS)) {
            throw new SandboxException(SandboxException.Kind.NOT_FOUND, "Not found: " + src);
        }
        if (Files.isDirectory(destination)) {
            destination = destination.resolve(source.getFileName().toString());
        }
        createParents(destination);
        try {
            Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            // different file store: copy + delete
            Files.move(source, destination, StandardCopyOption.REPLACE_EXISTING);
        }
        return ActionOutcome.success("Moved " + src + " -> " + dst);
    }

    private ActionOutcome makeDir(Path root, Action action) throws IOException {
        String rel = arg(action, 0);
        Path target = PathConfinement.confine(root, rel);
        Files.createDirectories(target);
        return ActionOutcome.success("Created dir " + rel);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static String arg(Action action, int index) {
        if (index >= action.args().size()) {
            throw new SandboxException(SandboxException.Kind.MALFORMED_ACTION,
                    "Malformed action: %s expects at least %d argument(s), got %d"
                            .formatted(action.name(), index + 1, action.args().size()));
        }
        return action.args().get(index);
    }

    private static void createParents(Path target) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName()
                                      : e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
