package com.actionguard.gateway.sandbox;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Keeps action paths inside a workspace root.
 *
 * A relative path is resolved against the root and normalised, then its
 * deepest existing ancestor is canonicalised (symlinks followed) and the
 * not-yet-existing remainder re-appended. The result must sit inside the
 * canonical root, compared component by component so {@code /ws/dev2}
 * does not pass for {@code /ws/dev}.
 */
final class PathConfinement {

    static final String BLOCKED = "Path traversal blocked";

    private PathConfinement() {}

    /**
     * @return the lexical (symlinks not resolved) path to operate on
     * @throws SandboxException CONFINEMENT_VIOLATION if the path escapes the root
     */
    static Path confine(Path root, String relative) {
        Path canonicalRoot = canonical(root);
        Path lexical;
        try {
            lexical = canonicalRoot.resolve(relative).normalize();
        } catch (InvalidPathException e) {
            throw new SandboxException(SandboxException.Kind.CONFINEMENT_VIOLATION, BLOCKED);
        }
        if (!lexical.startsWith(canonicalRoot) || !canonical(lexical).startsWith(canonicalRoot)) {
            throw new SandboxException(SandboxException.Kind.CONFINEMENT_VIOLATION, BLOCKED);
        }
        return lexical;
    }

    private static Path canonical(Path path) {
        Path existing = path;
        Path remainder = null;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            Path name = existing.getFileName();
            remainder = remainder == null ? name : name.resolve(remainder);
            existing = existing.getParent();
        }
        if (existing == null) {
            return path;
        }
        try {
            Path real = existing.toRealPath();
            return remainder == null ? real : real.resolve(remainder).normalize();
        } catch (IOException e) {
            // dangling symlink
            throw new SandboxException(SandboxException.Kind.CONFINEMENT_VIOLATION, BLOCKED);
        }
    }
}
