package com.actionguard.gateway.sandbox;

/**
 * Raised inside the sandbox when an action cannot be applied.
 *
 * Never leaves {@link SandboxExecutor}: it is converted into a failed
 * {@link ActionOutcome} at the action boundary so the rest of the batch
 * still runs.
 */
public class SandboxException extends RuntimeException {

    public enum Kind {
        CONFINEMENT_VIOLATION,
        MALFORMED_ACTION,
        NOT_ALLOWED,
        NOT_FOUND,
        DIRECTORY_REFUSED,
        IO_ERROR
    }

    private final Kind   kind;
    private final String detail;

    public SandboxException(Kind kind, String detail) {
        super("[" + kind + "] " + detail);
        this.kind   = kind;
        this.detail = detail;
    }

    public Kind getKind() { return kind; }

    /** Operator-facing message, without the kind prefix. */
    public String getDetail() { return detail; }
}
