package com.actionguard.gateway.workspace;

/**
 * Thrown when a snapshot cannot be taken, found or restored.
 *
 * Never swallowed: a missing pre-execution snapshot means there is no
 * rollback point, so the caller must see it.
 */
public class SnapshotException extends RuntimeException {

    public SnapshotException(String message) {
        super(message);
    }

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
