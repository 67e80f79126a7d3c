package com.actionguard.gateway.audit;

/**
 * Thrown when an audit entry cannot be written.
 */
public class AuditLogException extends RuntimeException {

    public AuditLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
