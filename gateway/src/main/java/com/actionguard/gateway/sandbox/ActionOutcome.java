package com.actionguard.gateway.sandbox;

/**
 * Result of applying one action.
 *
 * @param ok       true if the action took effect
 * @param message  human-readable outcome, recorded verbatim in the audit log
 * @param failure  failure category, or null when ok
 */
public record ActionOutcome(boolean ok, String message, SandboxException.Kind failure) {

    public static ActionOutcome success(String message) {
        return new ActionOutcome(true, message, null);
    }

    public static ActionOutcome failure(SandboxException.Kind kind, String message) {
        return new ActionOutcome(false, message, kind);
    }
}
