package com.actionguard.gateway.plan;

import java.util.Arrays;

/**
 * The fixed action vocabulary understood by the sandbox.
 *
 * Anything the parser does not recognise maps to {@link #UNKNOWN}; the
 * verbatim token stays on the {@link Action} so it can be reported as
 * disallowed.
 */
public enum ActionKind {
    WRITE("write"),
    APPEND("append"),
    DELETE_FILE("delete_file"),
    MOVE("move"),
    MAKE_DIR("make_dir"),
    UNKNOWN(null);

    private final String token;

    ActionKind(String token) {
        this.token = token;
    }

    /** Token as written in a plan, or null for UNKNOWN. */
    public String token() { return token; }

    public static ActionKind fromToken(String token) {
        return Arrays.stream(values())
                .filter(k -> k.token != null && k.token.equals(token))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
