package com.actionguard.gateway.plan;

import java.util.List;

/**
 * One requested mutation, as parsed from a single plan line.
 *
 * @param kind  tagged kind; {@link ActionKind#UNKNOWN} for anything outside the vocabulary
 * @param name  the kind token exactly as written (e.g. "write", "rm")
 * @param args  positional arguments; a "| payload" suffix is the last element
 * @param raw   the trimmed source line, kept for audit and keyword scanning
 */
public record Action(ActionKind kind, String name, List<String> args, String raw) {

    public Action {
        args = List.copyOf(args);
    }

    public static Action of(String name, List<String> args, String raw) {
        return new Action(ActionKind.fromToken(name), name, args, raw);
    }
}
