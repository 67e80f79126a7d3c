package com.actionguard.gateway.plan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses an agent plan into {@link Action}s, one per line.
 *
 * Grammar:
 * <pre>
 *   # comment
 *   kind arg1 arg2 ...
 *   kind arg1 ... | payload text
 * </pre>
 * Everything after the first {@code |} is a single trailing argument.
 * There is no quoting or escaping.
 *
 * The parser never rejects a line. Argument counts are checked by the
 * sandbox when the action runs, so one bad line cannot sink a whole plan.
 */
public class PlanParser {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private PlanParser() {}

    public static List<Action> parse(String planText) {
        List<Action> actions = new ArrayList<>();
        if (planText == null) {
            return actions;
        }
        for (String line : planText.lines().toList()) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            actions.add(parseLine(trimmed));
        }
        return actions;
    }

    private static Action parseLine(String line) {
        int bar = line.indexOf('|');
        List<String> tokens;
        if (bar >= 0) {
            tokens = split(line.substring(0, bar));
            tokens.add(line.substring(bar + 1).strip());
        } else {
            tokens = split(line);
        }
        // "| payload" leaves no kind token; keep it as an empty, unknown kind
        String name = bar == 0 || tokens.isEmpty() ? "" : tokens.remove(0);
        return Action.of(name, tokens, line);
    }

    private static List<String> split(String text) {
        String stripped = text.strip();
        if (stripped.isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(WHITESPACE.split(stripped)));
    }
}
