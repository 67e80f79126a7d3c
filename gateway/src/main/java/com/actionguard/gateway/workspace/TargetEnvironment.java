package com.actionguard.gateway.workspace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Deployment targets, each with its own confined workspace.
 */
public enum TargetEnvironment {
    DEV,
    STAGING,
    PROD;

    /** Lower-case id used in paths, snapshot names and audit records. */
    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TargetEnvironment fromId(String id) {
        return Arrays.stream(values())
                .filter(e -> e.id().equalsIgnoreCase(id == null ? "" : id.strip()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown environment: " + id));
    }
}
