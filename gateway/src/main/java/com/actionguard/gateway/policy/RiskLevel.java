package com.actionguard.gateway.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Batch risk classification, ordered LOW &lt; MEDIUM &lt; HIGH.
 *
 * Serialized with its display label ("Low", "Medium", "High") so audit
 * lines read the same as the risk banner an operator sees.
 */
public enum RiskLevel {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() { return label; }

    /** The higher of this level and {@code other}; never downgrades. */
    public RiskLevel atLeast(RiskLevel other) {
        return other.ordinal() > ordinal() ? other : this;
    }

    @JsonCreator
    public static RiskLevel fromLabel(String label) {
        return Arrays.stream(values())
                .filter(r -> r.label.equalsIgnoreCase(label) || r.name().equalsIgnoreCase(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown risk level: " + label));
    }
}
