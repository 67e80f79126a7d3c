package com.actionguard.gateway.policy;

import java.util.List;

/**
 * Result of evaluating a batch against a policy.
 *
 * @param risk    overall batch risk; a single HIGH signal anywhere makes the batch HIGH
 * @param reasons human-readable findings in discovery order, duplicates kept
 */
public record Analysis(RiskLevel risk, List<String> reasons) {

    public Analysis {
        reasons = List.copyOf(reasons);
    }
}
