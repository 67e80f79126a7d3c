package com.actionguard.gateway.policy;

import com.actionguard.gateway.plan.Action;
import com.actionguard.gateway.plan.ActionKind;
import com.actionguard.gateway.workspace.TargetEnvironment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Static risk classifier for a batch of actions.
 *
 * Runs entirely in memory: no filesystem access, no state between calls.
 * The same (actions, environment, policy) always produces the same
 * {@link Analysis}, reasons included.
 *
 * Checks, in order:
 *   - prod locked by policy (batch-level)
 *   - per action: kind outside the allow-list, high-risk keywords,
 *     medium-risk hints, file deletion in prod
 *
 * Risk is coarse-grained: one HIGH finding on any action marks the whole
 * batch HIGH.
 */
@Component
public class PolicyEvaluator {

    public Analysis evaluate(List<Action> actions, TargetEnvironment env, Policy policy) {
        List<String> reasons = new ArrayList<>();
        RiskLevel risk = RiskLevel.LOW;

        if (env == TargetEnvironment.PROD && policy.prodLocked()) {
            risk = risk.atLeast(RiskLevel.HIGH);
            reasons.add("Prod environment is locked by policy.");
        }

        for (Action action : actions) {
            String rawLower = action.raw().toLowerCase(Locale.ROOT);

            if (!policy.allowedActions().contains(action.name())) {
                risk = risk.atLeast(RiskLevel.HIGH);
                reasons.add("Disallowed action: " + action.name());
            }
            for (String keyword : policy.highRiskKeywords()) {
                if (rawLower.contains(keyword.toLowerCase(Locale.ROOT))) {
                    risk = risk.atLeast(RiskLevel.HIGH);
                    reasons.add("High-risk keyword detected: '%s' in '%s'".formatted(keyword, action.raw()));
                }
            }
            for (String hint : policy.medRiskHints()) {
                if (rawLower.contains(hint.toLowerCase(Locale.ROOT))) {
                    risk = risk.atLeast(RiskLevel.MEDIUM);
                    reasons.add("Medium-risk hint: '%s' in '%s'".formatted(hint, action.raw()));
                }
            }
            if (env == TargetEnvironment.PROD && action.kind() == ActionKind.DELETE_FILE) {
                risk = risk.atLeast(RiskLevel.HIGH);
                reasons.add("Deleting files in prod requires explicit approval.");
            }
        }

        return new Analysis(risk, reasons);
    }
}
