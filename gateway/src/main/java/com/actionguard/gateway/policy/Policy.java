package com.actionguard.gateway.policy;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Declarative risk rules, treated as an immutable value.
 *
 * @param prodLocked        every batch against prod is HIGH
 * @param allowedActions    permitted action kind tokens
 * @param highRiskKeywords  case-insensitive substrings of a raw line that force HIGH
 * @param medRiskHints      case-insensitive substrings that force at least MEDIUM
 */
public record Policy(
        boolean      prodLocked,
        Set<String>  allowedActions,
        List<String> highRiskKeywords,
        List<String> medRiskHints) {

    public static final List<String> DEFAULT_ALLOWED_ACTIONS = List.of(
            "write", "append", "delete_file", "move", "make_dir");

    public static final List<String> DEFAULT_HIGH_RISK_KEYWORDS = List.of(
            "drop table", "delete database", "rm -rf", "truncate", "kubectl delete",
            "terraform destroy", "shutdown", "format", "wipe", "vault delete",
            "aws s3 rm", "gcloud sql instances delete");

    public static final List<String> DEFAULT_MED_RISK_HINTS = List.of(
            "overwrite", "migrate", "secrets", "credentials", "prod", "production");

    public Policy {
        // keep the configured order so reasons come out in a stable sequence
        allowedActions   = allowedActions   == null ? Set.of()  : Collections.unmodifiableSet(new LinkedHashSet<>(allowedActions));
        highRiskKeywords = highRiskKeywords == null ? List.of() : List.copyOf(highRiskKeywords);
        medRiskHints     = medRiskHints     == null ? List.of() : List.copyOf(medRiskHints);
    }

    public static Policy defaults() {
        return new Policy(true,
                new LinkedHashSet<>(DEFAULT_ALLOWED_ACTIONS),
                DEFAULT_HIGH_RISK_KEYWORDS,
                DEFAULT_MED_RISK_HINTS);
    }
}
