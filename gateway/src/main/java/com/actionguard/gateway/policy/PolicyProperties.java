package com.actionguard.gateway.policy;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Policy overrides from application configuration.
 *
 * Every field is optional; anything left unset falls back to
 * {@link Policy#defaults()}. {@code file} points at an optional YAML policy
 * file that is layered on top and re-read by {@link PolicyStore#reload()}.
 */
@ConfigurationProperties("actionguard.policy")
public record PolicyProperties(
        Boolean      prodLocked,
        List<String> allowedActions,
        List<String> highRiskKeywords,
        List<String> medRiskHints,
        String       file) {

    /** Defaults overlaid with whatever is set here. */
    public Policy toPolicy() {
        Policy defaults = Policy.defaults();
        return new Policy(
                prodLocked       != null ? prodLocked       : defaults.prodLocked(),
                allowedActions   != null ? new LinkedHashSet<>(allowedActions) : defaults.allowedActions(),
                highRiskKeywords != null ? highRiskKeywords : defaults.highRiskKeywords(),
                medRiskHints     != null ? medRiskHints     : defaults.medRiskHints());
    }
}
