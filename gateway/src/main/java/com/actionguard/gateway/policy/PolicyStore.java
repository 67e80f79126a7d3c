package com.actionguard.gateway.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Holds the policy currently in force.
 *
 * The policy is an immutable value: callers take {@link #current()} and
 * pass it to {@link PolicyEvaluator#evaluate}. {@link #reload()} rebuilds it
 * from the configured sources and swaps it in wholesale.
 *
 * Sources, lowest precedence first:
 *   1. built-in defaults ({@link Policy#defaults()})
 *   2. {@code actionguard.policy.*} properties
 *   3. the YAML file at {@code actionguard.policy.file}, key by key
 *
 * A missing file is not an error. A malformed one is logged and ignored, so
 * a bad edit never leaves the gateway without a policy.
 */
@Component
public class PolicyStore {

    private static final Logger log = LoggerFactory.getLogger(PolicyStore.class);

    private final PolicyProperties properties;
    private final YAMLMapper       yaml = new YAMLMapper();

    private volatile Policy current;

    public PolicyStore(PolicyProperties properties) {
        this.properties = properties;
        this.current    = load();
    }

    public Policy current() {
        return current;
    }

    /** Re-read all sources and replace the current policy. */
    public Policy reload() {
        Policy reloaded = load();
        this.current = reloaded;
        log.info("Policy reloaded: prodLocked={} allowed={} highRiskKeywords={} medRiskHints={}",
                reloaded.prodLocked(), reloaded.allowedActions(),
                reloaded.highRiskKeywords().size(), reloaded.medRiskHints().size());
        return reloaded;
    }

    // ------------------------------------------------------------------
    // Loading
    // ------------------------------------------------------------------

    /** Keys as written in the YAML policy file. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record PolicyFile(
            @JsonProperty("prod_locked")        Boolean      prodLocked,
            @JsonProperty("allowed_actions")    List<String> allowedActions,
            @JsonProperty("high_risk_keywords") List<String> highRiskKeywords,
            @JsonProperty("med_risk_hints")     List<String> medRiskHints) {}

    private Policy load() {
        Policy base = properties.toPolicy();
        PolicyFile overrides = readFile();
        if (overrides == null) {
            return assemble(base.prodLocked(), List.copyOf(base.allowedActions()),
                    base.highRiskKeywords(), base.medRiskHints());
        }
        return assemble(
                overrides.prodLocked()       != null ? overrides.prodLocked()       : base.prodLocked(),
                overrides.allowedActions()   != null ? overrides.allowedActions()   : List.copyOf(base.allowedActions()),
                overrides.highRiskKeywords() != null ? overrides.highRiskKeywords() : base.highRiskKeywords(),
                overrides.medRiskHints()     != null ? overrides.medRiskHints()     : base.medRiskHints());
    }

    /** The parsed policy file, or null when there is none or it is unusable. */
    private PolicyFile readFile() {
        if (properties.file() == null || properties.file().isBlank()) {
            return null;
        }
        Path path = Path.of(properties.file());
        if (!Files.isRegularFile(path)) {
            log.debug("No policy file at {}; using configured defaults", path);
            return null;
        }
        try {
            return yaml.readValue(path.toFile(), PolicyFile.class);
        } catch (MismatchedInputException e) {
            log.warn("Policy file {} has an unexpected shape, using configured defaults: {}",
                    path, e.getOriginalMessage());
            return null;
        } catch (IOException e) {
            log.warn("Policy file {} could not be read, using configured defaults: {}", path, e.getMessage());
            return null;
        }
    }

    // blank entries would match every line
    private static Policy assemble(boolean prodLocked,
                                   List<String> allowedActions,
                                   List<String> highRiskKeywords,
                                   List<String> medRiskHints) {
        return new Policy(
                prodLocked,
                new LinkedHashSet<>(clean(allowedActions)),
                clean(highRiskKeywords),
                clean(medRiskHints));
    }

    private static List<String> clean(List<String> values) {
        return values.stream()
                .filter(Objects::nonNull)
                .map(String::strip)
                .filter(v -> !v.isEmpty())
                .toList();
    }
}
