package com.actionguard.gateway.policy;

import com.actionguard.gateway.plan.Action;
import com.actionguard.gateway.workspace.TargetEnvironment;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders an {@link Analysis} as a Markdown report an operator can attach to
 * a change request.
 */
@Component
public class RiskReportRenderer {

    private static final DateTimeFormatter GENERATED =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final Clock clock;

    public RiskReportRenderer(Clock clock) {
        this.clock = clock;
    }

    public String render(Analysis analysis, List<Action> actions, TargetEnvironment env) {
        StringBuilder md = new StringBuilder();
        md.append("# Risk Analysis Report\n\n");
        md.append("**Environment:** ").append(env.id()).append("\n");
        md.append("**Overall Risk Level:** ").append(analysis.risk().label()).append("\n");
        md.append("**Generated:** ").append(GENERATED.format(clock.instant())).append(" UTC\n\n");
        md.append("## Risk Assessment\n\n");

        if (analysis.reasons().isEmpty()) {
            md.append("No specific risk factors identified.\n");
        } else {
            md.append("**Risk Factors:**\n");
            analysis.reasons().forEach(r -> md.append("- ").append(r).append("\n"));
        }

        md.append("\n## Planned Actions (").append(actions.size()).append(" total)\n\n");
        for (int i = 0; i < actions.size(); i++) {
            md.append(i + 1).append(". `").append(actions.get(i).raw()).append("`\n");
        }
        return md.toString();
    }
}
