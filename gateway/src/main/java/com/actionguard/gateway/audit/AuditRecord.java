package com.actionguard.gateway.audit;

import com.actionguard.gateway.policy.RiskLevel;
import com.actionguard.gateway.workspace.TargetEnvironment;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;

/**
 * One executed batch, as written to the audit log.
 *
 * @param ts           when the record was assembled (UTC)
 * @param env          target environment
 * @param task         operator's description of what the agent was doing
 * @param risk         batch risk at execution time
 * @param reasons      policy findings, in discovery order
 * @param approved     approval decision
 * @param approverNote free-text note from the approver, or the auto-approval marker
 * @param preSnapshot  path of the snapshot taken just before execution
 * @param results      per-action outcomes, in execution order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"ts", "env", "task", "risk", "reasons", "approved",
                    "approver_note", "pre_snapshot", "results"})
public record AuditRecord(
        Instant            ts,
        TargetEnvironment  env,
        String             task,
        RiskLevel          risk,
        List<String>       reasons,
        boolean            approved,
        @JsonProperty("approver_note") String approverNote,
        @JsonProperty("pre_snapshot")  String preSnapshot,
        List<ActionResult> results) {

    public AuditRecord {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        results = results == null ? List.of() : List.copyOf(results);
    }

    public boolean allSucceeded() {
        return results.stream().allMatch(ActionResult::ok);
    }
}
