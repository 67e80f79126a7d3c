package com.actionguard.gateway.api;

import com.actionguard.gateway.api.dto.AnalysisResponse;
import com.actionguard.gateway.api.dto.AnalyzeRequest;
import com.actionguard.gateway.api.dto.BatchResponse;
import com.actionguard.gateway.api.dto.ExecuteBatchRequest;
import com.actionguard.gateway.api.dto.RestoreRequest;
import com.actionguard.gateway.audit.AuditRecord;
import com.actionguard.gateway.audit.LineVerification;
import com.actionguard.gateway.policy.Policy;
import com.actionguard.gateway.service.ApprovalRequiredException;
import com.actionguard.gateway.service.BatchService;
import com.actionguard.gateway.service.ExecutionRequest;
import com.actionguard.gateway.workspace.SnapshotInfo;
import com.actionguard.gateway.workspace.SnapshotNotFoundException;
import com.actionguard.gateway.workspace.TargetEnvironment;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * REST API for the review → approve → execute → rollback cycle.
 *
 * POST /plans/analyze                  parse + risk analysis, nothing executed
 * POST /plans/report                   the same analysis as a Markdown report
 * POST /batches                        execute a plan (snapshot first, audited)
 * GET  /audit/last                     most recent audit record
 * GET  /audit/verify                   checksum check of every audit line
 * GET  /environments/{env}/snapshots   rollback points, newest first
 * POST /environments/{env}/restore     roll a workspace back to a snapshot
 * GET  /policy, POST /policy/reload    inspect / reload the risk policy
 */
@RestController
public class BatchController {

    private final BatchService batchService;

    public BatchController(BatchService batchService) {
        this.batchService = batchService;
    }

    // ------------------------------------------------------------------
    // Plans
    // ------------------------------------------------------------------

    /**
     * Example:
     *   curl -X POST http://localhost:8080/plans/analyze \
     *     -H "Content-Type: application/json" \
     *     -d '{"env":"dev","plan":"write releases/notes.md | Release v1.2 notes"}'
     */
    @PostMapping("/plans/analyze")
    public AnalysisResponse analyze(@RequestBody AnalyzeRequest req) {
        return AnalysisResponse.from(batchService.review(req.plan(), env(req.env())));
    }

    @PostMapping(value = "/plans/report", produces = "text/markdown")
    public String report(@RequestBody AnalyzeRequest req) {
        return batchService.report(req.plan(), env(req.env()));
    }

    // ------------------------------------------------------------------
    // Batches
    // ------------------------------------------------------------------

    /**
     * Execute a plan. Always 201 once the batch ran, even if some actions
     * failed: the failures are in the record and the snapshot allows a rollback.
     * 403 when the plan needs approval and "APPROVE" was not given.
     */
    @PostMapping("/batches")
    public ResponseEntity<BatchResponse> execute(@RequestBody ExecuteBatchRequest req) {
        ExecutionRequest request = new ExecutionRequest(
                req.task(), req.plan(), env(req.env()), req.approval(), req.approverNote());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BatchResponse.from(batchService.execute(request)));
    }

    @ExceptionHandler(ApprovalRequiredException.class)
    public ResponseEntity<Map<String, Object>> approvalRequired(ApprovalRequiredException e) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of(
                "error",   "approval_required",
                "risk",    e.getAnalysis().risk().label(),
                "reasons", e.getAnalysis().reasons()));
    }

    // ------------------------------------------------------------------
    // Audit
    // ------------------------------------------------------------------

    @GetMapping("/audit/last")
    public AuditRecord lastAudit() {
        return batchService.lastAudit().orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "No audit records yet"));
    }

    @GetMapping("/audit/verify")
    public List<LineVerification> verifyAudit() {
        return batchService.verifyAudit();
    }

    // ------------------------------------------------------------------
    // Snapshots
    // ------------------------------------------------------------------

    @GetMapping("/environments/{env}/snapshots")
    public List<String> snapshots(@PathVariable("env") String env) {
        return batchService.snapshots(env(env)).stream()
                .map(SnapshotInfo::name)
                .toList();
    }

    @PostMapping("/environments/{env}/restore")
    public ResponseEntity<Void> restore(@PathVariable("env") String env, @RequestBody RestoreRequest req) {
        try {
            batchService.restore(env(env), req.snapshot());
        } catch (SnapshotNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
        return ResponseEntity.noContent().build();
    }

    // ------------------------------------------------------------------
    // Policy
    // ------------------------------------------------------------------

    @GetMapping("/policy")
    public Policy policy() {
        return batchService.currentPolicy();
    }

    @PostMapping("/policy/reload")
    public Policy reloadPolicy() {
        return batchService.reloadPolicy();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static TargetEnvironment env(String id) {
        try {
            return TargetEnvironment.fromId(id);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }
}
