package com.actionguard.gateway.service;

import com.actionguard.gateway.audit.ActionResult;
import com.actionguard.gateway.audit.AuditEntry;
import com.actionguard.gateway.audit.AuditLog;
import com.actionguard.gateway.audit.AuditRecord;
import com.actionguard.gateway.audit.LineVerification;
import com.actionguard.gateway.plan.Action;
import com.actionguard.gateway.plan.ActionKind;
import com.actionguard.gateway.plan.PlanParser;
import com.actionguard.gateway.policy.Analysis;
import com.actionguard.gateway.policy.Policy;
import com.actionguard.gateway.policy.PolicyEvaluator;
import com.actionguard.gateway.policy.PolicyStore;
import com.actionguard.gateway.policy.RiskLevel;
import com.actionguard.gateway.policy.RiskReportRenderer;
import com.actionguard.gateway.sandbox.ActionOutcome;
import com.actionguard.gateway.sandbox.SandboxExecutor;
import com.actionguard.gateway.workspace.SnapshotInfo;
import com.actionguard.gateway.workspace.SnapshotManager;
import com.actionguard.gateway.workspace.TargetEnvironment;
import com.actionguard.gateway.workspace.WorkspaceResolver;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives a batch through the interlock:
 * <pre>
 *   parse → evaluate → approval gate → snapshot → execute each action → audit
 * </pre>
 * and rolls a workspace back to a chosen snapshot.
 *
 * Snapshot, execution and audit append for one environment run under that
 * environment's lock, as does restore, so a rollback can never interleave
 * with a running batch. Everything is synchronous on the caller's thread.
 *
 * Failure handling:
 *   - a failing action is recorded and the batch moves on to the next one
 *   - snapshot and audit failures propagate; without them there is no
 *     rollback point or no record, so the batch must not report success
 */
@Service
public class BatchService {

    private static final Logger log = LoggerFactory.getLogger(BatchService.class);

    static final String APPROVAL_PHRASE = "APPROVE";
    static final String AUTO_APPROVED   = "Auto-approved (Low risk)";

    private final PolicyStore        policyStore;
    private final PolicyEvaluator    evaluator;
    private final SandboxExecutor    executor;
    private final SnapshotManager    snapshots;
    private final AuditLog           auditLog;
    private final WorkspaceResolver  workspaces;
    private final RiskReportRenderer reportRenderer;
    private final MeterRegistry      meterRegistry;
    private final Clock              clock;

    private final EnvironmentLocks locks = new EnvironmentLocks();

    public BatchService(PolicyStore policyStore,
                        PolicyEvaluator evaluator,
                        SandboxExecutor executor,
                        SnapshotManager snapshots,
                        AuditLog auditLog,
                        WorkspaceResolver workspaces,
                        RiskReportRenderer reportRenderer,
                        MeterRegistry meterRegistry,
                        Clock clock) {
        this.policyStore    = policyStore;
        this.evaluator      = evaluator;
        this.executor       = executor;
        this.snapshots      = snapshots;
        this.auditLog       = auditLog;
        this.workspaces     = workspaces;
        this.reportRenderer = reportRenderer;
        this.meterRegistry  = meterRegistry;
        this.clock          = clock;
    }

    // ------------------------------------------------------------------
    // Review
    // ------------------------------------------------------------------

    /** Parse and evaluate a plan against the current policy. Touches nothing on disk. */
    public PlanReview review(String plan, TargetEnvironment env) {
        List<Action> actions = PlanParser.parse(plan);
        Analysis analysis = evaluator.evaluate(actions, env, policyStore.current());
        boolean approvalRequired = analysis.risk() != RiskLevel.LOW || env == TargetEnvironment.PROD;
        return new PlanReview(env, actions, analysis, approvalRequired);
    }

    /** Markdown risk report for a plan. */
    public String report(String plan, TargetEnvironment env) {
        PlanReview review = review(plan, env);
        return reportRenderer.render(review.analysis(), review.actions(), env);
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    /**
     * Run a batch in the sandbox.
     *
     * The plan is evaluated again here, so the gate always applies to what
     * actually runs rather than to an earlier review.
     *
     * @throws ApprovalRequiredException if approval is needed and missing;
     *                                   nothing has been touched
     */
    public BatchReport execute(ExecutionRequest request) {
        TargetEnvironment env = request.env();
        PlanReview review = review(request.plan(), env);

        boolean approved = APPROVAL_PHRASE.equals(request.approval() == null ? null : request.approval().strip());
        if (review.approvalRequired() && !approved) {
            meterRegistry.counter("actionguard.batch.rejected", "env", env.id()).increment();
            log.warn("Batch for {} rejected: {} risk needs approval", env.id(), review.analysis().risk().label());
            throw new ApprovalRequiredException(review.analysis());
        }
        String note = review.approvalRequired() ? request.approverNote() : AUTO_APPROVED;

        MDC.put("env",     env.id());
        MDC.put("batchId", UUID.randomUUID().toString().substring(0, 8));
        try {
            return locks.withLock(env, () -> runBatch(request.task(), review, note));
        } finally {
            MDC.remove("env");
            MDC.remove("batchId");
        }
    }

    private BatchReport runBatch(String task, PlanReview review, String approverNote) {
        TargetEnvironment env = review.env();
        Timer.Sample sample = Timer.start(meterRegistry);
        log.info("Starting batch: env={} actions={} risk={}",
                env.id(), review.actions().size(), review.analysis().risk().label());

        Path snapshot = snapshots.snapshot(env);
        Path root     = workspaces.root(env);

        List<ActionResult> results = new ArrayList<>();
        for (Action action : review.actions()) {
            ActionOutcome outcome = executor.execute(root, action);
            results.add(new ActionResult(action.raw(), outcome.ok(), outcome.message()));
            meterRegistry.counter("actionguard.action.calls",
                    "kind",   metricKind(action),
                    "status", outcome.ok() ? "success" : outcome.failure().name().toLowerCase(Locale.ROOT)).increment();
            if (outcome.ok()) {
                log.debug("Action ok: {} -> {}", action.raw(), outcome.message());
            } else {
                log.warn("Action failed: {} -> {}", action.raw(), outcome.message());
            }
        }

        AuditRecord record = new AuditRecord(
                clock.instant(),
                env,
                task,
                review.analysis().risk(),
                review.analysis().reasons(),
                true,
                approverNote,
                snapshot.toString(),
                results);
        AuditEntry entry = auditLog.append(record);

        sample.stop(meterRegistry.timer("actionguard.batch.duration", "env", env.id()));
        long failed = results.stream().filter(r -> !r.ok()).count();
        if (failed > 0) {
            log.warn("Batch finished with {}/{} failed actions; rollback point is '{}'",
                    failed, results.size(), snapshot.getFileName());
        } else {
            log.info("Batch finished: {} actions applied", results.size());
        }
        return new BatchReport(record, entry.checksum(), snapshot.getFileName().toString());
    }

    // ------------------------------------------------------------------
    // Rollback
    // ------------------------------------------------------------------

    /** Snapshots available for {@code env}, newest first. */
    public List<SnapshotInfo> snapshots(TargetEnvironment env) {
        return snapshots.list(env);
    }

    /**
     * Replace the live workspace of {@code env} with a named snapshot.
     *
     * @throws com.actionguard.gateway.workspace.SnapshotException if the
     *         snapshot does not exist or the restore fails
     */
    public void restore(TargetEnvironment env, String snapshotName) {
        Path snapshot = snapshots.resolve(snapshotName);
        MDC.put("env", env.id());
        try {
            locks.withLock(env, () -> {
                snapshots.restore(env, snapshot);
                return null;
            });
        } finally {
            MDC.remove("env");
        }
    }

    // ------------------------------------------------------------------
    // Audit / policy
    // ------------------------------------------------------------------

    public Optional<AuditRecord> lastAudit() {
        return auditLog.lastRecord();
    }

    public List<LineVerification> verifyAudit() {
        return auditLog.verify();
    }

    public Policy currentPolicy() {
        return policyStore.current();
    }

    public Policy reloadPolicy() {
        return policyStore.reload();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Unknown kinds share one "unknown" tag. */
    private static String metricKind(Action action) {
        return action.kind() == ActionKind.UNKNOWN ? "unknown" : action.kind().token();
    }
}
