package com.actionguard.gateway.service;

import com.actionguard.gateway.audit.ActionResult;
import com.actionguard.gateway.audit.AuditLog;
import com.actionguard.gateway.audit.AuditRecord;
import com.actionguard.gateway.audit.LineVerification;
import com.actionguard.gateway.policy.PolicyEvaluator;
import com.actionguard.gateway.policy.PolicyProperties;
import com.actionguard.gateway.policy.PolicyStore;
import com.actionguard.gateway.policy.RiskLevel;
import com.actionguard.gateway.policy.RiskReportRenderer;
import com.actionguard.gateway.sandbox.SandboxExecutor;
import com.actionguard.gateway.workspace.SnapshotInfo;
import com.actionguard.gateway.workspace.SnapshotManager;
import com.actionguard.gateway.workspace.SnapshotNotFoundException;
import com.actionguard.gateway.workspace.TargetEnvironment;
import com.actionguard.gateway.workspace.WorkspaceProperties;
import com.actionguard.gateway.workspace.WorkspaceResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for BatchService over real components on a temp
 * directory: policy, sandbox, snapshots and audit log all hit the disk.
 */
class BatchServiceTest {

    @TempDir Path tmp;

    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    Clock clock = Clock.fixed(Instant.parse("2025-08-29T12:30:00Z"), ZoneOffset.UTC);

    WorkspaceResolver workspaces;
    SnapshotManager   snapshots;
    AuditLog          auditLog;
    BatchService      service;

    @BeforeEach
    void setUp() {
        WorkspaceProperties props = new WorkspaceProperties(
                tmp.resolve("workspaces").toString(),
                tmp.resolve("snapshots").toString(),
                tmp.resolve("logs/actions.jsonl").toString());
        workspaces = new WorkspaceResolver(props);
        snapshots  = new SnapshotManager(workspaces, props, clock);
        auditLog   = new AuditLog(props, new ObjectMapper());
        service = new BatchService(
                new PolicyStore(new PolicyProperties(null, null, null, null, null)),
                new PolicyEvaluator(),
                new SandboxExecutor(),
                snapshots,
                auditLog,
                workspaces,
                new RiskReportRenderer(clock),
                meterRegistry,
                clock);
    }

    private static ExecutionRequest request(String plan, TargetEnvironment env, String approval) {
        return new ExecutionRequest("test task", plan, env, approval, "approved by test");
    }

    // ------------------------------------------------------------------
    // review
    // ------------------------------------------------------------------

    @Test
    void review_lowRiskDev_needsNoApproval() {
        PlanReview review = service.review("write notes.md | hello", TargetEnvironment.DEV);

        assertThat(review.analysis().risk()).isEqualTo(RiskLevel.LOW);
        assertThat(review.approvalRequired()).isFalse();
        assertThat(review.actions()).hasSize(1);
    }

    @Test
    void review_unlockedProdLowRisk_stillNeedsApproval() {
        BatchService unlocked = new BatchService(
                new PolicyStore(new PolicyProperties(false, null, null, null, null)),
                new PolicyEvaluator(), new SandboxExecutor(), snapshots, auditLog, workspaces,
                new RiskReportRenderer(clock), meterRegistry, clock);

        PlanReview review = unlocked.review("write a.txt | hi", TargetEnvironment.PROD);

        assertThat(review.analysis().risk()).isEqualTo(RiskLevel.LOW);
        assertThat(review.approvalRequired()).isTrue();
    }

    @Test
    void review_touchesNothingOnDisk() {
        service.review("write a.txt | x\ndelete_file b.txt", TargetEnvironment.DEV);

        assertThat(tmp.resolve("workspaces")).doesNotExist();
        assertThat(tmp.resolve("snapshots")).doesNotExist();
    }

    @Test
    void report_rendersMarkdown() {
        String md = service.report("write a.txt | migrate", TargetEnvironment.STAGING);

        assertThat(md).contains("**Overall Risk Level:** Medium");
        assertThat(md).contains("**Environment:** staging");
    }

    // ------------------------------------------------------------------
    // Approval gate
    // ------------------------------------------------------------------

    @Test
    void execute_highRiskWithoutApproval_throwsAndTouchesNothing() {
        assertThatThrownBy(() -> service.execute(
                request("write a.sql | DROP TABLE users", TargetEnvironment.DEV, null)))
                .isInstanceOfSatisfying(ApprovalRequiredException.class,
                        e -> assertThat(e.getAnalysis().risk()).isEqualTo(RiskLevel.HIGH));

        assertThat(snapshots.listAll()).isEmpty();
        assertThat(auditLog.file()).doesNotExist();
        assertThat(meterRegistry.counter("actionguard.batch.rejected", "env", "dev").count()).isEqualTo(1.0);
    }

    @Test
    void execute_wrongApprovalWord_isRejected() {
        assertThatThrownBy(() -> service.execute(
                request("write a.txt | migrate", TargetEnvironment.DEV, "approve")))
                .isInstanceOf(ApprovalRequiredException.class);
    }

    @Test
    void execute_approvalWithSurroundingWhitespace_isAccepted() {
        BatchReport report = service.execute(
                request("write a.txt | migrate", TargetEnvironment.DEV, "  APPROVE \n"));

        assertThat(report.record().approved()).isTrue();
        assertThat(report.record().approverNote()).isEqualTo("approved by test");
    }

    @Test
    void execute_lowRisk_autoApproves() {
        BatchReport report = service.execute(request("write a.txt | hi", TargetEnvironment.DEV, null));

        assertThat(report.record().approverNote()).isEqualTo(BatchService.AUTO_APPROVED);
        assertThat(report.record().risk()).isEqualTo(RiskLevel.LOW);
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    @Test
    void execute_snapshotsBeforeChanges() throws IOException {
        Path live = workspaces.root(TargetEnvironment.DEV);
        Files.writeString(live.resolve("a.txt"), "before");

        BatchReport report = service.execute(request("write a.txt | after", TargetEnvironment.DEV, null));

        Path snap = snapshots.resolve(report.snapshotName());
        assertThat(Files.readString(snap.resolve("a.txt"))).isEqualTo("before");
        assertThat(Files.readString(live.resolve("a.txt"))).isEqualTo("after");
        assertThat(report.record().preSnapshot()).isEqualTo(snap.toString());
    }

    @Test
    void execute_failingAction_continuesWithRest() throws IOException {
        BatchReport report = service.execute(request("""
                write one.txt | 1
                write ../escape.txt | x
                rm -f stuff
                write two.txt | 2
                """, TargetEnvironment.DEV, "APPROVE"));

        assertThat(report.record().results())
                .extracting(ActionResult::ok)
                .containsExactly(true, false, false, true);
        assertThat(report.record().results().get(1).message()).isEqualTo("Path traversal blocked");
        assertThat(report.record().allSucceeded()).isFalse();
        Path live = workspaces.path(TargetEnvironment.DEV);
        assertThat(Files.readString(live.resolve("two.txt"))).isEqualTo("2");
        assertThat(tmp.resolve("workspaces/escape.txt")).doesNotExist();
    }

    @Test
    void execute_appendsVerifiableAuditRecord() {
        BatchReport report = service.execute(request("make_dir out", TargetEnvironment.STAGING, null));

        AuditRecord last = service.lastAudit().orElseThrow();
        assertThat(last).isEqualTo(report.record());
        assertThat(last.ts()).isEqualTo(clock.instant());
        assertThat(last.task()).isEqualTo("test task");
        assertThat(service.verifyAudit()).extracting(LineVerification::intact).containsExactly(true);
    }

    @Test
    void execute_countsActionsByKindAndStatus() {
        service.execute(request("write a.txt | x\ndelete_file missing.txt", TargetEnvironment.DEV, null));

        assertThat(meterRegistry.counter("actionguard.action.calls",
                "kind", "write", "status", "success").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("actionguard.action.calls",
                "kind", "delete_file", "status", "not_found").count()).isEqualTo(1.0);
        assertThat(meterRegistry.timer("actionguard.batch.duration", "env", "dev").count()).isEqualTo(1);
    }

    @Test
    void execute_statusTag_ignoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            service.execute(request("write ../escape.txt | x", TargetEnvironment.DEV, null));
        } finally {
            Locale.setDefault(previous);
        }

        assertThat(meterRegistry.counter("actionguard.action.calls",
                "kind", "write", "status", "confinement_violation").count()).isEqualTo(1.0);
    }

    @Test
    void execute_emptyPlan_stillSnapshotsAndAudits() {
        BatchReport report = service.execute(request("# nothing to do\n", TargetEnvironment.DEV, null));

        assertThat(report.record().results()).isEmpty();
        assertThat(snapshots.list(TargetEnvironment.DEV)).hasSize(1);
        assertThat(service.lastAudit()).isPresent();
    }

    // ------------------------------------------------------------------
    // Rollback
    // ------------------------------------------------------------------

    @Test
    void restore_undoesBatch() throws IOException {
        Path live = workspaces.root(TargetEnvironment.DEV);
        Files.writeString(live.resolve("config.yml"), "v1");

        BatchReport report = service.execute(request("""
                write config.yml | v2
                write extra.txt | junk
                """, TargetEnvironment.DEV, null));
        service.restore(TargetEnvironment.DEV, report.snapshotName());

        assertThat(Files.readString(live.resolve("config.yml"))).isEqualTo("v1");
        assertThat(live.resolve("extra.txt")).doesNotExist();
    }

    @Test
    void restore_otherEnvironmentsSnapshot_leavesWorkspaceAlone() throws IOException {
        Path prod = workspaces.root(TargetEnvironment.PROD);
        Files.writeString(prod.resolve("prod.cfg"), "live");
        Files.writeString(workspaces.root(TargetEnvironment.DEV).resolve("dev.txt"), "dev");
        BatchReport devBatch = service.execute(request("make_dir out", TargetEnvironment.DEV, null));

        assertThatThrownBy(() -> service.restore(TargetEnvironment.PROD, devBatch.snapshotName()))
                .isInstanceOf(SnapshotNotFoundException.class);

        assertThat(Files.readString(prod.resolve("prod.cfg"))).isEqualTo("live");
        assertThat(prod.resolve("dev.txt")).doesNotExist();
    }

    @Test
    void restore_unknownSnapshot_throwsNotFound() {
        assertThatThrownBy(() -> service.restore(TargetEnvironment.DEV, "dev-20000101T000000Z"))
                .isInstanceOf(SnapshotNotFoundException.class);
    }

    @Test
    void snapshots_listsOnlyRequestedEnvironment() {
        service.execute(request("write a.txt | x", TargetEnvironment.DEV, null));
        service.execute(request("write a.txt | x", TargetEnvironment.STAGING, null));

        assertThat(service.snapshots(TargetEnvironment.STAGING))
                .extracting(SnapshotInfo::name)
                .containsExactly("staging-20250829T123000Z");
    }
}
