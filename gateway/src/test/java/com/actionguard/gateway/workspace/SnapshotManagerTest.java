package com.actionguard.gateway.workspace;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotManagerTest {

    @TempDir Path tmp;

    StepClock clock = new StepClock(Instant.parse("2025-08-29T12:30:00Z"));
    WorkspaceResolver workspaces;
    SnapshotManager snapshots;

    @BeforeEach
    void setUp() {
        WorkspaceProperties props = new WorkspaceProperties(
                tmp.resolve("workspaces").toString(),
                tmp.resolve("snapshots").toString(),
                tmp.resolve("logs/actions.jsonl").toString());
        workspaces = new WorkspaceResolver(props);
        snapshots  = new SnapshotManager(workspaces, props, clock);
    }

    // ------------------------------------------------------------------
    // snapshot / restore
    // ------------------------------------------------------------------

    @Test
    void snapshot_namesByEnvironmentAndUtcSecond() {
        Path snap = snapshots.snapshot(TargetEnvironment.STAGING);

        assertThat(snap.getFileName().toString()).isEqualTo("staging-20250829T123000Z");
        assertThat(snap.getParent()).isEqualTo(tmp.resolve("snapshots").toAbsolutePath().normalize());
    }

    @Test
    void snapshot_twiceInSameSecond_suffixesSecond() {
        Path first  = snapshots.snapshot(TargetEnvironment.DEV);
        Path second = snapshots.snapshot(TargetEnvironment.DEV);

        assertThat(first.getFileName().toString()).isEqualTo("dev-20250829T123000Z");
        assertThat(second.getFileName().toString()).isEqualTo("dev-20250829T123000Z-001");
    }

    @Test
    void snapshot_emptyWorkspace_isCreatedAndEmpty() throws IOException {
        Path snap = snapshots.snapshot(TargetEnvironment.DEV);

        assertThat(snap).isDirectory();
        try (var children = Files.list(snap)) {
            assertThat(children).isEmpty();
        }
    }

    @Test
    void restore_bringsBackExactContent() throws IOException {
        Path live = workspaces.root(TargetEnvironment.DEV);
        Files.writeString(live.resolve("a.txt"), "original");
        Files.createDirectories(live.resolve("empty/nested"));
        Files.write(live.resolve("bin.dat"), new byte[] {0, 1, 2, (byte) 0xFF});
        Path snap = snapshots.snapshot(TargetEnvironment.DEV);

        Files.writeString(live.resolve("a.txt"), "changed");
        Files.writeString(live.resolve("added.txt"), "new");
        Files.delete(live.resolve("bin.dat"));

        snapshots.restore(TargetEnvironment.DEV, snap);

        assertThat(Files.readString(live.resolve("a.txt"))).isEqualTo("original");
        assertThat(live.resolve("added.txt")).doesNotExist();
        assertThat(Files.readAllBytes(live.resolve("bin.dat"))).containsExactly(0, 1, 2, 0xFF);
        assertThat(live.resolve("empty/nested")).isDirectory();
    }

    @Test
    void restore_leavesSnapshotUntouched() throws IOException {
        Path live = workspaces.root(TargetEnvironment.DEV);
        Files.writeString(live.resolve("a.txt"), "v1");
        Path snap = snapshots.snapshot(TargetEnvironment.DEV);

        snapshots.restore(TargetEnvironment.DEV, snap);
        Files.writeString(live.resolve("a.txt"), "v2");

        assertThat(Files.readString(snap.resolve("a.txt"))).isEqualTo("v1");
    }

    @Test
    void restore_pathOutsideSnapshotRoot_isRejected() throws IOException {
        Path stray = Files.createDirectories(tmp.resolve("elsewhere"));
        Path live = workspaces.root(TargetEnvironment.DEV);
        Files.writeString(live.resolve("keep.txt"), "k");

        assertThatThrownBy(() -> snapshots.restore(TargetEnvironment.DEV, stray))
                .isInstanceOf(SnapshotException.class)
                .hasMessageContaining("Not a snapshot");
        assertThat(live.resolve("keep.txt")).exists();
    }

    @Test
    void restore_snapshotOfAnotherEnvironment_isRejected() throws IOException {
        Path dev = workspaces.root(TargetEnvironment.DEV);
        Files.writeString(dev.resolve("dev.txt"), "dev");
        Path devSnap = snapshots.snapshot(TargetEnvironment.DEV);
        Path prod = workspaces.root(TargetEnvironment.PROD);
        Files.writeString(prod.resolve("prod.cfg"), "live");

        assertThatThrownBy(() -> snapshots.restore(TargetEnvironment.PROD, devSnap))
                .isInstanceOf(SnapshotNotFoundException.class)
                .hasMessage("Snapshot not found: 'dev-20250829T123000Z'");

        assertThat(Files.readString(prod.resolve("prod.cfg"))).isEqualTo("live");
        assertThat(prod.resolve("dev.txt")).doesNotExist();
    }

    // ------------------------------------------------------------------
    // list / resolve
    // ------------------------------------------------------------------

    @Test
    void list_filtersByEnvironmentNewestFirst() {
        snapshots.snapshot(TargetEnvironment.DEV);
        clock.advanceSeconds(5);
        snapshots.snapshot(TargetEnvironment.PROD);
        clock.advanceSeconds(5);
        snapshots.snapshot(TargetEnvironment.DEV);

        assertThat(snapshots.list(TargetEnvironment.DEV))
                .extracting(SnapshotInfo::name)
                .containsExactly("dev-20250829T123010Z", "dev-20250829T123000Z");
        assertThat(snapshots.list(TargetEnvironment.STAGING)).isEmpty();
        assertThat(snapshots.listAll()).hasSize(3);
    }

    @Test
    void list_manySnapshotsInSameSecond_staysNewestFirst() {
        for (int i = 0; i < 12; i++) {
            snapshots.snapshot(TargetEnvironment.DEV);
        }

        assertThat(snapshots.list(TargetEnvironment.DEV))
                .extracting(SnapshotInfo::name)
                .startsWith("dev-20250829T123000Z-011", "dev-20250829T123000Z-010", "dev-20250829T123000Z-009")
                .endsWith("dev-20250829T123000Z-001", "dev-20250829T123000Z");
    }

    @Test
    void list_noSnapshotRootYet_isEmpty() {
        assertThat(snapshots.listAll()).isEmpty();
    }

    @Test
    void resolve_knownName_returnsPath() {
        Path snap = snapshots.snapshot(TargetEnvironment.DEV);
        assertThat(snapshots.resolve("dev-20250829T123000Z")).isEqualTo(snap);
    }

    @Test
    void resolve_unknownOrEscapingName_throwsNotFound() throws IOException {
        Files.createDirectories(tmp.resolve("escaped"));
        snapshots.snapshot(TargetEnvironment.DEV);

        assertThatThrownBy(() -> snapshots.resolve("dev-19990101T000000Z"))
                .isInstanceOf(SnapshotNotFoundException.class)
                .hasMessage("Snapshot not found: 'dev-19990101T000000Z'");
        assertThatThrownBy(() -> snapshots.resolve("../escaped"))
                .isInstanceOf(SnapshotNotFoundException.class);
        assertThatThrownBy(() -> snapshots.resolve(""))
                .isInstanceOf(SnapshotNotFoundException.class);
    }

    /** Clock whose instant only moves when told to. */
    static final class StepClock extends Clock {

        private Instant now;

        StepClock(Instant start) {
            this.now = start;
        }

        void advanceSeconds(long seconds) {
            now = now.plusSeconds(seconds);
        }

        @Override public ZoneId getZone()              { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone)   { return this; }
        @Override public Instant instant()             { return now; }
    }
}
