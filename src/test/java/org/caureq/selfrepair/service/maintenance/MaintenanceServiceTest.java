package org.caureq.selfrepair.service.maintenance;

import org.caureq.selfrepair.domain.RepairAttempt;
import org.caureq.selfrepair.service.integrity.IntegrityGuard;
import org.caureq.selfrepair.service.store.InMemoryHealthStore;
import org.caureq.selfrepair.support.MutableClock;
import org.caureq.selfrepair.support.TestProps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MaintenanceService")
class MaintenanceServiceTest {
    @TempDir
    Path tmp;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final InMemoryHealthStore store = new InMemoryHealthStore(clock);
    private Path logs;
    private IntegrityGuard guard;
    private MaintenanceService maintenance;

    @BeforeEach
    void setUp() throws IOException {
        logs = Files.createDirectories(tmp.resolve("logs"));
        var etc = Files.createDirectories(tmp.resolve("etc"));
        Files.writeString(etc.resolve("app.conf"), "port=8080\n");
        guard = new IntegrityGuard(List.of(etc), tmp.resolve("backups"), 2, clock);
        var props = TestProps.of(TestProps.health(1, 3, 6), TestProps.repair(Duration.ZERO, 5),
                TestProps.retention(List.of(logs.toString()), Duration.ofDays(14)));
        maintenance = new MaintenanceService(store, guard, props, clock);
    }

    private Path logFile(String name, Duration age) throws IOException {
        var f = Files.writeString(logs.resolve(name), "x".repeat(100));
        Files.setLastModifiedTime(f, FileTime.from(clock.instant().minus(age)));
        return f;
    }

    @Test
    @DisplayName("Log files past the maximum age are deleted, newer ones stay")
    void cleanupLogs() throws IOException {
        // Given
        var old = logFile("app.log.1", Duration.ofDays(20));
        Files.createDirectories(logs.resolve("archive"));
        var nestedOld = Files.writeString(logs.resolve("archive/app.log.9"), "y".repeat(50));
        Files.setLastModifiedTime(nestedOld, FileTime.from(clock.instant().minus(Duration.ofDays(30))));
        var fresh = logFile("app.log", Duration.ofDays(1));

        // When
        var report = maintenance.cleanupLogs();

        // Then
        assertThat(report.filesDeleted()).isEqualTo(2);
        assertThat(report.bytesFreed()).isEqualTo(150);
        assertThat(report.ok()).isTrue();
        assertThat(old).doesNotExist();
        assertThat(nestedOld).doesNotExist();
        assertThat(fresh).exists();
    }

    @Test
    @DisplayName("A missing log directory is not an error")
    void missingLogDir() throws IOException {
        Files.delete(logs);

        var report = maintenance.cleanupLogs();

        assertThat(report.filesDeleted()).isZero();
        assertThat(report.ok()).isTrue();
    }

    @Test
    @DisplayName("Repair log rows older than the audit window are pruned")
    void pruneRepairLog() {
        store.register("web");
        for (int days : new int[]{1200, 1100, 10}) {
            store.appendAttempt(RepairAttempt.builder()
                    .componentName("web").incidentId("inc-" + days).errorMessage("down")
                    .repairTier(1).repairAction("tier 1")
                    .createdAt(clock.instant().minus(Duration.ofDays(days)))
                    .build());
        }

        assertThat(maintenance.pruneRepairLog()).isEqualTo(2);
        assertThat(store.attempts("web", 10, 0)).hasSize(1);
    }

    @Test
    @DisplayName("The retention sweep covers logs, snapshots and the repair log")
    void retentionSweep() throws IOException {
        // Given
        logFile("old.log", Duration.ofDays(15));
        for (int i = 0; i < 3; i++) {
            guard.snapshot();
            clock.advance(Duration.ofSeconds(1));
        }

        // When
        var sweep = maintenance.retentionSweep();

        // Then
        assertThat(sweep.ok()).isTrue();
        assertThat(sweep.logs().filesDeleted()).isEqualTo(1);
        assertThat(sweep.attemptsPruned()).isZero();
        assertThat(guard.listSnapshots()).hasSize(2);
    }
}
