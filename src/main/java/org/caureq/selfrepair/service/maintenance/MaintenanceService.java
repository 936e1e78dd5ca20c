package org.caureq.selfrepair.service.maintenance;

import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.config.SupervisorProps;
import org.caureq.selfrepair.service.integrity.IntegrityGuard;
import org.caureq.selfrepair.service.store.HealthStore;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Retention: old log files, snapshots beyond the keep count, and repair log rows older than the
 * audit window. Component health rows are never touched.
 */
@Slf4j
@Service
public class MaintenanceService {
    private final HealthStore store;
    private final IntegrityGuard guard;
    private final SupervisorProps.RetentionProps retention;
    private final Clock clock;

    public MaintenanceService(HealthStore store, IntegrityGuard guard, SupervisorProps props, Clock clock) {
        this.store = store;
        this.guard = guard;
        this.retention = props.retention();
        this.clock = clock;
    }

    /** Deletes regular files under the configured log directories older than the maximum age. */
    public CleanupReport cleanupLogs() {
        var cutoff = clock.instant().minus(retention.logMaxAge());
        int deleted = 0;
        long bytes = 0;
        var errors = new ArrayList<String>();
        for (String dir : retention.logDirs()) {
            var root = Path.of(dir);
            if (!Files.isDirectory(root)) continue;
            List<Path> files;
            try (Stream<Path> walk = Files.walk(root)) {
                files = walk.filter(Files::isRegularFile).toList();
            } catch (IOException e) {
                errors.add("%s: %s".formatted(root, e.getMessage()));
                continue;
            }
            for (Path f : files) {
                try {
                    if (Files.getLastModifiedTime(f).toInstant().isBefore(cutoff)) {
                        long size = Files.size(f);
                        Files.delete(f);
                        deleted++;
                        bytes += size;
                    }
                } catch (IOException e) {
                    errors.add("%s: %s".formatted(f, e.getMessage()));
                }
            }
        }
        if (!errors.isEmpty()) log.warn("[Maintenance] log cleanup errors: {}", errors);
        log.info("[Maintenance] removed {} log files ({} bytes) older than {}", deleted, bytes, cutoff);
        return new CleanupReport(deleted, bytes, List.copyOf(errors));
    }

    public int cleanupBackups() {
        int n = guard.prune();
        log.info("[Maintenance] pruned {} snapshots", n);
        return n;
    }

    public int pruneRepairLog() {
        Instant cutoff = clock.instant().minus(retention.repairLog());
        int n = store.pruneAttemptsBefore(cutoff);
        log.info("[Maintenance] pruned {} repair log rows created before {}", n, cutoff);
        return n;
    }

    public SweepReport retentionSweep() {
        var errors = new ArrayList<String>();
        var logs = cleanupLogs();
        int snapshots = -1;
        int attempts = -1;
        try {
            snapshots = cleanupBackups();
        } catch (RuntimeException e) {
            log.error("[Maintenance] snapshot pruning failed: {}", e.getMessage());
            errors.add("snapshots: " + e.getMessage());
        }
        try {
            attempts = pruneRepairLog();
        } catch (RuntimeException e) {
            log.error("[Maintenance] repair log pruning failed: {}", e.getMessage());
            errors.add("repair log: " + e.getMessage());
        }
        return new SweepReport(clock.instant(), logs, snapshots, attempts, List.copyOf(errors));
    }
}
