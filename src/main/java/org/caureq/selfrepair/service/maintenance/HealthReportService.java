package org.caureq.selfrepair.service.maintenance;

import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.domain.ComponentHealth;
import org.caureq.selfrepair.domain.HealthStatus;
import org.caureq.selfrepair.service.store.HealthStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/** Builds the health report; the hourly snapshot is logged and kept for the report surfaces. */
@Slf4j
@Service
public class HealthReportService {
    static final Duration WINDOW = Duration.ofHours(24);

    private final HealthStore store;
    private final Clock clock;
    private final AtomicReference<HealthReport> last = new AtomicReference<>();

    public HealthReportService(HealthStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public HealthReport current() {
        var now = clock.instant();
        var rows = store.findAll();
        var byStatus = new EnumMap<HealthStatus, Long>(HealthStatus.class);
        for (var s : HealthStatus.values()) byStatus.put(s, 0L);
        long probes = 0, successes = 0, recoveries = 0;
        double recoverySeconds = 0;
        for (var h : rows) {
            byStatus.merge(h.getStatus(), 1L, Long::sum);
            probes += h.getProbeCount();
            successes += h.getProbeSuccessCount();
            if (h.getRecoveryTimeAvg() != null && h.getRecoveryCount() > 0) {
                recoverySeconds += h.getRecoveryTimeAvg() * h.getRecoveryCount();
                recoveries += h.getRecoveryCount();
            }
        }
        var critical = rows.stream()
                .filter(h -> h.getStatus() == HealthStatus.CRITICAL)
                .map(ComponentHealth::getComponentName)
                .toList();
        long open = rows.stream().filter(ComponentHealth::hasOpenIncident).count();
        return new HealthReport(now, rows.size(), byStatus,
                probes == 0 ? 100.0 : 100.0 * successes / probes,
                open, critical, WINDOW,
                store.countAttemptsByTierAndOutcome(now.minus(WINDOW)),
                recoveries == 0 ? null : recoverySeconds / recoveries);
    }

    /** Metrics snapshot job. */
    public HealthReport snapshot() {
        var report = current();
        last.set(report);
        log.info("[Metrics] components={} healthy={} degraded={} failing={} critical={} uptime={}% openIncidents={} attempts24h={}",
                report.components(),
                report.byStatus().get(HealthStatus.HEALTHY), report.byStatus().get(HealthStatus.DEGRADED),
                report.byStatus().get(HealthStatus.FAILING), report.byStatus().get(HealthStatus.CRITICAL),
                "%.2f".formatted(report.overallUptime()), report.openIncidents(),
                report.attempts().stream().mapToLong(HealthStore.AttemptCount::count).sum());
        return report;
    }

    public Optional<HealthReport> lastSnapshot() {
        return Optional.ofNullable(last.get());
    }
}
