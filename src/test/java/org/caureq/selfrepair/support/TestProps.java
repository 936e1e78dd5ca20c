package org.caureq.selfrepair.support;

import org.caureq.selfrepair.config.SupervisorProps;
import org.caureq.selfrepair.config.SupervisorProps.*;

import java.time.Duration;
import java.util.List;

/** Supervisor settings for tests: short timeouts, no jitter, no restart grace, no pre-repair checks. */
public final class TestProps {
    private TestProps() {}

    public static HealthProps health(int degradedAt, int failingAt, int criticalAt) {
        return new HealthProps(Duration.ofMinutes(5), Duration.ZERO, Duration.ofMillis(500), 50,
                Duration.ofSeconds(2), degradedAt, failingAt, criticalAt, 2);
    }

    public static RepairProps repair(Duration restartGrace, int maxRestartsPerHour) {
        return repair(restartGrace, maxRestartsPerHour, new SafetyProps(false, 90, 95, ".", 3, Duration.ofMinutes(5)));
    }

    public static RepairProps repair(Duration restartGrace, int maxRestartsPerHour, SafetyProps safety) {
        return new RepairProps(Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofSeconds(5),
                restartGrace, Duration.ZERO, maxRestartsPerHour, safety);
    }

    public static RetentionProps retention(List<String> logDirs, Duration logMaxAge) {
        return new RetentionProps(Duration.ofDays(1095), logDirs, logMaxAge,
                Duration.ofHours(24), Duration.ofHours(1), Duration.ZERO);
    }

    public static SupervisorProps defaults() {
        return of(health(1, 3, 6), repair(Duration.ZERO, 5));
    }

    public static SupervisorProps of(HealthProps health, RepairProps repair) {
        return of(health, repair, retention(List.of(), Duration.ofDays(14)));
    }

    public static SupervisorProps of(HealthProps health, RepairProps repair, RetentionProps retention) {
        return new SupervisorProps("test-key", "memory", health, repair,
                new IntegrityProps(List.of(), "data/backups", 10),
                retention,
                new AlertsProps(null, Duration.ofSeconds(1)),
                new SchedulerProps(true, true),
                List.of());
    }
}
