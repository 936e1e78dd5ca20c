package org.caureq.selfrepair.service.repair;

import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.config.SupervisorProps;
import org.caureq.selfrepair.service.health.MonitoredComponent;
import org.caureq.selfrepair.service.store.HealthStore;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;

/**
 * Decides whether a repair may run at all. A repair is refused while host memory or disk usage
 * is above its limit, or when too many repairs, on any component, started within the recent window.
 */
@Slf4j
@Component
public class RepairSafetyGate {
    private final HostResources host;
    private final HealthStore store;
    private final SupervisorProps.SafetyProps safety;
    private final Clock clock;

    public RepairSafetyGate(HostResources host, HealthStore store, SupervisorProps props, Clock clock) {
        this.host = host;
        this.store = store;
        this.safety = props.repair().safety();
        this.clock = clock;
    }

    /**
     * Called once the attempt is already in the repair log.
     *
     * @return the reason the repair must not run, empty when it may
     */
    public Optional<String> refusal(MonitoredComponent component) {
        if (!safety.enabled()) return Optional.empty();
        var usage = host.sample(Path.of(safety.diskPath()));
        if (usage.memoryUsedPct() > safety.maxMemoryPct()) {
            return refuse(component, "memory used %.1f%% (max %.1f%%)".formatted(usage.memoryUsedPct(), safety.maxMemoryPct()));
        }
        if (usage.diskUsedPct() > safety.maxDiskPct()) {
            return refuse(component, "disk %s used %.1f%% (max %.1f%%)".formatted(safety.diskPath(), usage.diskUsedPct(), safety.maxDiskPct()));
        }
        long earlier = store.countAllAttemptsSince(clock.instant().minus(safety.recentWindow())) - 1;
        if (earlier > safety.maxRecentRepairs()) {
            return refuse(component, "%d repairs started in the last %d s (max %d)"
                    .formatted(earlier, safety.recentWindow().toSeconds(), safety.maxRecentRepairs()));
        }
        return Optional.empty();
    }

    private Optional<String> refuse(MonitoredComponent component, String reason) {
        log.error("[Repair] {} repair refused: {}", component.name(), reason);
        return Optional.of(reason);
    }
}
