package org.caureq.selfrepair.service.health;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.config.SupervisorProps;
import org.caureq.selfrepair.domain.StatusThresholds;
import org.caureq.selfrepair.service.integrity.IntegrityWatch;
import org.caureq.selfrepair.service.repair.RepairEscalator;
import org.caureq.selfrepair.service.store.HealthStore;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

/**
 * One monitoring cycle: probe every registered component concurrently, fold each result into its
 * health row, hand failures and successes to the escalator, then verify the protected files.
 */
@Slf4j
@Service
public class HealthMonitor {
    private final ComponentRegistry registry;
    private final HealthStore store;
    private final ProbeRunner probes;
    private final RepairEscalator escalator;
    private final IntegrityWatch integrity;
    private final StatusThresholds thresholds;
    private final Duration probeTimeout;
    private final Duration shutdownGrace;
    private final Clock clock;
    private final ThreadPoolExecutor workers;

    public HealthMonitor(ComponentRegistry registry, HealthStore store, ProbeRunner probes,
                         RepairEscalator escalator, IntegrityWatch integrity, SupervisorProps props, Clock clock) {
        this.registry = registry;
        this.store = store;
        this.probes = probes;
        this.escalator = escalator;
        this.integrity = integrity;
        this.thresholds = props.health().thresholds();
        this.probeTimeout = props.health().probeTimeout();
        this.shutdownGrace = props.health().shutdownGrace();
        this.clock = clock;
        int size = Math.max(1, props.health().maxConcurrentProbes());
        this.workers = new ThreadPoolExecutor(size, size, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), new CustomizableThreadFactory("health-"));
        this.workers.allowCoreThreadTimeOut(true);
    }

    /** Probes one component without recording anything. */
    public ProbeOutcome checkComponent(String name) {
        return probes.run(registry.get(name), probeTimeout);
    }

    public CycleReport runCycle() {
        var started = clock.instant();
        var components = registry.all();
        var futures = new ArrayList<Future<ProbeOutcome>>(components.size());
        for (var c : components) {
            try {
                futures.add(workers.submit(() -> probeAndRecord(c)));
            } catch (RejectedExecutionException e) {
                futures.add(CompletableFuture.completedFuture(
                        new ProbeOutcome(c.name(), false, "not probed: supervisor shutting down", "cancelled", Duration.ZERO)));
            }
        }
        var outcomes = new ArrayList<ProbeOutcome>(components.size());
        for (int i = 0; i < futures.size(); i++) {
            var c = components.get(i);
            try {
                outcomes.add(futures.get(i).get());
            } catch (ExecutionException e) {
                log.error("[Health] {} could not be recorded", c.name(), e.getCause());
                outcomes.add(new ProbeOutcome(c.name(), false, "supervisor error: " + e.getCause().getMessage(),
                        "supervisor_error", Duration.ZERO));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcomes.add(new ProbeOutcome(c.name(), false, "cycle interrupted", "cancelled", Duration.ZERO));
            }
        }
        var verification = integrity.check().orElse(null);
        var report = new CycleReport(started, clock.instant(), List.copyOf(outcomes), verification);
        log.info("[Health] cycle done: {} components, {} unhealthy{}", outcomes.size(), report.unhealthy().size(),
                verification == null ? "" : ", %d integrity violations".formatted(verification.violations().size()));
        return report;
    }

    private ProbeOutcome probeAndRecord(MonitoredComponent c) {
        var outcome = probes.run(c, probeTimeout);
        var now = clock.instant();
        store.update(c.name(), row -> row.recordProbe(outcome.healthy(), now, thresholds));
        if (outcome.healthy()) {
            log.debug("[Health] {} healthy in {} ms", c.name(), outcome.elapsed().toMillis());
            escalator.onSuccess(c.name());
        } else {
            log.warn("[Health] {} unhealthy ({}): {}", c.name(), outcome.errorType(), outcome.detail());
            var decision = escalator.onFailure(c.name(), outcome.detail(), outcome.errorType());
            if (!decision.repairing()) log.debug("[Health] {} no repair dispatched: {}", c.name(), decision.reason());
        }
        return outcome;
    }

    @PreDestroy
    void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Health] probes still running after {} s, cancelling", shutdownGrace.toSeconds());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
