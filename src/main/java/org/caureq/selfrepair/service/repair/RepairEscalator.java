package org.caureq.selfrepair.service.repair;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.config.SupervisorProps;
import org.caureq.selfrepair.domain.ComponentHealth;
import org.caureq.selfrepair.domain.RepairAttempt;
import org.caureq.selfrepair.domain.RepairOutcome;
import org.caureq.selfrepair.domain.RepairState;
import org.caureq.selfrepair.domain.StatusThresholds;
import org.caureq.selfrepair.service.alerts.AlertService;
import org.caureq.selfrepair.service.alerts.IncidentContext;
import org.caureq.selfrepair.service.health.ComponentRegistry;
import org.caureq.selfrepair.service.health.MonitoredComponent;
import org.caureq.selfrepair.service.integrity.PathMismatch;
import org.caureq.selfrepair.service.store.HealthStore;
import org.caureq.selfrepair.service.store.UnknownComponentException;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-component escalation ladder: IDLE, TIER1, TIER2, TIER3, EXHAUSTED.
 * <p>
 * Each newly observed failure moves a component up exactly one tier and dispatches that tier's
 * repair. Failures seen while a repair runs, or during the grace period after a restart, are not
 * new observations. A success closes the incident and the next failure starts again at tier 1.
 * A failed tier 3 repair exhausts the incident and raises one alert; nothing more is attempted
 * until the component recovers or someone acknowledges the alert.
 * <p>
 * Every attempt is written to the repair log before its action starts.
 */
@Slf4j
@Service
public class RepairEscalator {
    private final HealthStore store;
    private final ComponentRegistry registry;
    private final RepairExecutor executor;
    private final AlertService alerts;
    private final StatusThresholds thresholds;
    private final Duration restartGrace;
    private final Duration drainTimeout;
    private final Clock clock;
    private final ObjectMapper om = new ObjectMapper();
    private final ExecutorService repairs;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<RepairAttempt>> running = new ConcurrentHashMap<>();
    private volatile boolean accepting = true;

    public RepairEscalator(HealthStore store, ComponentRegistry registry, RepairExecutor executor,
                           AlertService alerts, SupervisorProps props, Clock clock) {
        this.store = store;
        this.registry = registry;
        this.executor = executor;
        this.alerts = alerts;
        this.thresholds = props.health().thresholds();
        this.restartGrace = props.repair().restartGrace();
        this.drainTimeout = props.repair().tier3Timeout().plus(props.repair().validationDelay()).plus(props.health().probeTimeout());
        this.clock = clock;
        this.repairs = Executors.newCachedThreadPool(new CustomizableThreadFactory("repair-"));
    }

    /* --------------------- observations --------------------- */

    public EscalationDecision onFailure(String component, String detail, String errorType) {
        var lock = lockFor(component);
        lock.lock();
        try {
            if (!accepting) return EscalationDecision.skipped(component, "supervisor shutting down");
            if (running.containsKey(component)) return EscalationDecision.skipped(component, "repair already running");
            var h = current(component);
            var now = clock.instant();
            if (h.getRepairGraceUntil() != null && now.isBefore(h.getRepairGraceUntil())) {
                return EscalationDecision.skipped(component, "restart grace period until " + h.getRepairGraceUntil());
            }
            if (h.getRepairState() == RepairState.EXHAUSTED) {
                return EscalationDecision.skipped(component, "incident exhausted, waiting for recovery or acknowledgement");
            }
            int tier = h.getRepairState().nextTier();
            if (tier == 0) {
                // TIER3 without a running repair: its outcome was lost, treat as failed
                return exhaust(component, h.getIncidentId(), IncidentContext.REPAIR_EXHAUSTED,
                        "failure observed after tier 3 repair: " + detail);
            }
            return dispatch(h, tier, detail == null ? "unknown failure" : detail, errorType, now);
        } finally {
            lock.unlock();
        }
    }

    /** @return true when an open incident was closed */
    public boolean onSuccess(String component) {
        var lock = lockFor(component);
        lock.lock();
        try {
            var h = current(component);
            if (!h.hasOpenIncident()) return false;
            // integrity incidents close through a restore, a clean verification or an acknowledgement
            if (h.isIntegrityViolation()) return false;
            closeIncident(component, h.getIncidentId(), clock.instant(), false);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Protected files owned by {@code component} no longer match the latest snapshot: go straight to tier 3. */
    public EscalationDecision onIntegrityViolation(String component, List<PathMismatch> mismatches) {
        var lock = lockFor(component);
        lock.lock();
        try {
            var before = current(component);
            var paths = mismatches.stream().map(m -> m.path() + " (" + m.kind().name().toLowerCase() + ")").toList();
            var h = store.update(component, row -> {
                row.setIntegrityViolation(true);
                row.refreshStatus(thresholds);
            });
            if (!before.isIntegrityViolation()) {
                log.error("[Integrity] {} protected files changed outside a restore: {}", component, paths);
            }
            if (!accepting) return EscalationDecision.skipped(component, "supervisor shutting down");
            if (running.containsKey(component)) return EscalationDecision.skipped(component, "repair already running");
            if (h.getRepairState() == RepairState.EXHAUSTED) {
                return EscalationDecision.skipped(component, "incident exhausted, waiting for acknowledgement");
            }
            if (h.getRepairState() == RepairState.TIER3) {
                return exhaust(component, h.getIncidentId(), IncidentContext.INTEGRITY_VIOLATION,
                        "protected files still modified after tier 3 repair: " + paths);
            }
            return dispatch(h, 3, "protected files modified: " + paths, "integrity_violation", clock.instant());
        } finally {
            lock.unlock();
        }
    }

    /** Verification found the component's protected files intact again. */
    public void onIntegrityCleared(String component) {
        var lock = lockFor(component);
        lock.lock();
        try {
            var h = current(component);
            if (!h.isIntegrityViolation() || running.containsKey(component)) return;
            log.info("[Integrity] {} protected files verified intact", component);
            if (h.hasOpenIncident() && h.getConsecutiveFailures() == 0) {
                closeIncident(component, h.getIncidentId(), clock.instant(), false);
            } else {
                store.update(component, row -> {
                    row.setIntegrityViolation(false);
                    row.refreshStatus(thresholds);
                });
            }
        } finally {
            lock.unlock();
        }
    }

    /* --------------------- human actions --------------------- */

    /** Closes the component's incident without a repair; the next failure starts at tier 1. */
    public boolean acknowledge(String component) {
        var lock = lockFor(component);
        lock.lock();
        try {
            var h = current(component);
            if (!h.hasOpenIncident() && !h.isIntegrityViolation()) return false;
            var now = clock.instant();
            if (h.getIncidentId() != null) store.resolveIncident(h.getIncidentId(), now);
            store.update(component, row -> {
                row.closeIncident();
                row.setIntegrityViolation(false);
                row.refreshStatus(thresholds);
            });
            log.info("[Repair] {} incident {} acknowledged", component, h.getIncidentId());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the alert acknowledged and closes the incident of its component.
     *
     * @return false when no alert has this id
     */
    public boolean acknowledgeAlert(String alertId) {
        var alert = alerts.acknowledge(alertId);
        if (alert.isEmpty()) return false;
        var component = alert.get().getComponent();
        if (store.find(component).isPresent()) acknowledge(component);
        return true;
    }

    /* --------------------- queries --------------------- */

    public boolean isRepairing(String component) { return running.containsKey(component); }

    /** Waits for the repairs running right now. @return false on timeout */
    public boolean awaitIdle(Duration timeout) {
        var pending = running.values().toArray(new CompletableFuture[0]);
        if (pending.length == 0) return true;
        try {
            CompletableFuture.allOf(pending).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /* --------------------- internals --------------------- */

    private EscalationDecision dispatch(ComponentHealth h, int tier, String detail, String errorType, Instant now) {
        MonitoredComponent c = registry.get(h.getComponentName());
        boolean opening = h.getIncidentId() == null;
        String incidentId = opening ? UUID.randomUUID().toString() : h.getIncidentId();
        var updated = store.update(c.name(), row -> {
            if (row.getIncidentId() == null) row.openIncident(incidentId, now);
            row.setRepairState(RepairState.forTier(tier));
            row.setRepairGraceUntil(null);
            row.refreshStatus(thresholds);
        });
        if (opening) log.warn("[Repair] {} incident {} opened: {}", c.name(), incidentId, detail);

        var attempt = store.appendAttempt(RepairAttempt.builder()
                .componentName(c.name())
                .incidentId(incidentId)
                .errorMessage(detail)
                .errorType(errorType)
                .repairTier(tier)
                .repairAction(executor.describe(tier, c))
                .errorContext(errorContext(updated, errorType))
                .createdAt(now)
                .nextEscalationTier(tier < 3 ? tier + 1 : null)
                .failureCount(updated.getConsecutiveFailures())
                .lastFailureAt(updated.getLastFailureAt())
                .build());
        log.info("[Repair] {} escalating to tier {} (attempt #{})", c.name(), tier, attempt.getId());

        var done = new CompletableFuture<RepairAttempt>();
        running.put(c.name(), done);
        var ctx = new RepairContext(attempt.getId(), incidentId, detail, errorType, updated.getConsecutiveFailures());
        try {
            repairs.execute(() -> {
                try {
                    done.complete(runAttempt(c, attempt, ctx));
                } catch (Throwable t) {
                    done.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            running.remove(c.name());
            var failed = store.completeAttempt(attempt.getId(), RepairOutcome.FAILURE,
                    "not started: supervisor shutting down", 0.0, clock.instant());
            done.complete(failed);
        }
        return new EscalationDecision(EscalationDecision.Action.REPAIR, c.name(), "tier " + tier, attempt, done);
    }

    private RepairAttempt runAttempt(MonitoredComponent c, RepairAttempt attempt, RepairContext ctx) {
        long start = System.nanoTime();
        RepairResult result;
        try {
            result = executor.execute(attempt.getRepairTier(), c, ctx);
        } catch (RuntimeException e) {
            log.error("[Repair] {} executor error on attempt #{}", c.name(), attempt.getId(), e);
            result = RepairResult.failure("executor error: " + e.getMessage());
        }
        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
        var lock = lockFor(c.name());
        lock.lock();
        try {
            var done = store.completeAttempt(attempt.getId(), result.outcome(), result.details(), seconds, clock.instant());
            afterAttempt(c.name(), done, result);
            return done;
        } catch (RuntimeException e) {
            log.error("[Repair] {} could not record the outcome of attempt #{}", c.name(), attempt.getId(), e);
            throw e;
        } finally {
            running.remove(c.name());
            lock.unlock();
        }
    }

    private void afterAttempt(String component, RepairAttempt done, RepairResult result) {
        var h = current(component);
        var now = clock.instant();
        if (!done.getIncidentId().equals(h.getIncidentId())) {
            log.info("[Repair] {} attempt #{} finished {} after its incident was closed",
                    component, done.getId(), done.getRepairOutcome().dbValue());
            return;
        }
        switch (done.getRepairOutcome()) {
            case SUCCESS, PARTIAL -> {
                log.info("[Repair] {} tier {} {}: {}", component, done.getRepairTier(),
                        done.getRepairOutcome().dbValue(), done.getExecutionDetails());
                closeIncident(component, done.getIncidentId(), now, true);
            }
            case FAILURE -> {
                log.warn("[Repair] {} tier {} failed: {}", component, done.getRepairTier(), done.getExecutionDetails());
                if (done.getRepairTier() >= 3) {
                    exhaust(component, done.getIncidentId(),
                            h.isIntegrityViolation() ? IncidentContext.INTEGRITY_VIOLATION : IncidentContext.REPAIR_EXHAUSTED,
                            "tier 3 repair failed: " + done.getExecutionDetails());
                } else if (result.restarted()) {
                    store.update(component, row -> row.setRepairGraceUntil(now.plus(restartGrace)));
                }
            }
        }
    }

    private void closeIncident(String component, String incidentId, Instant now, boolean validatedByRepair) {
        if (incidentId != null) store.resolveIncident(incidentId, now);
        store.update(component, row -> {
            if (row.getIncidentStartedAt() != null) {
                row.recordRecovery(Duration.between(row.getIncidentStartedAt(), now));
            }
            row.closeIncident();
            row.setIntegrityViolation(false);
            if (validatedByRepair) row.markRecovered(now, thresholds);
            else row.refreshStatus(thresholds);
        });
        log.info("[Repair] {} incident {} resolved", component, incidentId);
    }

    private EscalationDecision exhaust(String component, String incidentId, String type, String reason) {
        var h = store.update(component, row -> {
            row.setRepairState(RepairState.EXHAUSTED);
            row.setRepairGraceUntil(null);
            row.refreshStatus(thresholds);
        });
        var history = incidentId == null ? List.<RepairAttempt>of() : store.incidentAttempts(incidentId);
        log.error("[Repair] {} incident {} exhausted after {} attempts: {}", component, incidentId, history.size(), reason);
        try {
            alerts.raise(IncidentContext.of(h, type, reason, history, clock.instant()));
        } catch (RuntimeException e) {
            log.error("[Repair] {} alert could not be raised", component, e);
        }
        return EscalationDecision.exhausted(component, reason);
    }

    private ComponentHealth current(String component) {
        return store.find(component).orElseThrow(() -> new UnknownComponentException(component));
    }

    private ReentrantLock lockFor(String component) {
        return locks.computeIfAbsent(component, k -> new ReentrantLock());
    }

    private String errorContext(ComponentHealth h, String errorType) {
        var ctx = new LinkedHashMap<String, Object>();
        ctx.put("errorType", errorType);
        ctx.put("status", h.getStatus().dbValue());
        ctx.put("consecutiveFailures", h.getConsecutiveFailures());
        ctx.put("totalFailures", h.getTotalFailures());
        ctx.put("lastFailureAt", h.getLastFailureAt() == null ? null : h.getLastFailureAt().toString());
        ctx.put("integrityViolation", h.isIntegrityViolation());
        try {
            return om.writeValueAsString(ctx);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /* --------------------- lifecycle --------------------- */

    @EventListener(ContextClosedEvent.class)
    public void stopAccepting() {
        if (accepting) {
            accepting = false;
            log.info("[Repair] no longer accepting new repairs ({} running)", running.size());
        }
    }

    @PreDestroy
    void shutdown() {
        accepting = false;
        repairs.shutdown();
        try {
            if (!repairs.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Repair] repairs still running after {} s, interrupting", drainTimeout.toSeconds());
                repairs.shutdownNow();
            }
        } catch (InterruptedException e) {
            repairs.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
