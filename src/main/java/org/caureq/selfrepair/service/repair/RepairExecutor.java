package org.caureq.selfrepair.service.repair;

import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.config.SupervisorProps;
import org.caureq.selfrepair.domain.RepairOutcome;
import org.caureq.selfrepair.service.health.MonitoredComponent;
import org.caureq.selfrepair.service.health.ProbeRunner;
import org.caureq.selfrepair.service.integrity.IntegrityException;
import org.caureq.selfrepair.service.integrity.IntegrityGuard;
import org.caureq.selfrepair.service.store.HealthStore;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Runs the concrete action of a repair tier, then re-probes the component.
 * Actions for one component are strictly serialized; different components repair in parallel.
 * Timeouts are enforced inside each action so the component lock is never released while an action still runs.
 */
@Slf4j
@Service
public class RepairExecutor {
    private final IntegrityGuard guard;
    private final ProbeRunner probes;
    private final HealthStore store;
    private final RepairSafetyGate safety;
    private final SupervisorProps.RepairProps repair;
    private final Duration probeTimeout;
    private final Clock clock;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public RepairExecutor(IntegrityGuard guard, ProbeRunner probes, HealthStore store,
                          RepairSafetyGate safety, SupervisorProps props, Clock clock) {
        this.guard = guard;
        this.probes = probes;
        this.store = store;
        this.safety = safety;
        this.repair = props.repair();
        this.probeTimeout = props.health().probeTimeout();
        this.clock = clock;
    }

    public String describe(int tier, MonitoredComponent component) {
        return switch (tier) {
            case 1 -> "tier 1: clear caches, truncate oversized logs, soft reload";
            case 2 -> "tier 2: restart process";
            case 3 -> "tier 3: restore protected files from latest snapshot, restart";
            default -> throw new IllegalArgumentException("repair tier out of range: " + tier);
        };
    }

    public RepairResult execute(int tier, MonitoredComponent component, RepairContext ctx) {
        var lock = locks.computeIfAbsent(component.name(), k -> new ReentrantLock());
        lock.lock();
        try {
            var refusal = safety.refusal(component);
            if (refusal.isPresent()) return RepairResult.failure("repair refused: " + refusal.get());
            log.info("[Repair] {} tier {} starting (attempt #{}, incident {})", component.name(), tier, ctx.attemptId(), ctx.incidentId());
            var action = switch (tier) {
                case 1 -> lightweight(component);
                case 2 -> restart(component);
                case 3 -> restoreAndRestart(component);
                default -> throw new IllegalArgumentException("repair tier out of range: " + tier);
            };
            if (action.outcome() == RepairOutcome.FAILURE) return action;
            return validate(component, action);
        } catch (RuntimeException e) {
            log.error("[Repair] {} tier {} action threw", component.name(), tier, e);
            return RepairResult.failure("tier %d action error: %s".formatted(tier, e.getMessage()));
        } finally {
            lock.unlock();
        }
    }

    /* --------------------- tier 1 --------------------- */

    private RepairResult lightweight(MonitoredComponent c) {
        long deadline = System.nanoTime() + repair.tier1Timeout().toNanos();
        var steps = new ArrayList<String>();
        boolean partial = false;
        var plan = c.plan();
        for (Path dir : plan.cacheDirs()) {
            if (System.nanoTime() > deadline) return timedOut(1, steps);
            try {
                steps.add("cleared %d cache files in %s".formatted(clearDirectory(dir), dir));
            } catch (IOException e) {
                partial = true;
                steps.add("cache clear failed in %s: %s".formatted(dir, e.getMessage()));
            }
        }
        for (Path logFile : plan.logFiles()) {
            if (System.nanoTime() > deadline) return timedOut(1, steps);
            try {
                if (Files.isRegularFile(logFile) && Files.size(logFile) > plan.maxLogBytes()) {
                    long size = Files.size(logFile);
                    try (var ch = FileChannel.open(logFile, StandardOpenOption.WRITE)) {
                        ch.truncate(0);
                    }
                    steps.add("truncated %s (%d bytes)".formatted(logFile, size));
                }
            } catch (IOException e) {
                partial = true;
                steps.add("truncate failed for %s: %s".formatted(logFile, e.getMessage()));
            }
        }
        long left = deadline - System.nanoTime();
        if (left <= 0) return timedOut(1, steps);
        var reload = c.controller().reload(Duration.ofNanos(left));
        if (reload.supported()) {
            steps.add(reload.detail());
            if (!reload.ok()) partial = true;
        }
        if (System.nanoTime() > deadline) return timedOut(1, steps);
        if (steps.isEmpty()) steps.add("nothing to clean");
        var details = String.join("; ", steps);
        return partial ? RepairResult.partial(details) : RepairResult.success(details, false);
    }

    private static int clearDirectory(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) return 0;
        int n = 0;
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                if (Files.isRegularFile(p)) {
                    Files.delete(p);
                    n++;
                }
            }
        }
        return n;
    }

    /* --------------------- tier 2 --------------------- */

    private RepairResult restart(MonitoredComponent c) {
        if (!c.controller().managesProcess()) return RepairResult.failure("no process control configured");
        // the count includes the attempt being executed
        long recent = store.countAttemptsSince(c.name(), 2, clock.instant().minus(Duration.ofHours(1)));
        if (recent > repair.maxRestartsPerHour()) {
            return RepairResult.failure("restart rate limited: %d restarts in the last hour (max %d)"
                    .formatted(recent - 1, repair.maxRestartsPerHour()));
        }
        var r = c.controller().restart(repair.tier2Timeout());
        if (!r.ok()) return RepairResult.failure("restart failed: " + r.detail());
        pause(repair.validationDelay());
        return RepairResult.success(r.detail(), true);
    }

    /* --------------------- tier 3 --------------------- */

    private RepairResult restoreAndRestart(MonitoredComponent c) {
        if (c.protectedPaths().isEmpty()) return RepairResult.failure("no protected paths declared for component");
        if (guard.latestSnapshot().isEmpty()) return RepairResult.failure("no snapshot available to restore from");
        String restored;
        try {
            var report = guard.restore("latest", c.protectedPaths());
            restored = "restored %d files from snapshot %s".formatted(report.restoredPaths().size(), report.snapshotId());
        } catch (IntegrityException e) {
            return RepairResult.failure("restore failed: " + e.getMessage());
        }
        if (!c.controller().managesProcess()) return RepairResult.success(restored, false);
        var r = c.controller().restart(repair.tier3Timeout());
        if (!r.ok()) return RepairResult.failure(restored + "; restart failed: " + r.detail());
        pause(repair.validationDelay());
        return RepairResult.success(restored + "; " + r.detail(), true);
    }

    /* --------------------- validation --------------------- */

    private RepairResult validate(MonitoredComponent c, RepairResult action) {
        var probe = probes.run(c, probeTimeout);
        if (probe.healthy()) {
            return new RepairResult(action.outcome(), action.details() + "; validation probe passed", action.restarted());
        }
        return RepairResult.failure(action.details() + "; validation probe failed: " + probe.detail(), action.restarted());
    }

    private RepairResult timedOut(int tier, java.util.List<String> steps) {
        var done = steps.isEmpty() ? "" : " after: " + String.join("; ", steps);
        var timeout = tier == 1 ? repair.tier1Timeout() : repair.tier2Timeout();
        return RepairResult.failure("tier %d timed out after %d ms%s".formatted(tier, timeout.toMillis(), done));
    }

    private static void pause(Duration d) {
        if (d == null || d.isZero() || d.isNegative()) return;
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
