package org.caureq.selfrepair.service.store;

import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.domain.ComponentHealth;
import org.caureq.selfrepair.domain.RepairAttempt;
import org.caureq.selfrepair.domain.RepairOutcome;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Process-local store. {@link ConcurrentHashMap#compute} serializes writers of the same row;
 * nothing survives a restart.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "supervisor.store", havingValue = "memory")
public class InMemoryHealthStore implements HealthStore {
    private final Clock clock;
    private final Map<String, ComponentHealth> rows = new ConcurrentHashMap<>();
    private final NavigableMap<Long, RepairAttempt> attempts = new ConcurrentSkipListMap<>();
    private final AtomicLong rowIds = new AtomicLong();
    private final AtomicLong attemptIds = new AtomicLong();

    public InMemoryHealthStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ComponentHealth register(String component) {
        return rows.computeIfAbsent(component, name -> {
            var row = ComponentHealth.fresh(name, clock.instant());
            row.setId(rowIds.incrementAndGet());
            row.setVersion(0L);
            log.info("[Store] registered component {}", name);
            return row;
        }).copy();
    }

    @Override
    public Optional<ComponentHealth> find(String component) {
        return Optional.ofNullable(rows.get(component)).map(ComponentHealth::copy);
    }

    @Override
    public List<ComponentHealth> findAll() {
        return rows.values().stream()
                .map(ComponentHealth::copy)
                .sorted(Comparator.comparing(ComponentHealth::getComponentName))
                .toList();
    }

    @Override
    public ComponentHealth update(String component, Consumer<ComponentHealth> mutation) {
        var updated = rows.computeIfPresent(component, (name, current) -> {
            var next = current.copy();
            mutation.accept(next);
            next.setUpdatedAt(clock.instant());
            next.setVersion(current.getVersion() == null ? 1L : current.getVersion() + 1);
            return next;
        });
        if (updated == null) throw new UnknownComponentException(component);
        return updated.copy();
    }

    @Override
    public RepairAttempt appendAttempt(RepairAttempt attempt) {
        if (attempt.getId() != null) throw new IllegalArgumentException("attempt already persisted: " + attempt.getId());
        int tier = attempt.getRepairTier() == null ? 0 : attempt.getRepairTier();
        if (tier < 1 || tier > 3) throw new IllegalArgumentException("repair tier out of range: " + tier);
        var row = attempt.copy();
        row.setId(attemptIds.incrementAndGet());
        attempts.put(row.getId(), row);
        return row.copy();
    }

    @Override
    public RepairAttempt completeAttempt(long attemptId, RepairOutcome outcome, String details,
                                         double durationSeconds, Instant resolvedAt) {
        var done = attempts.computeIfPresent(attemptId, (id, current) -> {
            var next = current.copy();
            next.setRepairOutcome(outcome);
            next.setExecutionDetails(JpaHealthStore.truncate(details, 4000));
            next.setRepairDurationSeconds(durationSeconds);
            next.setResolvedAt(resolvedAt);
            return next;
        });
        if (done == null) throw new IllegalArgumentException("repair attempt not found: " + attemptId);
        return done.copy();
    }

    @Override
    public int resolveIncident(String incidentId, Instant at) {
        int n = 0;
        for (var e : attempts.entrySet()) {
            var a = e.getValue();
            if (!incidentId.equals(a.getIncidentId()) || a.getResolvedAt() != null) continue;
            var resolved = a.copy();
            resolved.setResolvedAt(at);
            if (attempts.replace(e.getKey(), a, resolved)) n++;
        }
        return n;
    }

    @Override
    public List<RepairAttempt> incidentAttempts(String incidentId) {
        return attempts.values().stream()
                .filter(a -> incidentId.equals(a.getIncidentId()))
                .map(RepairAttempt::copy)
                .toList();
    }

    @Override
    public List<RepairAttempt> attempts(String component, int limit, int offset) {
        int size = Math.max(1, Math.min(limit <= 0 ? 50 : limit, 500));
        return attempts.descendingMap().values().stream()
                .filter(a -> component == null || component.isBlank() || component.equals(a.getComponentName()))
                .skip(Math.max(0, offset))
                .limit(size)
                .map(RepairAttempt::copy)
                .toList();
    }

    @Override
    public long countAttemptsSince(String component, int tier, Instant since) {
        return attempts.values().stream()
                .filter(a -> component.equals(a.getComponentName()))
                .filter(a -> a.getRepairTier() == tier)
                .filter(a -> !a.getCreatedAt().isBefore(since))
                .count();
    }

    @Override
    public long countAllAttemptsSince(Instant since) {
        return attempts.values().stream()
                .filter(a -> !a.getCreatedAt().isBefore(since))
                .count();
    }

    @Override
    public int pruneAttemptsBefore(Instant cutoff) {
        int n = 0;
        for (var e : attempts.entrySet()) {
            if (e.getValue().getCreatedAt().isBefore(cutoff) && attempts.remove(e.getKey(), e.getValue())) n++;
        }
        return n;
    }

    @Override
    public List<AttemptCount> countAttemptsByTierAndOutcome(Instant since) {
        record Key(int tier, RepairOutcome outcome) {}
        Map<Key, Long> counts = attempts.values().stream()
                .filter(a -> !a.getCreatedAt().isBefore(since))
                .collect(Collectors.groupingBy(a -> new Key(a.getRepairTier(), a.getRepairOutcome()), Collectors.counting()));
        return counts.entrySet().stream()
                .map(e -> new AttemptCount(e.getKey().tier(), e.getKey().outcome(), e.getValue()))
                .sorted(Comparator.comparingInt(AttemptCount::tier))
                .toList();
    }
}
