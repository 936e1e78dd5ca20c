package org.caureq.selfrepair.service.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.domain.ComponentHealth;
import org.caureq.selfrepair.domain.RepairAttempt;
import org.caureq.selfrepair.domain.RepairOutcome;
import org.caureq.selfrepair.repo.ComponentHealthRepo;
import org.caureq.selfrepair.repo.OffsetPageRequest;
import org.caureq.selfrepair.repo.RepairAttemptRepo;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "supervisor.store", havingValue = "jpa", matchIfMissing = true)
public class JpaHealthStore implements HealthStore {
    private final ComponentHealthRepo healthRepo;
    private final RepairAttemptRepo attemptRepo;
    private final Clock clock;

    @Override
    public ComponentHealth register(String component) {
        var existing = healthRepo.findByComponentName(component);
        if (existing.isPresent()) return existing.get().copy();
        try {
            var row = healthRepo.save(ComponentHealth.fresh(component, clock.instant()));
            log.info("[Store] registered component {}", component);
            return row.copy();
        } catch (DataIntegrityViolationException race) {
            // another writer registered it first
            return healthRepo.findByComponentName(component)
                    .map(ComponentHealth::copy)
                    .orElseThrow(() -> race);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ComponentHealth> find(String component) {
        return healthRepo.findByComponentName(component).map(ComponentHealth::copy);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ComponentHealth> findAll() {
        return healthRepo.findAllByOrderByComponentNameAsc().stream().map(ComponentHealth::copy).toList();
    }

    @Override
    @Transactional
    public ComponentHealth update(String component, Consumer<ComponentHealth> mutation) {
        var row = healthRepo.findForUpdate(component)
                .orElseThrow(() -> new UnknownComponentException(component));
        mutation.accept(row);
        row.setUpdatedAt(clock.instant());
        return healthRepo.saveAndFlush(row).copy();
    }

    @Override
    @Transactional
    public RepairAttempt appendAttempt(RepairAttempt attempt) {
        if (attempt.getId() != null) throw new IllegalArgumentException("attempt already persisted: " + attempt.getId());
        return attemptRepo.saveAndFlush(attempt.copy()).copy();
    }

    @Override
    @Transactional
    public RepairAttempt completeAttempt(long attemptId, RepairOutcome outcome, String details,
                                         double durationSeconds, Instant resolvedAt) {
        var row = attemptRepo.findById(attemptId)
                .orElseThrow(() -> new IllegalArgumentException("repair attempt not found: " + attemptId));
        row.setRepairOutcome(outcome);
        row.setExecutionDetails(truncate(details, 4000));
        row.setRepairDurationSeconds(durationSeconds);
        row.setResolvedAt(resolvedAt);
        return attemptRepo.save(row).copy();
    }

    @Override
    @Transactional
    public int resolveIncident(String incidentId, Instant at) {
        return attemptRepo.resolveIncident(incidentId, at);
    }

    @Override
    @Transactional(readOnly = true)
    public List<RepairAttempt> incidentAttempts(String incidentId) {
        return attemptRepo.findByIncidentIdOrderByIdAsc(incidentId).stream().map(RepairAttempt::copy).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<RepairAttempt> attempts(String component, int limit, int offset) {
        int size = Math.max(1, Math.min(limit <= 0 ? 50 : limit, 500));
        Pageable p = OffsetPageRequest.of(offset, size, Sort.by(Sort.Direction.DESC, "id"));
        var rows = (component == null || component.isBlank())
                ? attemptRepo.findAll(p)
                : attemptRepo.findByComponentName(component, p);
        return rows.stream().map(RepairAttempt::copy).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long countAttemptsSince(String component, int tier, Instant since) {
        return attemptRepo.countByComponentNameAndRepairTierAndCreatedAtGreaterThanEqual(component, tier, since);
    }

    @Override
    @Transactional(readOnly = true)
    public long countAllAttemptsSince(Instant since) {
        return attemptRepo.countByCreatedAtGreaterThanEqual(since);
    }

    @Override
    @Transactional
    public int pruneAttemptsBefore(Instant cutoff) {
        return attemptRepo.deleteCreatedBefore(cutoff);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AttemptCount> countAttemptsByTierAndOutcome(Instant since) {
        return attemptRepo.countByTierAndOutcome(since).stream()
                .map(r -> new AttemptCount(((Number) r[0]).intValue(), (RepairOutcome) r[1], ((Number) r[2]).longValue()))
                .toList();
    }

    static String truncate(String s, int max) {
        if (s == null || s.length() <= max) return s;
        return s.substring(0, max - 3) + "...";
    }
}
