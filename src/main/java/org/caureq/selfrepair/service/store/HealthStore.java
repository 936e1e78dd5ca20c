package org.caureq.selfrepair.service.store;

import org.caureq.selfrepair.domain.ComponentHealth;
import org.caureq.selfrepair.domain.RepairAttempt;
import org.caureq.selfrepair.domain.RepairOutcome;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Durable storage for component health rows and the append-only repair log.
 * Every row mutation goes through {@link #update}, which holds the row exclusively while the mutation runs.
 * Returned entities are detached copies.
 */
public interface HealthStore {

    /** Creates the row on first registration; returns the existing row otherwise. */
    ComponentHealth register(String component);

    Optional<ComponentHealth> find(String component);

    List<ComponentHealth> findAll();

    /**
     * Applies {@code mutation} to the current row under a single-writer guarantee.
     *
     * @throws UnknownComponentException when the component was never registered
     */
    ComponentHealth update(String component, Consumer<ComponentHealth> mutation);

    /** Appends a new attempt and returns it with its id assigned. */
    RepairAttempt appendAttempt(RepairAttempt attempt);

    RepairAttempt completeAttempt(long attemptId, RepairOutcome outcome, String details,
                                  double durationSeconds, Instant resolvedAt);

    /** Stamps {@code resolved_at} on every attempt of the incident that does not carry one yet. */
    int resolveIncident(String incidentId, Instant at);

    List<RepairAttempt> incidentAttempts(String incidentId);

    /** Newest first; {@code component} may be null for all components. */
    List<RepairAttempt> attempts(String component, int limit, int offset);

    long countAttemptsSince(String component, int tier, Instant since);

    /** Attempts of any tier, on any component, created at or after {@code since}. */
    long countAllAttemptsSince(Instant since);

    int pruneAttemptsBefore(Instant cutoff);

    List<AttemptCount> countAttemptsByTierAndOutcome(Instant since);

    record AttemptCount(int tier, RepairOutcome outcome, long count) {}
}
