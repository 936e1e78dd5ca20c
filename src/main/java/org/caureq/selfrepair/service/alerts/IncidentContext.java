package org.caureq.selfrepair.service.alerts;

import org.caureq.selfrepair.domain.ComponentHealth;
import org.caureq.selfrepair.domain.HealthStatus;
import org.caureq.selfrepair.domain.RepairAttempt;

import java.time.Instant;
import java.util.List;

/**
 * Everything a human needs to act on an exhausted incident: the component's counters
 * and the full attempt history of the incident, oldest first.
 */
public record IncidentContext(String component,
                              String incidentId,
                              String type,
                              String reason,
                              HealthStatus status,
                              int consecutiveFailures,
                              long totalFailures,
                              Instant incidentStartedAt,
                              Instant lastFailureAt,
                              List<AttemptSummary> attempts,
                              Instant raisedAt) {

    public static final String REPAIR_EXHAUSTED = "REPAIR_EXHAUSTED";
    public static final String INTEGRITY_VIOLATION = "INTEGRITY_VIOLATION";

    public record AttemptSummary(long id, int tier, String action, String outcome, String details,
                                 Instant createdAt, Instant resolvedAt) {
        static AttemptSummary of(RepairAttempt a) {
            return new AttemptSummary(a.getId(), a.getRepairTier(), a.getRepairAction(),
                    a.getRepairOutcome() == null ? "pending" : a.getRepairOutcome().dbValue(),
                    a.getExecutionDetails(), a.getCreatedAt(), a.getResolvedAt());
        }
    }

    public static IncidentContext of(ComponentHealth h, String type, String reason,
                                     List<RepairAttempt> attempts, Instant raisedAt) {
        return new IncidentContext(h.getComponentName(), h.getIncidentId(), type, reason, h.getStatus(),
                h.getConsecutiveFailures(), h.getTotalFailures(), h.getIncidentStartedAt(), h.getLastFailureAt(),
                attempts.stream().map(AttemptSummary::of).toList(), raisedAt);
    }
}
