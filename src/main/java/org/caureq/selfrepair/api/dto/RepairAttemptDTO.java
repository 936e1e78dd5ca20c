package org.caureq.selfrepair.api.dto;

import org.caureq.selfrepair.domain.RepairAttempt;

import java.time.Instant;

public record RepairAttemptDTO(
        Long id, String component, String incidentId, int tier, String action,
        String outcome, String errorMessage, String errorType, String details,
        Double durationSeconds, Instant createdAt, Instant resolvedAt, Integer nextEscalationTier
) {
    public static RepairAttemptDTO of(RepairAttempt a) {
        return new RepairAttemptDTO(a.getId(), a.getComponentName(), a.getIncidentId(), a.getRepairTier(),
                a.getRepairAction(), a.getRepairOutcome() == null ? null : a.getRepairOutcome().dbValue(),
                a.getErrorMessage(), a.getErrorType(), a.getExecutionDetails(), a.getRepairDurationSeconds(),
                a.getCreatedAt(), a.getResolvedAt(), a.getNextEscalationTier());
    }
}
