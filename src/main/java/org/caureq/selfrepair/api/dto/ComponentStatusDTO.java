package org.caureq.selfrepair.api.dto;

import org.caureq.selfrepair.service.StatusService;

import java.time.Instant;

public record ComponentStatusDTO(
        String component, String status, String freshness,
        int consecutiveFailures, long totalFailures, double uptimePercentage,
        Instant lastCheck, Instant lastFailureAt, Double recoveryTimeAvg,
        String repairState, String incidentId, boolean integrityViolation
) {
    public static ComponentStatusDTO of(StatusService.ComponentStatus s) {
        var h = s.health();
        return new ComponentStatusDTO(h.getComponentName(), h.getStatus().dbValue(), s.freshness().name(),
                h.getConsecutiveFailures(), h.getTotalFailures(), h.getUptimePercentage(),
                h.getLastCheck(), h.getLastFailureAt(), h.getRecoveryTimeAvg(),
                h.getRepairState().name(), h.getIncidentId(), h.isIntegrityViolation());
    }
}
