package org.caureq.selfrepair.service.health;

import org.caureq.selfrepair.service.integrity.VerificationReport;

import java.time.Instant;
import java.util.List;

/** @param integrity null when no verification ran this cycle */
public record CycleReport(Instant startedAt, Instant finishedAt, List<ProbeOutcome> outcomes, VerificationReport integrity) {

    public List<ProbeOutcome> unhealthy() {
        return outcomes.stream().filter(o -> !o.healthy()).toList();
    }

    public boolean allHealthy() {
        return unhealthy().isEmpty() && (integrity == null || integrity.violations().isEmpty());
    }
}
