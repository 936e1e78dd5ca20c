package org.caureq.selfrepair.service.maintenance;

import org.caureq.selfrepair.domain.HealthStatus;
import org.caureq.selfrepair.service.store.HealthStore;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * System-wide health summary.
 *
 * @param overallUptime successful probes over all probes of all components, in percent
 * @param attempts      repair attempts created within {@code window}, by tier and outcome
 */
public record HealthReport(Instant generatedAt,
                           int components,
                           Map<HealthStatus, Long> byStatus,
                           double overallUptime,
                           long openIncidents,
                           List<String> critical,
                           Duration window,
                           List<HealthStore.AttemptCount> attempts,
                           Double recoveryTimeAvg) {}
