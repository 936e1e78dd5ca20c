package org.caureq.selfrepair.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;

/**
 * Current health of one monitored component. Rows are created on registration and never deleted.
 * The status column is always derived from the counters through {@link #refreshStatus(StatusThresholds)}.
 */
@Entity
@Table(name = "component_health", indexes = {
        @Index(name = "idx_component_health_status", columnList = "status")
})
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
public class ComponentHealth {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "component_name", nullable = false, unique = true, length = 128)
    private String componentName;

    @Convert(converter = HealthStatusConverter.class)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private HealthStatus status = HealthStatus.HEALTHY;

    private int consecutiveFailures;
    private long totalFailures;

    @Builder.Default
    private double uptimePercentage = 100.0;
    private long probeCount;
    private long probeSuccessCount;

    private Instant lastCheck;
    private Instant lastFailureAt;

    private Double recoveryTimeAvg;   // seconds
    private long recoveryCount;

    @Column(length = 2000)
    private String metadata;          // JSON

    // current incident
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private RepairState repairState = RepairState.IDLE;
    @Column(length = 36)
    private String incidentId;
    private Instant incidentStartedAt;
    private Instant repairGraceUntil;
    private boolean integrityViolation;

    private Instant createdAt;
    private Instant updatedAt;

    @Version
    private Long version;

    public static ComponentHealth fresh(String componentName, Instant now) {
        return ComponentHealth.builder()
                .componentName(componentName)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /** Applies one probe result to the counters and re-derives the status. */
    public void recordProbe(boolean healthy, Instant at, StatusThresholds thresholds) {
        probeCount++;
        lastCheck = at;
        if (healthy) {
            probeSuccessCount++;
            consecutiveFailures = 0;
        } else {
            consecutiveFailures++;
            totalFailures++;
            lastFailureAt = at;
        }
        uptimePercentage = 100.0 * probeSuccessCount / probeCount;
        refreshStatus(thresholds);
    }

    /** A validated repair counts as restored health without being a scheduled probe. */
    public void markRecovered(Instant at, StatusThresholds thresholds) {
        consecutiveFailures = 0;
        lastCheck = at;
        refreshStatus(thresholds);
    }

    public void recordRecovery(Duration took) {
        double seconds = Math.max(0, took.toMillis()) / 1000.0;
        recoveryCount++;
        double avg = recoveryTimeAvg == null ? 0.0 : recoveryTimeAvg;
        recoveryTimeAvg = avg + (seconds - avg) / recoveryCount;
    }

    public void openIncident(String id, Instant at) {
        incidentId = id;
        incidentStartedAt = lastFailureAt != null ? lastFailureAt : at;
    }

    public void closeIncident() {
        repairState = RepairState.IDLE;
        incidentId = null;
        incidentStartedAt = null;
        repairGraceUntil = null;
    }

    public boolean hasOpenIncident() {
        return repairState != RepairState.IDLE || incidentId != null;
    }

    public void refreshStatus(StatusThresholds thresholds) {
        boolean exhausted = repairState == RepairState.EXHAUSTED && consecutiveFailures > 0;
        status = thresholds.statusFor(consecutiveFailures, exhausted || integrityViolation);
    }

    public ComponentHealth copy() {
        return toBuilder().build();
    }
}
