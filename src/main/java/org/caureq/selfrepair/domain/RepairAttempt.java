package org.caureq.selfrepair.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.*;

import java.time.Instant;

/**
 * One remediation action, appended to {@code repair_log} before the action runs.
 * Only the completion columns (outcome, details, duration, resolved_at) change afterwards.
 */
@Entity
@Table(name = "repair_log", indexes = {
        @Index(name = "idx_repair_log_component", columnList = "component_name"),
        @Index(name = "idx_repair_log_created", columnList = "created_at"),
        @Index(name = "idx_repair_log_outcome", columnList = "repair_outcome"),
        @Index(name = "idx_repair_log_tier", columnList = "repair_tier"),
        @Index(name = "idx_repair_log_incident", columnList = "incident_id")
})
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
public class RepairAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "component_name", nullable = false, length = 128)
    private String componentName;

    @Column(name = "incident_id", nullable = false, length = 36)
    private String incidentId;

    @Column(nullable = false, length = 2000)
    private String errorMessage;

    @Column(length = 64)
    private String errorType;

    @Min(1) @Max(3)
    @Column(name = "repair_tier", nullable = false)
    private Integer repairTier;

    @Column(nullable = false, length = 512)
    private String repairAction;

    @Convert(converter = RepairOutcomeConverter.class)
    @Column(name = "repair_outcome", length = 16)
    private RepairOutcome repairOutcome;

    @Column(length = 4000)
    private String executionDetails;

    @Column(length = 4000)
    private String errorContext;      // JSON

    private Double repairDurationSeconds;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
    private Instant resolvedAt;

    private Integer nextEscalationTier;

    // incident values at the time of this attempt
    private Integer failureCount;
    private Instant lastFailureAt;

    public boolean isCompleted() { return repairOutcome != null; }

    public RepairAttempt copy() { return toBuilder().build(); }
}
