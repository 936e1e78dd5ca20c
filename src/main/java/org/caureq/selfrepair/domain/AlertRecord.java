package org.caureq.selfrepair.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "alerts", indexes = {
        @Index(name = "idx_alert_ts", columnList = "ts DESC"),
        @Index(name = "idx_alert_component_ts", columnList = "component, ts DESC")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AlertRecord {
    @Id
    @Column(length = 36)
    private String id; // UUID string

    @Column(nullable = false, length = 128)
    private String component;

    @Column(nullable = false, length = 64)
    private String type; // REPAIR_EXHAUSTED, INTEGRITY_VIOLATION

    @Column(nullable = false, length = 512)
    private String message;

    @Column(length = 4000)
    private String context; // incident JSON as delivered to the sink

    @Column(nullable = false)
    private Instant ts;

    @Column(nullable = false)
    private boolean acknowledged;

    private Instant acknowledgedAt;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (ts == null) ts = Instant.now();
    }
}
