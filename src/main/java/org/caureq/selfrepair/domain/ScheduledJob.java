package org.caureq.selfrepair.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/** Installation flag and last-run bookkeeping for one periodic supervisor job. */
@Entity
@Table(name = "scheduled_job")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ScheduledJob {
    @Id
    @Column(length = 64)
    private String name;

    private boolean enabled;

    private long intervalSeconds;

    private Instant installedAt;
    private Instant lastRunAt;
    private Boolean lastRunOk;

    @Column(length = 1000)
    private String lastError;

    private long runCount;
    private long failureCount;
}
