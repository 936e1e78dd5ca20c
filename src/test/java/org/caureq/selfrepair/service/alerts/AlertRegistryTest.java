package org.caureq.selfrepair.service.alerts;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.caureq.selfrepair.domain.HealthStatus;
import org.caureq.selfrepair.repo.AlertRepo;
import org.caureq.selfrepair.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@DisplayName("AlertRegistry")
class AlertRegistryTest {
    @Autowired
    AlertRepo repo;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private AlertRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new AlertRegistry(repo, clock, new ObjectMapper().findAndRegisterModules());
    }

    private IncidentContext incident(String component, String type) {
        return new IncidentContext(component, "inc-" + component, type, "tier 3 repair failed",
                HealthStatus.CRITICAL, 6, 9, clock.instant().minusSeconds(600), clock.instant(), List.of(), clock.instant());
    }

    @Test
    @DisplayName("A raised alert starts unacknowledged and carries its type")
    void add() {
        var alert = registry.add(incident("web", IncidentContext.REPAIR_EXHAUSTED));

        assertThat(alert.isAcknowledged()).isFalse();
        assertThat(alert.getMessage()).startsWith("REPAIR_EXHAUSTED");
        assertThat(repo.findById(alert.getId()).orElseThrow().getContext()).contains("\"incidentId\":\"inc-web\"");
    }

    @Test
    @DisplayName("Acknowledging stamps the time once")
    void ack() {
        var alert = registry.add(incident("web", IncidentContext.REPAIR_EXHAUSTED));
        clock.advance(Duration.ofMinutes(5));

        var acked = registry.ack(alert.getId()).orElseThrow();
        clock.advance(Duration.ofMinutes(5));
        var again = registry.ack(alert.getId()).orElseThrow();

        assertThat(acked.isAcknowledged()).isTrue();
        assertThat(again.getAcknowledgedAt()).isEqualTo(acked.getAcknowledgedAt());
        assertThat(registry.ack("missing")).isEmpty();
    }

    @Test
    @DisplayName("Query filters by component and acknowledgement, newest first")
    void query() {
        registry.add(incident("web", IncidentContext.REPAIR_EXHAUSTED));
        clock.advance(Duration.ofMinutes(1));
        var db = registry.add(incident("db", IncidentContext.INTEGRITY_VIOLATION));
        clock.advance(Duration.ofMinutes(1));
        var web2 = registry.add(incident("web", IncidentContext.REPAIR_EXHAUSTED));
        registry.ack(db.getId());

        assertThat(registry.query(null, null, 10, 0)).extracting(AlertRegistry.Alert::getComponent)
                .containsExactly("web", "db", "web");
        assertThat(registry.query("WEB", null, 10, 0)).hasSize(2).first()
                .extracting(AlertRegistry.Alert::getId).isEqualTo(web2.getId());
        assertThat(registry.query(null, false, 10, 0)).hasSize(2);
        assertThat(registry.query("db", true, 10, 0)).hasSize(1);
    }

    @Test
    @DisplayName("Offset skips exactly that many alerts, newest first")
    void offsetIsExact() {
        for (int i = 0; i < 4; i++) {
            registry.add(incident("c" + i, IncidentContext.REPAIR_EXHAUSTED));
            clock.advance(Duration.ofMinutes(1));
        }

        var page = registry.query(null, null, 2, 1);

        assertThat(page).extracting(AlertRegistry.Alert::getComponent).containsExactly("c2", "c1");
    }
}
