package org.caureq.selfrepair.service.alerts;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.domain.AlertRecord;
import org.caureq.selfrepair.repo.AlertRepo;
import org.caureq.selfrepair.repo.OffsetPageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Persistent record of every alert raised, with list and acknowledge. */
@Slf4j
@Component
public class AlertRegistry {
    @Value
    public static class Alert {
        String id;
        String component;
        String type; // REPAIR_EXHAUSTED, INTEGRITY_VIOLATION
        String message;
        Instant ts;
        boolean acknowledged;
        Instant acknowledgedAt;
    }

    private final AlertRepo repo;
    private final Clock clock;
    private final ObjectMapper om;

    public AlertRegistry(AlertRepo repo, Clock clock, ObjectMapper om) {
        this.repo = repo;
        this.clock = clock;
        this.om = om;
    }

    public Alert add(IncidentContext incident) {
        var message = "%s: %s".formatted(incident.type(), incident.reason());
        var rec = AlertRecord.builder()
                .id(UUID.randomUUID().toString())
                .component(incident.component())
                .type(incident.type())
                .message(message.length() > 512 ? message.substring(0, 512) : message)
                .context(toJson(incident))
                .ts(incident.raisedAt())
                .acknowledged(false)
                .build();
        return toDto(repo.save(rec));
    }

    @Transactional
    public Optional<Alert> ack(String id) {
        return repo.findById(id).map(r -> {
            if (!r.isAcknowledged()) {
                r.setAcknowledged(true);
                r.setAcknowledgedAt(clock.instant());
                repo.save(r);
            }
            return toDto(r);
        });
    }

    /** Query with optional filters and pagination (offset/limit). */
    public List<Alert> query(String component, Boolean ack, int limit, int offset) {
        int size = Math.max(1, Math.min(limit <= 0 ? 50 : limit, 500));
        Pageable p = OffsetPageRequest.of(offset, size, Sort.by(Sort.Direction.DESC, "ts"));
        var stream = (
                component != null && !component.isBlank() && ack != null ?
                        repo.findByComponentIgnoreCaseAndAcknowledged(component, ack, p).stream() :
                component != null && !component.isBlank() ?
                        repo.findByComponentIgnoreCase(component, p).stream() :
                ack != null ?
                        repo.findByAcknowledged(ack, p).stream() :
                        repo.findAll(p).stream()
        );
        return stream.map(this::toDto).toList();
    }

    private Alert toDto(AlertRecord r) {
        return new Alert(r.getId(), r.getComponent(), r.getType(), r.getMessage(), r.getTs(),
                r.isAcknowledged(), r.getAcknowledgedAt());
    }

    private String toJson(IncidentContext incident) {
        try {
            var json = om.writeValueAsString(incident);
            return json.length() > 4000 ? json.substring(0, 4000) : json;
        } catch (JsonProcessingException e) {
            log.warn("[Alerts] cannot serialize incident {}: {}", incident.incidentId(), e.getMessage());
            return null;
        }
    }
}
