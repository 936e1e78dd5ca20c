package org.caureq.selfrepair.service.alerts;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.caureq.selfrepair.config.SupervisorProps;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Records an alert and hands it to the configured sink. Never throws: an alert that cannot be
 * stored or delivered is logged, and the caller's escalation state stays as it is.
 * <p>
 * The record is written on the caller's thread; delivery runs on a single background thread,
 * so a slow or unreachable sink never holds up the escalator or the health cycle.
 */
@Slf4j
@Service
public class AlertService {
    private static final int MAX_PENDING = 256;

    private final AlertRegistry registry;
    private final AlertSink sink;
    private final Duration drainTimeout;
    private final ThreadPoolExecutor deliveries;

    public AlertService(AlertRegistry registry, AlertSink sink, SupervisorProps props) {
        this.registry = registry;
        this.sink = sink;
        // three webhook tries plus their backoff
        this.drainTimeout = props.alerts().timeout().multipliedBy(4);
        var factory = new CustomizableThreadFactory("alert-");
        factory.setDaemon(true);
        this.deliveries = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(MAX_PENDING), factory);
    }

    public void raise(IncidentContext incident) {
        try {
            var alert = registry.add(incident);
            log.warn("[Alerts] {} raised for {} (alert {})", incident.type(), incident.component(), alert.getId());
        } catch (RuntimeException e) {
            log.error("[Alerts] could not store {} alert for {}: {}", incident.type(), incident.component(), e.getMessage());
        }
        try {
            deliveries.execute(() -> deliver(incident));
        } catch (RejectedExecutionException e) {
            log.error("[Alerts] delivery queue full or closed, {} incident {} not sent",
                    incident.component(), incident.incidentId());
        }
    }

    private void deliver(IncidentContext incident) {
        try {
            sink.notify(incident.component(), incident);
        } catch (AlertException e) {
            log.error("[Alerts] delivery failed for {} incident {}: {}", incident.component(), incident.incidentId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Alerts] sink error for {} incident {}", incident.component(), incident.incidentId(), e);
        }
    }

    public Optional<AlertRegistry.Alert> acknowledge(String alertId) {
        return registry.ack(alertId);
    }

    public List<AlertRegistry.Alert> query(String component, Boolean ack, int limit, int offset) {
        return registry.query(component, ack, limit, offset);
    }

    /** Delivers what is already queued, up to the drain timeout. */
    @PreDestroy
    void shutdown() {
        deliveries.shutdown();
        try {
            if (!deliveries.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Alerts] {} deliveries still pending after {} s, dropping them",
                        deliveries.getQueue().size(), drainTimeout.toSeconds());
                deliveries.shutdownNow();
            }
        } catch (InterruptedException e) {
            deliveries.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
