package org.caureq.selfrepair.service.alerts;

import lombok.extern.slf4j.Slf4j;

/** Used when no webhook is configured: the alert only reaches the supervisor log. */
@Slf4j
public class LoggingAlertSink implements AlertSink {
    @Override
    public void notify(String component, IncidentContext incident) {
        log.error("[Alerts] {} {} incident {}: {} ({} attempts)", incident.type(), component,
                incident.incidentId(), incident.reason(), incident.attempts().size());
    }
}
