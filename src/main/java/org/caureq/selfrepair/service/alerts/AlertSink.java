package org.caureq.selfrepair.service.alerts;

/** Destination for human-facing alerts. */
public interface AlertSink {
    void notify(String component, IncidentContext incident) throws AlertException;
}
