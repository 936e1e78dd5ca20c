package org.caureq.selfrepair.domain;

import java.util.Locale;

/** Component health as stored in {@code component_health.status}. */
public enum HealthStatus {
    HEALTHY, DEGRADED, FAILING, CRITICAL;

    public String dbValue() { return name().toLowerCase(Locale.ROOT); }

    public static HealthStatus fromDb(String value) {
        if (value == null || value.isBlank()) return HEALTHY;
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
