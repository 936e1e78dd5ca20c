package org.caureq.selfrepair.domain;

/**
 * Maps a consecutive-failure count to a {@link HealthStatus}.
 * Defaults: 0 healthy, 1-2 degraded, 3-5 failing, 6+ critical.
 */
public record StatusThresholds(int degradedAt, int failingAt, int criticalAt) {

    public static final StatusThresholds DEFAULT = new StatusThresholds(1, 3, 6);

    public StatusThresholds {
        if (degradedAt < 1 || failingAt < degradedAt || criticalAt < failingAt) {
            throw new IllegalArgumentException("thresholds must satisfy 1 <= degraded <= failing <= critical, got %d/%d/%d"
                    .formatted(degradedAt, failingAt, criticalAt));
        }
    }

    /**
     * @param forceCritical set when the incident is exhausted or an integrity violation is open
     */
    public HealthStatus statusFor(int consecutiveFailures, boolean forceCritical) {
        if (forceCritical) return HealthStatus.CRITICAL;
        if (consecutiveFailures >= criticalAt) return HealthStatus.CRITICAL;
        if (consecutiveFailures >= failingAt) return HealthStatus.FAILING;
        if (consecutiveFailures >= degradedAt) return HealthStatus.DEGRADED;
        return HealthStatus.HEALTHY;
    }
}
