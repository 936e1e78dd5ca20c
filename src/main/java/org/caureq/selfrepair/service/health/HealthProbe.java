package org.caureq.selfrepair.service.health;

import java.time.Duration;

/**
 * Health check supplied by each component. Throwing counts as a failed probe;
 * so does not returning within the timeout.
 */
@FunctionalInterface
public interface HealthProbe {
    ProbeResult check(Duration timeout) throws Exception;
}
