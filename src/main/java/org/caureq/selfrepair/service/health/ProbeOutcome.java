package org.caureq.selfrepair.service.health;

import java.time.Duration;

/**
 * Result of one probe as seen by the supervisor.
 * errorType is null when healthy; "timeout", "cancelled", "unhealthy" or the exception's simple name otherwise.
 */
public record ProbeOutcome(String component, boolean healthy, String detail, String errorType, Duration elapsed) {

    public boolean timedOut() { return "timeout".equals(errorType); }
}
