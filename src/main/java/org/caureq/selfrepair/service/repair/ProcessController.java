package org.caureq.selfrepair.service.repair;

import java.time.Duration;

/**
 * Process control for one component. Implementations must return within {@code timeout};
 * an overrun is reported as a failed {@link ControlResult}, not by throwing.
 */
public interface ProcessController {
    ControlResult start(Duration timeout);
    ControlResult stop(Duration timeout);
    ControlResult restart(Duration timeout);
    ControlResult isHealthy(Duration timeout);

    /** Soft reload signal; unsupported unless overridden. */
    default ControlResult reload(Duration timeout) {
        return ControlResult.unsupported("reload");
    }

    /** False when there is no process behind the component (nothing to restart). */
    default boolean managesProcess() { return true; }
}
