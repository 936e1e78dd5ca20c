package org.caureq.selfrepair.service.health.probe;

import org.caureq.selfrepair.service.health.HealthProbe;
import org.caureq.selfrepair.service.health.ProbeResult;

import java.time.Duration;

/** For components watched only through their protected files. */
public class PassiveProbe implements HealthProbe {
    public static final PassiveProbe INSTANCE = new PassiveProbe();

    @Override
    public ProbeResult check(Duration timeout) {
        return ProbeResult.healthy("passive component");
    }
}
