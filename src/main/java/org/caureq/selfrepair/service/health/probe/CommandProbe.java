package org.caureq.selfrepair.service.health.probe;

import org.caureq.selfrepair.service.health.HealthProbe;
import org.caureq.selfrepair.service.health.ProbeResult;
import org.caureq.selfrepair.service.repair.ProcessController;

import java.time.Duration;

/** Delegates to the component's own health command. */
public class CommandProbe implements HealthProbe {
    private final ProcessController controller;

    public CommandProbe(ProcessController controller) {
        this.controller = controller;
    }

    @Override
    public ProbeResult check(Duration timeout) {
        var r = controller.isHealthy(timeout);
        return new ProbeResult(r.ok(), r.detail());
    }
}
