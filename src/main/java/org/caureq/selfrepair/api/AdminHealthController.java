package org.caureq.selfrepair.api;

import lombok.RequiredArgsConstructor;
import org.caureq.selfrepair.service.health.CycleReport;
import org.caureq.selfrepair.service.health.HealthMonitor;
import org.caureq.selfrepair.service.health.ProbeOutcome;
import org.springframework.web.bind.annotation.*;

/** Runs probes on demand, outside the schedule. */
@RestController
@RequestMapping("/api/admin/health")
@RequiredArgsConstructor
public class AdminHealthController {
    private final HealthMonitor monitor;

    @PostMapping("/run")
    public CycleReport run() {
        return monitor.runCycle();
    }

    /** Probes one component without recording the result. */
    @GetMapping("/probe/{component}")
    public ProbeOutcome probe(@PathVariable String component) {
        return monitor.checkComponent(component);
    }
}
