package org.caureq.selfrepair.service.health.probe;

import org.caureq.selfrepair.service.health.HealthProbe;
import org.caureq.selfrepair.service.health.ProbeResult;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/** Host physical memory usage against a threshold percentage. */
public class MemoryProbe implements HealthProbe {
    private final double maxUsedPct;

    public MemoryProbe(double maxUsedPct) {
        this.maxUsedPct = maxUsedPct;
    }

    @Override
    public ProbeResult check(Duration timeout) {
        var os = ManagementFactory.getOperatingSystemMXBean();
        if (!(os instanceof com.sun.management.OperatingSystemMXBean sun)) {
            return ProbeResult.healthy("memory metrics unavailable on this JVM");
        }
        long total = sun.getTotalMemorySize();
        if (total <= 0) return ProbeResult.healthy("memory metrics unavailable on this host");
        double used = 100.0 * (total - sun.getFreeMemorySize()) / total;
        var msg = "memory used %.1f%% (max %.1f%%)".formatted(used, maxUsedPct);
        return used > maxUsedPct ? ProbeResult.unhealthy(msg) : ProbeResult.healthy(msg);
    }
}
