package org.caureq.selfrepair.service.health.probe;

import org.caureq.selfrepair.service.health.HealthProbe;
import org.caureq.selfrepair.service.health.ProbeResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/** Unhealthy when the file store holding {@code path} is used above the threshold percentage. */
public class DiskSpaceProbe implements HealthProbe {
    private final Path path;
    private final double maxUsedPct;

    public DiskSpaceProbe(Path path, double maxUsedPct) {
        this.path = path;
        this.maxUsedPct = maxUsedPct;
    }

    @Override
    public ProbeResult check(Duration timeout) throws IOException {
        var store = Files.getFileStore(path);
        long total = store.getTotalSpace();
        if (total <= 0) return ProbeResult.unhealthy("disk %s reports no capacity".formatted(path));
        double used = 100.0 * (total - store.getUsableSpace()) / total;
        var msg = "disk %s used %.1f%% (max %.1f%%)".formatted(path, used, maxUsedPct);
        return used > maxUsedPct ? ProbeResult.unhealthy(msg) : ProbeResult.healthy(msg);
    }
}
