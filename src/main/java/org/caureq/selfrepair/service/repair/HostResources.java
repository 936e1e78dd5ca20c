package org.caureq.selfrepair.service.repair;

import java.nio.file.Path;

/** Current host memory and disk usage, sampled before a repair. */
@FunctionalInterface
public interface HostResources {

    Usage sample(Path disk);

    /** Percentages in 0..100; {@code NaN} when the host does not report a value. */
    record Usage(double memoryUsedPct, double diskUsedPct) {}
}
