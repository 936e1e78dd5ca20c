package org.caureq.selfrepair.service.repair;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
@Component
public class SystemHostResources implements HostResources {

    @Override
    public Usage sample(Path disk) {
        return new Usage(memoryUsedPct(), diskUsedPct(disk));
    }

    private static double memoryUsedPct() {
        var os = ManagementFactory.getOperatingSystemMXBean();
        if (!(os instanceof com.sun.management.OperatingSystemMXBean sun)) return Double.NaN;
        long total = sun.getTotalMemorySize();
        if (total <= 0) return Double.NaN;
        return 100.0 * (total - sun.getFreeMemorySize()) / total;
    }

    private static double diskUsedPct(Path disk) {
        try {
            var store = Files.getFileStore(disk);
            long total = store.getTotalSpace();
            if (total <= 0) return Double.NaN;
            return 100.0 * (total - store.getUsableSpace()) / total;
        } catch (IOException e) {
            log.warn("[Repair] cannot read disk usage for {}: {}", disk, e.getMessage());
            return Double.NaN;
        }
    }
}
