package org.caureq.selfrepair.service.health;

import java.nio.file.Path;
import java.util.List;

/** Targets for the lightweight tier-1 clean-up. */
public record RepairPlan(List<Path> cacheDirs, List<Path> logFiles, long maxLogBytes) {
    public static final RepairPlan NONE = new RepairPlan(List.of(), List.of(), Long.MAX_VALUE);

    public RepairPlan {
        cacheDirs = List.copyOf(cacheDirs);
        logFiles = List.copyOf(logFiles);
    }
}
