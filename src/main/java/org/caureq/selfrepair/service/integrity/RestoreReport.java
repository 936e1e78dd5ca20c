package org.caureq.selfrepair.service.integrity;

import java.time.Instant;
import java.util.List;

public record RestoreReport(String snapshotId, List<String> restoredPaths, Instant completedAt) {}
