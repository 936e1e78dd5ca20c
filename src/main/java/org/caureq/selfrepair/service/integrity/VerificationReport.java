package org.caureq.selfrepair.service.integrity;

import java.time.Instant;
import java.util.List;

public record VerificationReport(String snapshotId, Instant checkedAt, int filesChecked, List<PathMismatch> mismatches) {
    public boolean clean() { return mismatches.isEmpty(); }

    public List<PathMismatch> violations() {
        return mismatches.stream().filter(PathMismatch::isViolation).toList();
    }
}
