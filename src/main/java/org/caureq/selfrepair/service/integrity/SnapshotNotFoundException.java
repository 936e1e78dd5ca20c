package org.caureq.selfrepair.service.integrity;

import java.util.List;

public class SnapshotNotFoundException extends IntegrityException {
    public SnapshotNotFoundException(String snapshotId) {
        super(snapshotId == null ? "no snapshot available" : "snapshot not found: " + snapshotId, snapshotId, List.of());
    }
}
