package org.caureq.selfrepair.service.integrity;

import java.util.List;

/** Snapshot, verification or restore could not be completed consistently. */
public class IntegrityException extends RuntimeException {
    private final String snapshotId;
    private final List<String> paths;

    public IntegrityException(String message, String snapshotId, List<String> paths) {
        super(message);
        this.snapshotId = snapshotId;
        this.paths = paths == null ? List.of() : List.copyOf(paths);
    }

    public IntegrityException(String message, String snapshotId, Throwable cause) {
        super(message, cause);
        this.snapshotId = snapshotId;
        this.paths = List.of();
    }

    public String snapshotId() { return snapshotId; }
    public List<String> paths() { return paths; }
}
