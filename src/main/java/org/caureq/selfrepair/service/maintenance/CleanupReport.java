package org.caureq.selfrepair.service.maintenance;

import java.util.List;

public record CleanupReport(int filesDeleted, long bytesFreed, List<String> errors) {
    public boolean ok() { return errors.isEmpty(); }
}
