package org.caureq.selfrepair.service.maintenance;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Result of one retention sweep; a step that failed reports -1 and adds to errors. */
public record SweepReport(Instant at, CleanupReport logs, int snapshotsPruned, int attemptsPruned, List<String> errors) {
    public boolean ok() { return errors.isEmpty() && logs.ok(); }

    /** Every error of the sweep, log clean-up included. */
    public List<String> allErrors() {
        if (logs.ok()) return errors;
        var all = new ArrayList<String>(logs.errors().size() + errors.size());
        logs.errors().forEach(e -> all.add("logs: " + e));
        all.addAll(errors);
        return all;
    }
}
