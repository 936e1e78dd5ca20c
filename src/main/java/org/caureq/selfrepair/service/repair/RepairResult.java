package org.caureq.selfrepair.service.repair;

import org.caureq.selfrepair.domain.RepairOutcome;

/** @param restarted the component's process was restarted by this action */
public record RepairResult(RepairOutcome outcome, String details, boolean restarted) {
    public static RepairResult success(String details, boolean restarted) { return new RepairResult(RepairOutcome.SUCCESS, details, restarted); }
    public static RepairResult partial(String details) { return new RepairResult(RepairOutcome.PARTIAL, details, false); }
    public static RepairResult failure(String details) { return new RepairResult(RepairOutcome.FAILURE, details, false); }
    public static RepairResult failure(String details, boolean restarted) { return new RepairResult(RepairOutcome.FAILURE, details, restarted); }
}
