package org.caureq.selfrepair.service.repair;

import org.caureq.selfrepair.domain.RepairAttempt;

import java.util.concurrent.CompletableFuture;

/**
 * What the escalator did with one observation.
 * For {@link Action#REPAIR}, {@code attempt} is the row written before the action started and
 * {@code completion} yields the completed row; otherwise both are empty.
 */
public record EscalationDecision(Action action, String component, String reason,
                                 RepairAttempt attempt, CompletableFuture<RepairAttempt> completion) {

    public enum Action { REPAIR, EXHAUSTED, SKIPPED }

    public static EscalationDecision skipped(String component, String reason) {
        return new EscalationDecision(Action.SKIPPED, component, reason, null, CompletableFuture.completedFuture(null));
    }

    public static EscalationDecision exhausted(String component, String reason) {
        return new EscalationDecision(Action.EXHAUSTED, component, reason, null, CompletableFuture.completedFuture(null));
    }

    public boolean repairing() { return action == Action.REPAIR; }
}
