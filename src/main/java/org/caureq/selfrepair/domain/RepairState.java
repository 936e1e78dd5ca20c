package org.caureq.selfrepair.domain;

/**
 * Escalation state of a component's current incident.
 * IDLE means no open incident; EXHAUSTED is terminal until a success or an acknowledgement.
 */
public enum RepairState {
    IDLE(0), TIER1(1), TIER2(2), TIER3(3), EXHAUSTED(4);

    private final int level;

    RepairState(int level) { this.level = level; }

    public int level() { return level; }

    /** Tier to run on the next newly observed failure, or 0 when the ladder is used up. */
    public int nextTier() {
        return switch (this) {
            case IDLE -> 1;
            case TIER1 -> 2;
            case TIER2 -> 3;
            case TIER3, EXHAUSTED -> 0;
        };
    }

    public static RepairState forTier(int tier) {
        return switch (tier) {
            case 1 -> TIER1;
            case 2 -> TIER2;
            case 3 -> TIER3;
            default -> throw new IllegalArgumentException("repair tier out of range: " + tier);
        };
    }
}
