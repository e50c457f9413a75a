package io.jobcenter4j.core;

/**
 * What a trigger does when its fire time passed without being acted on.
 */
public enum MisfireInstruction {
    /**
     * Skip every missed fire and wait for the next slot after now.
     */
    DO_NOTHING,
    /**
     * Fire once now; the next fire time is computed from now (interval schedules re-anchor).
     */
    FIRE_NOW,
    /**
     * Fire once now for the most recent missed slot, then continue on the original cadence.
     */
    FIRE_AND_PROCEED;

    public static MisfireInstruction defaultFor(ScheduleKind kind) {
        return kind == ScheduleKind.CRON ? FIRE_AND_PROCEED : FIRE_NOW;
    }
}
