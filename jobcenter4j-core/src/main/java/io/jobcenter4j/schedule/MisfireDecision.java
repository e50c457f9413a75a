package io.jobcenter4j.schedule;

public enum MisfireDecision {
    /**
     * Fire immediately with the current time as the effective fire time.
     */
    FIRE_NOW,
    /**
     * Fire immediately for the most recent missed slot, which stays the recorded fire time.
     */
    FIRE_LAST_MISSED,
    /**
     * Not misfired: fire at the scheduled time.
     */
    FIRE_AT_SCHEDULED,
    /**
     * Drop the missed fires and wait for the next slot in the future.
     */
    SKIP
}
