package io.jobcenter4j.core;

public enum TriggerState {
    WAITING,
    PAUSED,
    ACQUIRED,
    EXECUTING,
    COMPLETE,
    ERROR;

    public boolean isInFlight() {
        return this == ACQUIRED || this == EXECUTING;
    }
}
