package io.jobcenter4j.core;

/**
 * When to hand an execution outcome to the configured {@link io.jobcenter4j.ExecutionNotifier}.
 */
public enum NotifyPolicy {
    NONE,
    ON_FAILURE,
    ALWAYS;

    public boolean shouldNotify(ExecutionOutcome outcome) {
        return switch (this) {
            case NONE -> false;
            case ON_FAILURE -> !outcome.success();
            case ALWAYS -> true;
        };
    }
}
