package io.jobcenter4j.core;

/**
 * Result of one job execution.
 *
 * @param success true when the executor returned normally
 * @param message failure message, {@code null} on success
 * @param fatal   failure that should stop the trigger (state ERROR)
 */
public record ExecutionOutcome(boolean success, String message, boolean fatal) {

    public static ExecutionOutcome succeeded() {
        return new ExecutionOutcome(true, null, false);
    }

    public static ExecutionOutcome failed(String message) {
        return new ExecutionOutcome(false, message, false);
    }

    public static ExecutionOutcome fatal(String message) {
        return new ExecutionOutcome(false, message, true);
    }
}
