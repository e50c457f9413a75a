package io.jobcenter4j.core;

/**
 * Thrown by executors to report a failed run. A fatal failure moves the trigger to
 * {@link TriggerState#ERROR} instead of letting it fire again on schedule.
 */
public class JobExecutionException extends Exception {

    private final boolean fatal;

    public JobExecutionException(String message) {
        this(message, false, null);
    }

    public JobExecutionException(String message, boolean fatal) {
        this(message, fatal, null);
    }

    public JobExecutionException(String message, boolean fatal, Throwable cause) {
        super(message, cause);
        this.fatal = fatal;
    }

    public boolean isFatal() {
        return fatal;
    }
}
