package io.jobcenter4j;

import io.jobcenter4j.core.JobKind;

import java.util.Map;

/**
 * Runs jobs of one {@link JobKind}. Implementations must be thread-safe: the scheduler calls them
 * from its worker pool.
 */
public interface JobExecutor {
    JobKind kind();

    /**
     * Checks the parameter map when a job is added.
     *
     * @throws IllegalArgumentException describing the invalid parameter
     */
    default void validate(Map<String, String> parameters) {
        kind().requireParameters(parameters);
    }

    /**
     * Executes the job once. Throwing {@link io.jobcenter4j.core.JobExecutionException} with the fatal
     * flag set moves the trigger to ERROR; any other exception is a plain failure.
     */
    void execute(Map<String, String> parameters) throws Exception;
}
