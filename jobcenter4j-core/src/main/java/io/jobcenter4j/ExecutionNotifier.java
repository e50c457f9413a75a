package io.jobcenter4j;

import io.jobcenter4j.core.ExecutionOutcome;
import io.jobcenter4j.core.JobDefinition;

/**
 * Receives execution outcomes of jobs whose {@link io.jobcenter4j.core.NotifyPolicy} asks for it.
 */
public interface ExecutionNotifier {
    void onExecuted(JobDefinition job, ExecutionOutcome outcome) throws Exception;
}
