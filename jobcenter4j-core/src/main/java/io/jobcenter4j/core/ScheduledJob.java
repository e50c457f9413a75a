package io.jobcenter4j.core;

/**
 * A job with its trigger, as enumerated by {@link io.jobcenter4j.store.JobStore#listAll()}.
 * The trigger is {@code null} for a job whose trigger was deleted on its own.
 */
public record ScheduledJob(JobDefinition job, TriggerDefinition trigger) {
}
