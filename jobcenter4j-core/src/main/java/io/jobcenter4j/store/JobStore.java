package io.jobcenter4j.store;

import io.jobcenter4j.core.JobDefinition;
import io.jobcenter4j.core.JobKey;
import io.jobcenter4j.core.ScheduledJob;
import io.jobcenter4j.core.TriggerDefinition;
import io.jobcenter4j.core.TriggerKey;
import io.jobcenter4j.core.TriggerState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage of jobs and their triggers.
 *
 * <p>Every method is one atomic transition: a crash between two calls leaves at worst an
 * ACQUIRED/EXECUTING trigger that {@link #recoverStaleTriggers(Instant)} or {@link #recoverInFlightTriggers()}
 * returns to its previous state. Failures of the backing storage surface as
 * {@link io.jobcenter4j.core.JobStoreException}; missing keys as
 * {@link io.jobcenter4j.core.JobCenterException} with {@code NOT_FOUND}.
 */
public interface JobStore {

    /**
     * One-time preparation before the scheduler starts (migrations, orphan cleanup).
     */
    default void initialize() {
    }

    /**
     * Store a new job with its trigger. The trigger's next fire time is derived from its schedule.
     *
     * @throws io.jobcenter4j.core.JobCenterException {@code ALREADY_EXISTS} when the job key is taken
     */
    void storeJobAndTrigger(JobDefinition job, TriggerDefinition trigger);

    /**
     * Replace an existing job and its trigger, keeping nothing of the old trigger.
     *
     * @throws io.jobcenter4j.core.JobCenterException {@code NOT_FOUND} when absent, {@code ALREADY_EXISTS}
     *                                                 when the current trigger is in flight
     */
    void replaceJobAndTrigger(JobDefinition job, TriggerDefinition trigger);

    void upsertJob(JobDefinition job);

    JobDefinition getJob(JobKey key);

    Optional<JobDefinition> findJob(JobKey key);

    /**
     * @throws io.jobcenter4j.core.JobCenterException {@code NOT_FOUND} when the trigger's job does not exist
     */
    void upsertTrigger(TriggerDefinition trigger);

    TriggerDefinition getTrigger(TriggerKey key);

    Optional<TriggerDefinition> findTrigger(TriggerKey key);

    default Optional<TriggerDefinition> findTriggerOfJob(JobKey jobKey) {
        return findTrigger(TriggerKey.forJob(jobKey));
    }

    /**
     * Delete a job and its trigger. While the trigger is in flight the deletion is deferred to the end
     * of the fire.
     *
     * @return true when deleted now, false when deferred
     */
    boolean deleteJob(JobKey key);

    void deleteTrigger(TriggerKey key);

    TriggerDefinition pauseTrigger(TriggerKey key);

    /**
     * @throws io.jobcenter4j.core.JobCenterException {@code EXPIRED_END_TIME} when the end time has passed
     */
    TriggerDefinition resumeTrigger(TriggerKey key, Instant now);

    TriggerDefinition requestImmediateFire(TriggerKey key);

    /**
     * WAITING triggers whose next fire time is before {@code misfireBefore}, oldest first.
     */
    List<TriggerDefinition> findMisfiredTriggers(Instant misfireBefore, int limit);

    /**
     * Compare-and-set of the next fire time of a misfired WAITING trigger. A {@code null}
     * {@code newNextFireAt} completes the trigger.
     *
     * @return false when the trigger changed since it was read
     */
    boolean rescheduleMisfired(TriggerKey key, Instant expectedNextFireAt, Instant newNextFireAt);

    /**
     * Atomically move up to {@code batchSize} due triggers to ACQUIRED, ordered by due time then key.
     * Due means WAITING with {@code nextFireAt <= now}, or carrying a run-now request.
     */
    List<TriggerKey> acquireDueTriggers(Instant now, int batchSize, String instanceId);

    /**
     * ACQUIRED to EXECUTING.
     *
     * @return the executing trigger, empty when it is no longer ACQUIRED
     */
    Optional<TriggerDefinition> markExecuting(TriggerKey key);

    /**
     * End the in-flight fire of a trigger and advance its schedule. Performs a deferred deletion.
     * Only the acquisition that produced {@code fire} may end it: once the trigger was recovered and
     * claimed again, the call changes nothing.
     *
     * @param fire the trigger as returned by {@link #markExecuting(TriggerKey)}
     * @return the state the trigger entered, its current state when the fire no longer owns it,
     * empty when it was deleted
     */
    Optional<TriggerState> completeFire(TriggerDefinition fire, boolean fatal);

    /**
     * Give back an acquisition that will not be executed. The trigger fires again on the next pass.
     */
    void releaseAcquired(TriggerKey key);

    /**
     * Return triggers acquired before {@code acquiredBefore} to their previous state.
     *
     * @return number of recovered triggers
     */
    int recoverStaleTriggers(Instant acquiredBefore);

    /**
     * Startup recovery: every in-flight trigger was interrupted by a shutdown or crash.
     */
    int recoverInFlightTriggers();

    /**
     * Earliest next fire time of a WAITING trigger; {@code now} when a run-now request is pending.
     */
    Optional<Instant> earliestNextFireTime(Instant now);

    /**
     * Apply one execution to the job: run count + 1, log entry appended, error stored when not null.
     */
    JobDefinition recordExecution(JobKey key, String logEntry, String error, int maxLogEntries);

    void clearError(JobKey key);

    /**
     * Every job with its trigger, ordered by (group, name).
     */
    List<ScheduledJob> listAll();
}
