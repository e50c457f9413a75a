package io.jobcenter4j.internal.memory;

import io.jobcenter4j.core.JobCenterException;
import io.jobcenter4j.core.JobDefinition;
import io.jobcenter4j.core.JobKey;
import io.jobcenter4j.core.ScheduledJob;
import io.jobcenter4j.core.TriggerDefinition;
import io.jobcenter4j.core.TriggerKey;
import io.jobcenter4j.core.TriggerState;
import io.jobcenter4j.schedule.TriggerTransitions;
import io.jobcenter4j.store.JobStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * Volatile {@link JobStore} kept in two sorted maps. A single monitor serialises every write, which
 * makes each method one atomic transition.
 */
public class InMemoryJobStore implements JobStore {

    private static final Comparator<TriggerDefinition> DUE_ORDER = Comparator
            .comparing((TriggerDefinition t) -> t.fireNowRequested() ? Instant.MIN : t.nextFireAt())
            .thenComparing(TriggerDefinition::key);

    private final Map<JobKey, JobDefinition> jobs = new TreeMap<>();
    private final Map<TriggerKey, TriggerDefinition> triggers = new TreeMap<>();

    @Override
    public synchronized void storeJobAndTrigger(JobDefinition job, TriggerDefinition trigger) {
        requireOwnTrigger(job, trigger);
        if (jobs.containsKey(job.key())) {
            throw JobCenterException.alreadyExists(job.key());
        }
        jobs.put(job.key(), job);
        triggers.put(trigger.key(), TriggerTransitions.schedule(trigger));
    }

    @Override
    public synchronized void replaceJobAndTrigger(JobDefinition job, TriggerDefinition trigger) {
        requireOwnTrigger(job, trigger);
        if (!jobs.containsKey(job.key())) {
            throw JobCenterException.notFound(job.key());
        }
        TriggerDefinition current = triggers.get(trigger.key());
        if (current != null && current.state().isInFlight()) {
            throw JobCenterException.alreadyExists(job.key() + " is executing");
        }
        jobs.put(job.key(), job);
        triggers.put(trigger.key(), TriggerTransitions.schedule(trigger));
    }

    @Override
    public synchronized void upsertJob(JobDefinition job) {
        jobs.put(job.key(), job);
    }

    @Override
    public synchronized JobDefinition getJob(JobKey key) {
        return findJob(key).orElseThrow(() -> JobCenterException.notFound(key));
    }

    @Override
    public synchronized Optional<JobDefinition> findJob(JobKey key) {
        return Optional.ofNullable(jobs.get(key));
    }

    @Override
    public synchronized void upsertTrigger(TriggerDefinition trigger) {
        if (!jobs.containsKey(trigger.jobKey())) {
            throw JobCenterException.notFound(trigger.jobKey());
        }
        triggers.put(trigger.key(), TriggerTransitions.schedule(trigger));
    }

    @Override
    public synchronized TriggerDefinition getTrigger(TriggerKey key) {
        return findTrigger(key).orElseThrow(() -> JobCenterException.notFound(key));
    }

    @Override
    public synchronized Optional<TriggerDefinition> findTrigger(TriggerKey key) {
        return Optional.ofNullable(triggers.get(key));
    }

    @Override
    public synchronized boolean deleteJob(JobKey key) {
        if (!jobs.containsKey(key)) {
            throw JobCenterException.notFound(key);
        }
        TriggerKey triggerKey = TriggerKey.forJob(key);
        TriggerDefinition trigger = triggers.get(triggerKey);
        if (trigger != null && trigger.state().isInFlight()) {
            triggers.put(triggerKey, TriggerTransitions.markDeletePending(trigger));
            return false;
        }
        jobs.remove(key);
        triggers.remove(triggerKey);
        return true;
    }

    @Override
    public synchronized void deleteTrigger(TriggerKey key) {
        triggers.remove(key);
    }

    @Override
    public synchronized TriggerDefinition pauseTrigger(TriggerKey key) {
        return update(key, TriggerTransitions::pause);
    }

    @Override
    public synchronized TriggerDefinition resumeTrigger(TriggerKey key, Instant now) {
        return update(key, t -> TriggerTransitions.resume(t, now));
    }

    @Override
    public synchronized TriggerDefinition requestImmediateFire(TriggerKey key) {
        return update(key, TriggerTransitions::requestFire);
    }

    @Override
    public synchronized List<TriggerDefinition> findMisfiredTriggers(Instant misfireBefore, int limit) {
        return triggers.values().stream()
                .filter(t -> TriggerTransitions.isMisfireCandidate(t, misfireBefore))
                .sorted(DUE_ORDER)
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized boolean rescheduleMisfired(TriggerKey key, Instant expectedNextFireAt, Instant newNextFireAt) {
        TriggerDefinition t = triggers.get(key);
        if (t == null || t.state() != TriggerState.WAITING || t.fireNowRequested()
                || !Objects.equals(t.nextFireAt(), expectedNextFireAt)) {
            return false;
        }
        triggers.put(key, TriggerTransitions.rescheduleMisfired(t, newNextFireAt));
        return true;
    }

    @Override
    public synchronized List<TriggerKey> acquireDueTriggers(Instant now, int batchSize, String instanceId) {
        List<TriggerDefinition> due = triggers.values().stream()
                .filter(t -> TriggerTransitions.isAcquirable(t, now))
                .sorted(DUE_ORDER)
                .limit(batchSize)
                .toList();

        List<TriggerKey> acquired = new ArrayList<>(due.size());
        for (TriggerDefinition t : due) {
            triggers.put(t.key(), TriggerTransitions.acquire(t, now, instanceId));
            acquired.add(t.key());
        }
        return acquired;
    }

    @Override
    public synchronized Optional<TriggerDefinition> markExecuting(TriggerKey key) {
        TriggerDefinition t = triggers.get(key);
        if (t == null || t.state() != TriggerState.ACQUIRED) {
            return Optional.empty();
        }
        TriggerDefinition executing = TriggerTransitions.markExecuting(t);
        triggers.put(key, executing);
        return Optional.of(executing);
    }

    @Override
    public synchronized Optional<TriggerState> completeFire(TriggerDefinition fire, boolean fatal) {
        TriggerKey key = fire.key();
        TriggerDefinition t = triggers.get(key);
        if (t == null) {
            return Optional.empty();
        }
        if (!TriggerTransitions.isSameAcquisition(t, fire)) {
            return Optional.of(t.state());
        }
        if (t.deletePending()) {
            jobs.remove(t.jobKey());
            triggers.remove(key);
            return Optional.empty();
        }
        TriggerDefinition done = TriggerTransitions.completeFire(t, fatal);
        triggers.put(key, done);
        return Optional.of(done.state());
    }

    @Override
    public synchronized void releaseAcquired(TriggerKey key) {
        TriggerDefinition t = triggers.get(key);
        if (t == null) {
            return;
        }
        if (t.deletePending()) {
            jobs.remove(t.jobKey());
            triggers.remove(key);
            return;
        }
        triggers.put(key, TriggerTransitions.recover(t));
    }

    @Override
    public synchronized int recoverStaleTriggers(Instant acquiredBefore) {
        List<TriggerDefinition> stale = triggers.values().stream()
                .filter(t -> t.state().isInFlight())
                .filter(t -> t.acquiredAt() == null || t.acquiredAt().isBefore(acquiredBefore))
                .toList();
        stale.forEach(t -> releaseAcquired(t.key()));
        return stale.size();
    }

    @Override
    public synchronized int recoverInFlightTriggers() {
        return recoverStaleTriggers(Instant.MAX);
    }

    @Override
    public synchronized Optional<Instant> earliestNextFireTime(Instant now) {
        Instant earliest = null;
        for (TriggerDefinition t : triggers.values()) {
            if (t.deletePending() || t.state().isInFlight()) {
                continue;
            }
            if (t.fireNowRequested()) {
                return Optional.of(now);
            }
            if (t.state() == TriggerState.WAITING && t.nextFireAt() != null
                    && (earliest == null || t.nextFireAt().isBefore(earliest))) {
                earliest = t.nextFireAt();
            }
        }
        return Optional.ofNullable(earliest);
    }

    @Override
    public synchronized JobDefinition recordExecution(JobKey key, String logEntry, String error, int maxLogEntries) {
        JobDefinition updated = getJob(key).withExecution(logEntry, error, maxLogEntries);
        jobs.put(key, updated);
        return updated;
    }

    @Override
    public synchronized void clearError(JobKey key) {
        jobs.put(key, getJob(key).withoutError());
    }

    @Override
    public synchronized List<ScheduledJob> listAll() {
        List<ScheduledJob> all = new ArrayList<>(jobs.size());
        for (JobDefinition job : jobs.values()) {
            all.add(new ScheduledJob(job, triggers.get(TriggerKey.forJob(job.key()))));
        }
        return all;
    }

    private TriggerDefinition update(TriggerKey key, UnaryOperator<TriggerDefinition> transition) {
        TriggerDefinition next = transition.apply(getTrigger(key));
        triggers.put(key, next);
        return next;
    }

    private static void requireOwnTrigger(JobDefinition job, TriggerDefinition trigger) {
        if (!trigger.jobKey().equals(job.key())) {
            throw new IllegalArgumentException("Trigger " + trigger.key() + " does not belong to job " + job.key());
        }
    }
}
