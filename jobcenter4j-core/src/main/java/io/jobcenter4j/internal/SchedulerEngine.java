package io.jobcenter4j.internal;

import io.jobcenter4j.config.JobCenterProperties;
import io.jobcenter4j.core.ExecutionOutcome;
import io.jobcenter4j.core.JobDefinition;
import io.jobcenter4j.core.JobStoreException;
import io.jobcenter4j.core.TriggerDefinition;
import io.jobcenter4j.core.TriggerKey;
import io.jobcenter4j.core.TriggerState;
import io.jobcenter4j.schedule.MisfireDecision;
import io.jobcenter4j.schedule.MisfireEvaluator;
import io.jobcenter4j.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scheduler loop: one coordinator thread claims due triggers from the {@link JobStore} and hands them
 * to a fixed worker pool.
 *
 * <p>Each coordinator pass:
 * <ol>
 *   <li>returns stale acquisitions (older than {@code staleAcquisitionThreshold}) to their previous state</li>
 *   <li>applies misfire instructions to WAITING triggers that are late by more than {@code misfireThreshold}</li>
 *   <li>acquires up to the number of free workers and submits one fire per acquisition</li>
 * </ol>
 * The coordinator then sleeps until the earliest next fire time, at most {@code idleWaitTime}, or until
 * {@link #wakeUp()} is called.
 *
 * <p>Lifecycle is UNINITIALIZED, RUNNING, STOPPED. A stopped engine cannot be started again.
 */
public class SchedulerEngine {
    private static final Logger log = LoggerFactory.getLogger(SchedulerEngine.class);

    private static final int MISFIRE_BATCH = 100;
    private static final Duration COORDINATOR_JOIN_TIMEOUT = Duration.ofSeconds(30);

    public enum Status {
        UNINITIALIZED,
        RUNNING,
        STOPPED
    }

    private final JobCenterProperties props;
    private final JobStore store;
    private final ExecutionDispatcher dispatcher;
    private final MisfireEvaluator misfireEvaluator;
    private final StoreRetry storeRetry;
    private final Clock clock;
    private final String instanceId;
    private final boolean ownsWorkerPool;

    private final AtomicReference<Status> status = new AtomicReference<>(Status.UNINITIALIZED);
    private final Semaphore globalSem;
    private final Semaphore refillSignal = new Semaphore(0);

    private ExecutorService workerPool;
    private Thread coordinatorThread;
    private int systemErrorCount = 0;

    public SchedulerEngine(JobCenterProperties props, JobStore store, ExecutionDispatcher dispatcher, Clock clock) {
        this(props, store, dispatcher, clock, null);
    }

    /**
     * @param workerPool pool running the fires; when {@code null} the engine creates and owns a fixed pool
     *                   of {@code maxConcurrency} daemon threads
     */
    public SchedulerEngine(JobCenterProperties props,
                           JobStore store,
                           ExecutionDispatcher dispatcher,
                           Clock clock,
                           ExecutorService workerPool) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (props.getMaxConcurrency() <= 0) {
            throw new IllegalArgumentException("jobcenter.maxConcurrency must be positive");
        }
        this.misfireEvaluator = new MisfireEvaluator(
                Objects.requireNonNull(props.getMisfireThreshold(), "jobcenter.misfireThreshold must not be null"));
        this.storeRetry = new StoreRetry(props.getStoreRetryAttempts(), props.getStoreRetryBackoff());
        this.globalSem = new Semaphore(props.getMaxConcurrency());
        this.instanceId = InstanceIds.resolve(props.getInstanceId());
        this.workerPool = workerPool;
        this.ownsWorkerPool = workerPool == null;
    }

    /**
     * Recover interrupted fires and start the coordinator. Idempotent while running.
     *
     * @throws IllegalStateException when the engine was stopped
     */
    public synchronized void start() {
        Status current = status.get();
        if (current == Status.RUNNING) {
            return;
        }
        if (current == Status.STOPPED) {
            throw new IllegalStateException("Scheduler was stopped and cannot be restarted");
        }

        requirePositive(props.getIdleWaitTime(), "jobcenter.idleWaitTime");
        requirePositive(props.getStaleAcquisitionThreshold(), "jobcenter.staleAcquisitionThreshold");
        requirePositive(props.getExecutionTimeout(), "jobcenter.executionTimeout");
        warnIfNotBelowStaleThreshold("executionTimeout", props.getExecutionTimeout());
        if (props.getExecutionTimeouts() != null) {
            props.getExecutionTimeouts().forEach((kind, timeout) ->
                    warnIfNotBelowStaleThreshold("executionTimeouts." + kind, timeout));
        }

        log.info("JobCenter starting with instanceId={}, maxConcurrency={}, batchSize={}, idleWaitTime={}, misfireThreshold={}",
                instanceId,
                props.getMaxConcurrency(),
                props.getBatchSize(),
                props.getIdleWaitTime(),
                props.getMisfireThreshold());

        storeRetry.run("initialize", store::initialize);
        int recovered = storeRetry.call("recoverInFlightTriggers", store::recoverInFlightTriggers);
        if (recovered > 0) {
            log.info("jobcenter recovered interrupted fires count={}", recovered);
        }

        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
                Thread t = new Thread(r);
                t.setName("jobcenter.worker");
                t.setDaemon(true);
                return t;
            });
        }

        status.set(Status.RUNNING);

        coordinatorThread = new Thread(this::coordinatorLoop);
        coordinatorThread.setName("jobcenter.coordinator");
        coordinatorThread.setDaemon(true);
        coordinatorThread.start();
        log.info("JobCenter started successfully.");
    }

    /**
     * Stop acquiring and wait for in-flight fires to finish.
     *
     * @return true once the engine is not running
     */
    public synchronized boolean stop() {
        if (!status.compareAndSet(Status.RUNNING, Status.STOPPED)) {
            return status.get() != Status.RUNNING;
        }

        log.info("JobCenter stopping...");
        refillSignal.release();

        Thread coordinator = coordinatorThread;
        coordinatorThread = null;
        if (coordinator != null && coordinator != Thread.currentThread()) {
            try {
                coordinator.join(COORDINATOR_JOIN_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (coordinator.isAlive()) {
                log.warn("jobcenter coordinator did not finish its pass within {}", COORDINATOR_JOIN_TIMEOUT);
                coordinator.interrupt();
            }
        }

        // every permit back means no fire is in flight
        globalSem.acquireUninterruptibly(props.getMaxConcurrency());
        globalSem.release(props.getMaxConcurrency());

        if (ownsWorkerPool && workerPool != null) {
            workerPool.shutdown();
            workerPool = null;
        }
        dispatcher.shutdown();
        refillSignal.drainPermits();
        log.info("JobCenter stopped successfully.");
        return true;
    }

    public boolean isRunning() {
        return status.get() == Status.RUNNING;
    }

    public Status status() {
        return status.get();
    }

    public String instanceId() {
        return instanceId;
    }

    /**
     * Interrupt the coordinator's sleep so the next pass starts now.
     */
    public void wakeUp() {
        refillSignal.release();
    }

    /**
     * One coordinator pass. Also usable to drive the engine without the coordinator thread.
     *
     * @return number of acquired triggers
     */
    public int runOnce() {
        if (status.get() == Status.STOPPED) {
            return 0;
        }
        if (workerPool == null) {
            throw new IllegalStateException("Scheduler has no worker pool; start it first");
        }
        Instant now = clock.instant();
        recoverStaleTriggers(now);
        resolveMisfires(now);
        return acquireAndSubmit(now);
    }

    private void coordinatorLoop() {
        while (status.get() == Status.RUNNING) {
            boolean backlog;
            try {
                int acquired = runOnce();
                backlog = acquired >= Math.max(1, props.getBatchSize()) && globalSem.availablePermits() > 0;
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("jobcenter coordinator pass failed attempt={} msg={}", systemErrorCount, e.getMessage(), e);
                if (!sleepQuietly(backoff(systemErrorCount))) {
                    break;
                }
                continue;
            }

            if (status.get() != Status.RUNNING) {
                break;
            }
            if (backlog) {
                continue;
            }

            try {
                refillSignal.tryAcquire(nextWait().toMillis(), TimeUnit.MILLISECONDS);
                refillSignal.drainPermits();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private Duration nextWait() {
        Duration idle = props.getIdleWaitTime();
        Instant now = clock.instant();
        try {
            Optional<Instant> earliest = store.earliestNextFireTime(now);
            if (earliest.isEmpty()) {
                return idle;
            }
            Duration untilNext = Duration.between(now, earliest.get());
            if (untilNext.isNegative()) {
                return Duration.ZERO;
            }
            return untilNext.compareTo(idle) < 0 ? untilNext : idle;
        } catch (JobStoreException e) {
            log.warn("jobcenter could not read next fire time msg={}", e.getMessage());
            return idle;
        }
    }

    private void recoverStaleTriggers(Instant now) {
        Instant acquiredBefore = now.minus(props.getStaleAcquisitionThreshold());
        int recovered = storeRetry.call("recoverStaleTriggers", () -> store.recoverStaleTriggers(acquiredBefore));
        if (recovered > 0) {
            log.warn("jobcenter recovered stale acquisitions count={} acquiredBefore={}", recovered, acquiredBefore);
        }
    }

    private void resolveMisfires(Instant now) {
        Instant misfireBefore = now.minus(misfireEvaluator.threshold());
        while (true) {
            List<TriggerDefinition> misfired = storeRetry.call("findMisfiredTriggers",
                    () -> store.findMisfiredTriggers(misfireBefore, MISFIRE_BATCH));
            int changed = 0;
            for (TriggerDefinition trigger : misfired) {
                Instant scheduled = trigger.nextFireAt();
                MisfireDecision decision = misfireEvaluator.resolve(trigger, scheduled, now);
                if (decision == MisfireDecision.FIRE_AT_SCHEDULED) {
                    continue;
                }
                Instant newNext = misfireEvaluator.rescheduledFireTime(trigger, decision, now).orElse(null);
                if (Objects.equals(newNext, scheduled)) {
                    // already on its latest missed slot, acquisition picks it up
                    continue;
                }
                boolean updated = storeRetry.call("rescheduleMisfired",
                        () -> store.rescheduleMisfired(trigger.key(), scheduled, newNext));
                if (updated) {
                    changed++;
                    log.info("jobcenter trigger misfired trigger={} scheduledAt={} instruction={} decision={} nextFireAt={}",
                            trigger.key(), scheduled, trigger.misfireInstruction(), decision, newNext);
                }
            }
            if (misfired.size() < MISFIRE_BATCH || changed == 0) {
                return;
            }
        }
    }

    private int acquireAndSubmit(Instant now) {
        int free = globalSem.availablePermits();
        if (free <= 0) {
            return 0;
        }
        int take = Math.min(free, Math.max(1, props.getBatchSize()));
        List<TriggerKey> keys = storeRetry.call("acquireDueTriggers",
                () -> store.acquireDueTriggers(now, take, instanceId));
        if (!keys.isEmpty()) {
            log.debug("jobcenter acquired triggers count={} now={}", keys.size(), now);
        }

        for (TriggerKey key : keys) {
            if (!globalSem.tryAcquire()) {
                release(key);
                continue;
            }
            try {
                workerPool.execute(() -> fire(key));
            } catch (RejectedExecutionException e) {
                globalSem.release();
                log.warn("jobcenter worker pool rejected trigger={}", key);
                release(key);
            }
        }
        return keys.size();
    }

    private void fire(TriggerKey key) {
        try {
            Optional<TriggerDefinition> executing = storeRetry.call("markExecuting", () -> store.markExecuting(key));
            if (executing.isEmpty()) {
                log.debug("jobcenter trigger no longer acquired trigger={}", key);
                return;
            }
            TriggerDefinition trigger = executing.get();
            if (trigger.deletePending()) {
                storeRetry.call("completeFire", () -> store.completeFire(trigger, false));
                log.info("jobcenter job deleted before its fire started key={}", trigger.jobKey());
                return;
            }

            Optional<JobDefinition> job = storeRetry.call("findJob", () -> store.findJob(trigger.jobKey()));
            if (job.isEmpty()) {
                log.warn("jobcenter trigger without job, removing trigger={}", key);
                storeRetry.run("deleteTrigger", () -> store.deleteTrigger(key));
                return;
            }

            Instant fireTime = trigger.manualFire() || trigger.nextFireAt() == null
                    ? clock.instant()
                    : trigger.nextFireAt();
            ExecutionOutcome outcome = dispatcher.dispatch(job.get(), trigger, fireTime);

            Optional<TriggerState> state = storeRetry.call("completeFire",
                    () -> store.completeFire(trigger, outcome.fatal()));
            if (state.isEmpty()) {
                log.info("jobcenter job deleted after its fire completed key={}", trigger.jobKey());
            } else if (state.get().isInFlight()) {
                log.warn("jobcenter fire outlived its acquisition, trigger was claimed again key={}", trigger.jobKey());
            } else if (state.get() == TriggerState.COMPLETE && props.isCleanupCompletedJobs()) {
                storeRetry.call("deleteJob", () -> store.deleteJob(trigger.jobKey()));
                log.info("jobcenter completed job removed key={}", trigger.jobKey());
            } else if (state.get() == TriggerState.ERROR) {
                log.warn("jobcenter trigger entered ERROR key={}", trigger.jobKey());
            }
        } catch (JobStoreException e) {
            log.error("jobcenter store write failed; trigger left for stale recovery trigger={} msg={}",
                    key, e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("jobcenter fire failed trigger={} msg={}", key, e.getMessage(), e);
        } finally {
            globalSem.release();
            refillSignal.release();
        }
    }

    private void release(TriggerKey key) {
        try {
            storeRetry.run("releaseAcquired", () -> store.releaseAcquired(key));
        } catch (JobStoreException e) {
            log.error("jobcenter could not release trigger={} msg={}", key, e.getMessage(), e);
        }
    }

    private boolean sleepQuietly(Duration d) {
        try {
            Thread.sleep(d.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // Exponential backoff for repeated coordinator failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    private void warnIfNotBelowStaleThreshold(String name, Duration timeout) {
        if (timeout != null && timeout.compareTo(props.getStaleAcquisitionThreshold()) >= 0) {
            log.warn("jobcenter {}={} is not below staleAcquisitionThreshold={}; "
                            + "long fires may be recovered while still running",
                    name, timeout, props.getStaleAcquisitionThreshold());
        }
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }
}
