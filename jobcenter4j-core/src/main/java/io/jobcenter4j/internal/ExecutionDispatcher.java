package io.jobcenter4j.internal;

import io.jobcenter4j.ExecutionNotifier;
import io.jobcenter4j.JobExecutor;
import io.jobcenter4j.config.JobCenterProperties;
import io.jobcenter4j.core.ExecutionOutcome;
import io.jobcenter4j.core.JobDefinition;
import io.jobcenter4j.core.JobExecutionException;
import io.jobcenter4j.core.JobExecutorRegistry;
import io.jobcenter4j.core.TriggerDefinition;
import io.jobcenter4j.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one fired job through the executor of its kind and records the outcome on the job:
 * run count, bounded log and last error. Trigger state is left to the caller.
 */
public class ExecutionDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ExecutionDispatcher.class);

    private final JobStore store;
    private final JobExecutorRegistry executors;
    private final ExecutionNotifier notifier;
    private final JobCenterProperties props;
    private final Clock clock;
    private final StoreRetry storeRetry;
    private final ExecutorService callPool;

    public ExecutionDispatcher(JobStore store,
                               JobExecutorRegistry executors,
                               ExecutionNotifier notifier,
                               JobCenterProperties props,
                               Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.executors = Objects.requireNonNull(executors, "executors must not be null");
        this.notifier = notifier;
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.storeRetry = new StoreRetry(props.getStoreRetryAttempts(), props.getStoreRetryBackoff());
        this.callPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("jobcenter.executorCall");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @throws io.jobcenter4j.core.JobStoreException when the outcome cannot be recorded
     */
    public ExecutionOutcome dispatch(JobDefinition job, TriggerDefinition trigger, Instant fireTime) {
        Instant startedAt = clock.instant();
        log.debug("jobcenter job started key={} kind={} fireTime={} manual={}",
                job.key(), job.kind(), fireTime, trigger.manualFire());

        ExecutionOutcome outcome = invoke(job);
        Instant finishedAt = clock.instant();
        long tookMs = Duration.between(startedAt, finishedAt).toMillis();

        String entry;
        if (outcome.success()) {
            entry = finishedAt + " SUCCESS fireTime=" + fireTime + " took=" + tookMs + "ms";
            log.debug("jobcenter job succeeded key={} took={}ms", job.key(), tookMs);
        } else {
            entry = finishedAt + " FAILURE fireTime=" + fireTime + " took=" + tookMs + "ms " + outcome.message();
            log.warn("jobcenter job failed key={} kind={} fatal={} msg={}",
                    job.key(), job.kind(), outcome.fatal(), outcome.message());
        }

        JobDefinition recorded = storeRetry.call("recordExecution", () ->
                store.recordExecution(job.key(), entry, outcome.success() ? null : outcome.message(),
                        props.getMaxLogEntries()));

        notify(recorded, outcome);
        return outcome;
    }

    public void shutdown() {
        callPool.shutdownNow();
    }

    private ExecutionOutcome invoke(JobDefinition job) {
        Optional<JobExecutor> executor = executors.find(job.kind());
        if (executor.isEmpty()) {
            return ExecutionOutcome.fatal("No executor registered for kind " + job.kind());
        }

        Duration timeout = props.executionTimeoutFor(job.kind());
        Future<?> future = callPool.submit(() -> {
            executor.get().execute(job.parameters());
            return null;
        });
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return ExecutionOutcome.succeeded();
        } catch (TimeoutException e) {
            future.cancel(true);
            return ExecutionOutcome.failed("Execution timed out after " + timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ExecutionOutcome.failed("Execution interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof JobExecutionException jee) {
                return jee.isFatal()
                        ? ExecutionOutcome.fatal(describe(jee))
                        : ExecutionOutcome.failed(describe(jee));
            }
            return ExecutionOutcome.failed(describe(cause));
        }
    }

    private void notify(JobDefinition job, ExecutionOutcome outcome) {
        if (notifier == null || !job.notifyPolicy().shouldNotify(outcome)) {
            return;
        }
        try {
            notifier.onExecuted(job, outcome);
        } catch (Exception e) {
            log.warn("jobcenter notifier failed key={} msg={}", job.key(), e.getMessage(), e);
        }
    }

    private static String describe(Throwable t) {
        String msg = t.getMessage();
        return msg == null || msg.isBlank() ? t.getClass().getName() : msg;
    }
}
