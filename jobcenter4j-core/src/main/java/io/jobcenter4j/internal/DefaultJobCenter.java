package io.jobcenter4j.internal;

import io.jobcenter4j.ExecutionNotifier;
import io.jobcenter4j.JobCenter;
import io.jobcenter4j.JobExecutor;
import io.jobcenter4j.config.JobCenterProperties;
import io.jobcenter4j.core.ErrorCode;
import io.jobcenter4j.core.JobCenterException;
import io.jobcenter4j.core.JobDefinition;
import io.jobcenter4j.core.JobExecutorRegistry;
import io.jobcenter4j.core.JobGroupBriefView;
import io.jobcenter4j.core.JobGroupView;
import io.jobcenter4j.core.JobKey;
import io.jobcenter4j.core.JobSpec;
import io.jobcenter4j.core.JobStoreException;
import io.jobcenter4j.core.JobView;
import io.jobcenter4j.core.OperationResult;
import io.jobcenter4j.core.TriggerDefinition;
import io.jobcenter4j.core.TriggerKey;
import io.jobcenter4j.core.TriggerSpec;
import io.jobcenter4j.schedule.FireTimeCalculator;
import io.jobcenter4j.store.JobStore;
import io.jobcenter4j.utils.CronExpressions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link JobCenter} over a {@link JobStore}. Owns its {@link SchedulerEngine}.
 *
 * <p>Typical usage:
 * <pre>{@code
 * JobCenter center = new DefaultJobCenter(props, store, registry, null, Clock.systemUTC());
 * center.startScheduling();
 *
 * center.addJob(
 *         JobSpec.builder(JobKey.of("billing", "nightly-report"), JobKind.HTTP)
 *                 .parameter(JobParameters.REQUEST_URL, "https://example.org/report")
 *                 .build(),
 *         TriggerSpec.cron("0 2 * * *"));
 * }</pre>
 */
public class DefaultJobCenter implements JobCenter {
    private static final Logger log = LoggerFactory.getLogger(DefaultJobCenter.class);

    private final JobStore store;
    private final JobExecutorRegistry executors;
    private final SchedulerEngine engine;
    private final Clock clock;

    public DefaultJobCenter(JobCenterProperties props,
                            JobStore store,
                            JobExecutorRegistry executors,
                            ExecutionNotifier notifier,
                            Clock clock) {
        this(store, executors,
                new SchedulerEngine(props, store, new ExecutionDispatcher(store, executors, notifier, props, clock), clock),
                clock);
    }

    public DefaultJobCenter(JobStore store, JobExecutorRegistry executors, SchedulerEngine engine, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.executors = Objects.requireNonNull(executors, "executors must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public SchedulerEngine engine() {
        return engine;
    }

    @Override
    public OperationResult<Void> addJob(JobSpec job, TriggerSpec trigger) {
        return execute("addJob", job == null ? null : job.key(), () -> {
            TriggerDefinition definition = validate(job, trigger, clock.instant());
            store.storeJobAndTrigger(JobDefinition.fromSpec(job), definition);
            engine.wakeUp();
            log.info("jobcenter job added key={} kind={} schedule={}", job.key(), job.kind(), definition.describeSchedule());
            return OperationResult.ok("Job " + job.key() + " added");
        });
    }

    @Override
    public OperationResult<Void> modifyJob(JobSpec job, TriggerSpec trigger) {
        return execute("modifyJob", job == null ? null : job.key(), () -> {
            TriggerDefinition definition = validate(job, trigger, clock.instant());
            JobDefinition previous = store.getJob(job.key());
            store.replaceJobAndTrigger(JobDefinition.fromSpec(job).withHistoryOf(previous), definition);
            engine.wakeUp();
            log.info("jobcenter job modified key={} kind={} schedule={}", job.key(), job.kind(), definition.describeSchedule());
            return OperationResult.ok("Job " + job.key() + " modified");
        });
    }

    @Override
    public OperationResult<Void> pauseOrDelete(JobKey key, boolean delete) {
        if (delete) {
            return execute("delete", key, () -> {
                boolean deletedNow = store.deleteJob(key);
                log.info("jobcenter job deleted key={} deferred={}", key, !deletedNow);
                return OperationResult.ok(deletedNow
                        ? "Job " + key + " deleted"
                        : "Job " + key + " is executing and will be deleted when the fire completes");
            });
        }
        return execute("pause", key, () -> {
            store.getJob(key);
            store.pauseTrigger(TriggerKey.forJob(key));
            log.info("jobcenter job paused key={}", key);
            return OperationResult.ok("Job " + key + " paused");
        });
    }

    @Override
    public OperationResult<Void> resume(JobKey key) {
        return execute("resume", key, () -> {
            store.getJob(key);
            TriggerDefinition trigger = store.resumeTrigger(TriggerKey.forJob(key), clock.instant());
            engine.wakeUp();
            log.info("jobcenter job resumed key={} state={} nextFireAt={}", key, trigger.state(), trigger.nextFireAt());
            return OperationResult.ok("Job " + key + " resumed");
        });
    }

    @Override
    public OperationResult<Void> triggerNow(JobKey key) {
        return execute("triggerNow", key, () -> {
            store.getJob(key);
            TriggerKey triggerKey = TriggerKey.forJob(key);
            if (store.getTrigger(triggerKey).deletePending()) {
                throw JobCenterException.notFound(key);
            }
            store.requestImmediateFire(triggerKey);
            engine.wakeUp();
            log.info("jobcenter job fire requested key={}", key);
            return OperationResult.ok("Job " + key + " will fire now");
        });
    }

    @Override
    public OperationResult<JobView> queryJob(JobKey key) {
        return execute("queryJob", key, () -> {
            JobDefinition job = store.getJob(key);
            TriggerDefinition trigger = store.findTriggerOfJob(key).orElse(null);
            return OperationResult.ok(JobViews.toView(job, trigger));
        });
    }

    @Override
    public OperationResult<List<JobGroupView>> listAllDetailed() {
        return execute("listAllDetailed", null, () -> OperationResult.ok(JobViews.groupDetailed(store.listAll())));
    }

    @Override
    public OperationResult<List<JobGroupBriefView>> listAllBrief() {
        return execute("listAllBrief", null, () -> OperationResult.ok(JobViews.groupBrief(store.listAll())));
    }

    @Override
    public OperationResult<Void> clearError(JobKey key) {
        return execute("clearError", key, () -> {
            store.clearError(key);
            return OperationResult.ok("Error of job " + key + " cleared");
        });
    }

    @Override
    public OperationResult<List<String>> jobLogs(JobKey key) {
        return execute("jobLogs", key, () -> OperationResult.ok(store.getJob(key).log()));
    }

    @Override
    public OperationResult<Long> runCount(JobKey key) {
        return execute("runCount", key, () -> OperationResult.ok(store.getJob(key).runCount()));
    }

    @Override
    public boolean startScheduling() {
        try {
            engine.start();
        } catch (IllegalStateException | JobCenterException e) {
            log.error("jobcenter could not start scheduling msg={}", e.getMessage(), e);
        }
        return engine.isRunning();
    }

    @Override
    public boolean stopScheduling() {
        return engine.stop();
    }

    @Override
    public boolean isRunning() {
        return engine.isRunning();
    }

    private TriggerDefinition validate(JobSpec job, TriggerSpec trigger, Instant now) {
        if (job == null) {
            throw JobCenterException.invalidSchedule("job must not be null");
        }
        if (trigger == null) {
            throw JobCenterException.invalidSchedule("trigger must not be null");
        }

        JobExecutor executor = executors.find(job.kind())
                .orElseThrow(() -> JobCenterException.invalidSchedule("No executor registered for kind " + job.kind()));
        try {
            executor.validate(job.parameters());
        } catch (IllegalArgumentException e) {
            throw JobCenterException.invalidSchedule(e.getMessage());
        }

        switch (trigger.kind()) {
            case CRON -> {
                if (!CronExpressions.isValid(trigger.cronExpression())) {
                    throw JobCenterException.invalidSchedule("Invalid cron expression: " + trigger.cronExpression());
                }
            }
            case SIMPLE -> {
                Duration interval = trigger.interval();
                if (interval == null || interval.isZero() || interval.isNegative()) {
                    throw JobCenterException.invalidSchedule("Interval must be a positive duration: " + interval);
                }
            }
        }

        if (trigger.timezone() != null && !trigger.timezone().isBlank()) {
            try {
                ZoneId.of(trigger.timezone());
            } catch (DateTimeException e) {
                throw JobCenterException.invalidSchedule("Invalid time zone: " + trigger.timezone());
            }
        }

        Instant start = trigger.startAt() != null ? trigger.startAt() : now;
        if (trigger.endAt() != null && !trigger.endAt().isAfter(start)) {
            throw JobCenterException.invalidSchedule("End time " + trigger.endAt() + " must be after start time " + start);
        }

        TriggerDefinition definition = TriggerDefinition.fromSpec(job.key(), trigger, now);
        if (FireTimeCalculator.firstFireTime(definition).isEmpty()) {
            throw JobCenterException.invalidSchedule("Schedule of job " + job.key() + " never fires");
        }
        return definition;
    }

    private <T> OperationResult<T> execute(String operation, JobKey key, Supplier<OperationResult<T>> action) {
        try {
            return action.get();
        } catch (JobStoreException e) {
            log.error("jobcenter {} failed key={} msg={}", operation, key, e.getMessage(), e);
            return OperationResult.failure(e);
        } catch (JobCenterException e) {
            log.info("jobcenter {} rejected key={} code={} msg={}", operation, key, e.code(), e.getMessage());
            return OperationResult.failure(e);
        } catch (IllegalArgumentException e) {
            log.info("jobcenter {} rejected key={} msg={}", operation, key, e.getMessage());
            return OperationResult.failure(ErrorCode.INVALID_SCHEDULE, e.getMessage());
        }
    }
}
