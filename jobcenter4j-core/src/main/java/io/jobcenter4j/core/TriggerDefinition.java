package io.jobcenter4j.core;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Persisted trigger of a job.
 *
 * <p>{@code nextFireAt} is derived: stores recompute it from the schedule on every write
 * (see {@link io.jobcenter4j.schedule.TriggerTransitions}). The remaining bookkeeping fields describe a fire
 * in progress:
 * <ul>
 *   <li>{@code fireNowRequested}: a run-now request waits to be acquired</li>
 *   <li>{@code manualFire}: the in-flight fire came from a run-now request and leaves the schedule untouched</li>
 *   <li>{@code stateAfterFire}: state to enter once the in-flight fire completes (pause/resume while running)</li>
 *   <li>{@code deletePending}: delete job and trigger once the in-flight fire completes</li>
 * </ul>
 */
public record TriggerDefinition(
        TriggerKey key,
        JobKey jobKey,
        ScheduleKind scheduleKind,
        String cronExpression,
        String timezone,
        Duration interval,
        Integer repeatCount,
        Instant startAt,
        Instant endAt,
        MisfireInstruction misfireInstruction,
        TriggerState state,
        int timesFired,
        Instant previousFireAt,
        Instant nextFireAt,
        boolean fireNowRequested,
        boolean manualFire,
        TriggerState stateAfterFire,
        boolean deletePending,
        Instant acquiredAt,
        String acquiredBy,
        long version
) {
    public TriggerDefinition {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(jobKey, "jobKey must not be null");
        Objects.requireNonNull(scheduleKind, "scheduleKind must not be null");
        Objects.requireNonNull(startAt, "startAt must not be null");
        Objects.requireNonNull(state, "state must not be null");
        if (misfireInstruction == null) {
            misfireInstruction = MisfireInstruction.defaultFor(scheduleKind);
        }
    }

    /**
     * New WAITING trigger for {@code jobKey} built from a validated spec.
     */
    public static TriggerDefinition fromSpec(JobKey jobKey, TriggerSpec spec, Instant defaultStart) {
        return builder()
                .key(TriggerKey.forJob(jobKey))
                .jobKey(jobKey)
                .scheduleKind(spec.kind())
                .cronExpression(spec.cronExpression())
                .timezone(spec.timezone())
                .interval(spec.interval())
                .repeatCount(spec.repeatsForever() ? null : spec.repeatCount())
                .startAt(spec.startAt() != null ? spec.startAt() : defaultStart)
                .endAt(spec.endAt())
                .misfireInstruction(spec.misfireInstruction())
                .state(TriggerState.WAITING)
                .build();
    }

    public boolean repeatsForever() {
        return repeatCount == null || repeatCount < 0;
    }

    public ZoneId zone() {
        return timezone == null || timezone.isBlank() ? ZoneOffset.UTC : ZoneId.of(timezone);
    }

    public boolean isExpired(Instant now) {
        return endAt != null && !endAt.isAfter(now);
    }

    /**
     * Human readable schedule: the cron expression or the ISO-8601 interval.
     */
    public String describeSchedule() {
        return scheduleKind == ScheduleKind.CRON ? cronExpression : String.valueOf(interval);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TriggerKey key;
        private JobKey jobKey;
        private ScheduleKind scheduleKind;
        private String cronExpression;
        private String timezone;
        private Duration interval;
        private Integer repeatCount;
        private Instant startAt;
        private Instant endAt;
        private MisfireInstruction misfireInstruction;
        private TriggerState state = TriggerState.WAITING;
        private int timesFired;
        private Instant previousFireAt;
        private Instant nextFireAt;
        private boolean fireNowRequested;
        private boolean manualFire;
        private TriggerState stateAfterFire;
        private boolean deletePending;
        private Instant acquiredAt;
        private String acquiredBy;
        private long version;

        private Builder() {
        }

        private Builder(TriggerDefinition t) {
            this.key = t.key;
            this.jobKey = t.jobKey;
            this.scheduleKind = t.scheduleKind;
            this.cronExpression = t.cronExpression;
            this.timezone = t.timezone;
            this.interval = t.interval;
            this.repeatCount = t.repeatCount;
            this.startAt = t.startAt;
            this.endAt = t.endAt;
            this.misfireInstruction = t.misfireInstruction;
            this.state = t.state;
            this.timesFired = t.timesFired;
            this.previousFireAt = t.previousFireAt;
            this.nextFireAt = t.nextFireAt;
            this.fireNowRequested = t.fireNowRequested;
            this.manualFire = t.manualFire;
            this.stateAfterFire = t.stateAfterFire;
            this.deletePending = t.deletePending;
            this.acquiredAt = t.acquiredAt;
            this.acquiredBy = t.acquiredBy;
            this.version = t.version;
        }

        public Builder key(TriggerKey key) {
            this.key = key;
            return this;
        }

        public Builder jobKey(JobKey jobKey) {
            this.jobKey = jobKey;
            return this;
        }

        public Builder scheduleKind(ScheduleKind scheduleKind) {
            this.scheduleKind = scheduleKind;
            return this;
        }

        public Builder cronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder interval(Duration interval) {
            this.interval = interval;
            return this;
        }

        public Builder repeatCount(Integer repeatCount) {
            this.repeatCount = repeatCount;
            return this;
        }

        public Builder startAt(Instant startAt) {
            this.startAt = startAt;
            return this;
        }

        public Builder endAt(Instant endAt) {
            this.endAt = endAt;
            return this;
        }

        public Builder misfireInstruction(MisfireInstruction misfireInstruction) {
            this.misfireInstruction = misfireInstruction;
            return this;
        }

        public Builder state(TriggerState state) {
            this.state = state;
            return this;
        }

        public Builder timesFired(int timesFired) {
            this.timesFired = timesFired;
            return this;
        }

        public Builder previousFireAt(Instant previousFireAt) {
            this.previousFireAt = previousFireAt;
            return this;
        }

        public Builder nextFireAt(Instant nextFireAt) {
            this.nextFireAt = nextFireAt;
            return this;
        }

        public Builder fireNowRequested(boolean fireNowRequested) {
            this.fireNowRequested = fireNowRequested;
            return this;
        }

        public Builder manualFire(boolean manualFire) {
            this.manualFire = manualFire;
            return this;
        }

        public Builder stateAfterFire(TriggerState stateAfterFire) {
            this.stateAfterFire = stateAfterFire;
            return this;
        }

        public Builder deletePending(boolean deletePending) {
            this.deletePending = deletePending;
            return this;
        }

        public Builder acquiredAt(Instant acquiredAt) {
            this.acquiredAt = acquiredAt;
            return this;
        }

        public Builder acquiredBy(String acquiredBy) {
            this.acquiredBy = acquiredBy;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public TriggerDefinition build() {
            return new TriggerDefinition(key, jobKey, scheduleKind, cronExpression, timezone, interval, repeatCount,
                    startAt, endAt, misfireInstruction, state, timesFired, previousFireAt, nextFireAt,
                    fireNowRequested, manualFire, stateAfterFire, deletePending, acquiredAt, acquiredBy, version);
        }
    }
}
