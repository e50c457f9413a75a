package io.jobcenter4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Schedule submitted together with a {@link JobSpec}.
 *
 * <p>Use {@link #cron(String)} or {@link #simple(Duration, Integer)} and refine with the {@code with*} methods.
 * A {@code null} start time means "now" at the moment the job is added; a {@code null} misfire instruction
 * means {@link MisfireInstruction#defaultFor(ScheduleKind)}.
 */
public record TriggerSpec(
        ScheduleKind kind,
        String cronExpression,
        String timezone,
        Duration interval,
        Integer repeatCount,
        Instant startAt,
        Instant endAt,
        MisfireInstruction misfireInstruction
) {
    public TriggerSpec {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static TriggerSpec cron(String cronExpression) {
        return new TriggerSpec(ScheduleKind.CRON, cronExpression, null, null, null, null, null, null);
    }

    /**
     * @param repeatCount number of repeats after the first fire; {@code null} or negative repeats forever
     */
    public static TriggerSpec simple(Duration interval, Integer repeatCount) {
        return new TriggerSpec(ScheduleKind.SIMPLE, null, null, interval, repeatCount, null, null, null);
    }

    public static TriggerSpec simpleForever(Duration interval) {
        return simple(interval, null);
    }

    public TriggerSpec withTimezone(String timezone) {
        return new TriggerSpec(kind, cronExpression, timezone, interval, repeatCount, startAt, endAt, misfireInstruction);
    }

    public TriggerSpec withStartAt(Instant startAt) {
        return new TriggerSpec(kind, cronExpression, timezone, interval, repeatCount, startAt, endAt, misfireInstruction);
    }

    public TriggerSpec withEndAt(Instant endAt) {
        return new TriggerSpec(kind, cronExpression, timezone, interval, repeatCount, startAt, endAt, misfireInstruction);
    }

    public TriggerSpec withMisfireInstruction(MisfireInstruction misfireInstruction) {
        return new TriggerSpec(kind, cronExpression, timezone, interval, repeatCount, startAt, endAt, misfireInstruction);
    }

    public boolean repeatsForever() {
        return repeatCount == null || repeatCount < 0;
    }
}
