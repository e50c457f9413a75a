package io.jobcenter4j.schedule;

import io.jobcenter4j.core.MisfireInstruction;
import io.jobcenter4j.core.ScheduleKind;
import io.jobcenter4j.core.TriggerDefinition;
import io.jobcenter4j.utils.CronExpressions;
import org.quartz.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * Computes fire times from a trigger's schedule. Pure: no clock reads, no side effects.
 *
 * <p>Interval schedules fire on the grid {@code anchor + k * interval}. The anchor is the start time,
 * except for {@link MisfireInstruction#FIRE_NOW} triggers that already fired: they re-anchor on their
 * previous fire time, so a late fire shifts the cadence.
 */
public final class FireTimeCalculator {
    private FireTimeCalculator() {
    }

    /**
     * Earliest fire time strictly after {@code after}, or empty when the trigger will not fire again
     * (repeat count exhausted or past the end time).
     */
    public static Optional<Instant> nextFireTime(TriggerDefinition trigger, Instant after) {
        if (after == null) {
            throw new IllegalArgumentException("after must not be null");
        }
        Optional<Instant> candidate = trigger.scheduleKind() == ScheduleKind.CRON
                ? nextCronTime(trigger, after)
                : nextSimpleTime(trigger, after);
        return candidate.filter(t -> trigger.endAt() == null || !t.isAfter(trigger.endAt()));
    }

    /**
     * First fire time at or after the trigger's start time.
     */
    public static Optional<Instant> firstFireTime(TriggerDefinition trigger) {
        return nextFireTime(trigger, trigger.startAt().minusMillis(1));
    }

    /**
     * Latest fire time in {@code [notBefore, notAfter]}. {@code notBefore} must itself be a fire time of the
     * trigger and is returned when no later one is due yet.
     */
    public static Instant latestFireTime(TriggerDefinition trigger, Instant notBefore, Instant notAfter) {
        if (!notAfter.isAfter(notBefore)) {
            return notBefore;
        }
        Instant latest = trigger.scheduleKind() == ScheduleKind.CRON
                ? latestCronTime(trigger, notBefore, notAfter)
                : latestSimpleTime(trigger, notAfter);
        return latest == null || latest.isBefore(notBefore) ? notBefore : latest;
    }

    private static Optional<Instant> nextCronTime(TriggerDefinition trigger, Instant after) {
        CronExpression exp = CronExpressions.parse(trigger.cronExpression(), trigger.zone());

        Instant from = after;
        if (from.isBefore(trigger.startAt())) {
            from = trigger.startAt().minusMillis(1);
        }

        Date next = exp.getNextValidTimeAfter(Date.from(from));
        return next == null ? Optional.empty() : Optional.of(next.toInstant());
    }

    // Quartz has no reverse lookup, so widen a window back from notAfter until it holds a fire time.
    private static Instant latestCronTime(TriggerDefinition trigger, Instant notBefore, Instant notAfter) {
        CronExpression exp = CronExpressions.parse(trigger.cronExpression(), trigger.zone());
        Date limit = Date.from(notAfter);

        Date found = null;
        Duration window = Duration.ofSeconds(1);
        while (found == null) {
            Instant from = notAfter.minus(window);
            boolean exhausted = !from.isAfter(notBefore);
            if (exhausted) {
                from = notBefore;
            }
            Date next = exp.getNextValidTimeAfter(Date.from(from));
            if (next != null && !next.after(limit)) {
                found = next;
            } else if (exhausted) {
                return notBefore;
            }
            window = window.multipliedBy(2);
        }

        while (true) {
            Date next = exp.getNextValidTimeAfter(found);
            if (next == null || next.after(limit)) {
                return found.toInstant();
            }
            found = next;
        }
    }

    private static Instant latestSimpleTime(TriggerDefinition trigger, Instant notAfter) {
        Duration interval = requireInterval(trigger);
        Instant anchor = anchor(trigger);
        if (notAfter.isBefore(anchor)) {
            return null;
        }
        long intervalMs = interval.toMillis();
        long steps = Duration.between(anchor, notAfter).toMillis() / intervalMs;
        try {
            return anchor.plusMillis(Math.multiplyExact(steps, intervalMs));
        } catch (ArithmeticException | java.time.DateTimeException overflow) {
            return null;
        }
    }

    private static Duration requireInterval(TriggerDefinition trigger) {
        Duration interval = trigger.interval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be a positive duration: " + interval);
        }
        return interval;
    }

    private static Instant anchor(TriggerDefinition trigger) {
        boolean reanchor = trigger.misfireInstruction() == MisfireInstruction.FIRE_NOW
                && trigger.previousFireAt() != null;
        return reanchor ? trigger.previousFireAt() : trigger.startAt();
    }

    private static Optional<Instant> nextSimpleTime(TriggerDefinition trigger, Instant after) {
        Duration interval = requireInterval(trigger);
        if (!trigger.repeatsForever() && trigger.timesFired() > trigger.repeatCount()) {
            return Optional.empty();
        }

        boolean reanchor = trigger.misfireInstruction() == MisfireInstruction.FIRE_NOW
                && trigger.previousFireAt() != null;
        Instant anchor = anchor(trigger);

        if (after.isBefore(anchor)) {
            return Optional.of(reanchor ? anchor.plus(interval) : anchor);
        }

        long intervalMs = interval.toMillis();
        long elapsedMs = Duration.between(anchor, after).toMillis();
        try {
            long steps = elapsedMs / intervalMs + 1;
            return Optional.of(anchor.plusMillis(Math.multiplyExact(steps, intervalMs)));
        } catch (ArithmeticException | java.time.DateTimeException overflow) {
            return Optional.empty();
        }
    }
}
