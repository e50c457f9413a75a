package io.jobcenter4j.schedule;

import io.jobcenter4j.core.TriggerDefinition;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides what a trigger does when its scheduled fire time has passed.
 *
 * <p>A fire time has misfired when {@code scheduledTime + threshold < now}.
 */
public final class MisfireEvaluator {

    private final Duration threshold;

    public MisfireEvaluator(Duration threshold) {
        Objects.requireNonNull(threshold, "threshold must not be null");
        if (threshold.isNegative()) {
            throw new IllegalArgumentException("misfire threshold must not be negative");
        }
        this.threshold = threshold;
    }

    public Duration threshold() {
        return threshold;
    }

    public boolean isMisfired(Instant scheduledTime, Instant now) {
        return scheduledTime.plus(threshold).isBefore(now);
    }

    public MisfireDecision resolve(TriggerDefinition trigger, Instant scheduledTime, Instant now) {
        if (!isMisfired(scheduledTime, now)) {
            return MisfireDecision.FIRE_AT_SCHEDULED;
        }
        return switch (trigger.misfireInstruction()) {
            case DO_NOTHING -> MisfireDecision.SKIP;
            case FIRE_NOW -> MisfireDecision.FIRE_NOW;
            case FIRE_AND_PROCEED -> MisfireDecision.FIRE_LAST_MISSED;
        };
    }

    /**
     * Fire time a misfired trigger is moved to, or empty when it should complete instead
     * (end time passed or no slot left). A trigger already on its latest missed slot keeps it.
     */
    public Optional<Instant> rescheduledFireTime(TriggerDefinition trigger, MisfireDecision decision, Instant now) {
        return switch (decision) {
            case FIRE_AT_SCHEDULED -> Optional.ofNullable(trigger.nextFireAt());
            case FIRE_NOW -> trigger.endAt() != null && now.isAfter(trigger.endAt())
                    ? Optional.empty()
                    : Optional.of(now);
            case FIRE_LAST_MISSED -> trigger.endAt() != null && now.isAfter(trigger.endAt())
                    ? Optional.empty()
                    : Optional.of(trigger.nextFireAt() == null
                            ? now
                            : FireTimeCalculator.latestFireTime(trigger, trigger.nextFireAt(), now));
            case SKIP -> FireTimeCalculator.nextFireTime(trigger, now);
        };
    }
}
