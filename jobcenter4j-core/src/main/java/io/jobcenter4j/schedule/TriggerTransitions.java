package io.jobcenter4j.schedule;

import io.jobcenter4j.core.ErrorCode;
import io.jobcenter4j.core.JobCenterException;
import io.jobcenter4j.core.TriggerDefinition;
import io.jobcenter4j.core.TriggerState;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * State machine of a trigger. Every method returns the next version of the trigger and leaves
 * persistence to the store; each result must be written as one atomic update.
 */
public final class TriggerTransitions {
    private TriggerTransitions() {
    }

    /**
     * Fresh trigger: derives {@code nextFireAt} from the schedule. A schedule that never fires is COMPLETE.
     */
    public static TriggerDefinition schedule(TriggerDefinition trigger) {
        Optional<Instant> next = trigger.previousFireAt() == null
                ? FireTimeCalculator.firstFireTime(trigger)
                : FireTimeCalculator.nextFireTime(trigger, trigger.previousFireAt());

        TriggerDefinition.Builder b = trigger.toBuilder().nextFireAt(next.orElse(null));
        if (next.isEmpty() && trigger.state() == TriggerState.WAITING) {
            b.state(TriggerState.COMPLETE);
        }
        return b.build();
    }

    public static boolean isAcquirable(TriggerDefinition trigger, Instant now) {
        if (trigger.deletePending()) {
            return false;
        }
        if (trigger.fireNowRequested() && !trigger.state().isInFlight()) {
            return true;
        }
        return trigger.state() == TriggerState.WAITING
                && trigger.nextFireAt() != null
                && !trigger.nextFireAt().isAfter(now);
    }

    /**
     * WAITING trigger whose fire time is older than {@code misfireBefore}. Run-now requests are never misfires.
     */
    public static boolean isMisfireCandidate(TriggerDefinition trigger, Instant misfireBefore) {
        return trigger.state() == TriggerState.WAITING
                && !trigger.fireNowRequested()
                && !trigger.deletePending()
                && trigger.nextFireAt() != null
                && trigger.nextFireAt().isBefore(misfireBefore);
    }

    /**
     * Claims the trigger for one fire. A pending run-now request turns the fire into a manual one
     * that returns the trigger to its current state afterwards.
     */
    public static TriggerDefinition acquire(TriggerDefinition trigger, Instant now, String instanceId) {
        boolean manual = trigger.fireNowRequested();
        TriggerState returnTo = trigger.state() == TriggerState.WAITING ? null : trigger.state();
        return trigger.toBuilder()
                .state(TriggerState.ACQUIRED)
                .manualFire(manual)
                .fireNowRequested(false)
                .stateAfterFire(returnTo)
                .acquiredAt(now)
                .acquiredBy(instanceId)
                .version(trigger.version() + 1)
                .build();
    }

    /**
     * Whether {@code current} is still held by the acquisition that produced {@code fire}.
     */
    public static boolean isSameAcquisition(TriggerDefinition current, TriggerDefinition fire) {
        return current.state().isInFlight()
                && Objects.equals(current.acquiredAt(), fire.acquiredAt())
                && Objects.equals(current.acquiredBy(), fire.acquiredBy());
    }

    public static TriggerDefinition markExecuting(TriggerDefinition trigger) {
        if (trigger.state() != TriggerState.ACQUIRED) {
            throw new IllegalStateException("Trigger " + trigger.key() + " is not ACQUIRED but " + trigger.state());
        }
        return trigger.toBuilder()
                .state(TriggerState.EXECUTING)
                .version(trigger.version() + 1)
                .build();
    }

    /**
     * Ends an in-flight fire. Scheduled fires advance the schedule; manual fires leave it untouched.
     * Callers handle {@code deletePending} before calling this.
     */
    public static TriggerDefinition completeFire(TriggerDefinition trigger, boolean fatal) {
        TriggerDefinition.Builder b = trigger.toBuilder()
                .manualFire(false)
                .stateAfterFire(null)
                .acquiredAt(null)
                .acquiredBy(null)
                .version(trigger.version() + 1);

        if (trigger.manualFire()) {
            TriggerState back = trigger.stateAfterFire() != null ? trigger.stateAfterFire() : TriggerState.WAITING;
            if (back == TriggerState.WAITING && trigger.nextFireAt() == null) {
                back = TriggerState.COMPLETE;
            }
            return b.state(fatal ? TriggerState.ERROR : back).build();
        }

        Instant scheduled = trigger.nextFireAt();
        TriggerDefinition fired = b
                .timesFired(trigger.timesFired() + 1)
                .previousFireAt(scheduled)
                .build();
        Optional<Instant> next = scheduled == null
                ? Optional.empty()
                : FireTimeCalculator.nextFireTime(fired, scheduled);

        TriggerState state;
        if (fatal) {
            state = TriggerState.ERROR;
        } else if (next.isEmpty()) {
            state = TriggerState.COMPLETE;
        } else if (trigger.stateAfterFire() == TriggerState.PAUSED) {
            state = TriggerState.PAUSED;
        } else {
            state = TriggerState.WAITING;
        }
        return fired.toBuilder()
                .state(state)
                .nextFireAt(next.orElse(null))
                .build();
    }

    /**
     * Returns an interrupted fire to the state it came from, keeping its fire time so it runs again.
     */
    public static TriggerDefinition recover(TriggerDefinition trigger) {
        if (!trigger.state().isInFlight()) {
            return trigger;
        }
        TriggerState back = trigger.stateAfterFire() != null ? trigger.stateAfterFire() : TriggerState.WAITING;
        return trigger.toBuilder()
                .state(back)
                .fireNowRequested(trigger.fireNowRequested() || trigger.manualFire())
                .manualFire(false)
                .stateAfterFire(null)
                .acquiredAt(null)
                .acquiredBy(null)
                .version(trigger.version() + 1)
                .build();
    }

    /**
     * Pausing an in-flight trigger defers to the end of the fire. COMPLETE triggers stay COMPLETE.
     */
    public static TriggerDefinition pause(TriggerDefinition trigger) {
        TriggerDefinition.Builder b = trigger.toBuilder().version(trigger.version() + 1);
        if (trigger.state().isInFlight()) {
            if (trigger.stateAfterFire() == TriggerState.COMPLETE) {
                return trigger;
            }
            return b.stateAfterFire(TriggerState.PAUSED).build();
        }
        if (trigger.state() == TriggerState.WAITING || trigger.state() == TriggerState.ERROR) {
            return b.state(TriggerState.PAUSED).build();
        }
        return trigger;
    }

    /**
     * @throws JobCenterException with {@link ErrorCode#EXPIRED_END_TIME} when the end time has passed
     */
    public static TriggerDefinition resume(TriggerDefinition trigger, Instant now) {
        boolean pausedInFlight = trigger.state().isInFlight() && trigger.stateAfterFire() == TriggerState.PAUSED;
        boolean stopped = trigger.state() == TriggerState.PAUSED || trigger.state() == TriggerState.ERROR;
        if (!pausedInFlight && !stopped) {
            return trigger;
        }
        if (trigger.isExpired(now)) {
            throw new JobCenterException(ErrorCode.EXPIRED_END_TIME,
                    "Trigger " + trigger.key() + " ended at " + trigger.endAt() + " and cannot be resumed");
        }

        TriggerDefinition.Builder b = trigger.toBuilder().version(trigger.version() + 1);
        if (pausedInFlight) {
            return b.stateAfterFire(null).build();
        }

        Instant next = trigger.nextFireAt();
        if (next == null) {
            next = (trigger.previousFireAt() == null
                    ? FireTimeCalculator.firstFireTime(trigger)
                    : FireTimeCalculator.nextFireTime(trigger, trigger.previousFireAt())).orElse(null);
        }
        return b.state(next == null ? TriggerState.COMPLETE : TriggerState.WAITING)
                .nextFireAt(next)
                .build();
    }

    public static TriggerDefinition requestFire(TriggerDefinition trigger) {
        return trigger.toBuilder()
                .fireNowRequested(true)
                .version(trigger.version() + 1)
                .build();
    }

    /**
     * Moves a misfired trigger to {@code newNext}; an absent fire time completes it.
     */
    public static TriggerDefinition rescheduleMisfired(TriggerDefinition trigger, Instant newNext) {
        return trigger.toBuilder()
                .state(newNext == null ? TriggerState.COMPLETE : TriggerState.WAITING)
                .nextFireAt(newNext)
                .version(trigger.version() + 1)
                .build();
    }

    public static TriggerDefinition markDeletePending(TriggerDefinition trigger) {
        return trigger.toBuilder()
                .deletePending(true)
                .version(trigger.version() + 1)
                .build();
    }
}
