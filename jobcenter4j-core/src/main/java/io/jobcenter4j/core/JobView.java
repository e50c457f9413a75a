package io.jobcenter4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Full definition of one job and its schedule, as returned by {@link io.jobcenter4j.JobCenter#queryJob}.
 */
public record JobView(
        JobKey key,
        JobKind kind,
        String description,
        Map<String, String> parameters,
        NotifyPolicy notifyPolicy,
        ScheduleKind scheduleKind,
        String cronExpression,
        String timezone,
        Duration interval,
        Integer repeatCount,
        Instant startAt,
        Instant endAt,
        MisfireInstruction misfireInstruction,
        TriggerState triggerState,
        long runCount,
        String lastError
) {
}
