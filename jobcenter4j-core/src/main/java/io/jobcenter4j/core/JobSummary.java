package io.jobcenter4j.core;

import java.time.Instant;

/**
 * Detailed listing entry.
 *
 * @param triggerAddress URL, recipients, topic or queue depending on the kind
 * @param schedule       cron expression or ISO-8601 interval
 */
public record JobSummary(
        String name,
        JobKind kind,
        String description,
        String lastError,
        String triggerAddress,
        String requestMethod,
        TriggerState triggerState,
        Instant previousFireAt,
        Instant nextFireAt,
        Instant startAt,
        Instant endAt,
        String schedule,
        long runCount
) {
}
