package io.jobcenter4j.core;

import java.time.Instant;

/**
 * Brief listing entry, used for periodic refreshes.
 */
public record JobBriefView(
        String name,
        String lastError,
        TriggerState triggerState,
        Instant previousFireAt,
        Instant nextFireAt,
        long runCount
) {
}
