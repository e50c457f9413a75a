package io.jobcenter4j.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted job: its spec plus execution bookkeeping.
 *
 * @param runCount  number of executions so far, never decreases
 * @param lastError message of the latest failed execution, empty when none
 * @param log       bounded execution log, oldest first
 */
public record JobDefinition(
        JobKey key,
        JobKind kind,
        String description,
        Map<String, String> parameters,
        NotifyPolicy notifyPolicy,
        long runCount,
        String lastError,
        List<String> log
) {
    public JobDefinition {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        notifyPolicy = notifyPolicy == null ? NotifyPolicy.NONE : notifyPolicy;
        lastError = lastError == null ? "" : lastError;
        log = log == null ? List.of() : List.copyOf(log);
    }

    public static JobDefinition fromSpec(JobSpec spec) {
        return new JobDefinition(spec.key(), spec.kind(), spec.description(), spec.parameters(),
                spec.notifyPolicy(), 0, "", List.of());
    }

    public boolean hasError() {
        return !lastError.isEmpty();
    }

    /**
     * Same definition with the execution bookkeeping of {@code previous} (used when a job is modified).
     */
    public JobDefinition withHistoryOf(JobDefinition previous) {
        return new JobDefinition(key, kind, description, parameters, notifyPolicy,
                previous.runCount(), previous.lastError(), previous.log());
    }

    /**
     * Applies one execution: bumps the run counter, appends {@code logEntry} keeping at most
     * {@code maxLogEntries}, and overwrites the last error when {@code error} is not null.
     */
    public JobDefinition withExecution(String logEntry, String error, int maxLogEntries) {
        List<String> entries = new ArrayList<>(log);
        entries.add(logEntry);
        int overflow = entries.size() - Math.max(1, maxLogEntries);
        if (overflow > 0) {
            entries = entries.subList(overflow, entries.size());
        }
        return new JobDefinition(key, kind, description, parameters, notifyPolicy,
                runCount + 1, error != null ? error : lastError, entries);
    }

    public JobDefinition withoutError() {
        return new JobDefinition(key, kind, description, parameters, notifyPolicy, runCount, "", log);
    }
}
