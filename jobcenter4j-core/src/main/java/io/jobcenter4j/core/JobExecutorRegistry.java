package io.jobcenter4j.core;

import io.jobcenter4j.JobExecutor;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class JobExecutorRegistry {

    private final Map<JobKind, JobExecutor> executorsByKind;

    public JobExecutorRegistry(List<? extends JobExecutor> executors) {
        Map<JobKind, JobExecutor> byKind = new EnumMap<>(JobKind.class);
        for (JobExecutor executor : executors) {
            JobExecutor previous = byKind.putIfAbsent(executor.kind(), executor);
            if (previous != null) {
                throw new IllegalStateException("Duplicate JobExecutor for kind: " + executor.kind());
            }
        }
        this.executorsByKind = Collections.unmodifiableMap(byKind);
    }

    public Optional<JobExecutor> find(JobKind kind) {
        return Optional.ofNullable(executorsByKind.get(kind));
    }

    public JobExecutor getRequired(JobKind kind) {
        JobExecutor executor = executorsByKind.get(kind);
        if (executor == null) {
            throw new IllegalStateException("No JobExecutor registered for kind: " + kind);
        }
        return executor;
    }

    public boolean supports(JobKind kind) {
        return executorsByKind.containsKey(kind);
    }
}
