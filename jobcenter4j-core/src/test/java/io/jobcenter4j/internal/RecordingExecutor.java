package io.jobcenter4j.internal;

import io.jobcenter4j.JobExecutor;
import io.jobcenter4j.core.JobKind;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

final class RecordingExecutor implements JobExecutor {

    @FunctionalInterface
    interface Behavior {
        void run(Map<String, String> parameters) throws Exception;
    }

    private final JobKind kind;
    private final List<Map<String, String>> calls = new CopyOnWriteArrayList<>();
    private volatile Behavior behavior = p -> {
    };

    RecordingExecutor(JobKind kind) {
        this.kind = kind;
    }

    void behave(Behavior behavior) {
        this.behavior = behavior;
    }

    int callCount() {
        return calls.size();
    }

    List<Map<String, String>> calls() {
        return calls;
    }

    @Override
    public JobKind kind() {
        return kind;
    }

    @Override
    public void execute(Map<String, String> parameters) throws Exception {
        calls.add(parameters);
        behavior.run(parameters);
    }
}
