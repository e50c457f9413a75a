package io.jobcenter4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Job definition as submitted to {@link io.jobcenter4j.JobCenter#addJob}. Pure data, no persistence logic.
 */
public record JobSpec(
        JobKey key,
        JobKind kind,
        String description,
        Map<String, String> parameters,
        NotifyPolicy notifyPolicy
) {
    public JobSpec {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        notifyPolicy = notifyPolicy == null ? NotifyPolicy.NONE : notifyPolicy;
    }

    public static Builder builder(JobKey key, JobKind kind) {
        return new Builder(key, kind);
    }

    public static final class Builder {
        private final JobKey key;
        private final JobKind kind;
        private String description;
        private final Map<String, String> parameters = new LinkedHashMap<>();
        private NotifyPolicy notifyPolicy = NotifyPolicy.NONE;

        private Builder(JobKey key, JobKind kind) {
            this.key = key;
            this.kind = kind;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder parameter(String name, String value) {
            Objects.requireNonNull(name, "name must not be null");
            if (value != null) {
                parameters.put(name, value);
            }
            return this;
        }

        public Builder parameters(Map<String, String> parameters) {
            if (parameters != null) {
                parameters.forEach(this::parameter);
            }
            return this;
        }

        public Builder notifyPolicy(NotifyPolicy notifyPolicy) {
            this.notifyPolicy = notifyPolicy;
            return this;
        }

        public JobSpec build() {
            return new JobSpec(key, kind, description, parameters, notifyPolicy);
        }
    }
}
