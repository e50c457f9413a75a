package io.jobcenter4j.core;

import java.util.Comparator;

/**
 * Identity of a trigger. Each job owns exactly one trigger whose key mirrors the job key.
 */
public record TriggerKey(String name, String group) implements Comparable<TriggerKey> {

    private static final Comparator<TriggerKey> ORDER =
            Comparator.comparing(TriggerKey::group).thenComparing(TriggerKey::name);

    public TriggerKey {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("trigger name must not be blank");
        }
        if (group == null || group.isBlank()) {
            group = JobKey.DEFAULT_GROUP;
        }
        if (group.indexOf('/') >= 0) {
            throw new IllegalArgumentException("trigger group must not contain '/': " + group);
        }
    }

    public static TriggerKey forJob(JobKey jobKey) {
        return new TriggerKey(jobKey.name(), jobKey.group());
    }

    public String asId() {
        return group + "/" + name;
    }

    public static TriggerKey fromId(String id) {
        JobKey k = JobKey.fromId(id);
        return new TriggerKey(k.name(), k.group());
    }

    @Override
    public int compareTo(TriggerKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return group + "." + name;
    }
}
