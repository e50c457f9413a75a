package io.jobcenter4j.core;

import java.util.Comparator;

/**
 * Identity of a job definition: a (name, group) pair.
 *
 * <p>Groups partition jobs per tenant. The group must not contain {@code '/'} because it separates
 * group and name in persisted ids.
 */
public record JobKey(String name, String group) implements Comparable<JobKey> {

    public static final String DEFAULT_GROUP = "DEFAULT";

    private static final Comparator<JobKey> ORDER =
            Comparator.comparing(JobKey::group).thenComparing(JobKey::name);

    public JobKey {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("job name must not be blank");
        }
        if (group == null || group.isBlank()) {
            group = DEFAULT_GROUP;
        }
        if (group.indexOf('/') >= 0) {
            throw new IllegalArgumentException("job group must not contain '/': " + group);
        }
    }

    public static JobKey of(String group, String name) {
        return new JobKey(name, group);
    }

    /**
     * Persisted id, {@code group/name}.
     */
    public String asId() {
        return group + "/" + name;
    }

    public static JobKey fromId(String id) {
        int slash = id.indexOf('/');
        if (slash <= 0) {
            throw new IllegalArgumentException("Invalid job id: " + id);
        }
        return new JobKey(id.substring(slash + 1), id.substring(0, slash));
    }

    @Override
    public int compareTo(JobKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return group + "." + name;
    }
}
