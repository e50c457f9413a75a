package io.jobcenter4j.internal;

import io.jobcenter4j.core.JobStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retries store calls that fail with {@link JobStoreException}, backing off exponentially.
 */
public class StoreRetry {
    private static final Logger log = LoggerFactory.getLogger(StoreRetry.class);

    private static final long MAX_BACKOFF_MS = 60_000L;

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int attempts;
    private final Duration backoff;
    private final Sleeper sleeper;

    public StoreRetry(int attempts, Duration backoff) {
        this(attempts, backoff, d -> Thread.sleep(d.toMillis()));
    }

    public StoreRetry(int attempts, Duration backoff, Sleeper sleeper) {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must not be negative");
        }
        this.attempts = attempts;
        this.backoff = backoff == null ? Duration.ZERO : backoff;
        this.sleeper = sleeper;
    }

    /**
     * Calls {@code action}, retrying up to {@code attempts} times.
     *
     * @throws JobStoreException the last failure once retries are exhausted
     */
    public <T> T call(String operation, Supplier<T> action) {
        int failures = 0;
        while (true) {
            try {
                return action.get();
            } catch (JobStoreException e) {
                failures++;
                if (failures > attempts) {
                    throw e;
                }
                Duration delay = backoff(failures);
                log.warn("jobcenter store call failed op={} attempt={} retryIn={} msg={}",
                        operation, failures, delay, e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    // backoff * 2^(failures - 1), capped at one minute.
    Duration backoff(int failures) {
        int exp = Math.max(0, Math.min(failures - 1, 15));
        long ms = Math.min(backoff.toMillis() * (1L << exp), MAX_BACKOFF_MS);
        return Duration.ofMillis(ms);
    }
}
