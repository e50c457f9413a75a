package io.jobcenter4j.config;

import io.jobcenter4j.core.JobKind;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Runtime configuration for the job center.
 * <p>
 * Bound from {@code jobcenter.*} by the Spring Boot starter; usable as a plain POJO elsewhere.
 */
public class JobCenterProperties {
    private int maxConcurrency = 10; // worker threads
    private int batchSize = 5; // triggers claimed per acquisition
    private Duration idleWaitTime = Duration.ofSeconds(30);
    private Duration misfireThreshold = Duration.ofSeconds(5);
    private Duration staleAcquisitionThreshold = Duration.ofMinutes(10);
    private int storeRetryAttempts = 3;
    private Duration storeRetryBackoff = Duration.ofMillis(500);
    private Duration executionTimeout = Duration.ofSeconds(60);
    private Map<JobKind, Duration> executionTimeouts = new EnumMap<>(JobKind.class);
    private int maxLogEntries = 20;
    private boolean cleanupCompletedJobs = false;
    private String instanceId;
    private boolean ensureIndexesOnStartup = false;
    private boolean autoStartup = true;

    /**
     * Timeout of one execution of {@code kind}: the per-kind override or {@link #getExecutionTimeout()}.
     */
    public Duration executionTimeoutFor(JobKind kind) {
        Duration d = executionTimeouts == null ? null : executionTimeouts.get(kind);
        return d != null ? d : executionTimeout;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getIdleWaitTime() {
        return idleWaitTime;
    }

    public void setIdleWaitTime(Duration idleWaitTime) {
        this.idleWaitTime = idleWaitTime;
    }

    public Duration getMisfireThreshold() {
        return misfireThreshold;
    }

    public void setMisfireThreshold(Duration misfireThreshold) {
        this.misfireThreshold = misfireThreshold;
    }

    public Duration getStaleAcquisitionThreshold() {
        return staleAcquisitionThreshold;
    }

    public void setStaleAcquisitionThreshold(Duration staleAcquisitionThreshold) {
        this.staleAcquisitionThreshold = staleAcquisitionThreshold;
    }

    public int getStoreRetryAttempts() {
        return storeRetryAttempts;
    }

    public void setStoreRetryAttempts(int storeRetryAttempts) {
        this.storeRetryAttempts = storeRetryAttempts;
    }

    public Duration getStoreRetryBackoff() {
        return storeRetryBackoff;
    }

    public void setStoreRetryBackoff(Duration storeRetryBackoff) {
        this.storeRetryBackoff = storeRetryBackoff;
    }

    public Duration getExecutionTimeout() {
        return executionTimeout;
    }

    public void setExecutionTimeout(Duration executionTimeout) {
        this.executionTimeout = executionTimeout;
    }

    public Map<JobKind, Duration> getExecutionTimeouts() {
        return executionTimeouts;
    }

    public void setExecutionTimeouts(Map<JobKind, Duration> executionTimeouts) {
        this.executionTimeouts = executionTimeouts;
    }

    public int getMaxLogEntries() {
        return maxLogEntries;
    }

    public void setMaxLogEntries(int maxLogEntries) {
        this.maxLogEntries = maxLogEntries;
    }

    public boolean isCleanupCompletedJobs() {
        return cleanupCompletedJobs;
    }

    public void setCleanupCompletedJobs(boolean cleanupCompletedJobs) {
        this.cleanupCompletedJobs = cleanupCompletedJobs;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public void setInstanceId(String instanceId) {
        this.instanceId = instanceId;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }
}
