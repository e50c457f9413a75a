package io.jobcenter4j.config;

import io.jobcenter4j.JobCenter;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the scheduler start/stop with the Spring container lifecycle.
 */
public class JobCenterLifecycle implements SmartLifecycle {
    private final JobCenter jobCenter;
    private final boolean autoStartup;

    public JobCenterLifecycle(JobCenter jobCenter, boolean autoStartup) {
        this.jobCenter = jobCenter;
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        jobCenter.startScheduling();
    }

    @Override
    public void stop() {
        jobCenter.stopScheduling();
    }

    @Override
    public boolean isRunning() {
        return jobCenter.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
