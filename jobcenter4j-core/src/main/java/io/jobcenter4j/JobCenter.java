package io.jobcenter4j;

import io.jobcenter4j.core.JobBriefView;
import io.jobcenter4j.core.JobGroupBriefView;
import io.jobcenter4j.core.JobGroupView;
import io.jobcenter4j.core.JobKey;
import io.jobcenter4j.core.JobSpec;
import io.jobcenter4j.core.JobView;
import io.jobcenter4j.core.OperationResult;
import io.jobcenter4j.core.TriggerSpec;

import java.util.List;

/**
 * Management API of the job center.
 *
 * <p>Operations never throw for validation or persistence problems: the outcome is reported in the
 * returned {@link OperationResult}.
 */
public interface JobCenter {

    OperationResult<Void> addJob(JobSpec job, TriggerSpec trigger);

    /**
     * Replace the definition and schedule of an existing job. Run count, last error and log are kept.
     */
    OperationResult<Void> modifyJob(JobSpec job, TriggerSpec trigger);

    /**
     * Pause the job, or delete it together with its trigger when {@code delete} is true.
     */
    OperationResult<Void> pauseOrDelete(JobKey key, boolean delete);

    default OperationResult<Void> pause(JobKey key) {
        return pauseOrDelete(key, false);
    }

    default OperationResult<Void> delete(JobKey key) {
        return pauseOrDelete(key, true);
    }

    OperationResult<Void> resume(JobKey key);

    /**
     * Fire the job once as soon as possible, whatever its trigger state. The schedule is not affected.
     */
    OperationResult<Void> triggerNow(JobKey key);

    OperationResult<JobView> queryJob(JobKey key);

    OperationResult<List<JobGroupView>> listAllDetailed();

    OperationResult<List<JobGroupBriefView>> listAllBrief();

    OperationResult<Void> clearError(JobKey key);

    OperationResult<List<String>> jobLogs(JobKey key);

    OperationResult<Long> runCount(JobKey key);

    boolean startScheduling();

    boolean stopScheduling();

    boolean isRunning();
}
