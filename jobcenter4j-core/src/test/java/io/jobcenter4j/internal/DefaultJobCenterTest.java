package io.jobcenter4j.internal;

import io.jobcenter4j.config.JobCenterProperties;
import io.jobcenter4j.core.ErrorCode;
import io.jobcenter4j.core.JobBriefView;
import io.jobcenter4j.core.JobExecutorRegistry;
import io.jobcenter4j.core.JobGroupBriefView;
import io.jobcenter4j.core.JobGroupView;
import io.jobcenter4j.core.JobKey;
import io.jobcenter4j.core.JobKind;
import io.jobcenter4j.core.JobParameters;
import io.jobcenter4j.core.JobSpec;
import io.jobcenter4j.core.JobSummary;
import io.jobcenter4j.core.JobView;
import io.jobcenter4j.core.OperationResult;
import io.jobcenter4j.core.ScheduleKind;
import io.jobcenter4j.core.TriggerKey;
import io.jobcenter4j.core.TriggerSpec;
import io.jobcenter4j.core.TriggerState;
import io.jobcenter4j.internal.memory.InMemoryJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultJobCenterTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final JobKey KEY = JobKey.of("tenant-a", "ping");

    private final MutableClock clock = new MutableClock(T0);
    private final RecordingExecutor http = new RecordingExecutor(JobKind.HTTP);
    private InMemoryJobStore store;
    private SchedulerEngine engine;
    private DefaultJobCenter center;

    @BeforeEach
    void setUp() {
        JobCenterProperties props = new JobCenterProperties();
        props.setStoreRetryBackoff(Duration.ZERO);
        props.setInstanceId("test-node");
        JobExecutorRegistry registry = new JobExecutorRegistry(List.of(http));
        store = new InMemoryJobStore();
        engine = new SchedulerEngine(props, store, new ExecutionDispatcher(store, registry, null, props, clock), clock,
                new DirectExecutorService());
        center = new DefaultJobCenter(store, registry, engine, clock);
    }

    @Test
    void addJobShouldBeQueryable() {
        OperationResult<Void> added = center.addJob(httpJob(KEY), TriggerSpec.cron("0 */5 * * * ?"));

        assertTrue(added.isSuccess());
        assertEquals(OperationResult.OK, added.code());

        OperationResult<JobView> view = center.queryJob(KEY);
        assertTrue(view.isSuccess());
        assertEquals(JobKind.HTTP, view.data().kind());
        assertEquals(ScheduleKind.CRON, view.data().scheduleKind());
        assertEquals("0 */5 * * * ?", view.data().cronExpression());
        assertEquals(TriggerState.WAITING, view.data().triggerState());
        assertEquals(T0, view.data().startAt());
    }

    @Test
    void addJobTwiceShouldReportAlreadyExists() {
        center.addJob(httpJob(KEY), TriggerSpec.cron("0 */5 * * * ?"));

        OperationResult<Void> second = center.addJob(httpJob(KEY), TriggerSpec.cron("0 */5 * * * ?"));

        assertEquals(ErrorCode.ALREADY_EXISTS, second.error());
        assertEquals(409, second.code());
    }

    @Test
    void invalidSchedulesShouldBeRejected() {
        assertInvalid(httpJob(KEY), TriggerSpec.cron("not a cron"));
        assertInvalid(httpJob(KEY), TriggerSpec.simple(Duration.ZERO, 3));
        assertInvalid(httpJob(KEY), TriggerSpec.cron("0 0 12 1 1 ? 2020"));
        assertInvalid(httpJob(KEY), TriggerSpec.cron("0 * * * *").withTimezone("Mars/Olympus"));
        assertInvalid(httpJob(KEY), TriggerSpec.cron("0 * * * *").withStartAt(T0).withEndAt(T0.minusSeconds(1)));
        assertInvalid(JobSpec.builder(KEY, JobKind.HTTP).build(), TriggerSpec.cron("0 * * * *"));
        assertInvalid(JobSpec.builder(KEY, JobKind.EMAIL)
                .parameter(JobParameters.MAIL_TO, "ops@example.org")
                .parameter(JobParameters.MAIL_TITLE, "report")
                .build(), TriggerSpec.cron("0 * * * *"));

        assertEquals(ErrorCode.NOT_FOUND, center.queryJob(KEY).error());
    }

    @Test
    void pauseAndResumeShouldToggleState() {
        center.addJob(httpJob(KEY), TriggerSpec.simpleForever(Duration.ofMinutes(1)));

        assertTrue(center.pause(KEY).isSuccess());
        assertEquals(TriggerState.PAUSED, center.queryJob(KEY).data().triggerState());

        assertTrue(center.resume(KEY).isSuccess());
        assertEquals(TriggerState.WAITING, center.queryJob(KEY).data().triggerState());
    }

    @Test
    void resumeAfterEndTimeShouldReportExpired() {
        center.addJob(httpJob(KEY), TriggerSpec.simpleForever(Duration.ofMinutes(1)).withEndAt(T0.plusSeconds(3600)));
        center.pause(KEY);

        clock.set(T0.plusSeconds(7200));
        OperationResult<Void> resumed = center.resume(KEY);

        assertEquals(ErrorCode.EXPIRED_END_TIME, resumed.error());
        assertEquals(TriggerState.PAUSED, center.queryJob(KEY).data().triggerState());
    }

    @Test
    void deleteShouldRemoveJob() {
        center.addJob(httpJob(KEY), TriggerSpec.simpleForever(Duration.ofMinutes(1)));

        assertTrue(center.delete(KEY).isSuccess());

        assertEquals(ErrorCode.NOT_FOUND, center.queryJob(KEY).error());
        assertEquals(ErrorCode.NOT_FOUND, center.delete(KEY).error());
        assertTrue(store.findTrigger(TriggerKey.forJob(KEY)).isEmpty());
    }

    @Test
    void operationsOnUnknownJobShouldReportNotFound() {
        JobKey missing = JobKey.of("tenant-a", "missing");

        assertEquals(ErrorCode.NOT_FOUND, center.pause(missing).error());
        assertEquals(ErrorCode.NOT_FOUND, center.resume(missing).error());
        assertEquals(ErrorCode.NOT_FOUND, center.triggerNow(missing).error());
        assertEquals(ErrorCode.NOT_FOUND, center.clearError(missing).error());
        assertEquals(ErrorCode.NOT_FOUND, center.jobLogs(missing).error());
        assertEquals(ErrorCode.NOT_FOUND, center.runCount(missing).error());
        assertEquals(404, center.runCount(missing).code());
    }

    @Test
    void triggerNowShouldFireOnceWithoutTouchingSchedule() {
        center.addJob(httpJob(KEY), TriggerSpec.simpleForever(Duration.ofHours(1)).withStartAt(T0.plusSeconds(600)));

        assertTrue(center.triggerNow(KEY).isSuccess());
        engine.runOnce();

        assertEquals(1, http.callCount());
        assertEquals(1L, center.runCount(KEY).data());
        assertEquals(T0.plusSeconds(600), store.getTrigger(TriggerKey.forJob(KEY)).nextFireAt());
        assertEquals(1, center.jobLogs(KEY).data().size());
    }

    @Test
    void modifyJobShouldKeepHistory() {
        center.addJob(httpJob(KEY), TriggerSpec.simpleForever(Duration.ofMinutes(1)).withStartAt(T0));
        engine.runOnce();

        JobSpec changed = JobSpec.builder(KEY, JobKind.HTTP)
                .parameter(JobParameters.REQUEST_URL, "http://localhost/v2")
                .description("moved")
                .build();
        OperationResult<Void> modified = center.modifyJob(changed, TriggerSpec.cron("0 0 * * * ?"));

        assertTrue(modified.isSuccess());
        JobView view = center.queryJob(KEY).data();
        assertEquals("http://localhost/v2", view.parameters().get(JobParameters.REQUEST_URL));
        assertEquals(ScheduleKind.CRON, view.scheduleKind());
        assertEquals(1, view.runCount());
        assertEquals(1, center.jobLogs(KEY).data().size());
    }

    @Test
    void modifyUnknownJobShouldReportNotFound() {
        assertEquals(ErrorCode.NOT_FOUND, center.modifyJob(httpJob(KEY), TriggerSpec.cron("0 * * * *")).error());
    }

    @Test
    void clearErrorShouldResetLastError() {
        http.behave(p -> {
            throw new IllegalStateException("503 from upstream");
        });
        center.addJob(httpJob(KEY), TriggerSpec.simpleForever(Duration.ofMinutes(1)).withStartAt(T0));
        engine.runOnce();
        assertEquals("503 from upstream", center.queryJob(KEY).data().lastError());

        assertTrue(center.clearError(KEY).isSuccess());

        assertEquals("", center.queryJob(KEY).data().lastError());
    }

    @Test
    void listingsShouldGroupAndSort() {
        center.addJob(httpJob(JobKey.of("tenant-b", "x")), TriggerSpec.cron("0 * * * *"));
        center.addJob(httpJob(JobKey.of("tenant-a", "z")), TriggerSpec.cron("0 * * * *"));
        center.addJob(JobSpec.builder(JobKey.of("tenant-a", "y"), JobKind.HTTP)
                .parameter(JobParameters.REQUEST_URL, "http://localhost/y")
                .parameter(JobParameters.REQUEST_METHOD, "POST")
                .build(), TriggerSpec.simpleForever(Duration.ofMinutes(5)));

        List<JobGroupView> detailed = center.listAllDetailed().data();
        assertEquals(List.of("tenant-a", "tenant-b"), detailed.stream().map(JobGroupView::groupName).toList());
        List<JobSummary> tenantA = detailed.get(0).jobs();
        assertEquals(List.of("y", "z"), tenantA.stream().map(JobSummary::name).toList());
        assertEquals("http://localhost/y", tenantA.get(0).triggerAddress());
        assertEquals("POST", tenantA.get(0).requestMethod());
        assertEquals("PT5M", tenantA.get(0).schedule());
        assertEquals("GET", tenantA.get(1).requestMethod());

        List<JobGroupBriefView> brief = center.listAllBrief().data();
        assertEquals(2, brief.size());
        JobBriefView x = brief.get(1).jobs().get(0);
        assertEquals("x", x.name());
        assertEquals(TriggerState.WAITING, x.triggerState());
        assertNull(x.previousFireAt());
    }

    @Test
    void schedulingLifecycleShouldReportState() {
        assertFalse(center.isRunning());
        assertTrue(center.startScheduling());
        assertTrue(center.isRunning());

        assertTrue(center.stopScheduling());
        assertFalse(center.isRunning());
        assertFalse(center.startScheduling());
    }

    private void assertInvalid(JobSpec job, TriggerSpec trigger) {
        OperationResult<Void> result = center.addJob(job, trigger);
        assertEquals(ErrorCode.INVALID_SCHEDULE, result.error(), () -> "expected rejection of " + trigger);
        assertEquals(400, result.code());
    }

    private static JobSpec httpJob(JobKey key) {
        return JobSpec.builder(key, JobKind.HTTP)
                .parameter(JobParameters.REQUEST_URL, "http://localhost/" + key.name())
                .build();
    }
}
