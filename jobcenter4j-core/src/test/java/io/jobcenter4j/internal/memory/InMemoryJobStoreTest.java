package io.jobcenter4j.internal.memory;

import io.jobcenter4j.core.ErrorCode;
import io.jobcenter4j.core.JobCenterException;
import io.jobcenter4j.core.JobDefinition;
import io.jobcenter4j.core.JobKey;
import io.jobcenter4j.core.JobKind;
import io.jobcenter4j.core.JobParameters;
import io.jobcenter4j.core.JobSpec;
import io.jobcenter4j.core.MisfireInstruction;
import io.jobcenter4j.core.ScheduledJob;
import io.jobcenter4j.core.TriggerDefinition;
import io.jobcenter4j.core.TriggerKey;
import io.jobcenter4j.core.TriggerSpec;
import io.jobcenter4j.core.TriggerState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryJobStoreTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final InMemoryJobStore store = new InMemoryJobStore();

    @Test
    void storeShouldDeriveNextFireTime() {
        JobKey key = add("tenant-a", "ping", T0.plusSeconds(30));

        assertEquals(T0.plusSeconds(30), store.getTrigger(TriggerKey.forJob(key)).nextFireAt());
        assertEquals(TriggerState.WAITING, store.getTrigger(TriggerKey.forJob(key)).state());
    }

    @Test
    void duplicateKeyShouldFailWithAlreadyExists() {
        add("tenant-a", "ping", T0);

        JobCenterException e = assertThrows(JobCenterException.class, () -> add("tenant-a", "ping", T0));
        assertEquals(ErrorCode.ALREADY_EXISTS, e.code());
    }

    @Test
    void unknownKeysShouldFailWithNotFound() {
        JobKey missing = JobKey.of("tenant-a", "missing");

        assertEquals(ErrorCode.NOT_FOUND, assertThrows(JobCenterException.class, () -> store.getJob(missing)).code());
        assertEquals(ErrorCode.NOT_FOUND, assertThrows(JobCenterException.class, () -> store.deleteJob(missing)).code());
        assertEquals(ErrorCode.NOT_FOUND,
                assertThrows(JobCenterException.class, () -> store.pauseTrigger(TriggerKey.forJob(missing))).code());
    }

    @Test
    void acquireShouldClaimDueTriggersInDueOrder() {
        add("tenant-b", "late", T0.plusSeconds(20));
        add("tenant-a", "early", T0.plusSeconds(10));
        add("tenant-a", "future", T0.plusSeconds(60));

        List<TriggerKey> keys = store.acquireDueTriggers(T0.plusSeconds(30), 10, "node-1");

        assertEquals(List.of(new TriggerKey("early", "tenant-a"), new TriggerKey("late", "tenant-b")), keys);
        TriggerDefinition acquired = store.getTrigger(keys.get(0));
        assertEquals(TriggerState.ACQUIRED, acquired.state());
        assertEquals("node-1", acquired.acquiredBy());
        assertTrue(store.acquireDueTriggers(T0.plusSeconds(30), 10, "node-2").isEmpty());
    }

    @Test
    void concurrentAcquisitionShouldNeverClaimTwice() throws Exception {
        for (int i = 0; i < 200; i++) {
            add("tenant-" + (i % 4), "job-" + i, T0);
        }

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<List<TriggerKey>>> workers = new ArrayList<>();
            for (int w = 0; w < 8; w++) {
                String instance = "node-" + w;
                workers.add(() -> {
                    List<TriggerKey> mine = new ArrayList<>();
                    List<TriggerKey> batch;
                    while (!(batch = store.acquireDueTriggers(T0, 3, instance)).isEmpty()) {
                        mine.addAll(batch);
                    }
                    return mine;
                });
            }

            List<TriggerKey> all = new ArrayList<>();
            for (Future<List<TriggerKey>> f : pool.invokeAll(workers)) {
                all.addAll(f.get());
            }

            Set<TriggerKey> unique = new HashSet<>(all);
            assertEquals(200, all.size());
            assertEquals(200, unique.size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void completeFireShouldAdvanceSchedule() {
        JobKey key = add("tenant-a", "ping", T0);
        TriggerKey tk = TriggerKey.forJob(key);

        store.acquireDueTriggers(T0, 1, "node-1");
        TriggerDefinition fire = store.markExecuting(tk).orElseThrow();
        Optional<TriggerState> state = store.completeFire(fire, false);

        TriggerDefinition t = store.getTrigger(tk);
        assertEquals(Optional.of(TriggerState.WAITING), state);
        assertEquals(1, t.timesFired());
        assertEquals(T0, t.previousFireAt());
        assertEquals(T0.plusSeconds(10), t.nextFireAt());
        assertNull(t.acquiredBy());
    }

    @Test
    void fatalFailureShouldMoveTriggerToError() {
        JobKey key = add("tenant-a", "ping", T0);
        TriggerKey tk = TriggerKey.forJob(key);

        store.acquireDueTriggers(T0, 1, "node-1");
        TriggerDefinition fire = store.markExecuting(tk).orElseThrow();

        assertEquals(Optional.of(TriggerState.ERROR), store.completeFire(fire, true));
        assertTrue(store.acquireDueTriggers(T0.plusSeconds(60), 1, "node-1").isEmpty());
    }

    @Test
    void pauseWhileExecutingShouldTakeEffectAfterFire() {
        JobKey key = add("tenant-a", "ping", T0);
        TriggerKey tk = TriggerKey.forJob(key);
        store.acquireDueTriggers(T0, 1, "node-1");
        TriggerDefinition fire = store.markExecuting(tk).orElseThrow();

        store.pauseTrigger(tk);
        assertEquals(TriggerState.EXECUTING, store.getTrigger(tk).state());

        assertEquals(Optional.of(TriggerState.PAUSED), store.completeFire(fire, false));
        assertEquals(T0.plusSeconds(10), store.getTrigger(tk).nextFireAt());
    }

    @Test
    void deleteWhileExecutingShouldBeDeferred() {
        JobKey key = add("tenant-a", "ping", T0);
        TriggerKey tk = TriggerKey.forJob(key);
        store.acquireDueTriggers(T0, 1, "node-1");
        TriggerDefinition fire = store.markExecuting(tk).orElseThrow();

        assertFalse(store.deleteJob(key));
        assertTrue(store.findJob(key).isPresent());

        assertEquals(Optional.empty(), store.completeFire(fire, false));
        assertTrue(store.findJob(key).isEmpty());
        assertTrue(store.findTrigger(tk).isEmpty());
    }

    @Test
    void resumeAfterEndTimeShouldFailAndKeepPaused() {
        JobKey key = JobKey.of("tenant-a", "bounded");
        TriggerSpec spec = TriggerSpec.simpleForever(Duration.ofSeconds(10)).withStartAt(T0).withEndAt(T0.plusSeconds(60));
        store.storeJobAndTrigger(job(key), TriggerDefinition.fromSpec(key, spec, T0));
        TriggerKey tk = TriggerKey.forJob(key);
        store.pauseTrigger(tk);

        JobCenterException e = assertThrows(JobCenterException.class, () -> store.resumeTrigger(tk, T0.plusSeconds(61)));

        assertEquals(ErrorCode.EXPIRED_END_TIME, e.code());
        assertEquals(TriggerState.PAUSED, store.getTrigger(tk).state());
    }

    @Test
    void runNowOnPausedTriggerShouldFireOnceAndStayPaused() {
        JobKey key = add("tenant-a", "ping", T0.plusSeconds(100));
        TriggerKey tk = TriggerKey.forJob(key);
        store.pauseTrigger(tk);
        store.requestImmediateFire(tk);

        assertEquals(List.of(tk), store.acquireDueTriggers(T0, 5, "node-1"));
        TriggerDefinition fire = store.markExecuting(tk).orElseThrow();
        store.completeFire(fire, false);

        TriggerDefinition t = store.getTrigger(tk);
        assertEquals(TriggerState.PAUSED, t.state());
        assertEquals(0, t.timesFired());
        assertEquals(T0.plusSeconds(100), t.nextFireAt());
        assertFalse(t.fireNowRequested());
    }

    @Test
    void lateCompletionAfterStaleRecoveryShouldLeaveNewClaimAlone() {
        JobKey key = add("tenant-a", "ping", T0);
        TriggerKey tk = TriggerKey.forJob(key);
        store.acquireDueTriggers(T0, 1, "node-1");
        TriggerDefinition first = store.markExecuting(tk).orElseThrow();

        assertEquals(1, store.recoverStaleTriggers(T0.plusSeconds(700)));
        assertEquals(List.of(tk), store.acquireDueTriggers(T0.plusSeconds(700), 1, "node-2"));
        TriggerDefinition second = store.markExecuting(tk).orElseThrow();

        assertEquals(Optional.of(TriggerState.EXECUTING), store.completeFire(first, false));
        assertTrue(store.acquireDueTriggers(T0.plusSeconds(710), 5, "node-1").isEmpty());
        assertEquals("node-2", store.getTrigger(tk).acquiredBy());
        assertEquals(0, store.getTrigger(tk).timesFired());

        assertEquals(Optional.of(TriggerState.WAITING), store.completeFire(second, false));
        assertEquals(1, store.getTrigger(tk).timesFired());
    }

    @Test
    void pauseAndResumeDuringRunNowOfCompletedTriggerShouldKeepItComplete() {
        JobKey key = JobKey.of("tenant-a", "once");
        TriggerKey tk = TriggerKey.forJob(key);
        store.storeJobAndTrigger(job(key), TriggerDefinition.fromSpec(key,
                TriggerSpec.simple(Duration.ofSeconds(10), 0).withStartAt(T0), T0));
        store.acquireDueTriggers(T0, 1, "node-1");
        assertEquals(Optional.of(TriggerState.COMPLETE),
                store.completeFire(store.markExecuting(tk).orElseThrow(), false));

        store.requestImmediateFire(tk);
        assertEquals(List.of(tk), store.acquireDueTriggers(T0.plusSeconds(60), 1, "node-1"));
        TriggerDefinition fire = store.markExecuting(tk).orElseThrow();
        store.pauseTrigger(tk);
        store.resumeTrigger(tk, T0.plusSeconds(61));

        assertEquals(Optional.of(TriggerState.COMPLETE), store.completeFire(fire, false));
        TriggerDefinition t = store.getTrigger(tk);
        assertNull(t.nextFireAt());
        assertEquals(1, t.timesFired());
        assertTrue(store.acquireDueTriggers(T0.plusSeconds(120), 5, "node-1").isEmpty());
    }

    @Test
    void staleRecoveryShouldKeepScheduledTime() {
        JobKey key = add("tenant-a", "ping", T0);
        TriggerKey tk = TriggerKey.forJob(key);
        store.acquireDueTriggers(T0, 1, "crashed-node");

        assertEquals(0, store.recoverStaleTriggers(T0));
        assertEquals(1, store.recoverStaleTriggers(T0.plusSeconds(1)));

        TriggerDefinition t = store.getTrigger(tk);
        assertEquals(TriggerState.WAITING, t.state());
        assertEquals(T0, t.nextFireAt());
        assertNull(t.acquiredAt());
    }

    @Test
    void misfireRescheduleShouldCompareAndSet() {
        JobKey key = add("tenant-a", "ping", T0);
        TriggerKey tk = TriggerKey.forJob(key);

        assertEquals(1, store.findMisfiredTriggers(T0.plusSeconds(1), 10).size());
        assertFalse(store.rescheduleMisfired(tk, T0.minusSeconds(10), T0.plusSeconds(60)));
        assertTrue(store.rescheduleMisfired(tk, T0, T0.plusSeconds(60)));
        assertEquals(T0.plusSeconds(60), store.getTrigger(tk).nextFireAt());

        assertTrue(store.rescheduleMisfired(tk, T0.plusSeconds(60), null));
        assertEquals(TriggerState.COMPLETE, store.getTrigger(tk).state());
    }

    @Test
    void earliestNextFireTimeShouldPreferRunNowRequests() {
        JobKey key = add("tenant-a", "ping", T0.plusSeconds(100));
        add("tenant-a", "pong", T0.plusSeconds(50));

        assertEquals(Optional.of(T0.plusSeconds(50)), store.earliestNextFireTime(T0));

        store.requestImmediateFire(TriggerKey.forJob(key));
        assertEquals(Optional.of(T0), store.earliestNextFireTime(T0));
    }

    @Test
    void recordExecutionShouldKeepBoundedLog() {
        JobKey key = add("tenant-a", "ping", T0);

        for (int i = 1; i <= 5; i++) {
            store.recordExecution(key, "run " + i, i == 2 ? "boom" : null, 3);
        }

        JobDefinition job = store.getJob(key);
        assertEquals(5, job.runCount());
        assertEquals(List.of("run 3", "run 4", "run 5"), job.log());
        assertEquals("boom", job.lastError());

        store.clearError(key);
        assertEquals("", store.getJob(key).lastError());
    }

    @Test
    void listAllShouldOrderByGroupThenName() {
        add("tenant-b", "alpha", T0);
        add("tenant-a", "zulu", T0);
        add("tenant-a", "bravo", T0);

        List<JobKey> keys = store.listAll().stream().map(sj -> sj.job().key()).toList();

        assertEquals(List.of(
                JobKey.of("tenant-a", "bravo"),
                JobKey.of("tenant-a", "zulu"),
                JobKey.of("tenant-b", "alpha")), keys);
        assertTrue(store.listAll().stream().map(ScheduledJob::trigger).allMatch(t -> t != null));
    }

    private JobKey add(String group, String name, Instant startAt) {
        JobKey key = JobKey.of(group, name);
        TriggerSpec spec = TriggerSpec.simpleForever(Duration.ofSeconds(10))
                .withStartAt(startAt)
                .withMisfireInstruction(MisfireInstruction.FIRE_AND_PROCEED);
        store.storeJobAndTrigger(job(key), TriggerDefinition.fromSpec(key, spec, startAt));
        return key;
    }

    private static JobDefinition job(JobKey key) {
        return JobDefinition.fromSpec(JobSpec.builder(key, JobKind.HTTP)
                .parameter(JobParameters.REQUEST_URL, "http://localhost/" + key.name())
                .build());
    }
}
