package io.jobcenter4j.internal.mongo;

import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import io.jobcenter4j.core.JobCenterException;
import io.jobcenter4j.core.JobDefinition;
import io.jobcenter4j.core.JobKey;
import io.jobcenter4j.core.JobKind;
import io.jobcenter4j.core.JobStoreException;
import io.jobcenter4j.core.ScheduledJob;
import io.jobcenter4j.core.TriggerDefinition;
import io.jobcenter4j.core.TriggerKey;
import io.jobcenter4j.core.TriggerState;
import io.jobcenter4j.schedule.TriggerTransitions;
import io.jobcenter4j.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * MongoDB persistence layer for jobs and triggers.
 *
 * <p>Every transition is a single-document atomic operation:
 * <ul>
 *   <li>acquisition and ACQUIRED to EXECUTING use {@code findAndModify} with the expected state in the query</li>
 *   <li>other trigger transitions read the document, apply {@link TriggerTransitions} and write it back
 *       with a compare-and-set on {@code version}</li>
 *   <li>execution bookkeeping uses {@code $inc} and a sliced {@code $push}</li>
 * </ul>
 * Spring {@link DataAccessException}s surface as {@link JobStoreException}.
 */
public class MongoJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    public static final String JOBS_COLLECTION = "jobcenter_jobs";
    public static final String TRIGGERS_COLLECTION = "jobcenter_triggers";

    private static final int MAX_CAS_ATTEMPTS = 16;
    private static final List<TriggerState> IN_FLIGHT = List.of(TriggerState.ACQUIRED, TriggerState.EXECUTING);
    private static final List<TriggerState> RUN_NOW_STATES =
            List.of(TriggerState.WAITING, TriggerState.PAUSED, TriggerState.COMPLETE, TriggerState.ERROR);

    private final MongoTemplate mongoTemplate;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Migrates job documents without a kind to HTTP and removes triggers whose job is gone.
     */
    @Override
    public void initialize() {
        translate("initialize", () -> {
            UpdateResult migrated = mongoTemplate.updateMulti(
                    new Query(Criteria.where("kind").is(null)),
                    new Update().set("kind", JobKind.HTTP),
                    JobDocument.class);
            if (migrated.getModifiedCount() > 0) {
                log.info("jobcenter migrated legacy jobs without kind to HTTP count={}", migrated.getModifiedCount());
            }

            Query idsOnly = new Query();
            idsOnly.fields().include("_id");
            Set<String> jobIds = mongoTemplate.find(idsOnly, JobDocument.class).stream()
                    .map(JobDocument::getId)
                    .collect(Collectors.toSet());
            DeleteResult orphans = mongoTemplate.remove(
                    new Query(Criteria.where("jobId").nin(jobIds)), TriggerDocument.class);
            if (orphans.getDeletedCount() > 0) {
                log.warn("jobcenter removed triggers without job count={}", orphans.getDeletedCount());
            }
            return null;
        });
    }

    @Override
    public void storeJobAndTrigger(JobDefinition job, TriggerDefinition trigger) {
        requireOwnTrigger(job, trigger);
        translate("storeJobAndTrigger", () -> {
            try {
                mongoTemplate.insert(JobDocument.from(job));
            } catch (DuplicateKeyException e) {
                throw JobCenterException.alreadyExists(job.key());
            }
            // save: a trigger left behind by an interrupted delete is overwritten
            mongoTemplate.save(TriggerDocument.from(TriggerTransitions.schedule(trigger)));
            return null;
        });
    }

    @Override
    public void replaceJobAndTrigger(JobDefinition job, TriggerDefinition trigger) {
        requireOwnTrigger(job, trigger);
        translate("replaceJobAndTrigger", () -> {
            if (!mongoTemplate.exists(byId(job.key().asId()), JobDocument.class)) {
                throw JobCenterException.notFound(job.key());
            }
            TriggerDocument current = mongoTemplate.findOne(byId(trigger.key().asId()), TriggerDocument.class);
            TriggerDefinition fresh = TriggerTransitions.schedule(trigger);
            if (current == null) {
                mongoTemplate.save(TriggerDocument.from(fresh));
            } else {
                TriggerDefinition existing = current.toDefinition();
                if (existing.state().isInFlight()) {
                    throw JobCenterException.alreadyExists(job.key() + " is executing");
                }
                TriggerDefinition next = fresh.toBuilder().version(existing.version() + 1).build();
                if (!replace(existing, next)) {
                    throw new JobStoreException("Concurrent modification of trigger " + trigger.key());
                }
            }
            mongoTemplate.save(JobDocument.from(job));
            return null;
        });
    }

    @Override
    public void upsertJob(JobDefinition job) {
        translate("upsertJob", () -> mongoTemplate.save(JobDocument.from(job)));
    }

    @Override
    public JobDefinition getJob(JobKey key) {
        return findJob(key).orElseThrow(() -> JobCenterException.notFound(key));
    }

    @Override
    public Optional<JobDefinition> findJob(JobKey key) {
        return translate("findJob", () -> Optional.ofNullable(mongoTemplate.findById(key.asId(), JobDocument.class))
                .map(JobDocument::toDefinition));
    }

    @Override
    public void upsertTrigger(TriggerDefinition trigger) {
        translate("upsertTrigger", () -> {
            if (!mongoTemplate.exists(byId(trigger.jobKey().asId()), JobDocument.class)) {
                throw JobCenterException.notFound(trigger.jobKey());
            }
            return mongoTemplate.save(TriggerDocument.from(TriggerTransitions.schedule(trigger)));
        });
    }

    @Override
    public TriggerDefinition getTrigger(TriggerKey key) {
        return findTrigger(key).orElseThrow(() -> JobCenterException.notFound(key));
    }

    @Override
    public Optional<TriggerDefinition> findTrigger(TriggerKey key) {
        return translate("findTrigger", () -> Optional.ofNullable(mongoTemplate.findById(key.asId(), TriggerDocument.class))
                .map(TriggerDocument::toDefinition));
    }

    /**
     * Removes the trigger only while it is not in flight, then the job. An in-flight trigger is flagged
     * {@code deletePending} instead and its fire removes both. Either write is conditional on the state,
     * so a trigger acquired in between is retried rather than deleted under a running fire. A crash between
     * the two removals leaves a job without trigger, which a later delete removes.
     */
    @Override
    public boolean deleteJob(JobKey key) {
        return translate("deleteJob", () -> {
            if (!mongoTemplate.exists(byId(key.asId()), JobDocument.class)) {
                throw JobCenterException.notFound(key);
            }
            String triggerId = TriggerKey.forJob(key).asId();
            for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
                DeleteResult removed = mongoTemplate.remove(
                        new Query(Criteria.where("_id").is(triggerId).and("state").nin(IN_FLIGHT)),
                        TriggerDocument.class);
                if (removed.getDeletedCount() > 0) {
                    mongoTemplate.remove(byId(key.asId()), JobDocument.class);
                    return true;
                }
                UpdateResult deferred = mongoTemplate.updateFirst(
                        new Query(Criteria.where("_id").is(triggerId).and("state").in(IN_FLIGHT)),
                        new Update().set("deletePending", true).inc("version", 1),
                        TriggerDocument.class);
                if (deferred.getModifiedCount() > 0) {
                    return false;
                }
                if (!mongoTemplate.exists(byId(triggerId), TriggerDocument.class)) {
                    mongoTemplate.remove(byId(key.asId()), JobDocument.class);
                    return true;
                }
                log.debug("jobcenter trigger changed state during delete, retrying key={} attempt={}", key, attempt + 1);
            }
            throw new JobStoreException("Job " + key + " kept changing concurrently; giving up delete");
        });
    }

    @Override
    public void deleteTrigger(TriggerKey key) {
        translate("deleteTrigger", () -> mongoTemplate.remove(byId(key.asId()), TriggerDocument.class));
    }

    @Override
    public TriggerDefinition pauseTrigger(TriggerKey key) {
        return transition("pauseTrigger", key, TriggerTransitions::pause);
    }

    @Override
    public TriggerDefinition resumeTrigger(TriggerKey key, Instant now) {
        return transition("resumeTrigger", key, t -> TriggerTransitions.resume(t, now));
    }

    @Override
    public TriggerDefinition requestImmediateFire(TriggerKey key) {
        return transition("requestImmediateFire", key, TriggerTransitions::requestFire);
    }

    @Override
    public List<TriggerDefinition> findMisfiredTriggers(Instant misfireBefore, int limit) {
        return translate("findMisfiredTriggers", () -> {
            Query q = new Query(Criteria.where("state").is(TriggerState.WAITING)
                    .and("fireNowRequested").is(false)
                    .and("deletePending").is(false)
                    .and("nextFireAt").ne(null).lt(misfireBefore));
            q.with(Sort.by(Sort.Order.asc("nextFireAt"), Sort.Order.asc("group"), Sort.Order.asc("name")));
            q.limit(limit);
            return mongoTemplate.find(q, TriggerDocument.class).stream()
                    .map(TriggerDocument::toDefinition)
                    .toList();
        });
    }

    @Override
    public boolean rescheduleMisfired(TriggerKey key, Instant expectedNextFireAt, Instant newNextFireAt) {
        return translate("rescheduleMisfired", () -> {
            Query q = new Query(Criteria.where("_id").is(key.asId())
                    .and("state").is(TriggerState.WAITING)
                    .and("fireNowRequested").is(false)
                    .and("nextFireAt").is(expectedNextFireAt));
            Update u = new Update()
                    .set("nextFireAt", newNextFireAt)
                    .inc("version", 1);
            if (newNextFireAt == null) {
                u.set("state", TriggerState.COMPLETE);
            }
            return mongoTemplate.updateFirst(q, u, TriggerDocument.class).getModifiedCount() > 0;
        });
    }

    /**
     * Atomically claims at most {@code batchSize} triggers, run-now requests first, then due WAITING
     * triggers by fire time. Each claim is one {@code findAndModify}, so concurrent callers never claim
     * the same trigger.
     */
    @Override
    public List<TriggerKey> acquireDueTriggers(Instant now, int batchSize, String instanceId) {
        Objects.requireNonNull(now, "now must not be null");
        if (batchSize <= 0) {
            return List.of();
        }
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("instanceId must not be blank");
        }

        return translate("acquireDueTriggers", () -> {
            FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);
            Sort byKey = Sort.by(Sort.Order.asc("group"), Sort.Order.asc("name"));
            List<TriggerKey> claimed = new ArrayList<>(Math.min(batchSize, 64));

            for (TriggerState state : RUN_NOW_STATES) {
                Query runNow = new Query(Criteria.where("fireNowRequested").is(true)
                        .and("deletePending").is(false)
                        .and("state").is(state));
                runNow.with(byKey);

                Update claim = claimUpdate(now, instanceId).set("manualFire", true);
                if (state == TriggerState.WAITING) {
                    claim.unset("stateAfterFire");
                } else {
                    claim.set("stateAfterFire", state);
                }
                claimInto(claimed, runNow, claim, options, batchSize);
            }

            Query due = new Query(Criteria.where("state").is(TriggerState.WAITING)
                    .and("fireNowRequested").is(false)
                    .and("deletePending").is(false)
                    .and("nextFireAt").ne(null).lte(now));
            due.with(Sort.by(Sort.Order.asc("nextFireAt"), Sort.Order.asc("group"), Sort.Order.asc("name")));
            claimInto(claimed, due, claimUpdate(now, instanceId).set("manualFire", false).unset("stateAfterFire"),
                    options, batchSize);
            return claimed;
        });
    }

    @Override
    public Optional<TriggerDefinition> markExecuting(TriggerKey key) {
        return translate("markExecuting", () -> {
            TriggerDocument doc = mongoTemplate.findAndModify(
                    new Query(Criteria.where("_id").is(key.asId()).and("state").is(TriggerState.ACQUIRED)),
                    new Update().set("state", TriggerState.EXECUTING).inc("version", 1),
                    FindAndModifyOptions.options().returnNew(true),
                    TriggerDocument.class);
            return Optional.ofNullable(doc).map(TriggerDocument::toDefinition);
        });
    }

    @Override
    public Optional<TriggerState> completeFire(TriggerDefinition fire, boolean fatal) {
        TriggerKey key = fire.key();
        return translate("completeFire", () -> casLoop(key, current -> {
            if (current.isEmpty()) {
                return CasStep.done(Optional.empty());
            }
            TriggerDefinition t = current.get();
            if (!TriggerTransitions.isSameAcquisition(t, fire)) {
                return CasStep.done(Optional.of(t.state()));
            }
            if (t.deletePending()) {
                removeJobAndTrigger(t.jobKey().asId(), key.asId());
                return CasStep.done(Optional.empty());
            }
            TriggerDefinition next = TriggerTransitions.completeFire(t, fatal);
            return CasStep.write(t, next, Optional.of(next.state()));
        }));
    }

    @Override
    public void releaseAcquired(TriggerKey key) {
        translate("releaseAcquired", () -> recover(key));
    }

    @Override
    public int recoverStaleTriggers(Instant acquiredBefore) {
        return translate("recoverStaleTriggers", () -> {
            Query q = new Query(Criteria.where("state").in(IN_FLIGHT)
                    .orOperator(
                            Criteria.where("acquiredAt").is(null),
                            Criteria.where("acquiredAt").lt(acquiredBefore)));
            return recoverAll(q);
        });
    }

    @Override
    public int recoverInFlightTriggers() {
        return translate("recoverInFlightTriggers",
                () -> recoverAll(new Query(Criteria.where("state").in(IN_FLIGHT))));
    }

    @Override
    public Optional<Instant> earliestNextFireTime(Instant now) {
        return translate("earliestNextFireTime", () -> {
            boolean runNowPending = mongoTemplate.exists(new Query(Criteria.where("fireNowRequested").is(true)
                    .and("deletePending").is(false)
                    .and("state").in(RUN_NOW_STATES)), TriggerDocument.class);
            if (runNowPending) {
                return Optional.of(now);
            }
            Query q = new Query(Criteria.where("state").is(TriggerState.WAITING)
                    .and("deletePending").is(false)
                    .and("nextFireAt").ne(null));
            q.with(Sort.by(Sort.Order.asc("nextFireAt")));
            q.fields().include("nextFireAt");
            TriggerDocument first = mongoTemplate.findOne(q, TriggerDocument.class);
            return Optional.ofNullable(first).map(TriggerDocument::getNextFireAt);
        });
    }

    @Override
    public JobDefinition recordExecution(JobKey key, String logEntry, String error, int maxLogEntries) {
        return translate("recordExecution", () -> {
            Update u = new Update().inc("runCount", 1);
            u.push("log").slice(-Math.max(1, maxLogEntries)).each(logEntry);
            if (error != null) {
                u.set("lastError", error);
            }
            JobDocument doc = mongoTemplate.findAndModify(byId(key.asId()), u,
                    FindAndModifyOptions.options().returnNew(true), JobDocument.class);
            if (doc == null) {
                throw JobCenterException.notFound(key);
            }
            return doc.toDefinition();
        });
    }

    @Override
    public void clearError(JobKey key) {
        translate("clearError", () -> {
            UpdateResult r = mongoTemplate.updateFirst(byId(key.asId()), new Update().set("lastError", ""),
                    JobDocument.class);
            if (r.getMatchedCount() == 0) {
                throw JobCenterException.notFound(key);
            }
            return null;
        });
    }

    @Override
    public List<ScheduledJob> listAll() {
        return translate("listAll", () -> {
            Query jobs = new Query().with(Sort.by(Sort.Order.asc("group"), Sort.Order.asc("name")));
            Map<String, TriggerDefinition> triggersByJob = mongoTemplate.findAll(TriggerDocument.class).stream()
                    .collect(Collectors.toMap(TriggerDocument::getJobId, TriggerDocument::toDefinition, (a, b) -> a));
            return mongoTemplate.find(jobs, JobDocument.class).stream()
                    .map(doc -> new ScheduledJob(doc.toDefinition(), triggersByJob.get(doc.getId())))
                    .toList();
        });
    }

    private static Update claimUpdate(Instant now, String instanceId) {
        return new Update()
                .set("state", TriggerState.ACQUIRED)
                .set("fireNowRequested", false)
                .set("acquiredAt", now)
                .set("acquiredBy", instanceId)
                .inc("version", 1);
    }

    private void claimInto(List<TriggerKey> claimed, Query query, Update claim, FindAndModifyOptions options,
                           int batchSize) {
        while (claimed.size() < batchSize) {
            TriggerDocument doc = mongoTemplate.findAndModify(query, claim, options, TriggerDocument.class);
            if (doc == null) {
                return;
            }
            claimed.add(new TriggerKey(doc.getName(), doc.getGroup()));
        }
    }

    private int recoverAll(Query query) {
        query.fields().include("_id");
        List<TriggerDocument> stale = mongoTemplate.find(query, TriggerDocument.class);
        int recovered = 0;
        for (TriggerDocument doc : stale) {
            if (recover(TriggerKey.fromId(doc.getId()))) {
                recovered++;
            }
        }
        return recovered;
    }

    private boolean recover(TriggerKey key) {
        return casLoop(key, current -> {
            if (current.isEmpty() || !current.get().state().isInFlight()) {
                return CasStep.done(false);
            }
            TriggerDefinition t = current.get();
            if (t.deletePending()) {
                removeJobAndTrigger(t.jobKey().asId(), key.asId());
                return CasStep.done(true);
            }
            return CasStep.write(t, TriggerTransitions.recover(t), true);
        });
    }

    private TriggerDefinition transition(String operation, TriggerKey key, UnaryOperator<TriggerDefinition> fn) {
        return translate(operation, () -> casLoop(key, current -> {
            TriggerDefinition t = current.orElseThrow(() -> JobCenterException.notFound(key));
            TriggerDefinition next = fn.apply(t);
            return next == t ? CasStep.done(t) : CasStep.write(t, next, next);
        }));
    }

    private <R> R casLoop(TriggerKey key, Function<Optional<TriggerDefinition>, CasStep<R>> step) {
        for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
            TriggerDocument doc = mongoTemplate.findById(key.asId(), TriggerDocument.class);
            CasStep<R> s = step.apply(Optional.ofNullable(doc).map(TriggerDocument::toDefinition));
            if (s.expected() == null || replace(s.expected(), s.next())) {
                return s.result();
            }
            log.debug("jobcenter trigger changed concurrently, retrying trigger={} attempt={}", key, attempt + 1);
        }
        throw new JobStoreException("Trigger " + key + " kept changing concurrently; giving up");
    }

    // Compare-and-set on version; true when the document was replaced.
    private boolean replace(TriggerDefinition expected, TriggerDefinition next) {
        Query q = new Query(Criteria.where("_id").is(expected.key().asId()).and("version").is(expected.version()));
        return mongoTemplate.findAndReplace(q, TriggerDocument.from(next)) != null;
    }

    private void removeJobAndTrigger(String jobId, String triggerId) {
        mongoTemplate.remove(byId(jobId), JobDocument.class);
        mongoTemplate.remove(byId(triggerId), TriggerDocument.class);
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }

    private static void requireOwnTrigger(JobDefinition job, TriggerDefinition trigger) {
        if (!trigger.jobKey().equals(job.key())) {
            throw new IllegalArgumentException("Trigger " + trigger.key() + " does not belong to job " + job.key());
        }
    }

    private static <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new JobStoreException("Mongo " + operation + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * One step of a read-transform-write loop. {@code expected == null} means nothing to write.
     */
    private record CasStep<R>(TriggerDefinition expected, TriggerDefinition next, R result) {
        static <R> CasStep<R> done(R result) {
            return new CasStep<>(null, null, result);
        }

        static <R> CasStep<R> write(TriggerDefinition expected, TriggerDefinition next, R result) {
            return new CasStep<>(expected, next, result);
        }
    }
}
