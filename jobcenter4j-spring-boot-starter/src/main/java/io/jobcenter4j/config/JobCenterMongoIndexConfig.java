package io.jobcenter4j.config;

import io.jobcenter4j.internal.mongo.JobDocument;
import io.jobcenter4j.internal.mongo.TriggerDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the job center.
 *
 * <p>Indexes are <b>not</b> created at startup unless {@code jobcenter.ensure-indexes-on-startup=true};
 * production deployments usually manage them with migration scripts.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_trigger_due</b> on {@code jobcenter_triggers}: { state: 1, fireNowRequested: 1, nextFireAt: 1 }
 *       <br/>Used by acquisition, misfire scans and the earliest-fire-time lookup.</li>
 *   <li><b>idx_trigger_state_acquired</b> on {@code jobcenter_triggers}: { state: 1, acquiredAt: 1 }
 *       <br/>Used by stale acquisition recovery.</li>
 *   <li><b>idx_job_group_name</b> on {@code jobcenter_jobs}: { group: 1, name: 1 }
 *       <br/>Used by the grouped listings.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.jobcenter_triggers.createIndex({ state: 1, fireNowRequested: 1, nextFireAt: 1 }, { name: "idx_trigger_due" });
 * db.jobcenter_triggers.createIndex({ state: 1, acquiredAt: 1 }, { name: "idx_trigger_state_acquired" });
 * db.jobcenter_jobs.createIndex({ group: 1, name: 1 }, { name: "idx_job_group_name" });
 * </pre>
 */
public class JobCenterMongoIndexConfig {

    public static final String IDX_TRIGGER_DUE = "idx_trigger_due";
    public static final String IDX_TRIGGER_STATE_ACQUIRED = "idx_trigger_state_acquired";
    public static final String IDX_JOB_GROUP_NAME = "idx_job_group_name";

    private final MongoTemplate mongoTemplate;

    public JobCenterMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Creates the required indexes. Existing indexes with the same definition are left alone.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(TriggerDocument.class).ensureIndex(triggerDueIndex());
        mongoTemplate.indexOps(TriggerDocument.class).ensureIndex(triggerStateAcquiredIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(jobGroupNameIndex());
    }

    public static Index triggerDueIndex() {
        return new Index()
                .on("state", Sort.Direction.ASC)
                .on("fireNowRequested", Sort.Direction.ASC)
                .on("nextFireAt", Sort.Direction.ASC)
                .named(IDX_TRIGGER_DUE);
    }

    public static Index triggerStateAcquiredIndex() {
        return new Index()
                .on("state", Sort.Direction.ASC)
                .on("acquiredAt", Sort.Direction.ASC)
                .named(IDX_TRIGGER_STATE_ACQUIRED);
    }

    public static Index jobGroupNameIndex() {
        return new Index()
                .on("group", Sort.Direction.ASC)
                .on("name", Sort.Direction.ASC)
                .named(IDX_JOB_GROUP_NAME);
    }
}
