package io.jobcenter4j.internal.mongo;

import io.jobcenter4j.core.JobDefinition;
import io.jobcenter4j.core.JobKey;
import io.jobcenter4j.core.JobKind;
import io.jobcenter4j.core.NotifyPolicy;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mongo document model for persisted job definitions. {@code _id} is {@code group/name}.
 */
@Document(collection = MongoJobStore.JOBS_COLLECTION)
public class JobDocument {

    @Id
    private String id;

    private String name;
    private String group;

    // null in documents written before job kinds existed; migrated to HTTP on startup
    private JobKind kind;

    private String description;
    private Map<String, String> parameters;
    private NotifyPolicy notifyPolicy;

    private long runCount;
    private String lastError;
    private List<String> log;

    public JobDocument() {
    }

    static JobDocument from(JobDefinition job) {
        JobDocument doc = new JobDocument();
        doc.setId(job.key().asId());
        doc.setName(job.key().name());
        doc.setGroup(job.key().group());
        doc.setKind(job.kind());
        doc.setDescription(job.description());
        doc.setParameters(new LinkedHashMap<>(job.parameters()));
        doc.setNotifyPolicy(job.notifyPolicy());
        doc.setRunCount(job.runCount());
        doc.setLastError(job.lastError());
        doc.setLog(new ArrayList<>(job.log()));
        return doc;
    }

    JobDefinition toDefinition() {
        if (kind == null) {
            throw new IllegalStateException("Job document " + id + " has no kind; run initialize() to migrate it");
        }
        return new JobDefinition(
                new JobKey(name, group),
                kind,
                description,
                parameters,
                notifyPolicy,
                runCount,
                lastError,
                log
        );
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getGroup() {
        return group;
    }

    public void setGroup(String group) {
        this.group = group;
    }

    public JobKind getKind() {
        return kind;
    }

    public void setKind(JobKind kind) {
        this.kind = kind;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    public void setParameters(Map<String, String> parameters) {
        this.parameters = parameters;
    }

    public NotifyPolicy getNotifyPolicy() {
        return notifyPolicy;
    }

    public void setNotifyPolicy(NotifyPolicy notifyPolicy) {
        this.notifyPolicy = notifyPolicy;
    }

    public long getRunCount() {
        return runCount;
    }

    public void setRunCount(long runCount) {
        this.runCount = runCount;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public List<String> getLog() {
        return log;
    }

    public void setLog(List<String> log) {
        this.log = log;
    }
}
