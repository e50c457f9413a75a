package io.jobcenter4j.internal.mongo;

import io.jobcenter4j.core.JobKey;
import io.jobcenter4j.core.MisfireInstruction;
import io.jobcenter4j.core.ScheduleKind;
import io.jobcenter4j.core.TriggerDefinition;
import io.jobcenter4j.core.TriggerKey;
import io.jobcenter4j.core.TriggerState;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Duration;
import java.time.Instant;

/**
 * Mongo document model for persisted triggers. {@code _id} is {@code group/name}, {@code jobId} the
 * {@code _id} of the owning job.
 */
@Document(collection = MongoJobStore.TRIGGERS_COLLECTION)
public class TriggerDocument {

    @Id
    private String id;

    private String name;
    private String group;
    private String jobId;

    private ScheduleKind scheduleKind;
    private String cronExpression;
    private String timezone;
    private Long intervalMillis;
    private Integer repeatCount;
    private Instant startAt;
    private Instant endAt;
    private MisfireInstruction misfireInstruction;

    private TriggerState state;
    private int timesFired;
    private Instant previousFireAt;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextFireAt;

    private boolean fireNowRequested;
    private boolean manualFire;
    private TriggerState stateAfterFire;
    private boolean deletePending;

    private Instant acquiredAt;
    private String acquiredBy;

    private long version;

    public TriggerDocument() {
    }

    static TriggerDocument from(TriggerDefinition t) {
        TriggerDocument doc = new TriggerDocument();
        doc.setId(t.key().asId());
        doc.setName(t.key().name());
        doc.setGroup(t.key().group());
        doc.setJobId(t.jobKey().asId());
        doc.setScheduleKind(t.scheduleKind());
        doc.setCronExpression(t.cronExpression());
        doc.setTimezone(t.timezone());
        doc.setIntervalMillis(t.interval() == null ? null : t.interval().toMillis());
        doc.setRepeatCount(t.repeatCount());
        doc.setStartAt(t.startAt());
        doc.setEndAt(t.endAt());
        doc.setMisfireInstruction(t.misfireInstruction());
        doc.setState(t.state());
        doc.setTimesFired(t.timesFired());
        doc.setPreviousFireAt(t.previousFireAt());
        doc.setNextFireAt(t.nextFireAt());
        doc.setFireNowRequested(t.fireNowRequested());
        doc.setManualFire(t.manualFire());
        doc.setStateAfterFire(t.stateAfterFire());
        doc.setDeletePending(t.deletePending());
        doc.setAcquiredAt(t.acquiredAt());
        doc.setAcquiredBy(t.acquiredBy());
        doc.setVersion(t.version());
        return doc;
    }

    TriggerDefinition toDefinition() {
        return TriggerDefinition.builder()
                .key(new TriggerKey(name, group))
                .jobKey(JobKey.fromId(jobId))
                .scheduleKind(scheduleKind)
                .cronExpression(cronExpression)
                .timezone(timezone)
                .interval(intervalMillis == null ? null : Duration.ofMillis(intervalMillis))
                .repeatCount(repeatCount)
                .startAt(startAt)
                .endAt(endAt)
                .misfireInstruction(misfireInstruction)
                .state(state)
                .timesFired(timesFired)
                .previousFireAt(previousFireAt)
                .nextFireAt(nextFireAt)
                .fireNowRequested(fireNowRequested)
                .manualFire(manualFire)
                .stateAfterFire(stateAfterFire)
                .deletePending(deletePending)
                .acquiredAt(acquiredAt)
                .acquiredBy(acquiredBy)
                .version(version)
                .build();
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

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public ScheduleKind getScheduleKind() {
        return scheduleKind;
    }

    public void setScheduleKind(ScheduleKind scheduleKind) {
        this.scheduleKind = scheduleKind;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Long getIntervalMillis() {
        return intervalMillis;
    }

    public void setIntervalMillis(Long intervalMillis) {
        this.intervalMillis = intervalMillis;
    }

    public Integer getRepeatCount() {
        return repeatCount;
    }

    public void setRepeatCount(Integer repeatCount) {
        this.repeatCount = repeatCount;
    }

    public Instant getStartAt() {
        return startAt;
    }

    public void setStartAt(Instant startAt) {
        this.startAt = startAt;
    }

    public Instant getEndAt() {
        return endAt;
    }

    public void setEndAt(Instant endAt) {
        this.endAt = endAt;
    }

    public MisfireInstruction getMisfireInstruction() {
        return misfireInstruction;
    }

    public void setMisfireInstruction(MisfireInstruction misfireInstruction) {
        this.misfireInstruction = misfireInstruction;
    }

    public TriggerState getState() {
        return state;
    }

    public void setState(TriggerState state) {
        this.state = state;
    }

    public int getTimesFired() {
        return timesFired;
    }

    public void setTimesFired(int timesFired) {
        this.timesFired = timesFired;
    }

    public Instant getPreviousFireAt() {
        return previousFireAt;
    }

    public void setPreviousFireAt(Instant previousFireAt) {
        this.previousFireAt = previousFireAt;
    }

    public Instant getNextFireAt() {
        return nextFireAt;
    }

    public void setNextFireAt(Instant nextFireAt) {
        this.nextFireAt = nextFireAt;
    }

    public boolean isFireNowRequested() {
        return fireNowRequested;
    }

    public void setFireNowRequested(boolean fireNowRequested) {
        this.fireNowRequested = fireNowRequested;
    }

    public boolean isManualFire() {
        return manualFire;
    }

    public void setManualFire(boolean manualFire) {
        this.manualFire = manualFire;
    }

    public TriggerState getStateAfterFire() {
        return stateAfterFire;
    }

    public void setStateAfterFire(TriggerState stateAfterFire) {
        this.stateAfterFire = stateAfterFire;
    }

    public boolean isDeletePending() {
        return deletePending;
    }

    public void setDeletePending(boolean deletePending) {
        this.deletePending = deletePending;
    }

    public Instant getAcquiredAt() {
        return acquiredAt;
    }

    public void setAcquiredAt(Instant acquiredAt) {
        this.acquiredAt = acquiredAt;
    }

    public String getAcquiredBy() {
        return acquiredBy;
    }

    public void setAcquiredBy(String acquiredBy) {
        this.acquiredBy = acquiredBy;
    }

    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }
}
