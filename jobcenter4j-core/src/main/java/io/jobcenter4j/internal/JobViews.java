package io.jobcenter4j.internal;

import io.jobcenter4j.core.JobBriefView;
import io.jobcenter4j.core.JobDefinition;
import io.jobcenter4j.core.JobGroupBriefView;
import io.jobcenter4j.core.JobGroupView;
import io.jobcenter4j.core.JobKind;
import io.jobcenter4j.core.JobParameters;
import io.jobcenter4j.core.JobSummary;
import io.jobcenter4j.core.JobView;
import io.jobcenter4j.core.ScheduledJob;
import io.jobcenter4j.core.TriggerDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Maps stored jobs to the read models of the management API.
 */
final class JobViews {
    private JobViews() {
    }

    static JobView toView(JobDefinition job, TriggerDefinition trigger) {
        return new JobView(
                job.key(),
                job.kind(),
                job.description(),
                job.parameters(),
                job.notifyPolicy(),
                trigger == null ? null : trigger.scheduleKind(),
                trigger == null ? null : trigger.cronExpression(),
                trigger == null ? null : trigger.timezone(),
                trigger == null ? null : trigger.interval(),
                trigger == null ? null : trigger.repeatCount(),
                trigger == null ? null : trigger.startAt(),
                trigger == null ? null : trigger.endAt(),
                trigger == null ? null : trigger.misfireInstruction(),
                trigger == null ? null : trigger.state(),
                job.runCount(),
                job.lastError()
        );
    }

    static JobSummary toSummary(ScheduledJob scheduled) {
        JobDefinition job = scheduled.job();
        TriggerDefinition trigger = scheduled.trigger();
        return new JobSummary(
                job.key().name(),
                job.kind(),
                job.description(),
                job.lastError(),
                job.parameters().get(job.kind().addressParameter()),
                job.kind() == JobKind.HTTP ? job.parameters().getOrDefault(JobParameters.REQUEST_METHOD, "GET") : null,
                trigger == null ? null : trigger.state(),
                trigger == null ? null : trigger.previousFireAt(),
                trigger == null ? null : trigger.nextFireAt(),
                trigger == null ? null : trigger.startAt(),
                trigger == null ? null : trigger.endAt(),
                trigger == null ? null : trigger.describeSchedule(),
                job.runCount()
        );
    }

    static JobBriefView toBrief(ScheduledJob scheduled) {
        JobDefinition job = scheduled.job();
        TriggerDefinition trigger = scheduled.trigger();
        return new JobBriefView(
                job.key().name(),
                job.lastError(),
                trigger == null ? null : trigger.state(),
                trigger == null ? null : trigger.previousFireAt(),
                trigger == null ? null : trigger.nextFireAt(),
                job.runCount()
        );
    }

    static List<JobGroupView> groupDetailed(List<ScheduledJob> all) {
        return group(all, JobViews::toSummary).entrySet().stream()
                .map(e -> new JobGroupView(e.getKey(), e.getValue()))
                .toList();
    }

    static List<JobGroupBriefView> groupBrief(List<ScheduledJob> all) {
        return group(all, JobViews::toBrief).entrySet().stream()
                .map(e -> new JobGroupBriefView(e.getKey(), e.getValue()))
                .toList();
    }

    // input is ordered by (group, name); insertion order keeps it
    private static <T> Map<String, List<T>> group(List<ScheduledJob> all, Function<ScheduledJob, T> mapper) {
        Map<String, List<T>> byGroup = new LinkedHashMap<>();
        for (ScheduledJob scheduled : all) {
            byGroup.computeIfAbsent(scheduled.job().key().group(), g -> new ArrayList<>()).add(mapper.apply(scheduled));
        }
        return byGroup;
    }
}
