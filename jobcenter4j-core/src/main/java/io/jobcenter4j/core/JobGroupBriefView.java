package io.jobcenter4j.core;

import java.util.List;

public record JobGroupBriefView(String groupName, List<JobBriefView> jobs) {
    public JobGroupBriefView {
        jobs = List.copyOf(jobs);
    }
}
