package io.jobcenter4j.core;

import java.util.List;

public record JobGroupView(String groupName, List<JobSummary> jobs) {
    public JobGroupView {
        jobs = List.copyOf(jobs);
    }
}
