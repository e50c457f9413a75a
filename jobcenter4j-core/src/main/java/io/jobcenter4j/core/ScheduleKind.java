package io.jobcenter4j.core;

public enum ScheduleKind {
    CRON,
    SIMPLE
}
