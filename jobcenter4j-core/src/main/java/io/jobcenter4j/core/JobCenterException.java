package io.jobcenter4j.core;

import java.util.Objects;

public class JobCenterException extends RuntimeException {

    private final ErrorCode code;

    public JobCenterException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    public JobCenterException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    public ErrorCode code() {
        return code;
    }

    public static JobCenterException notFound(Object key) {
        return new JobCenterException(ErrorCode.NOT_FOUND, "Job not found: " + key);
    }

    public static JobCenterException alreadyExists(Object key) {
        return new JobCenterException(ErrorCode.ALREADY_EXISTS, "Job already exists: " + key);
    }

    public static JobCenterException invalidSchedule(String message) {
        return new JobCenterException(ErrorCode.INVALID_SCHEDULE, message);
    }
}
