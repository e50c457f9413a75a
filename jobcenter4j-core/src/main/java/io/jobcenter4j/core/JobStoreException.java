package io.jobcenter4j.core;

/**
 * Persistence failure. Fatal to the operation in progress; the scheduler loop retries it with backoff.
 */
public class JobStoreException extends JobCenterException {

    public JobStoreException(String message) {
        super(ErrorCode.STORE_FAILURE, message);
    }

    public JobStoreException(String message, Throwable cause) {
        super(ErrorCode.STORE_FAILURE, message, cause);
    }
}
