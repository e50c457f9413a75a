package io.jobcenter4j.core;

/**
 * Error taxonomy shared by the store, the engine and the management façade.
 */
public enum ErrorCode {
    NOT_FOUND(404),
    ALREADY_EXISTS(409),
    INVALID_SCHEDULE(400),
    EXPIRED_END_TIME(410),
    EXECUTION_FAILURE(500),
    STORE_FAILURE(503);

    private final int status;

    ErrorCode(int status) {
        this.status = status;
    }

    public int status() {
        return status;
    }
}
