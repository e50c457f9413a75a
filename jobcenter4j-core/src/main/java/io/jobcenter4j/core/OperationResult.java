package io.jobcenter4j.core;

/**
 * Result of a management operation. Errors are reported here instead of thrown.
 *
 * @param code    HTTP-like status: 200 on success, {@link ErrorCode#status()} otherwise
 * @param message human readable outcome
 * @param error   error code, {@code null} on success
 * @param data    payload of query operations, {@code null} otherwise
 */
public record OperationResult<T>(
        int code,
        String message,
        ErrorCode error,
        T data
) {
    public static final int OK = 200;

    public static <T> OperationResult<T> ok(String message) {
        return new OperationResult<>(OK, message, null, null);
    }

    public static <T> OperationResult<T> ok(T data) {
        return new OperationResult<>(OK, "OK", null, data);
    }

    public static <T> OperationResult<T> failure(ErrorCode error, String message) {
        return new OperationResult<>(error.status(), message, error, null);
    }

    public static <T> OperationResult<T> failure(JobCenterException e) {
        return failure(e.code(), e.getMessage());
    }

    public boolean isSuccess() {
        return error == null;
    }
}
