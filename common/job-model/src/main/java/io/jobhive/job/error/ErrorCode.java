package io.jobhive.job.error;

/**
 * Stable identifiers for every failure the platform surfaces to callers, together with the HTTP
 * status the central service answers with.
 */
public enum ErrorCode {
    INVALID_WORKER_TYPE(400),
    INVALID_REQUEST(400),
    UNAUTHORIZED(401),
    FORBIDDEN(403),
    JOB_NOT_FOUND(404),
    RESUME_GAP(409),
    JOB_EXECUTION_FAILED(500),
    JOB_TIMEOUT(500),
    SCHEDULE_STORE_CORRUPTED(500),
    DISPATCH_UNAVAILABLE(503),
    RESOURCE_EXHAUSTED(503);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /**
     * Whether a caller may retry the same request after backing off.
     */
    public boolean retryable() {
        return this == DISPATCH_UNAVAILABLE || this == RESOURCE_EXHAUSTED;
    }
}
