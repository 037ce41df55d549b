package io.jobhive.job.error;

/**
 * The broker could not accept a job after the bounded publish retries were spent, or the enqueue
 * path has been closed because a fatal condition was detected.
 */
public class DispatchUnavailableException extends JobHiveException {

    public DispatchUnavailableException(String message) {
        super(ErrorCode.DISPATCH_UNAVAILABLE, message);
    }

    public DispatchUnavailableException(String message, Throwable cause) {
        super(ErrorCode.DISPATCH_UNAVAILABLE, message, cause);
    }
}
