package io.jobhive.job.error;

public class ResourceExhaustedException extends JobHiveException {

    public ResourceExhaustedException(String message) {
        super(ErrorCode.RESOURCE_EXHAUSTED, message);
    }

    public ResourceExhaustedException(String message, Throwable cause) {
        super(ErrorCode.RESOURCE_EXHAUSTED, message, cause);
    }
}
