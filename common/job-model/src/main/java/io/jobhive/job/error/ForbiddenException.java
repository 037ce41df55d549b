package io.jobhive.job.error;

public class ForbiddenException extends JobHiveException {

    public ForbiddenException(String message) {
        super(ErrorCode.FORBIDDEN, message);
    }
}
