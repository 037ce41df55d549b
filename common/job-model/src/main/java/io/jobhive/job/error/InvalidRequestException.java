package io.jobhive.job.error;

public class InvalidRequestException extends JobHiveException {

    public InvalidRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }
}
