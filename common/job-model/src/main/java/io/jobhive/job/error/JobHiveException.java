package io.jobhive.job.error;

import java.util.Objects;

/**
 * Base type of the platform's error taxonomy. Every subtype maps to exactly one {@link ErrorCode}.
 */
public abstract class JobHiveException extends RuntimeException {

    private final ErrorCode code;

    protected JobHiveException(ErrorCode code, String message) {
        this(code, message, null);
    }

    protected JobHiveException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode code() {
        return code;
    }
}
