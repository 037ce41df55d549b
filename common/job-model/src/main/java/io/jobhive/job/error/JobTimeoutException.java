package io.jobhive.job.error;

import java.time.Duration;

/**
 * A handler ran past its execution deadline. Handled exactly like any other execution failure.
 */
public class JobTimeoutException extends JobExecutionFailedException {

    public JobTimeoutException(Duration deadline) {
        super(ErrorCode.JOB_TIMEOUT, "Handler exceeded execution deadline of " + deadline);
    }
}
