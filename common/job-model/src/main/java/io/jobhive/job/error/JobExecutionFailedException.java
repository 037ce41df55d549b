package io.jobhive.job.error;

/**
 * A job handler failed. The worker runtime retries the job until its attempt budget is spent.
 */
public class JobExecutionFailedException extends JobHiveException {

    public JobExecutionFailedException(String message, Throwable cause) {
        super(ErrorCode.JOB_EXECUTION_FAILED, message, cause);
    }

    protected JobExecutionFailedException(ErrorCode code, String message) {
        super(code, message);
    }
}
