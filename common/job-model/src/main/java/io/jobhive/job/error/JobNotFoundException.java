package io.jobhive.job.error;

import java.util.UUID;

public class JobNotFoundException extends JobHiveException {

    public JobNotFoundException(UUID jobId) {
        super(ErrorCode.JOB_NOT_FOUND, "Job '%s' not found".formatted(jobId));
    }
}
