package io.jobhive.job;

import java.util.Objects;
import java.util.UUID;

/**
 * Answer to a submission. {@code duplicate} is set when an earlier submission with the same
 * idempotency key already created the job.
 */
public record JobReceipt(UUID jobId, JobStatus status, boolean duplicate) {

    public JobReceipt {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(status, "status");
    }
}
