package io.jobhive.core.domain;

import io.jobhive.job.Job;
import io.jobhive.job.JobResultReport;
import io.jobhive.job.JobStatus;
import io.jobhive.job.WorkerType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable job records. The idempotency key is unique across all jobs.
 */
public interface JobStore {

    /**
     * Inserts {@code job} unless another job already holds its idempotency key, in which case the
     * existing job is returned with {@code created == false}.
     */
    Reservation reserve(Job job);

    Optional<Job> find(UUID id);

    void markPublished(UUID id, Instant publishedAt);

    /**
     * Deletes a reservation whose publish failed. Only removes jobs that are still unpublished and
     * {@link JobStatus#PENDING}.
     *
     * @return whether a row was removed
     */
    boolean discard(UUID id);

    /**
     * Applies a worker report atomically with respect to concurrent reports for the same job.
     *
     * @throws io.jobhive.job.error.JobNotFoundException when no such job exists
     */
    ReportOutcome applyReport(UUID id, JobResultReport report, Instant now);

    List<Job> findByStatusAndType(JobStatus status, WorkerType workerType, int limit);

    List<Job> findUnpublished(Instant createdBefore, int limit);

    record Reservation(Job job, boolean created) {}

    /**
     * @param applied false when the report was ignored because the job is already terminal
     */
    record ReportOutcome(Job job, boolean applied) {}
}
