package io.jobhive.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.jobhive.job.Job;
import io.jobhive.job.WorkerType;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Broker-side view of a job: what travels on the queue and nothing more.
 *
 * @param attemptCount failed attempts so far; zero on first delivery
 */
public record JobMessage(UUID jobId,
                         WorkerType workerType,
                         JsonNode payload,
                         int priority,
                         int attemptCount,
                         Instant enqueuedAt) {

  public JobMessage {
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(workerType, "workerType");
    Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    payload = payload == null ? NullNode.getInstance() : payload;
    if (attemptCount < 0) {
      throw new IllegalArgumentException("attemptCount must not be negative");
    }
  }

  public static JobMessage of(Job job, Instant enqueuedAt) {
    return new JobMessage(job.id(), job.workerType(), job.payload(), job.priority(), job.attemptCount(), enqueuedAt);
  }

  public JobMessage nextAttempt(int attemptCount, Instant enqueuedAt) {
    return new JobMessage(jobId, workerType, payload, priority, attemptCount, enqueuedAt);
  }
}
