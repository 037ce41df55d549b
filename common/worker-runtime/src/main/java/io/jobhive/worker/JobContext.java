package io.jobhive.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.jobhive.job.WorkerType;
import io.jobhive.job.error.JobTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * What a handler gets to see of a job delivery. Handlers that run long loops should call
 * {@link #checkDeadline()} so an abandoned invocation stops promptly.
 */
public final class JobContext {

  private final UUID jobId;
  private final WorkerType workerType;
  private final JsonNode payload;
  private final int attemptCount;
  private final Instant deadline;
  private final Duration budget;
  private final Clock clock;

  public JobContext(UUID jobId, WorkerType workerType, JsonNode payload, int attemptCount,
                    Instant deadline, Duration budget, Clock clock) {
    this.jobId = Objects.requireNonNull(jobId, "jobId");
    this.workerType = Objects.requireNonNull(workerType, "workerType");
    this.payload = Objects.requireNonNull(payload, "payload");
    this.attemptCount = attemptCount;
    this.deadline = Objects.requireNonNull(deadline, "deadline");
    this.budget = Objects.requireNonNull(budget, "budget");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public UUID jobId() {
    return jobId;
  }

  public WorkerType workerType() {
    return workerType;
  }

  public JsonNode payload() {
    return payload;
  }

  /**
   * Failed attempts before this one.
   */
  public int attemptCount() {
    return attemptCount;
  }

  public Instant deadline() {
    return deadline;
  }

  public boolean isExpired() {
    return Thread.currentThread().isInterrupted() || !clock.instant().isBefore(deadline);
  }

  public void checkDeadline() {
    if (isExpired()) {
      throw new JobTimeoutException(budget);
    }
  }
}
