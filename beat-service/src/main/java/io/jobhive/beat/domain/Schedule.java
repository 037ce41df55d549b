package io.jobhive.beat.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.jobhive.job.WorkerType;
import java.time.Instant;
import java.util.Objects;

/**
 * Recurring job definition.
 *
 * @param trigger     {@code every <n>s|m|h} or a six-field cron expression
 * @param createdAt   anchor for interval triggers
 * @param lastFiredAt most recent tick that produced a job, or the anchor if none has yet
 */
public record Schedule(String id,
                       String trigger,
                       WorkerType workerType,
                       JsonNode payload,
                       Instant createdAt,
                       Instant lastFiredAt) {

  public Schedule {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("schedule id must not be blank");
    }
    Objects.requireNonNull(trigger, "trigger");
    Objects.requireNonNull(workerType, "workerType");
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(lastFiredAt, "lastFiredAt");
    payload = payload == null ? NullNode.getInstance() : payload;
  }

  /**
   * Idempotency key for the job produced by {@code tick}; stable across restarts.
   */
  public String idempotencyKey(Instant tick) {
    return "schedule:" + id + ":" + tick.toEpochMilli();
  }
}
