package io.jobhive.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Durable record of a unit of work. The central service owns it; workers only report results.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Job(UUID id,
                  WorkerType workerType,
                  JsonNode payload,
                  int priority,
                  int attemptCount,
                  JobStatus status,
                  String idempotencyKey,
                  Instant createdAt,
                  Instant lastAttemptAt,
                  Instant publishedAt,
                  String lastError,
                  JsonNode result) {

    public static final int DEFAULT_PRIORITY = 5;
    public static final int MAX_PRIORITY = 9;

    public Job {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(workerType, "workerType");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(createdAt, "createdAt");
        payload = payload == null ? NullNode.getInstance() : payload;
        if (priority < 0 || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("priority must be between 0 and " + MAX_PRIORITY);
        }
        if (attemptCount < 0) {
            throw new IllegalArgumentException("attemptCount must not be negative");
        }
    }

    public static Job pending(WorkerType workerType, JsonNode payload, int priority, String idempotencyKey, Instant now) {
        return new Job(UUID.randomUUID(), workerType, payload, priority, 0, JobStatus.PENDING,
            idempotencyKey, now, null, null, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public Job withPublishedAt(Instant at) {
        return new Job(id, workerType, payload, priority, attemptCount, status, idempotencyKey,
            createdAt, lastAttemptAt, at, lastError, result);
    }

    /**
     * Applies a worker report. Callers must check {@link JobStatus#canTransitionTo(JobStatus)} first.
     */
    public Job apply(JobResultReport report, Instant now) {
        Objects.requireNonNull(report, "report");
        return new Job(id, workerType, payload, priority,
            Math.max(attemptCount, report.attemptCount()),
            report.status(),
            idempotencyKey,
            createdAt,
            now,
            publishedAt,
            report.error() != null ? report.error() : lastError,
            report.result() != null ? report.result() : result);
    }
}
