package io.jobhive.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Submission body for {@code POST /jobs}. The worker type stays a string here so unknown types
 * are reported as {@code INVALID_WORKER_TYPE} instead of a generic parse failure.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobRequest(@NotBlank String workerType,
                         JsonNode payload,
                         @Min(0) @Max(Job.MAX_PRIORITY) Integer priority,
                         String idempotencyKey) {

    public int priorityOrDefault() {
        return priority == null ? Job.DEFAULT_PRIORITY : priority;
    }

    public boolean hasIdempotencyKey() {
        return idempotencyKey != null && !idempotencyKey.isBlank();
    }
}
