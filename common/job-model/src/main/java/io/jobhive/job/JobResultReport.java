package io.jobhive.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Body of the worker callback {@code POST /jobs/{id}/result}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResultReport(@NotNull JobStatus status,
                              @Min(0) int attemptCount,
                              JsonNode result,
                              String error) {

    public static JobResultReport inFlight(int attemptCount) {
        return new JobResultReport(JobStatus.IN_FLIGHT, attemptCount, null, null);
    }

    public static JobResultReport succeeded(int attemptCount, JsonNode result) {
        return new JobResultReport(JobStatus.SUCCEEDED, attemptCount, result, null);
    }

    public static JobResultReport retrying(int attemptCount, String error) {
        return new JobResultReport(JobStatus.PENDING, attemptCount, null, error);
    }

    public static JobResultReport failed(int attemptCount, String error) {
        return new JobResultReport(JobStatus.FAILED, attemptCount, null, error);
    }

    public static JobResultReport deadLettered(int attemptCount, String error) {
        return new JobResultReport(JobStatus.DEAD_LETTERED, attemptCount, null, error);
    }
}
