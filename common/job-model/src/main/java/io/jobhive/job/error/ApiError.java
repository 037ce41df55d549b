package io.jobhive.job.error;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Error body returned by the central service's HTTP surface.
 *
 * @param error an {@link ErrorCode} name
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiError(String error, String message) {

    public static ApiError of(JobHiveException ex) {
        return new ApiError(ex.code().name(), ex.getMessage());
    }
}
