package io.jobhive.beat.domain;

import com.fasterxml.jackson.databind.JsonNode;
import io.jobhive.job.WorkerType;

/**
 * Configured part of a schedule, without firing state.
 */
public record ScheduleDefinition(String id, String trigger, WorkerType workerType, JsonNode payload) {
}
