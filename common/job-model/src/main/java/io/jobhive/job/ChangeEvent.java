package io.jobhive.job;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable notification emitted after a durable state change. {@code sequence} is assigned by
 * the notification broker and is gap-free per channel.
 */
public record ChangeEvent(String channel, long sequence, JsonNode payload, Instant emittedAt) {

    public ChangeEvent {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel must not be blank");
        }
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be positive");
        }
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(emittedAt, "emittedAt");
    }
}
