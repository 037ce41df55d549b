package io.jobhive.workers.handlers;

import com.fasterxml.jackson.databind.JsonNode;
import io.jobhive.worker.NonRetryableJobException;
import java.util.Optional;
import java.util.Set;

/**
 * Payload accessors shared by the handlers. A malformed payload can never succeed on retry, so
 * every violation is a {@link NonRetryableJobException}.
 */
final class Payloads {

  private Payloads() {
  }

  static JsonNode requireObject(JsonNode payload) {
    if (payload == null || !payload.isObject()) {
      throw new NonRetryableJobException("payload must be a JSON object");
    }
    return payload;
  }

  static String requireText(JsonNode payload, String field) {
    return optionalText(payload, field)
        .orElseThrow(() -> new NonRetryableJobException("payload." + field + " is required"));
  }

  static Optional<String> optionalText(JsonNode payload, String field) {
    JsonNode value = payload.get(field);
    if (value == null || value.isNull()) {
      return Optional.empty();
    }
    if (!value.isTextual() || value.asText().isBlank()) {
      throw new NonRetryableJobException("payload." + field + " must be a non-blank string");
    }
    return Optional.of(value.asText().trim());
  }

  static String oneOf(JsonNode payload, String field, Set<String> allowed, String fallback) {
    String value = optionalText(payload, field).orElse(fallback);
    if (!allowed.contains(value)) {
      throw new NonRetryableJobException("payload." + field + " must be one of " + allowed + " but was '" + value + "'");
    }
    return value;
  }

  static boolean flag(JsonNode payload, String field) {
    JsonNode value = payload.get(field);
    if (value == null || value.isNull()) {
      return false;
    }
    if (!value.isBoolean()) {
      throw new NonRetryableJobException("payload." + field + " must be a boolean");
    }
    return value.booleanValue();
  }
}
