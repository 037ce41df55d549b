package io.jobhive.broker;

import java.time.Duration;
import java.util.Objects;

/**
 * Capped exponential delay: {@code initial * multiplier^(attempt - 1)}, never above {@code max}.
 */
public record ExponentialBackoff(Duration initial, Duration max, double multiplier) {

  public ExponentialBackoff {
    Objects.requireNonNull(initial, "initial");
    Objects.requireNonNull(max, "max");
    if (initial.isNegative() || max.compareTo(initial) < 0) {
      throw new IllegalArgumentException("backoff requires 0 <= initial <= max");
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be >= 1");
    }
  }

  public Duration delayFor(int attempt) {
    if (attempt < 1) {
      throw new IllegalArgumentException("attempt must be >= 1");
    }
    double millis = initial.toMillis() * Math.pow(multiplier, attempt - 1);
    if (millis >= max.toMillis()) {
      return max;
    }
    return Duration.ofMillis((long) millis);
  }
}
