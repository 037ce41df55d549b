package io.jobhive.worker;

import io.jobhive.broker.ExponentialBackoff;
import java.time.Duration;
import java.util.Objects;

/**
 * @param maxAttempts failed attempts after which a job is dead-lettered
 * @param executionDeadline wall-clock budget of one handler invocation
 * @param retryBackoff delay before attempt {@code n + 1}, indexed by failed attempts {@code n}
 */
public record RuntimeSettings(int maxAttempts, Duration executionDeadline, ExponentialBackoff retryBackoff) {

  public RuntimeSettings {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    Objects.requireNonNull(executionDeadline, "executionDeadline");
    if (executionDeadline.isZero() || executionDeadline.isNegative()) {
      throw new IllegalArgumentException("executionDeadline must be positive");
    }
    Objects.requireNonNull(retryBackoff, "retryBackoff");
  }
}
