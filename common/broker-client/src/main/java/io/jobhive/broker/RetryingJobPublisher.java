package io.jobhive.broker;

import io.jobhive.job.error.DispatchUnavailableException;
import io.jobhive.job.error.ResourceExhaustedException;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;

/**
 * Retries broker hand-off with bounded exponential backoff and surfaces
 * {@link DispatchUnavailableException} once the attempts are spent.
 * {@link ResourceExhaustedException} is not retried; the caller is expected to back off.
 */
public final class RetryingJobPublisher implements JobPublisher {

  private static final Logger log = LoggerFactory.getLogger(RetryingJobPublisher.class);

  private final JobPublisher delegate;
  private final int maxAttempts;
  private final ExponentialBackoff backoff;

  public RetryingJobPublisher(JobPublisher delegate, int maxAttempts, ExponentialBackoff backoff) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = maxAttempts;
    this.backoff = Objects.requireNonNull(backoff, "backoff");
  }

  @Override
  public void publish(JobMessage job) {
    withRetry(job, () -> delegate.publish(job));
  }

  @Override
  public void publishRetry(JobMessage job, Duration delay) {
    withRetry(job, () -> delegate.publishRetry(job, delay));
  }

  private void withRetry(JobMessage job, Runnable action) {
    AmqpException last = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        action.run();
        return;
      } catch (AmqpException ex) {
        last = ex;
        if (attempt == maxAttempts) {
          break;
        }
        Duration delay = backoff.delayFor(attempt);
        log.warn("publish of job {} failed (attempt {}/{}), retrying in {}: {}",
            job.jobId(), attempt, maxAttempts, delay, ex.getMessage());
        sleep(delay);
      }
    }
    log.error("publish of job {} failed after {} attempts", job.jobId(), maxAttempts, last);
    throw new DispatchUnavailableException(
        "Broker unavailable after %d publish attempts".formatted(maxAttempts), last);
  }

  private static void sleep(Duration delay) {
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new DispatchUnavailableException("Interrupted while waiting to retry publish", ex);
    }
  }
}
