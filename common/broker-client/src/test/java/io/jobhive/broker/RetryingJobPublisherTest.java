package io.jobhive.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jobhive.job.WorkerType;
import io.jobhive.job.error.DispatchUnavailableException;
import io.jobhive.job.error.ResourceExhaustedException;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.AmqpConnectException;

class RetryingJobPublisherTest {

  private static final ExponentialBackoff FAST = new ExponentialBackoff(Duration.ofMillis(1), Duration.ofMillis(4), 2.0);

  private final JobMessage job = new JobMessage(UUID.randomUUID(), WorkerType.BOT, null, 5, 0, Instant.now());

  @Test
  void succeedsOnceBrokerRecovers() {
    FlakyPublisher flaky = new FlakyPublisher(2);
    RetryingJobPublisher publisher = new RetryingJobPublisher(flaky, 5, FAST);

    publisher.publish(job);

    assertThat(flaky.calls.get()).isEqualTo(3);
  }

  @Test
  void surfacesDispatchUnavailableAfterBoundedAttempts() {
    FlakyPublisher flaky = new FlakyPublisher(Integer.MAX_VALUE);
    RetryingJobPublisher publisher = new RetryingJobPublisher(flaky, 3, FAST);

    assertThatThrownBy(() -> publisher.publish(job))
        .isInstanceOf(DispatchUnavailableException.class)
        .hasMessageContaining("3 publish attempts")
        .hasCauseInstanceOf(AmqpConnectException.class);
    assertThat(flaky.calls.get()).isEqualTo(3);
  }

  @Test
  void doesNotRetryResourceExhaustion() {
    AtomicInteger calls = new AtomicInteger();
    JobPublisher exhausted = new JobPublisher() {
      @Override
      public void publish(JobMessage message) {
        calls.incrementAndGet();
        throw new ResourceExhaustedException("no channel");
      }

      @Override
      public void publishRetry(JobMessage message, Duration delay) {
        publish(message);
      }
    };

    assertThatThrownBy(() -> new RetryingJobPublisher(exhausted, 5, FAST).publish(job))
        .isInstanceOf(ResourceExhaustedException.class);
    assertThat(calls.get()).isEqualTo(1);
  }

  @Test
  void backoffGrowsExponentiallyUpToCap() {
    ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(1), 2.0);

    assertThat(backoff.delayFor(1)).isEqualTo(Duration.ofMillis(100));
    assertThat(backoff.delayFor(3)).isEqualTo(Duration.ofMillis(400));
    assertThat(backoff.delayFor(10)).isEqualTo(Duration.ofSeconds(1));
  }

  private static final class FlakyPublisher implements JobPublisher {

    private final int failures;
    private final AtomicInteger calls = new AtomicInteger();

    private FlakyPublisher(int failures) {
      this.failures = failures;
    }

    @Override
    public void publish(JobMessage message) {
      if (calls.incrementAndGet() <= failures) {
        throw new AmqpConnectException(new java.net.ConnectException("connection refused"));
      }
    }

    @Override
    public void publishRetry(JobMessage message, Duration delay) {
      publish(message);
    }
  }
}
