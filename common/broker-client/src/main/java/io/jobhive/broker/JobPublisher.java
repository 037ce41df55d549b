package io.jobhive.broker;

import java.time.Duration;

/**
 * Hands jobs to the broker. Implementations return only once the broker has taken
 * responsibility for the message.
 */
public interface JobPublisher {

  void publish(JobMessage job);

  /**
   * Parks the job on its worker type's retry queue; the broker moves it back to the work queue
   * once {@code delay} has elapsed.
   */
  void publishRetry(JobMessage job, Duration delay);
}
