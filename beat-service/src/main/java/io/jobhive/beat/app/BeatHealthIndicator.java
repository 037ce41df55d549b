package io.jobhive.beat.app;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports DOWN once the beat loop has halted on a corrupted schedule.
 */
public class BeatHealthIndicator implements HealthIndicator {

  private final BeatScheduler scheduler;

  public BeatHealthIndicator(BeatScheduler scheduler) {
    this.scheduler = scheduler;
  }

  @Override
  public Health health() {
    return scheduler.haltCause()
        .map(cause -> Health.down()
            .withDetail("scheduleId", cause.scheduleId())
            .withDetail("error", cause.getMessage())
            .build())
        .orElseGet(() -> Health.up().build());
  }
}
