package io.jobhive.beat.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "jobhive.beat")
public class BeatProperties {

  private final Duration tickInterval;
  private final List<ScheduleConfig> schedules;

  public BeatProperties(@DefaultValue("1s") @NotNull Duration tickInterval,
                        @Valid List<ScheduleConfig> schedules) {
    this.tickInterval = tickInterval;
    this.schedules = schedules == null ? List.of() : List.copyOf(schedules);
  }

  public Duration getTickInterval() {
    return tickInterval;
  }

  public List<ScheduleConfig> getSchedules() {
    return schedules;
  }

  /**
   * One configured schedule. {@code payload} is copied into every job the schedule produces.
   */
  public record ScheduleConfig(@NotBlank String id,
                               @NotBlank String trigger,
                               @NotBlank String workerType,
                               Map<String, Object> payload) {
  }
}
