package io.jobhive.worker.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "jobhive.worker")
public class WorkerRuntimeProperties {

  private final List<String> types;
  private final int maxAttempts;
  private final Duration executionDeadline;
  private final Duration retryBackoffInitial;
  private final Duration retryBackoffMax;

  public WorkerRuntimeProperties(List<String> types,
                                 @DefaultValue("3") @Min(1) int maxAttempts,
                                 @DefaultValue("60s") @NotNull Duration executionDeadline,
                                 @DefaultValue("60s") @NotNull Duration retryBackoffInitial,
                                 @DefaultValue("10m") @NotNull Duration retryBackoffMax) {
    this.types = types == null ? List.of() : List.copyOf(types);
    this.maxAttempts = maxAttempts;
    this.executionDeadline = executionDeadline;
    this.retryBackoffInitial = retryBackoffInitial;
    this.retryBackoffMax = retryBackoffMax;
  }

  /**
   * Worker types served by this process; empty means every registered type with a handler.
   */
  public List<String> getTypes() {
    return types;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public Duration getExecutionDeadline() {
    return executionDeadline;
  }

  public Duration getRetryBackoffInitial() {
    return retryBackoffInitial;
  }

  public Duration getRetryBackoffMax() {
    return retryBackoffMax;
  }
}
