package io.jobhive.broker.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "jobhive.broker")
public class BrokerProperties {

  private final String exchange;
  private final String retryExchange;
  private final String deadLetterExchange;
  private final Publish publish;

  public BrokerProperties(@DefaultValue("jobhive.jobs") @NotBlank String exchange,
                          @DefaultValue("jobhive.jobs.retry") @NotBlank String retryExchange,
                          @DefaultValue("jobhive.jobs.dlx") @NotBlank String deadLetterExchange,
                          @DefaultValue @Valid Publish publish) {
    this.exchange = exchange;
    this.retryExchange = retryExchange;
    this.deadLetterExchange = deadLetterExchange;
    this.publish = Objects.requireNonNull(publish, "publish");
  }

  public String getExchange() {
    return exchange;
  }

  public String getRetryExchange() {
    return retryExchange;
  }

  public String getDeadLetterExchange() {
    return deadLetterExchange;
  }

  public Publish getPublish() {
    return publish;
  }

  @Validated
  public static final class Publish {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Duration confirmTimeout;

    public Publish(@DefaultValue("5") @Min(1) int maxAttempts,
                   @DefaultValue("200ms") @NotNull Duration initialBackoff,
                   @DefaultValue("5s") @NotNull Duration maxBackoff,
                   @DefaultValue("5s") @NotNull Duration confirmTimeout) {
      this.maxAttempts = maxAttempts;
      this.initialBackoff = initialBackoff;
      this.maxBackoff = maxBackoff;
      this.confirmTimeout = confirmTimeout;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public Duration getInitialBackoff() {
      return initialBackoff;
    }

    public Duration getMaxBackoff() {
      return maxBackoff;
    }

    public Duration getConfirmTimeout() {
      return confirmTimeout;
    }
  }
}
