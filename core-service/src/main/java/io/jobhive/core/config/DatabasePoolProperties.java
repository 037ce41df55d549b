package io.jobhive.core.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Connection pool sizing, taken from {@code DB_POOL_SIZE}, {@code DB_POOL_RECYCLE} and
 * {@code DB_POOL_TIMEOUT} (both in seconds).
 */
@Validated
@ConfigurationProperties(prefix = "jobhive.db")
public record DatabasePoolProperties(@DefaultValue("100") @Min(1) int poolSize,
                                     @DefaultValue("300s") @NotNull Duration recycle,
                                     @DefaultValue("5s") @NotNull Duration timeout) {
}
