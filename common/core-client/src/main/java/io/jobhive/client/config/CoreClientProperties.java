package io.jobhive.client.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "jobhive.core")
public class CoreClientProperties {

    private final String url;
    private final String apiKey;
    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final int maxAttempts;
    private final Duration retryBackoff;

    public CoreClientProperties(@NotBlank String url,
                                @NotBlank String apiKey,
                                @DefaultValue("5s") @NotNull Duration connectTimeout,
                                @DefaultValue("30s") @NotNull Duration requestTimeout,
                                @DefaultValue("3") @Min(1) int maxAttempts,
                                @DefaultValue("500ms") @NotNull Duration retryBackoff) {
        this.url = url;
        this.apiKey = apiKey;
        this.connectTimeout = connectTimeout;
        this.requestTimeout = requestTimeout;
        this.maxAttempts = maxAttempts;
        this.retryBackoff = retryBackoff;
    }

    public String getUrl() {
        return url;
    }

    public String getApiKey() {
        return apiKey;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }
}
