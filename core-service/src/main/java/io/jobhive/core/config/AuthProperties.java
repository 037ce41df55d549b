package io.jobhive.core.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "jobhive.auth")
public class AuthProperties {

    private static final int MIN_SECRET_BYTES = 32;

    private final String apiKey;
    private final String jwtSecret;
    private final List<String> submitRoles;
    private final Duration clockSkew;

    public AuthProperties(@NotBlank String apiKey,
                          @NotBlank String jwtSecret,
                          @DefaultValue("JOB_SUBMIT") List<String> submitRoles,
                          @DefaultValue("30s") @NotNull Duration clockSkew) {
        if (jwtSecret != null && jwtSecret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException(
                "jobhive.auth.jwt-secret must be at least %d bytes for HS256".formatted(MIN_SECRET_BYTES));
        }
        this.apiKey = apiKey;
        this.jwtSecret = jwtSecret;
        this.submitRoles = submitRoles == null ? List.of() : List.copyOf(submitRoles);
        this.clockSkew = clockSkew;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getJwtSecret() {
        return jwtSecret;
    }

    public List<String> getSubmitRoles() {
        return submitRoles;
    }

    public Duration getClockSkew() {
        return clockSkew;
    }
}
