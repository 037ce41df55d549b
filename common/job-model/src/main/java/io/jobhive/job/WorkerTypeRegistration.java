package io.jobhive.job;

import java.util.Objects;

public record WorkerTypeRegistration(WorkerType type, int concurrencyLimit, String queueBinding) {

    public WorkerTypeRegistration {
        Objects.requireNonNull(type, "type");
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException(
                "concurrencyLimit for %s must be at least 1 but was %d".formatted(type, concurrencyLimit));
        }
        if (queueBinding == null || queueBinding.isBlank()) {
            throw new IllegalArgumentException("queueBinding for %s must not be blank".formatted(type));
        }
    }
}
