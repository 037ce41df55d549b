package io.jobhive.job;

import io.jobhive.job.error.InvalidWorkerTypeException;
import java.util.Locale;

/**
 * Closed set of job handler categories. Configuration may name a type by its constant
 * ({@code COLLECTOR}) or by its pool label ({@code Collectors}); anything else is rejected.
 */
public enum WorkerType {
    COLLECTOR("Collectors"),
    BOT("Bots"),
    PRESENTER("Presenters"),
    PUBLISHER("Publishers");

    private final String poolLabel;

    WorkerType(String poolLabel) {
        this.poolLabel = poolLabel;
    }

    public String poolLabel() {
        return poolLabel;
    }

    /**
     * Lower-case token used in queue names and routing keys.
     */
    public String routingKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static WorkerType fromName(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidWorkerTypeException(String.valueOf(value));
        }
        String candidate = value.trim();
        for (WorkerType type : values()) {
            if (type.name().equalsIgnoreCase(candidate) || type.poolLabel.equalsIgnoreCase(candidate)) {
                return type;
            }
        }
        throw new InvalidWorkerTypeException(candidate);
    }
}
