package io.jobhive.job;

import io.jobhive.job.error.InvalidWorkerTypeException;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only table of the worker types this deployment accepts. Built once from configuration and
 * injected wherever submissions are validated or pools are started.
 */
public final class WorkerTypeRegistry {

    private final Map<WorkerType, WorkerTypeRegistration> registrations;

    public WorkerTypeRegistry(Collection<WorkerTypeRegistration> registrations) {
        Objects.requireNonNull(registrations, "registrations");
        EnumMap<WorkerType, WorkerTypeRegistration> byType = new EnumMap<>(WorkerType.class);
        for (WorkerTypeRegistration registration : registrations) {
            WorkerTypeRegistration previous = byType.putIfAbsent(registration.type(), registration);
            if (previous != null) {
                throw new IllegalStateException("Worker type " + registration.type() + " is registered twice");
            }
        }
        if (byType.isEmpty()) {
            throw new IllegalStateException("At least one worker type must be registered");
        }
        this.registrations = Collections.unmodifiableMap(byType);
    }

    /**
     * Resolves a submitted worker type name to its registration.
     *
     * @throws InvalidWorkerTypeException when the name is unknown or not registered here
     */
    public WorkerTypeRegistration require(String workerType) {
        WorkerType type = WorkerType.fromName(workerType);
        return find(type).orElseThrow(() -> new InvalidWorkerTypeException(workerType));
    }

    public WorkerTypeRegistration require(WorkerType type) {
        return find(type).orElseThrow(() -> new InvalidWorkerTypeException(String.valueOf(type)));
    }

    public Optional<WorkerTypeRegistration> find(WorkerType type) {
        return Optional.ofNullable(registrations.get(type));
    }

    public boolean isRegistered(WorkerType type) {
        return registrations.containsKey(type);
    }

    public List<WorkerTypeRegistration> all() {
        return List.copyOf(registrations.values());
    }
}
