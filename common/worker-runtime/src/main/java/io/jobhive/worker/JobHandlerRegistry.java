package io.jobhive.worker;

import io.jobhive.job.WorkerType;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

public final class JobHandlerRegistry {

  private final Map<WorkerType, JobHandler> handlers;

  public JobHandlerRegistry(Collection<? extends JobHandler> handlers) {
    Objects.requireNonNull(handlers, "handlers");
    EnumMap<WorkerType, JobHandler> byType = new EnumMap<>(WorkerType.class);
    for (JobHandler handler : handlers) {
      WorkerType type = Objects.requireNonNull(handler.workerType(), "workerType");
      JobHandler previous = byType.putIfAbsent(type, handler);
      if (previous != null) {
        throw new IllegalStateException("Duplicate handlers for %s: %s and %s".formatted(
            type, previous.getClass().getName(), handler.getClass().getName()));
      }
    }
    this.handlers = Collections.unmodifiableMap(byType);
  }

  public Optional<JobHandler> find(WorkerType type) {
    return Optional.ofNullable(handlers.get(type));
  }

  public Set<WorkerType> types() {
    return handlers.keySet();
  }
}
