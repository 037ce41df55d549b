package io.jobhive.worker;

import io.jobhive.job.WorkerType;
import io.jobhive.job.WorkerTypeRegistration;
import io.jobhive.job.WorkerTypeRegistry;
import io.jobhive.job.error.InvalidWorkerTypeException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves the pools a worker process runs from its configured type list. Misconfiguration
 * (unknown name, unregistered type, type without handler) fails startup.
 */
public final class WorkerPools {

  private WorkerPools() {
  }

  public static List<WorkerPool> resolve(Collection<String> configuredTypes,
                                         WorkerTypeRegistry registry,
                                         JobHandlerRegistry handlers) {
    Set<WorkerType> served = EnumSet.noneOf(WorkerType.class);
    if (configuredTypes == null || configuredTypes.isEmpty()) {
      handlers.types().stream().filter(registry::isRegistered).forEach(served::add);
    } else {
      for (String name : configuredTypes) {
        WorkerType type;
        try {
          type = WorkerType.fromName(name);
        } catch (InvalidWorkerTypeException ex) {
          throw new IllegalStateException("Configured worker type '" + name + "' is unknown", ex);
        }
        served.add(type);
      }
    }
    if (served.isEmpty()) {
      throw new IllegalStateException("Worker process serves no worker types");
    }
    List<WorkerPool> pools = new ArrayList<>();
    for (WorkerType type : served) {
      WorkerTypeRegistration registration = registry.find(type)
          .orElseThrow(() -> new IllegalStateException("Worker type " + type + " has no registration"));
      JobHandler handler = handlers.find(type)
          .orElseThrow(() -> new IllegalStateException("Worker type " + type + " has no handler"));
      pools.add(new WorkerPool(registration, handler));
    }
    return pools;
  }
}
