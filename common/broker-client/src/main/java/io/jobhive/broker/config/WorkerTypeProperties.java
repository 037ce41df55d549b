package io.jobhive.broker.config;

import io.jobhive.job.WorkerType;
import io.jobhive.job.WorkerTypeRegistration;
import io.jobhive.job.WorkerTypeRegistry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Registration table for worker types, bound from {@code jobhive.worker-types.<type>.*}.
 */
@Validated
@ConfigurationProperties(prefix = "jobhive")
public class WorkerTypeProperties {

  private final Map<WorkerType, Registration> workerTypes;

  public WorkerTypeProperties(@Valid Map<WorkerType, Registration> workerTypes) {
    this.workerTypes = workerTypes == null ? Map.of() : new EnumMap<>(workerTypes);
  }

  public Map<WorkerType, Registration> getWorkerTypes() {
    return workerTypes;
  }

  public WorkerTypeRegistry toRegistry(String queuePrefix) {
    List<WorkerTypeRegistration> registrations = new ArrayList<>();
    workerTypes.forEach((type, registration) -> {
      String queue = registration.getQueue();
      if (queue == null || queue.isBlank()) {
        queue = queuePrefix + "." + type.routingKey();
      }
      registrations.add(new WorkerTypeRegistration(type, registration.getConcurrencyLimit(), queue));
    });
    return new WorkerTypeRegistry(registrations);
  }

  @Validated
  public static final class Registration {

    private final int concurrencyLimit;
    private final String queue;

    public Registration(@DefaultValue("1") @Min(1) int concurrencyLimit, String queue) {
      this.concurrencyLimit = concurrencyLimit;
      this.queue = queue;
    }

    public int getConcurrencyLimit() {
      return concurrencyLimit;
    }

    public String getQueue() {
      return queue;
    }
  }
}
