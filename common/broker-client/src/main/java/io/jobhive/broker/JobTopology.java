package io.jobhive.broker;

import io.jobhive.job.Job;
import io.jobhive.job.WorkerType;
import io.jobhive.job.WorkerTypeRegistration;
import io.jobhive.job.WorkerTypeRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Declarable;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;

/**
 * Queue layout for typed jobs. Per worker type:
 * <ul>
 *   <li>work queue {@code <binding>} on the work exchange, dead-lettering into the DLX</li>
 *   <li>retry queue {@code <binding>.retry} on the retry exchange; expired messages return to the work exchange</li>
 *   <li>dead-letter queue {@code <binding>.dlq} on the DLX</li>
 * </ul>
 * All exchanges are direct and keyed by {@link WorkerType#routingKey()}.
 */
public final class JobTopology {

  private final String workExchange;
  private final String retryExchange;
  private final String deadLetterExchange;
  private final WorkerTypeRegistry registry;

  public JobTopology(String workExchange, String retryExchange, String deadLetterExchange, WorkerTypeRegistry registry) {
    this.workExchange = requireName(workExchange, "workExchange");
    this.retryExchange = requireName(retryExchange, "retryExchange");
    this.deadLetterExchange = requireName(deadLetterExchange, "deadLetterExchange");
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  public String workExchange() {
    return workExchange;
  }

  public String retryExchange() {
    return retryExchange;
  }

  public String deadLetterExchange() {
    return deadLetterExchange;
  }

  public String routingKey(WorkerType type) {
    return type.routingKey();
  }

  public String workQueue(WorkerType type) {
    return registry.require(type).queueBinding();
  }

  public String retryQueue(WorkerType type) {
    return workQueue(type) + ".retry";
  }

  public String deadLetterQueue(WorkerType type) {
    return workQueue(type) + ".dlq";
  }

  public Declarables declarables() {
    List<Declarable> declarables = new ArrayList<>();
    DirectExchange work = ExchangeBuilder.directExchange(workExchange).durable(true).build();
    DirectExchange retry = ExchangeBuilder.directExchange(retryExchange).durable(true).build();
    DirectExchange dead = ExchangeBuilder.directExchange(deadLetterExchange).durable(true).build();
    declarables.add(work);
    declarables.add(retry);
    declarables.add(dead);
    for (WorkerTypeRegistration registration : registry.all()) {
      WorkerType type = registration.type();
      String key = routingKey(type);
      Queue workQueue = QueueBuilder.durable(workQueue(type))
          .deadLetterExchange(deadLetterExchange)
          .deadLetterRoutingKey(key)
          .maxPriority(Job.MAX_PRIORITY)
          .build();
      Queue retryQueue = QueueBuilder.durable(retryQueue(type))
          .deadLetterExchange(workExchange)
          .deadLetterRoutingKey(key)
          .build();
      Queue deadLetterQueue = QueueBuilder.durable(deadLetterQueue(type)).build();
      Binding workBinding = BindingBuilder.bind(workQueue).to(work).with(key);
      Binding retryBinding = BindingBuilder.bind(retryQueue).to(retry).with(key);
      Binding deadBinding = BindingBuilder.bind(deadLetterQueue).to(dead).with(key);
      declarables.add(workQueue);
      declarables.add(retryQueue);
      declarables.add(deadLetterQueue);
      declarables.add(workBinding);
      declarables.add(retryBinding);
      declarables.add(deadBinding);
    }
    return new Declarables(declarables);
  }

  private static String requireName(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be null or blank");
    }
    return value;
  }
}
