package io.jobhive.worker.rabbit;

import io.jobhive.broker.JobTopology;
import io.jobhive.worker.JobWorkerRuntime;
import io.jobhive.worker.WorkerPool;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.rabbit.annotation.RabbitListenerConfigurer;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerEndpoint;
import org.springframework.amqp.rabbit.listener.RabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.listener.RabbitListenerEndpointRegistrar;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;

/**
 * Registers one listener endpoint per served worker type. Each endpoint runs
 * {@code concurrencyLimit} consumers with a prefetch of one and manual acknowledgement, so the
 * broker never has more unacknowledged deliveries outstanding than the pool can execute.
 */
public final class JobListenerConfigurer implements RabbitListenerConfigurer {

  private static final Logger log = LoggerFactory.getLogger(JobListenerConfigurer.class);

  private final JobWorkerRuntime runtime;
  private final JobTopology topology;
  private final RabbitListenerContainerFactory<?> containerFactory;

  public JobListenerConfigurer(JobWorkerRuntime runtime,
                               JobTopology topology,
                               RabbitListenerContainerFactory<?> containerFactory) {
    this.runtime = Objects.requireNonNull(runtime, "runtime");
    this.topology = Objects.requireNonNull(topology, "topology");
    this.containerFactory = Objects.requireNonNull(containerFactory, "containerFactory");
  }

  @Override
  public void configureRabbitListeners(RabbitListenerEndpointRegistrar registrar) {
    runtime.pools().values().forEach(pool -> registerEndpoint(registrar, pool));
  }

  private void registerEndpoint(RabbitListenerEndpointRegistrar registrar, WorkerPool pool) {
    String queue = topology.workQueue(pool.registration().type());
    String concurrency = Integer.toString(pool.concurrencyLimit());
    SimpleRabbitListenerEndpoint endpoint = new SimpleRabbitListenerEndpoint();
    endpoint.setId("jobhive-" + pool.registration().type().routingKey());
    endpoint.setQueueNames(queue);
    endpoint.setConcurrency(concurrency);
    endpoint.setMessageListener((ChannelAwareMessageListener) (message, channel) ->
        runtime.process(message, new AmqpJobDelivery(channel, message.getMessageProperties().getDeliveryTag())));
    registrar.registerEndpoint(endpoint, containerFactory);
    log.info("Registered job listener {} on queue {} with {} consumers", endpoint.getId(), queue, concurrency);
  }
}
