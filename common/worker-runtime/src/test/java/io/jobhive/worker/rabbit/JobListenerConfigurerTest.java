package io.jobhive.worker.rabbit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.Channel;
import io.jobhive.broker.ExponentialBackoff;
import io.jobhive.broker.JobMessage;
import io.jobhive.broker.JobMessageCodec;
import io.jobhive.broker.JobPublisher;
import io.jobhive.broker.JobTopology;
import io.jobhive.client.CoreApi;
import io.jobhive.job.WorkerType;
import io.jobhive.job.WorkerTypeRegistration;
import io.jobhive.job.WorkerTypeRegistry;
import io.jobhive.worker.JobContext;
import io.jobhive.worker.JobHandler;
import io.jobhive.worker.JobWorkerRuntime;
import io.jobhive.worker.RuntimeSettings;
import io.jobhive.worker.WorkerPool;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerEndpoint;
import org.springframework.amqp.rabbit.listener.RabbitListenerEndpointRegistrar;
import org.springframework.amqp.rabbit.listener.api.ChannelAwareMessageListener;

class JobListenerConfigurerTest {

  private final WorkerTypeRegistration registration =
      new WorkerTypeRegistration(WorkerType.BOT, 3, "jobhive.jobs.bot");
  private final JobMessageCodec codec = new JobMessageCodec(new ObjectMapper());
  private final JobWorkerRuntime runtime = new JobWorkerRuntime(
      List.of(new WorkerPool(registration, new JobHandler() {
        @Override
        public WorkerType workerType() {
          return WorkerType.BOT;
        }

        @Override
        public JsonNode handle(JobContext context) {
          return null;
        }
      })),
      codec,
      mock(JobPublisher.class),
      mock(CoreApi.class),
      new RuntimeSettings(3, Duration.ofSeconds(5), new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(1), 1.0)),
      new SimpleMeterRegistry(),
      Clock.systemUTC());

  @AfterEach
  void tearDown() {
    runtime.close();
  }

  @Test
  void registersOneManualAckEndpointPerPoolSizedToItsLimit() throws Exception {
    JobTopology topology = new JobTopology("jobhive.jobs", "jobhive.jobs.retry", "jobhive.jobs.dlx",
        new WorkerTypeRegistry(List.of(registration)));
    SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
    RabbitListenerEndpointRegistrar registrar = mock(RabbitListenerEndpointRegistrar.class);

    new JobListenerConfigurer(runtime, topology, factory).configureRabbitListeners(registrar);

    ArgumentCaptor<SimpleRabbitListenerEndpoint> endpoint = ArgumentCaptor.forClass(SimpleRabbitListenerEndpoint.class);
    verify(registrar).registerEndpoint(endpoint.capture(), eq(factory));
    assertThat(endpoint.getValue().getQueueNames()).containsExactly("jobhive.jobs.bot");
    assertThat(endpoint.getValue().getConcurrency()).isEqualTo("3");

    Channel channel = mock(Channel.class);
    Message message = codec.encode(new JobMessage(UUID.randomUUID(), WorkerType.BOT, null, 5, 0, Instant.now()));
    message.getMessageProperties().setDeliveryTag(42L);
    ((ChannelAwareMessageListener) endpoint.getValue().getMessageListener()).onMessage(message, channel);

    verify(channel).basicAck(42L, false);
  }
}
