package io.jobhive.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobhive.job.WorkerType;
import io.jobhive.job.WorkerTypeRegistration;
import io.jobhive.job.WorkerTypeRegistry;
import io.jobhive.job.error.DispatchUnavailableException;
import io.jobhive.job.error.ResourceExhaustedException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.AmqpTimeoutException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.ReturnedMessage;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitOperations;

@ExtendWith(MockitoExtension.class)
class AmqpJobPublisherTest {

  @Mock
  RabbitOperations rabbit;

  private AmqpJobPublisher publisher;
  private JobTopology topology;
  private final JobMessage job = new JobMessage(UUID.randomUUID(), WorkerType.COLLECTOR, null, 5, 1, Instant.now());

  @BeforeEach
  void setUp() {
    WorkerTypeRegistry registry = new WorkerTypeRegistry(List.of(
        new WorkerTypeRegistration(WorkerType.COLLECTOR, 2, "jobhive.jobs.collector")));
    topology = new JobTopology("jobhive.jobs", "jobhive.jobs.retry", "jobhive.jobs.dlx", registry);
    publisher = new AmqpJobPublisher(rabbit, topology, new JobMessageCodec(new ObjectMapper()), Duration.ofSeconds(2));
  }

  @Test
  void publishesToWorkExchangeAndWaitsForConfirm() {
    brokerAnswers(true, false);

    publisher.publish(job);

    verify(rabbit).send(eq("jobhive.jobs"), eq("collector"), any(Message.class), any(CorrelationData.class));
  }

  @Test
  void retryCopyCarriesExpirationOnRetryExchange() {
    brokerAnswers(true, false);

    publisher.publishRetry(job.nextAttempt(2, Instant.now()), Duration.ofSeconds(30));

    ArgumentCaptor<Message> sent = ArgumentCaptor.forClass(Message.class);
    verify(rabbit).send(eq("jobhive.jobs.retry"), eq("collector"), sent.capture(), any(CorrelationData.class));
    assertThat(sent.getValue().getMessageProperties().getExpiration()).isEqualTo("30000");
    assertThat((Object) sent.getValue().getMessageProperties().getHeader(JobHeaders.ATTEMPT_COUNT)).isEqualTo(2);
  }

  @Test
  void unroutableJobFailsThePublishEvenWhenConfirmed() {
    brokerAnswers(true, true);

    assertThatThrownBy(() -> publisher.publish(job))
        .isInstanceOf(AmqpException.class)
        .hasMessageContaining("unroutable")
        .hasMessageContaining("NO_ROUTE");
  }

  @Test
  void unroutableRetryCopyFailsThePublish() {
    brokerAnswers(true, true);

    assertThatThrownBy(() -> publisher.publishRetry(job, Duration.ofSeconds(5)))
        .isInstanceOf(AmqpException.class)
        .hasMessageContaining("unroutable");
  }

  @Test
  void unroutableJobSurfacesAsDispatchUnavailableOnceRetriesRunOut() {
    brokerAnswers(true, true);
    ExponentialBackoff fast = new ExponentialBackoff(Duration.ofMillis(1), Duration.ofMillis(2), 2.0);
    RetryingJobPublisher retrying = new RetryingJobPublisher(publisher, 3, fast);

    assertThatThrownBy(() -> retrying.publish(job))
        .isInstanceOf(DispatchUnavailableException.class)
        .hasCauseInstanceOf(AmqpException.class);
    verify(rabbit, times(3)).send(eq("jobhive.jobs"), eq("collector"), any(Message.class), any(CorrelationData.class));
  }

  @Test
  void negativeConfirmFailsThePublish() {
    brokerAnswers(false, false);

    assertThatThrownBy(() -> publisher.publish(job))
        .isInstanceOf(AmqpException.class)
        .hasMessageContaining("rejected");
  }

  @Test
  void missingConfirmSurfacesAsResourceExhausted() {
    AmqpJobPublisher impatient = new AmqpJobPublisher(rabbit, topology, new JobMessageCodec(new ObjectMapper()),
        Duration.ofMillis(20));

    assertThatThrownBy(() -> impatient.publish(job))
        .isInstanceOf(ResourceExhaustedException.class)
        .hasMessageContaining("did not confirm");
  }

  @Test
  void channelTimeoutSurfacesAsResourceExhausted() {
    doThrow(new AmqpTimeoutException("No available channels"))
        .when(rabbit).send(anyString(), anyString(), any(Message.class), any(CorrelationData.class));

    assertThatThrownBy(() -> publisher.publish(job)).isInstanceOf(ResourceExhaustedException.class);
  }

  private void brokerAnswers(boolean ack, boolean returned) {
    doAnswer(invocation -> {
      Message message = invocation.getArgument(2);
      CorrelationData correlation = invocation.getArgument(3);
      if (returned) {
        correlation.setReturned(new ReturnedMessage(message, 312, "NO_ROUTE",
            invocation.getArgument(0), invocation.getArgument(1)));
      }
      correlation.getFuture().complete(new CorrelationData.Confirm(ack, ack ? null : "nack"));
      return null;
    }).when(rabbit).send(anyString(), anyString(), any(Message.class), any(CorrelationData.class));
  }
}
