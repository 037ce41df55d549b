package io.jobhive.broker;

import io.jobhive.job.error.DispatchUnavailableException;
import io.jobhive.job.error.ResourceExhaustedException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.AmqpTimeoutException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.ReturnedMessage;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.connection.CorrelationData.Confirm;
import org.springframework.amqp.rabbit.core.RabbitOperations;

/**
 * Publishes job messages as mandatory and blocks until the broker confirms them. A message the
 * broker could not route counts as a failed publish. Requires
 * {@code spring.rabbitmq.publisher-confirm-type=correlated}, {@code publisher-returns=true} and a
 * mandatory template.
 */
public final class AmqpJobPublisher implements JobPublisher {

  private static final Logger log = LoggerFactory.getLogger(AmqpJobPublisher.class);

  private final RabbitOperations rabbit;
  private final JobTopology topology;
  private final JobMessageCodec codec;
  private final Duration confirmTimeout;

  public AmqpJobPublisher(RabbitOperations rabbit, JobTopology topology, JobMessageCodec codec, Duration confirmTimeout) {
    this.rabbit = Objects.requireNonNull(rabbit, "rabbit");
    this.topology = Objects.requireNonNull(topology, "topology");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.confirmTimeout = Objects.requireNonNull(confirmTimeout, "confirmTimeout");
  }

  @Override
  public void publish(JobMessage job) {
    Objects.requireNonNull(job, "job");
    Message message = codec.encode(job);
    send(topology.workExchange(), topology.routingKey(job.workerType()), message, job);
    log.debug("published job {} type={} attempt={}", job.jobId(), job.workerType(), job.attemptCount());
  }

  @Override
  public void publishRetry(JobMessage job, Duration delay) {
    Objects.requireNonNull(job, "job");
    Objects.requireNonNull(delay, "delay");
    Message message = codec.encode(job);
    message.getMessageProperties().setExpiration(Long.toString(Math.max(0L, delay.toMillis())));
    send(topology.retryExchange(), topology.routingKey(job.workerType()), message, job);
    log.debug("parked job {} type={} attempt={} for {}", job.jobId(), job.workerType(), job.attemptCount(), delay);
  }

  private void send(String exchange, String routingKey, Message message, JobMessage job) {
    CorrelationData correlation = new CorrelationData(job.jobId() + ":" + job.attemptCount());
    Confirm confirm;
    try {
      rabbit.send(exchange, routingKey, message, correlation);
      confirm = correlation.getFuture().get(confirmTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (AmqpTimeoutException ex) {
      throw new ResourceExhaustedException("Broker channel unavailable within timeout", ex);
    } catch (TimeoutException ex) {
      throw new ResourceExhaustedException("Broker did not confirm job " + job.jobId() + " within " + confirmTimeout, ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new DispatchUnavailableException("Interrupted while waiting for publish confirm", ex);
    } catch (ExecutionException ex) {
      throw new AmqpException("Publish confirm failed for job " + job.jobId(), ex.getCause());
    }
    if (!confirm.isAck()) {
      throw new AmqpException("Broker rejected job %s: %s".formatted(job.jobId(), confirm.getReason()));
    }
    // a returned message is set before the confirm completes
    ReturnedMessage returned = correlation.getReturned();
    if (returned != null) {
      throw new AmqpException("Job %s unroutable via %s/%s: %s".formatted(
          job.jobId(), returned.getExchange(), returned.getRoutingKey(), returned.getReplyText()));
    }
  }
}
