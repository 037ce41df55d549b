package io.jobhive.worker.rabbit;

import com.rabbitmq.client.Channel;
import io.jobhive.worker.JobDelivery;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Manual acknowledgement on the consumer channel that received the delivery.
 */
final class AmqpJobDelivery implements JobDelivery {

  private final Channel channel;
  private final long deliveryTag;

  AmqpJobDelivery(Channel channel, long deliveryTag) {
    this.channel = Objects.requireNonNull(channel, "channel");
    this.deliveryTag = deliveryTag;
  }

  @Override
  public void ack() {
    try {
      channel.basicAck(deliveryTag, false);
    } catch (IOException ex) {
      throw new UncheckedIOException("basicAck failed for delivery " + deliveryTag, ex);
    }
  }

  @Override
  public void reject(boolean requeue) {
    try {
      channel.basicNack(deliveryTag, false, requeue);
    } catch (IOException ex) {
      throw new UncheckedIOException("basicNack failed for delivery " + deliveryTag, ex);
    }
  }
}
