package io.jobhive.core.notify;

import io.jobhive.job.ChangeEvent;
import java.io.IOException;

/**
 * Transport end of a subscription. Called only from the subscription's sender thread.
 */
public interface SubscriptionSink {

  /**
   * @param cursor the subscription cursor after this event, usable to resume all channels
   */
  void send(ChangeEvent event, String cursor) throws IOException;

  void heartbeat() throws IOException;

  void close(String reason);
}
