package io.jobhive.worker;

/**
 * Settlement handle for one broker delivery. Exactly one of the methods is called per delivery.
 */
public interface JobDelivery {

  void ack();

  /**
   * @param requeue {@code true} to have the broker redeliver, {@code false} to dead-letter
   */
  void reject(boolean requeue);
}
