package io.jobhive.core.notify;

import io.jobhive.job.ChangeEvent;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One open stream. Holds an outbound queue that only the broker fills and only the sender thread
 * drains.
 */
public final class Subscription {

  private static final Object CLOSE_SIGNAL = new Object();

  private final String id = UUID.randomUUID().toString();
  private final String clientId;
  private final Set<String> channels;
  private final int watermark;
  private final SubscriptionSink sink;
  private final BlockingQueue<Object> outbound = new LinkedBlockingQueue<>();
  private final Map<String, Long> delivered;
  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicReference<String> closeReason = new AtomicReference<>();

  Subscription(String clientId, Set<String> channels, Map<String, Long> resumeFrom, int watermark,
               SubscriptionSink sink) {
    this.clientId = clientId;
    this.channels = Collections.unmodifiableSet(channels);
    this.watermark = watermark;
    this.sink = Objects.requireNonNull(sink, "sink");
    this.delivered = new LinkedHashMap<>(resumeFrom);
  }

  public String id() {
    return id;
  }

  public String clientId() {
    return clientId;
  }

  public Set<String> channels() {
    return channels;
  }

  public boolean isClosed() {
    return closed.get();
  }

  public String closeReason() {
    return closeReason.get();
  }

  int queued() {
    return outbound.size();
  }

  /**
   * Replay path; replayed events are never subject to the watermark.
   */
  void enqueueReplay(ChangeEvent event) {
    outbound.add(event);
  }

  /**
   * @return false when the subscriber is at its watermark and must be dropped
   */
  boolean offerLive(ChangeEvent event) {
    if (closed.get()) {
      return true;
    }
    if (outbound.size() >= watermark) {
      return false;
    }
    outbound.add(event);
    return true;
  }

  /**
   * @return true if this call closed the subscription
   */
  boolean markClosed(String reason) {
    if (!closed.compareAndSet(false, true)) {
      return false;
    }
    closeReason.set(reason);
    outbound.add(CLOSE_SIGNAL);
    return true;
  }

  /**
   * Sender loop. Runs until the subscription is closed or the transport fails.
   *
   * @param onTransportFailure invoked once when the sink rejects a write
   */
  void drain(long heartbeatMillis, Runnable onTransportFailure) {
    try {
      while (!closed.get()) {
        Object next = outbound.poll(heartbeatMillis, TimeUnit.MILLISECONDS);
        if (next == CLOSE_SIGNAL) {
          break;
        }
        if (next == null) {
          sink.heartbeat();
          continue;
        }
        ChangeEvent event = (ChangeEvent) next;
        delivered.put(event.channel(), event.sequence());
        sink.send(event, SubscriptionCursor.format(delivered));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      markClosed("shutdown");
    } catch (Exception e) {
      markClosed("transport failure: " + e.getMessage());
      onTransportFailure.run();
    } finally {
      sink.close(closeReason.get());
    }
  }
}
