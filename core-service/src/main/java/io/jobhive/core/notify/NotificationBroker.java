package io.jobhive.core.notify;

import com.fasterxml.jackson.databind.JsonNode;
import io.jobhive.core.config.NotificationProperties;
import io.jobhive.job.ChangeEvent;
import io.jobhive.job.error.InvalidRequestException;
import io.jobhive.job.error.ResourceExhaustedException;
import io.jobhive.job.error.ResumeGapException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory fan-out of change events. Sequences are assigned per channel under the channel lock,
 * and the same lock covers subscriber registration, so a resuming subscriber sees every event
 * after its cursor exactly once.
 * <p>
 * Producers never block on subscribers: each subscription has its own outbound queue and sender
 * thread, and a subscription whose queue reaches the watermark is disconnected.
 */
public class NotificationBroker implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(NotificationBroker.class);

  private final Map<String, ChannelState> channels = new ConcurrentHashMap<>();
  private final Set<Subscription> subscriptions = ConcurrentHashMap.newKeySet();
  private final AtomicInteger subscriberCount = new AtomicInteger();
  private final int replayWindow;
  private final int watermark;
  private final int maxSubscribers;
  private final long heartbeatMillis;
  private final Clock clock;
  private final ExecutorService senders;
  private final Counter published;
  private final Counter slowDisconnects;

  public NotificationBroker(NotificationProperties properties, Clock clock, MeterRegistry meters) {
    Objects.requireNonNull(properties, "properties");
    this.replayWindow = properties.getReplayWindow();
    this.watermark = properties.getSubscriberBuffer();
    this.maxSubscribers = properties.getMaxSubscribers();
    this.heartbeatMillis = Math.max(1L, properties.getHeartbeatInterval().toMillis());
    this.clock = Objects.requireNonNull(clock, "clock");
    AtomicInteger threadIds = new AtomicInteger();
    this.senders = Executors.newCachedThreadPool(runnable -> {
      Thread thread = new Thread(runnable, "jobhive-sse-" + threadIds.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
    this.published = Counter.builder("jobhive.notifications.published").register(meters);
    this.slowDisconnects = Counter.builder("jobhive.notifications.disconnects")
        .tag("reason", "slow_consumer")
        .register(meters);
    meters.gauge("jobhive.notifications.subscribers", subscriberCount);
  }

  public ChangeEvent publish(String channel, JsonNode payload) {
    requireChannel(channel);
    Objects.requireNonNull(payload, "payload");
    ChannelState state = state(channel);
    List<Subscription> overflowed = new ArrayList<>();
    ChangeEvent event;
    state.lock.lock();
    try {
      event = new ChangeEvent(channel, state.latest + 1, payload, clock.instant());
      state.latest = event.sequence();
      state.window.addLast(event);
      while (state.window.size() > replayWindow) {
        state.window.removeFirst();
      }
      for (Subscription subscription : state.subscribers) {
        if (!subscription.offerLive(event)) {
          overflowed.add(subscription);
        }
      }
      state.subscribers.removeAll(overflowed);
    } finally {
      state.lock.unlock();
    }
    published.increment();
    for (Subscription slow : overflowed) {
      log.warn("Disconnecting slow subscriber {} (client {}) on channel {} at sequence {}",
          slow.id(), slow.clientId(), channel, event.sequence());
      slowDisconnects.increment();
      close(slow, "slow consumer");
    }
    return event;
  }

  /**
   * Opens a subscription. Channels present in {@code resumeFrom} replay everything after the given
   * sequence; other channels start with the next live event.
   *
   * @throws ResumeGapException when a cursor is outside the retained window
   * @throws ResourceExhaustedException when the subscriber cap is reached
   */
  public Subscription subscribe(String clientId, Set<String> requested, Map<String, Long> resumeFrom,
                                SubscriptionSink sink) {
    if (requested == null || requested.isEmpty()) {
      throw new InvalidRequestException("At least one channel is required");
    }
    requested.forEach(NotificationBroker::requireChannel);
    Map<String, Long> cursor = resumeFrom == null ? Map.of() : resumeFrom;
    if (subscriberCount.incrementAndGet() > maxSubscribers) {
      subscriberCount.decrementAndGet();
      throw new ResourceExhaustedException("Subscriber limit of " + maxSubscribers + " reached");
    }
    Subscription subscription;
    try {
      subscription = register(clientId, new TreeSet<>(requested), cursor, sink);
    } catch (RuntimeException e) {
      subscriberCount.decrementAndGet();
      throw e;
    }
    subscriptions.add(subscription);
    try {
      senders.execute(() -> subscription.drain(heartbeatMillis, () -> close(subscription, null)));
    } catch (RejectedExecutionException e) {
      close(subscription, "shutdown");
      throw new ResourceExhaustedException("Notification broker is shutting down", e);
    }
    log.debug("Subscription {} opened for client {} on {}", subscription.id(), clientId, requested);
    return subscription;
  }

  public void unsubscribe(Subscription subscription) {
    close(subscription, "unsubscribed");
  }

  public int subscriberCount() {
    return subscriberCount.get();
  }

  public long latestSequence(String channel) {
    ChannelState state = channels.get(channel);
    if (state == null) {
      return 0L;
    }
    state.lock.lock();
    try {
      return state.latest;
    } finally {
      state.lock.unlock();
    }
  }

  @Override
  public void close() {
    for (Subscription subscription : List.copyOf(subscriptions)) {
      close(subscription, "shutdown");
    }
    senders.shutdownNow();
  }

  private Subscription register(String clientId, TreeSet<String> requested, Map<String, Long> cursor,
                                SubscriptionSink sink) {
    List<ChannelState> states = new ArrayList<>();
    for (String channel : requested) {
      states.add(state(channel));
    }
    // sorted acquisition order keeps concurrent multi-channel subscribes deadlock free
    states.forEach(state -> state.lock.lock());
    try {
      for (ChannelState state : states) {
        Long from = cursor.get(state.name);
        if (from != null) {
          long oldest = state.oldestRetained();
          if (from > state.latest || from < oldest - 1) {
            throw new ResumeGapException(state.name, from, oldest);
          }
        }
      }
      Map<String, Long> positions = new TreeMap<>();
      for (ChannelState state : states) {
        positions.put(state.name, cursor.getOrDefault(state.name, state.latest));
      }
      Subscription subscription = new Subscription(clientId, new LinkedHashSet<>(requested), positions,
          watermark, sink);
      for (ChannelState state : states) {
        Long from = cursor.get(state.name);
        if (from != null) {
          for (ChangeEvent event : state.window) {
            if (event.sequence() > from) {
              subscription.enqueueReplay(event);
            }
          }
        }
        state.subscribers.add(subscription);
      }
      return subscription;
    } finally {
      states.forEach(state -> state.lock.unlock());
    }
  }

  private void close(Subscription subscription, String reason) {
    subscription.markClosed(reason);
    if (!subscriptions.remove(subscription)) {
      return;
    }
    subscriberCount.decrementAndGet();
    for (String channel : subscription.channels()) {
      ChannelState state = channels.get(channel);
      if (state == null) {
        continue;
      }
      state.lock.lock();
      try {
        state.subscribers.remove(subscription);
      } finally {
        state.lock.unlock();
      }
    }
    log.debug("Subscription {} closed: {}", subscription.id(), subscription.closeReason());
  }

  private ChannelState state(String channel) {
    return channels.computeIfAbsent(channel, ChannelState::new);
  }

  private static void requireChannel(String channel) {
    if (channel == null || channel.isBlank() || channel.contains(":") || channel.contains(";")) {
      throw new InvalidRequestException("Invalid channel name '" + channel + "'");
    }
  }

  private static final class ChannelState {
    private final String name;
    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<ChangeEvent> window = new ArrayDeque<>();
    private final Set<Subscription> subscribers = new LinkedHashSet<>();
    private long latest;

    private ChannelState(String name) {
      this.name = name;
    }

    private long oldestRetained() {
      return window.isEmpty() ? latest + 1 : window.peekFirst().sequence();
    }
  }
}
