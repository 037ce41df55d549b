package io.jobhive.beat.infra;

import io.jobhive.beat.domain.Schedule;
import io.jobhive.beat.domain.ScheduleDefinition;
import io.jobhive.beat.domain.ScheduleStore;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Non-durable store for local runs and tests. A busy lock is skipped, like the row lock of the
 * JDBC store.
 */
@Component
@ConditionalOnProperty(name = "jobhive.beat.store", havingValue = "memory")
public class InMemoryScheduleStore implements ScheduleStore {

  private final Map<String, Schedule> schedules = new ConcurrentSkipListMap<>();
  private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  @Override
  public List<String> ids() {
    return List.copyOf(schedules.keySet());
  }

  @Override
  public Optional<Schedule> find(String id) {
    return Optional.ofNullable(schedules.get(id));
  }

  @Override
  public FireOutcome fire(String id, FireAction action) {
    ReentrantLock lock = locks.computeIfAbsent(id, ignored -> new ReentrantLock());
    if (!lock.tryLock()) {
      return FireOutcome.SKIPPED;
    }
    try {
      Schedule schedule = schedules.get(id);
      if (schedule == null) {
        return FireOutcome.SKIPPED;
      }
      Optional<Instant> tick = action.fire(schedule);
      if (tick.isEmpty()) {
        return FireOutcome.NOT_DUE;
      }
      schedules.put(id, new Schedule(schedule.id(), schedule.trigger(), schedule.workerType(), schedule.payload(),
          schedule.createdAt(), tick.get()));
      return FireOutcome.FIRED;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean upsert(ScheduleDefinition definition, Instant now) {
    Schedule previous = schedules.get(definition.id());
    Instant createdAt = previous == null ? now : previous.createdAt();
    Instant lastFiredAt = previous == null ? now : previous.lastFiredAt();
    schedules.put(definition.id(), new Schedule(definition.id(), definition.trigger(), definition.workerType(),
        definition.payload(), createdAt, lastFiredAt));
    return previous == null;
  }

  /**
   * Stores a schedule as is, including firing state.
   */
  public void put(Schedule schedule) {
    schedules.put(schedule.id(), schedule);
  }
}
