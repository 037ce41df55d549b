package io.jobhive.beat.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent schedules. Firing happens under a per-schedule lock that concurrent beat instances
 * skip rather than wait for.
 */
public interface ScheduleStore {

  List<String> ids();

  Optional<Schedule> find(String id);

  /**
   * Locks the schedule and runs {@code action}. If the action returns a tick, {@code lastFiredAt}
   * is advanced to it in the same transaction; if it throws, nothing is changed.
   *
   * @return {@link FireOutcome#SKIPPED} when another instance holds the lock or the schedule is gone
   * @throws io.jobhive.job.error.ScheduleStoreCorruptedException when the stored row is unreadable
   */
  FireOutcome fire(String id, FireAction action);

  /**
   * Inserts the schedule anchored at {@code now}, or updates trigger, worker type and payload of an
   * existing one while keeping its anchor and last fired tick.
   *
   * @return whether the schedule was newly created
   */
  boolean upsert(ScheduleDefinition definition, Instant now);

  @FunctionalInterface
  interface FireAction {
    Optional<Instant> fire(Schedule schedule);
  }

  enum FireOutcome {
    FIRED,
    NOT_DUE,
    SKIPPED
  }
}
