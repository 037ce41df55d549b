package io.jobhive.beat.app;

import io.jobhive.beat.domain.Schedule;
import io.jobhive.beat.domain.ScheduleStore;
import io.jobhive.beat.domain.Trigger;
import io.jobhive.client.CoreApi;
import io.jobhive.job.JobReceipt;
import io.jobhive.job.JobRequest;
import io.jobhive.job.error.InvalidWorkerTypeException;
import io.jobhive.job.error.JobHiveException;
import io.jobhive.job.error.ScheduleStoreCorruptedException;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * The beat loop. Each tick walks every schedule and fires the latest due tick of each, at most
 * once: the job is submitted with a key derived from the tick and {@code lastFiredAt} only moves
 * forward when the submission went through.
 * <p>
 * A corrupted schedule halts the loop for good; nothing is enqueued after that until an operator
 * repairs the store and restarts the service.
 */
public class BeatScheduler {

  private static final Logger log = LoggerFactory.getLogger(BeatScheduler.class);

  private final ScheduleStore store;
  private final CoreApi core;
  private final Clock clock;
  private final MeterRegistry meters;
  private final AtomicReference<ScheduleStoreCorruptedException> halted = new AtomicReference<>();

  public BeatScheduler(ScheduleStore store, CoreApi core, Clock clock, MeterRegistry meters) {
    this.store = store;
    this.core = core;
    this.clock = clock;
    this.meters = meters;
  }

  public void tick() {
    if (isHalted()) {
      return;
    }
    Instant now = clock.instant();
    List<String> ids;
    try {
      ids = store.ids();
    } catch (RuntimeException e) {
      log.warn("Schedule store unavailable, skipping tick: {}", e.getMessage());
      return;
    }
    for (String id : ids) {
      MDC.put("schedule_id", id);
      try {
        store.fire(id, schedule -> fire(schedule, now));
      } catch (ScheduleStoreCorruptedException e) {
        halted.set(e);
        meters.counter("jobhive.beat.halted").increment();
        log.error("Schedule store corrupted, beat halted: {}", e.getMessage(), e);
        return;
      } catch (JobHiveException e) {
        log.warn("Schedule {} not fired this tick, will retry: {}", id, e.getMessage());
      } catch (RuntimeException e) {
        log.warn("Schedule {} not fired this tick, will retry", id, e);
      } finally {
        MDC.remove("schedule_id");
      }
    }
  }

  public boolean isHalted() {
    return halted.get() != null;
  }

  public Optional<ScheduleStoreCorruptedException> haltCause() {
    return Optional.ofNullable(halted.get());
  }

  private Optional<Instant> fire(Schedule schedule, Instant now) {
    Trigger trigger;
    try {
      trigger = Trigger.parse(schedule.trigger(), schedule.createdAt());
    } catch (IllegalArgumentException e) {
      throw new ScheduleStoreCorruptedException(schedule.id(), "unparseable trigger '" + schedule.trigger() + "'", e);
    }
    Optional<Instant> due = trigger.latestDueTick(schedule.lastFiredAt(), now);
    if (due.isEmpty()) {
      return due;
    }
    Instant tick = due.get();
    JobReceipt receipt;
    try {
      receipt = core.submit(new JobRequest(schedule.workerType().name(), schedule.payload(), null,
          schedule.idempotencyKey(tick)));
    } catch (InvalidWorkerTypeException e) {
      // retrying cannot help, the schedule names a type the central service does not serve
      throw new ScheduleStoreCorruptedException(schedule.id(),
          "worker type " + schedule.workerType().name() + " is not registered with the central service", e);
    }
    meters.counter("jobhive.beat.fired", "type", schedule.workerType().name()).increment();
    log.info("Schedule {} fired tick {} as job {}{}", schedule.id(), tick, receipt.jobId(),
        receipt.duplicate() ? " (already submitted)" : "");
    return due;
  }
}
