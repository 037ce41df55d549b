package io.jobhive.beat.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobhive.beat.config.BeatProperties;
import io.jobhive.beat.domain.ScheduleDefinition;
import io.jobhive.beat.domain.ScheduleStore;
import io.jobhive.beat.domain.Trigger;
import io.jobhive.job.WorkerType;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies configured schedules into the store. New schedules are anchored at startup time, so a
 * freshly added schedule never fires for ticks before it existed.
 */
public class ScheduleSynchronizer {

  private static final Logger log = LoggerFactory.getLogger(ScheduleSynchronizer.class);

  private final ScheduleStore store;
  private final ObjectMapper mapper;
  private final Clock clock;

  public ScheduleSynchronizer(ScheduleStore store, ObjectMapper mapper, Clock clock) {
    this.store = store;
    this.mapper = mapper;
    this.clock = clock;
  }

  /**
   * @throws IllegalStateException when a configured schedule is invalid; nothing is written then
   */
  public void synchronize(List<BeatProperties.ScheduleConfig> configured) {
    Instant now = clock.instant();
    List<ScheduleDefinition> definitions = new ArrayList<>();
    Set<String> ids = new HashSet<>();
    for (BeatProperties.ScheduleConfig config : configured) {
      if (!ids.add(config.id())) {
        throw new IllegalStateException("Schedule '" + config.id() + "' is configured twice");
      }
      definitions.add(validate(config, now));
    }
    for (ScheduleDefinition definition : definitions) {
      boolean created = store.upsert(definition, now);
      log.info("Schedule {} {} ({} -> {})", definition.id(), created ? "created" : "updated",
          definition.trigger(), definition.workerType());
    }
  }

  private ScheduleDefinition validate(BeatProperties.ScheduleConfig config, Instant now) {
    WorkerType workerType;
    try {
      workerType = WorkerType.fromName(config.workerType());
      Trigger.parse(config.trigger(), now);
    } catch (RuntimeException e) {
      throw new IllegalStateException("Schedule '" + config.id() + "' is invalid: " + e.getMessage(), e);
    }
    JsonNode payload = config.payload() == null ? mapper.createObjectNode() : mapper.valueToTree(config.payload());
    return new ScheduleDefinition(config.id(), config.trigger().trim(), workerType, payload);
  }
}
