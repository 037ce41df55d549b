package io.jobhive.beat.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobhive.beat.domain.Schedule;
import io.jobhive.beat.domain.ScheduleDefinition;
import io.jobhive.beat.domain.ScheduleStore;
import io.jobhive.job.WorkerType;
import io.jobhive.job.error.InvalidWorkerTypeException;
import io.jobhive.job.error.ScheduleStoreCorruptedException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Postgres-backed {@link ScheduleStore}. {@code SELECT ... FOR UPDATE SKIP LOCKED} keeps two beat
 * instances from firing the same schedule at once.
 */
@Component
@ConditionalOnProperty(name = "jobhive.beat.store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcScheduleStore implements ScheduleStore {

  private static final String COLUMNS = "id, trigger, worker_type, payload::text AS payload, created_at, last_fired_at";

  private final JdbcTemplate jdbc;
  private final TransactionTemplate tx;
  private final ObjectMapper mapper;

  public JdbcScheduleStore(JdbcTemplate jdbc, TransactionTemplate tx, ObjectMapper mapper) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.tx = Objects.requireNonNull(tx, "tx");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public List<String> ids() {
    return jdbc.queryForList("SELECT id FROM schedule ORDER BY id", String.class);
  }

  @Override
  public Optional<Schedule> find(String id) {
    return jdbc.query("SELECT " + COLUMNS + " FROM schedule WHERE id = ?", this::mapRow, id).stream().findFirst();
  }

  @Override
  public FireOutcome fire(String id, FireAction action) {
    return tx.execute(status -> {
      List<Schedule> locked = jdbc.query(
          "SELECT " + COLUMNS + " FROM schedule WHERE id = ? FOR UPDATE SKIP LOCKED", this::mapRow, id);
      if (locked.isEmpty()) {
        return FireOutcome.SKIPPED;
      }
      Optional<Instant> tick = action.fire(locked.get(0));
      if (tick.isEmpty()) {
        return FireOutcome.NOT_DUE;
      }
      jdbc.update("UPDATE schedule SET last_fired_at = ? WHERE id = ?", Timestamp.from(tick.get()), id);
      return FireOutcome.FIRED;
    });
  }

  @Override
  public boolean upsert(ScheduleDefinition definition, Instant now) {
    Boolean inserted = jdbc.queryForObject("""
        INSERT INTO schedule (id, trigger, worker_type, payload, created_at, last_fired_at)
        VALUES (?, ?, ?, ?::jsonb, ?, ?)
        ON CONFLICT (id) DO UPDATE
           SET trigger = EXCLUDED.trigger,
               worker_type = EXCLUDED.worker_type,
               payload = EXCLUDED.payload
        RETURNING (xmax = 0)
        """,
        Boolean.class,
        definition.id(),
        definition.trigger(),
        definition.workerType().name(),
        toJson(definition.payload()),
        Timestamp.from(now),
        Timestamp.from(now));
    return Boolean.TRUE.equals(inserted);
  }

  private Schedule mapRow(ResultSet rs, int rowNum) throws SQLException {
    String id = rs.getString("id");
    WorkerType workerType;
    try {
      workerType = WorkerType.fromName(rs.getString("worker_type"));
    } catch (InvalidWorkerTypeException e) {
      throw new ScheduleStoreCorruptedException(id, e.getMessage(), e);
    }
    Timestamp createdAt = rs.getTimestamp("created_at");
    Timestamp lastFiredAt = rs.getTimestamp("last_fired_at");
    if (createdAt == null || lastFiredAt == null) {
      throw new ScheduleStoreCorruptedException(id, "missing anchor or last fired tick", null);
    }
    JsonNode payload;
    try {
      payload = mapper.readTree(rs.getString("payload"));
    } catch (JsonProcessingException e) {
      throw new ScheduleStoreCorruptedException(id, "payload is not valid JSON", e);
    }
    return new Schedule(id, rs.getString("trigger"), workerType, payload,
        createdAt.toInstant(), lastFiredAt.toInstant());
  }

  private String toJson(JsonNode payload) {
    try {
      return mapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Schedule payload is not serializable", e);
    }
  }
}
