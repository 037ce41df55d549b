package io.jobhive.core.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobhive.core.domain.JobStore;
import io.jobhive.job.Job;
import io.jobhive.job.JobResultReport;
import io.jobhive.job.JobStatus;
import io.jobhive.job.WorkerType;
import io.jobhive.job.error.JobNotFoundException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Postgres-backed {@link JobStore}. Idempotency relies on the unique index over
 * {@code idempotency_key}; report application locks the row for the duration of the update.
 */
@Component
@ConditionalOnProperty(name = "jobhive.store", havingValue = "jdbc", matchIfMissing = true)
public class JdbcJobStore implements JobStore {

  private static final String COLUMNS = "id, worker_type, payload::text AS payload, priority, attempt_count, status, "
      + "idempotency_key, created_at, last_attempt_at, published_at, last_error, result::text AS result";

  private final JdbcTemplate jdbc;
  private final TransactionTemplate tx;
  private final ObjectMapper mapper;
  private final RowMapper<Job> rowMapper = this::mapRow;

  public JdbcJobStore(JdbcTemplate jdbc, TransactionTemplate tx, ObjectMapper mapper) {
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    this.tx = Objects.requireNonNull(tx, "tx");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public Reservation reserve(Job job) {
    Objects.requireNonNull(job, "job");
    int inserted = jdbc.update("""
        INSERT INTO job (id, worker_type, payload, priority, attempt_count, status, idempotency_key,
                         created_at, last_attempt_at, published_at, last_error, result)
        VALUES (?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb)
        ON CONFLICT (idempotency_key) DO NOTHING
        """,
        job.id(),
        job.workerType().name(),
        toJson(job.payload()),
        job.priority(),
        job.attemptCount(),
        job.status().name(),
        job.idempotencyKey(),
        timestamp(job.createdAt()),
        timestamp(job.lastAttemptAt()),
        timestamp(job.publishedAt()),
        job.lastError(),
        toJson(job.result()));
    if (inserted == 1) {
      return new Reservation(job, true);
    }
    List<Job> existing = jdbc.query("SELECT " + COLUMNS + " FROM job WHERE idempotency_key = ?",
        rowMapper, job.idempotencyKey());
    if (existing.isEmpty()) {
      // the conflicting reservation was discarded in between
      return reserve(job);
    }
    return new Reservation(existing.get(0), false);
  }

  @Override
  public Optional<Job> find(UUID id) {
    List<Job> rows = jdbc.query("SELECT " + COLUMNS + " FROM job WHERE id = ?", rowMapper, id);
    return rows.stream().findFirst();
  }

  @Override
  public void markPublished(UUID id, Instant publishedAt) {
    jdbc.update("UPDATE job SET published_at = ? WHERE id = ? AND published_at IS NULL",
        timestamp(publishedAt), id);
  }

  @Override
  public boolean discard(UUID id) {
    return jdbc.update("DELETE FROM job WHERE id = ? AND published_at IS NULL AND status = ?",
        id, JobStatus.PENDING.name()) == 1;
  }

  @Override
  public ReportOutcome applyReport(UUID id, JobResultReport report, Instant now) {
    return tx.execute(status -> {
      List<Job> rows = jdbc.query("SELECT " + COLUMNS + " FROM job WHERE id = ? FOR UPDATE", rowMapper, id);
      if (rows.isEmpty()) {
        throw new JobNotFoundException(id);
      }
      Job current = rows.get(0);
      if (!current.status().canTransitionTo(report.status())) {
        return new ReportOutcome(current, false);
      }
      Job updated = current.apply(report, now);
      jdbc.update("""
          UPDATE job
             SET status = ?, attempt_count = ?, last_attempt_at = ?, last_error = ?, result = ?::jsonb
           WHERE id = ?
          """,
          updated.status().name(),
          updated.attemptCount(),
          timestamp(updated.lastAttemptAt()),
          updated.lastError(),
          toJson(updated.result()),
          id);
      return new ReportOutcome(updated, true);
    });
  }

  @Override
  public List<Job> findByStatusAndType(JobStatus status, WorkerType workerType, int limit) {
    StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM job WHERE 1 = 1");
    List<Object> args = new ArrayList<>();
    if (status != null) {
      sql.append(" AND status = ?");
      args.add(status.name());
    }
    if (workerType != null) {
      sql.append(" AND worker_type = ?");
      args.add(workerType.name());
    }
    sql.append(" ORDER BY created_at DESC LIMIT ?");
    args.add(limit);
    return jdbc.query(sql.toString(), rowMapper, args.toArray());
  }

  @Override
  public List<Job> findUnpublished(Instant createdBefore, int limit) {
    return jdbc.query("SELECT " + COLUMNS + " FROM job "
            + "WHERE published_at IS NULL AND status = ? AND created_at < ? ORDER BY created_at LIMIT ?",
        rowMapper, JobStatus.PENDING.name(), timestamp(createdBefore), limit);
  }

  private Job mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Job(
        rs.getObject("id", UUID.class),
        WorkerType.valueOf(rs.getString("worker_type")),
        fromJson(rs.getString("payload")),
        rs.getInt("priority"),
        rs.getInt("attempt_count"),
        JobStatus.valueOf(rs.getString("status")),
        rs.getString("idempotency_key"),
        instant(rs.getTimestamp("created_at")),
        instant(rs.getTimestamp("last_attempt_at")),
        instant(rs.getTimestamp("published_at")),
        rs.getString("last_error"),
        fromJson(rs.getString("result")));
  }

  private String toJson(JsonNode node) {
    if (node == null || node.isMissingNode()) {
      return null;
    }
    try {
      return mapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Job document is not serializable", e);
    }
  }

  private JsonNode fromJson(String json) throws SQLException {
    if (json == null) {
      return null;
    }
    try {
      return mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new SQLException("Stored job document is not valid JSON", e);
    }
  }

  private static Timestamp timestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  private static Instant instant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
