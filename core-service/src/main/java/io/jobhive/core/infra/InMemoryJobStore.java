package io.jobhive.core.infra;

import io.jobhive.core.domain.JobStore;
import io.jobhive.job.Job;
import io.jobhive.job.JobResultReport;
import io.jobhive.job.JobStatus;
import io.jobhive.job.WorkerType;
import io.jobhive.job.error.JobNotFoundException;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Non-durable store for local runs and tests.
 */
@Component
@ConditionalOnProperty(name = "jobhive.store", havingValue = "memory")
public class InMemoryJobStore implements JobStore {

  private final Map<UUID, Job> jobs = new ConcurrentHashMap<>();
  private final Map<String, UUID> keys = new ConcurrentHashMap<>();

  @Override
  public Reservation reserve(Job job) {
    Objects.requireNonNull(job, "job");
    String key = job.idempotencyKey();
    if (key == null) {
      jobs.put(job.id(), job);
      return new Reservation(job, true);
    }
    UUID owner = keys.computeIfAbsent(key, ignored -> {
      jobs.put(job.id(), job);
      return job.id();
    });
    if (owner.equals(job.id())) {
      return new Reservation(job, true);
    }
    Job existing = jobs.get(owner);
    if (existing == null) {
      // discarded between the two lookups; retry against the now free key
      keys.remove(key, owner);
      return reserve(job);
    }
    return new Reservation(existing, false);
  }

  @Override
  public Optional<Job> find(UUID id) {
    return Optional.ofNullable(jobs.get(id));
  }

  @Override
  public void markPublished(UUID id, Instant publishedAt) {
    jobs.computeIfPresent(id, (ignored, job) -> job.isPublished() ? job : job.withPublishedAt(publishedAt));
  }

  @Override
  public boolean discard(UUID id) {
    AtomicReference<Job> removed = new AtomicReference<>();
    jobs.computeIfPresent(id, (ignored, job) -> {
      if (job.isPublished() || job.status() != JobStatus.PENDING) {
        return job;
      }
      removed.set(job);
      return null;
    });
    Job job = removed.get();
    if (job == null) {
      return false;
    }
    if (job.idempotencyKey() != null) {
      keys.remove(job.idempotencyKey(), job.id());
    }
    return true;
  }

  @Override
  public ReportOutcome applyReport(UUID id, JobResultReport report, Instant now) {
    AtomicReference<ReportOutcome> outcome = new AtomicReference<>();
    jobs.computeIfPresent(id, (ignored, job) -> {
      if (!job.status().canTransitionTo(report.status())) {
        outcome.set(new ReportOutcome(job, false));
        return job;
      }
      Job updated = job.apply(report, now);
      outcome.set(new ReportOutcome(updated, true));
      return updated;
    });
    if (outcome.get() == null) {
      throw new JobNotFoundException(id);
    }
    return outcome.get();
  }

  @Override
  public List<Job> findByStatusAndType(JobStatus status, WorkerType workerType, int limit) {
    return jobs.values().stream()
        .filter(job -> status == null || job.status() == status)
        .filter(job -> workerType == null || job.workerType() == workerType)
        .sorted(Comparator.comparing(Job::createdAt).reversed())
        .limit(limit)
        .toList();
  }

  @Override
  public List<Job> findUnpublished(Instant createdBefore, int limit) {
    return jobs.values().stream()
        .filter(job -> !job.isPublished() && job.status() == JobStatus.PENDING)
        .filter(job -> job.createdAt().isBefore(createdBefore))
        .sorted(Comparator.comparing(Job::createdAt))
        .limit(limit)
        .toList();
  }
}
