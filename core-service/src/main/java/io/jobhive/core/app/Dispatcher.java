package io.jobhive.core.app;

import io.jobhive.broker.JobMessage;
import io.jobhive.broker.JobPublisher;
import io.jobhive.core.config.DispatchProperties;
import io.jobhive.core.domain.EnqueueGate;
import io.jobhive.core.domain.JobStore;
import io.jobhive.job.Job;
import io.jobhive.job.JobReceipt;
import io.jobhive.job.JobRequest;
import io.jobhive.job.JobStatus;
import io.jobhive.job.WorkerTypeRegistration;
import io.jobhive.job.WorkerTypeRegistry;
import io.jobhive.job.error.DispatchUnavailableException;
import io.jobhive.job.error.InvalidRequestException;
import io.jobhive.job.error.JobHiveException;
import io.jobhive.job.error.JobNotFoundException;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Accepts job submissions: reserve durably and notify, publish, then mark published.
 * <p>
 * The {@code PENDING} event goes out before the message reaches the broker, so it always precedes
 * the events of the worker that picks the job up.
 * <p>
 * A submission is only acknowledged once the broker confirmed the message. If publishing fails
 * after the configured retries the reservation is removed again and the caller sees
 * {@link DispatchUnavailableException}, so a reported job id always refers to a queued job.
 */
@Service
public class Dispatcher {
    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);
    private static final String REPLAY_KEY_PREFIX = "replay:";

    private final EnqueueGate gate;
    private final WorkerTypeRegistry registry;
    private final JobStore store;
    private final JobPublisher publisher;
    private final JobEvents events;
    private final Clock clock;
    private final Duration republishGrace;
    private final MeterRegistry meters;

    public Dispatcher(EnqueueGate gate,
                      WorkerTypeRegistry registry,
                      JobStore store,
                      JobPublisher publisher,
                      JobEvents events,
                      Clock clock,
                      DispatchProperties properties,
                      MeterRegistry meters) {
        this.gate = gate;
        this.registry = registry;
        this.store = store;
        this.publisher = publisher;
        this.events = events;
        this.clock = clock;
        this.republishGrace = properties.getRepublishGrace();
        this.meters = meters;
    }

    public JobReceipt submit(JobRequest request) {
        if (!gate.isOpen()) {
            throw new DispatchUnavailableException("Job submission is suspended: " + gate.closedReason());
        }
        if (request == null) {
            throw new InvalidRequestException("Request body is required");
        }
        WorkerTypeRegistration registration = registry.require(request.workerType());
        Instant now = clock.instant();
        String key = request.hasIdempotencyKey() ? request.idempotencyKey() : null;
        Job candidate = Job.pending(registration.type(), request.payload(), request.priorityOrDefault(), key, now);

        JobStore.Reservation reservation = store.reserve(candidate);
        Job job = reservation.job();
        MDC.put("job_id", job.id().toString());
        MDC.put("worker_type", job.workerType().name());
        try {
            if (!reservation.created()) {
                return duplicate(job, now);
            }
            events.jobChanged(job);
            try {
                publish(job, now);
            } catch (RuntimeException e) {
                boolean removed = store.discard(job.id());
                log.warn("Publish of job {} failed, reservation {}: {}", job.id(),
                    removed ? "rolled back" : "kept", e.getMessage());
                if (removed) {
                    events.jobDiscarded(job);
                }
                throw e instanceof JobHiveException jobHive
                    ? jobHive
                    : new DispatchUnavailableException("Job could not be published", e);
            }
            store.markPublished(job.id(), now);
            meters.counter("jobhive.dispatch.submitted", "type", job.workerType().name()).increment();
            log.info("Job {} queued for {} (priority {})", job.id(), job.workerType(), job.priority());
            return new JobReceipt(job.id(), JobStatus.PENDING, false);
        } finally {
            MDC.remove("job_id");
            MDC.remove("worker_type");
        }
    }

    /**
     * Publishes an already reserved job again. Used for reservations whose first publish never
     * completed; the reservation is kept when this fails.
     */
    public void republish(Job job) {
        Instant now = clock.instant();
        publish(job, now);
        store.markPublished(job.id(), now);
        log.info("Republished job {} reserved at {}", job.id(), job.createdAt());
    }

    /**
     * Re-enqueues a failed or dead-lettered job as a new job with the same payload. Replaying the
     * same job twice returns the first replay.
     */
    public JobReceipt replay(UUID jobId) {
        Job original = store.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (original.status() != JobStatus.DEAD_LETTERED && original.status() != JobStatus.FAILED) {
            throw new InvalidRequestException(
                "Only failed or dead-lettered jobs can be replayed; job %s is %s".formatted(jobId, original.status()));
        }
        JobReceipt receipt = submit(new JobRequest(original.workerType().name(), original.payload(),
            original.priority(), REPLAY_KEY_PREFIX + jobId));
        log.info("Job {} replayed as {}", jobId, receipt.jobId());
        return receipt;
    }

    private JobReceipt duplicate(Job existing, Instant now) {
        if (!existing.isPublished() && existing.status() == JobStatus.PENDING
            && existing.createdAt().plus(republishGrace).isBefore(now)) {
            republish(existing);
        }
        log.debug("Duplicate submission resolved to job {}", existing.id());
        return new JobReceipt(existing.id(), existing.status(), true);
    }

    private void publish(Job job, Instant now) {
        publisher.publish(JobMessage.of(job, now));
        meters.counter("jobhive.dispatch.published", "type", job.workerType().name()).increment();
    }
}
