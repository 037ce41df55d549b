package io.jobhive.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.jobhive.broker.JobMessage;
import io.jobhive.broker.JobMessageCodec;
import io.jobhive.broker.JobPublisher;
import io.jobhive.broker.MalformedJobMessageException;
import io.jobhive.client.CoreApi;
import io.jobhive.job.JobResultReport;
import io.jobhive.job.WorkerType;
import io.jobhive.job.error.JobExecutionFailedException;
import io.jobhive.job.error.JobNotFoundException;
import io.jobhive.job.error.JobTimeoutException;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.amqp.core.Message;

/**
 * Executes job deliveries for the worker types served by this process.
 * <p>
 * Each delivery is reported {@code IN_FLIGHT}, handed to the type's {@link JobHandler} on the
 * handler executor and awaited for at most the execution deadline. Outcomes:
 * <ul>
 *   <li>success: report {@code SUCCEEDED}, then ack</li>
 *   <li>{@link NonRetryableJobException}: report {@code FAILED}, then ack</li>
 *   <li>failure or timeout below {@code maxAttempts}: park a copy with the incremented attempt count
 *       on the retry queue, report {@code PENDING}, then ack</li>
 *   <li>failure or timeout at {@code maxAttempts}: report {@code DEAD_LETTERED}, then reject without
 *       requeue so the broker moves the delivery to the dead-letter queue</li>
 * </ul>
 * Terminal reports must reach the central service before the delivery is settled; when they do not,
 * the delivery is requeued and the job runs again. A timed-out handler is abandoned (its thread is
 * interrupted) and stops counting against the pool's limit as soon as the deadline passes.
 */
public final class JobWorkerRuntime implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(JobWorkerRuntime.class);

  static final String MDC_JOB_ID = "job_id";
  static final String MDC_WORKER_TYPE = "worker_type";

  private final Map<WorkerType, WorkerPool> pools;
  private final JobMessageCodec codec;
  private final JobPublisher publisher;
  private final CoreApi core;
  private final RuntimeSettings settings;
  private final MeterRegistry meters;
  private final Clock clock;
  private final ExecutorService handlerExecutor;

  public JobWorkerRuntime(Collection<WorkerPool> pools,
                          JobMessageCodec codec,
                          JobPublisher publisher,
                          CoreApi core,
                          RuntimeSettings settings,
                          MeterRegistry meters,
                          Clock clock) {
    Objects.requireNonNull(pools, "pools");
    EnumMap<WorkerType, WorkerPool> byType = new EnumMap<>(WorkerType.class);
    pools.forEach(pool -> byType.put(pool.registration().type(), pool));
    if (byType.isEmpty()) {
      throw new IllegalStateException("Worker runtime needs at least one pool");
    }
    this.pools = Collections.unmodifiableMap(byType);
    this.codec = Objects.requireNonNull(codec, "codec");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.core = Objects.requireNonNull(core, "core");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.meters = Objects.requireNonNull(meters, "meters");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.handlerExecutor = Executors.newCachedThreadPool(handlerThreads());
    this.pools.values().forEach(pool -> Gauge.builder("jobhive.worker.in_flight", pool, WorkerPool::inFlight)
        .tag("type", pool.registration().type().name())
        .register(meters));
  }

  public Map<WorkerType, WorkerPool> pools() {
    return pools;
  }

  public void process(Message message, JobDelivery delivery) {
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(delivery, "delivery");
    JobMessage job;
    try {
      job = codec.decode(message);
    } catch (MalformedJobMessageException ex) {
      log.error("Dead-lettering undecodable delivery: {}", ex.getMessage());
      delivery.reject(false);
      return;
    }
    WorkerPool pool = pools.get(job.workerType());
    if (pool == null) {
      log.error("No pool serves {} in this process; dead-lettering job {}", job.workerType(), job.jobId());
      delivery.reject(false);
      return;
    }
    if (!pool.tryAcquire()) {
      log.warn("Pool {} is at its limit of {}; returning job {} to the broker",
          job.workerType(), pool.concurrencyLimit(), job.jobId());
      delivery.reject(true);
      return;
    }
    MDC.put(MDC_JOB_ID, job.jobId().toString());
    MDC.put(MDC_WORKER_TYPE, job.workerType().name());
    try {
      execute(pool, job, delivery);
    } finally {
      pool.release();
      MDC.remove(MDC_JOB_ID);
      MDC.remove(MDC_WORKER_TYPE);
    }
  }

  private void execute(WorkerPool pool, JobMessage job, JobDelivery delivery) {
    log.info("starting job {} type={} attempt={}", job.jobId(), job.workerType(), job.attemptCount() + 1);
    reportQuietly(job, JobResultReport.inFlight(job.attemptCount()));
    JsonNode result;
    try {
      result = invoke(pool.handler(), job);
    } catch (NonRetryableJobException ex) {
      log.warn("job {} rejected by handler: {}", job.jobId(), ex.getMessage());
      count(job, "failed");
      settle(job, JobResultReport.failed(job.attemptCount() + 1, ex.getMessage()), delivery::ack, delivery);
      return;
    } catch (JobExecutionFailedException ex) {
      handleFailure(job, ex, delivery);
      return;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("interrupted while running job {}; returning it to the broker", job.jobId());
      delivery.reject(true);
      return;
    }
    log.info("job {} succeeded", job.jobId());
    count(job, "succeeded");
    settle(job, JobResultReport.succeeded(job.attemptCount(), result), delivery::ack, delivery);
  }

  private JsonNode invoke(JobHandler handler, JobMessage job) throws InterruptedException {
    Duration deadline = settings.executionDeadline();
    Instant started = clock.instant();
    JobContext context = new JobContext(job.jobId(), job.workerType(), job.payload(), job.attemptCount(),
        started.plus(deadline), deadline, clock);
    Map<String, String> mdc = MDC.getCopyOfContextMap();
    Future<JsonNode> future = handlerExecutor.submit(() -> {
      if (mdc != null) {
        MDC.setContextMap(mdc);
      }
      try {
        return handler.handle(context);
      } finally {
        MDC.clear();
      }
    });
    try {
      return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw new JobTimeoutException(deadline);
    } catch (InterruptedException ex) {
      future.cancel(true);
      throw ex;
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof NonRetryableJobException nonRetryable) {
        throw nonRetryable;
      }
      if (cause instanceof JobExecutionFailedException failed) {
        throw failed;
      }
      throw new JobExecutionFailedException(describe(cause), cause);
    }
  }

  private void handleFailure(JobMessage job, JobExecutionFailedException failure, JobDelivery delivery) {
    int failures = job.attemptCount() + 1;
    String error = failure.getMessage();
    if (failures < settings.maxAttempts()) {
      Duration delay = settings.retryBackoff().delayFor(failures);
      try {
        publisher.publishRetry(job.nextAttempt(failures, clock.instant()), delay);
      } catch (RuntimeException ex) {
        log.error("job {} failed and its retry could not be parked; returning delivery to the broker",
            job.jobId(), ex);
        delivery.reject(true);
        return;
      }
      log.warn("job {} failed attempt {}/{}, retrying in {}: {}",
          job.jobId(), failures, settings.maxAttempts(), delay, error);
      count(job, "retried");
      reportQuietly(job, JobResultReport.retrying(failures, error));
      delivery.ack();
      return;
    }
    log.error("job {} failed attempt {}/{}, dead-lettering: {}", job.jobId(), failures, settings.maxAttempts(), error);
    count(job, "dead_lettered");
    settle(job, JobResultReport.deadLettered(failures, error), () -> delivery.reject(false), delivery);
  }

  private void settle(JobMessage job, JobResultReport report, Runnable settlement, JobDelivery delivery) {
    try {
      core.reportResult(job.jobId(), report);
    } catch (JobNotFoundException ex) {
      log.warn("central service does not know job {}; settling {} anyway", job.jobId(), report.status());
    } catch (RuntimeException ex) {
      log.error("could not report {} for job {}; returning delivery to the broker", report.status(), job.jobId(), ex);
      delivery.reject(true);
      return;
    }
    settlement.run();
  }

  private void reportQuietly(JobMessage job, JobResultReport report) {
    try {
      core.reportResult(job.jobId(), report);
    } catch (RuntimeException ex) {
      log.warn("could not report {} for job {}: {}", report.status(), job.jobId(), ex.getMessage());
    }
  }

  private void count(JobMessage job, String outcome) {
    meters.counter("jobhive.worker.jobs", "type", job.workerType().name(), "outcome", outcome).increment();
  }

  private static String describe(Throwable cause) {
    if (cause == null) {
      return "handler failed";
    }
    String message = cause.getMessage();
    return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
  }

  private static ThreadFactory handlerThreads() {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, "jobhive-handler-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  @Override
  public void close() {
    handlerExecutor.shutdownNow();
  }
}
