package io.jobhive.worker;

import io.jobhive.job.WorkerTypeRegistration;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-flight accounting for one worker type. Broker prefetch keeps deliveries within the limit;
 * the permits make the bound hold for this process regardless of container configuration.
 */
public final class WorkerPool {

  private final WorkerTypeRegistration registration;
  private final JobHandler handler;
  private final Semaphore permits;
  private final AtomicInteger inFlight = new AtomicInteger();

  public WorkerPool(WorkerTypeRegistration registration, JobHandler handler) {
    this.registration = Objects.requireNonNull(registration, "registration");
    this.handler = Objects.requireNonNull(handler, "handler");
    this.permits = new Semaphore(registration.concurrencyLimit());
  }

  public WorkerTypeRegistration registration() {
    return registration;
  }

  public JobHandler handler() {
    return handler;
  }

  public int concurrencyLimit() {
    return registration.concurrencyLimit();
  }

  public int inFlight() {
    return inFlight.get();
  }

  boolean tryAcquire() {
    if (!permits.tryAcquire()) {
      return false;
    }
    inFlight.incrementAndGet();
    return true;
  }

  void release() {
    inFlight.decrementAndGet();
    permits.release();
  }
}
