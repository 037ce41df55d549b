package io.jobhive.broker;

/**
 * AMQP header names carried by every job message.
 */
public final class JobHeaders {

  public static final String JOB_ID = "job_id";
  public static final String ATTEMPT_COUNT = "attempt_count";
  public static final String ENQUEUED_AT = "enqueued_at";
  public static final String WORKER_TYPE = "worker_type";

  private JobHeaders() {
  }
}
