package io.jobhive.worker;

/**
 * Thrown by a handler that rejects a job outright (for example an invalid payload). The job is
 * reported {@code FAILED} without spending further attempts.
 */
public class NonRetryableJobException extends RuntimeException {

  public NonRetryableJobException(String message) {
    super(message);
  }

  public NonRetryableJobException(String message, Throwable cause) {
    super(message, cause);
  }
}
