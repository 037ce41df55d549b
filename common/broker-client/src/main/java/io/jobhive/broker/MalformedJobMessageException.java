package io.jobhive.broker;

/**
 * A delivery that cannot be decoded into a {@link JobMessage}. Redelivering it would fail again.
 */
public class MalformedJobMessageException extends RuntimeException {

  public MalformedJobMessageException(String message) {
    super(message);
  }

  public MalformedJobMessageException(String message, Throwable cause) {
    super(message, cause);
  }
}
