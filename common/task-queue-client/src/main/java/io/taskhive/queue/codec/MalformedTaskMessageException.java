package io.taskhive.queue.codec;

/**
 * Raised when a delivery body cannot be read as a task envelope.
 */
public class MalformedTaskMessageException extends IllegalArgumentException {

  public MalformedTaskMessageException(String message) {
    super(message);
  }

  public MalformedTaskMessageException(String message, Throwable cause) {
    super(message, cause);
  }
}
