package io.taskhive.queue.connection;

/**
 * Raised when a task cannot be handed to the broker.
 */
public class TaskPublishException extends RuntimeException {

  public TaskPublishException(String message, Throwable cause) {
    super(message, cause);
  }
}
