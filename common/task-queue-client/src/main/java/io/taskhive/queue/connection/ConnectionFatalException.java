package io.taskhive.queue.connection;

/**
 * Raised once the reconnect attempt cap is exhausted. Needs manual intervention.
 */
public class ConnectionFatalException extends RuntimeException {

  public ConnectionFatalException(String message, Throwable cause) {
    super(message, cause);
  }
}
