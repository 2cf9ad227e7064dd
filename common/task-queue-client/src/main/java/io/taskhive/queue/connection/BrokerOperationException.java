package io.taskhive.queue.connection;

/**
 * Wraps I/O failures of administrative broker calls (declarations, queue inspection, purges, consumer setup).
 */
public class BrokerOperationException extends RuntimeException {

  public BrokerOperationException(String message, Throwable cause) {
    super(message, cause);
  }
}
