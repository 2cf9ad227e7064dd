package io.taskhive.queue.connection;

/**
 * Raised when a broker operation is attempted while no live connection exists.
 */
public class NotConnectedException extends IllegalStateException {

  public NotConnectedException(String message) {
    super(message);
  }
}
