package io.taskhive.queue.connection;

/**
 * Callback for components that hold broker state (consumers, relays) and must rebuild it after the
 * connection is replaced.
 */
public interface ConnectionStateListener {

  /**
   * @param reconnect {@code false} for the first connection, {@code true} for every later one
   */
  void onConnected(boolean reconnect);

  default void onConnectionLost(Throwable cause) {
  }
}
