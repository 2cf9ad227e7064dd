package io.taskhive.queue.connection;

import java.util.Objects;

/**
 * Broker-reported counters of a queue, as returned by a passive declare.
 */
public record QueueInfo(String queue, long messageCount, int consumerCount) {

  public QueueInfo {
    Objects.requireNonNull(queue, "queue");
    if (messageCount < 0) {
      throw new IllegalArgumentException("messageCount must not be negative");
    }
    if (consumerCount < 0) {
      throw new IllegalArgumentException("consumerCount must not be negative");
    }
  }
}
