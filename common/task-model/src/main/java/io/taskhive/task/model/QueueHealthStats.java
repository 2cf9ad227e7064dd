package io.taskhive.task.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time health snapshot of one consumed queue.
 *
 * @param queueName          queue the snapshot belongs to
 * @param messageCount       broker depth after a metrics refresh, otherwise locally processed messages
 * @param consumerCount      consumers attached to the queue
 * @param avgWaitTime        cumulative average processing time in milliseconds
 * @param throughputPerSecond completed messages per second over the last refresh interval
 * @param errorRate          failed / processed, in [0, 1]
 * @param lastProcessedAt    time the last message finished processing
 */
public record QueueHealthStats(
    String queueName,
    long messageCount,
    int consumerCount,
    double avgWaitTime,
    double throughputPerSecond,
    double errorRate,
    Instant lastProcessedAt) {

  public QueueHealthStats {
    Objects.requireNonNull(queueName, "queueName");
    Objects.requireNonNull(lastProcessedAt, "lastProcessedAt");
    if (errorRate < 0.0 || errorRate > 1.0) {
      throw new IllegalArgumentException("errorRate must be within [0, 1]");
    }
  }

  public QueueHealthStats withLastProcessedAt(Instant at) {
    return new QueueHealthStats(queueName, messageCount, consumerCount, avgWaitTime, throughputPerSecond, errorRate,
        at);
  }
}
