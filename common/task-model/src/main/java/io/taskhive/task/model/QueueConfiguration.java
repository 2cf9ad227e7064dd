package io.taskhive.task.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Static declaration settings of one priority task queue.
 */
public record QueueConfiguration(
    String name,
    int priorityWeight,
    boolean durable,
    String deadLetterExchange,
    String deadLetterRoutingKey,
    Duration messageTtl,
    int maxRetries,
    Duration retryDelay) {

  public QueueConfiguration {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(deadLetterExchange, "deadLetterExchange");
    Objects.requireNonNull(deadLetterRoutingKey, "deadLetterRoutingKey");
    Objects.requireNonNull(messageTtl, "messageTtl");
    Objects.requireNonNull(retryDelay, "retryDelay");
    if (messageTtl.isNegative() || messageTtl.isZero()) {
      throw new IllegalArgumentException("messageTtl must be positive");
    }
  }
}
