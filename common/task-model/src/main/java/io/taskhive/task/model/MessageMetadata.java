package io.taskhive.task.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Delivery bookkeeping carried inside every {@link TaskMessage}.
 *
 * @param id                 unique message id, equal to the owning message id
 * @param correlationId      caller supplied correlation id, defaults to a fresh random UUID
 * @param timestamp          time of the last (re)publish
 * @param retryCount         number of retries already scheduled for this message
 * @param maxRetries         retry budget requested at enqueue time
 * @param priority           priority tier the message was enqueued at
 * @param originalRoutingKey routing key used for the first publish
 */
public record MessageMetadata(
    String id,
    String correlationId,
    Instant timestamp,
    int retryCount,
    int maxRetries,
    TaskPriority priority,
    String originalRoutingKey) {

  public MessageMetadata {
    id = requireNonBlank(id, "id");
    correlationId = requireNonBlank(correlationId, "correlationId");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(priority, "priority");
    originalRoutingKey = requireNonBlank(originalRoutingKey, "originalRoutingKey");
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must not be negative");
    }
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must not be negative");
    }
  }

  /**
   * Returns a copy describing the next delivery attempt.
   */
  public MessageMetadata withRetry(int nextRetryCount, Instant retriedAt) {
    return new MessageMetadata(id, correlationId, retriedAt, nextRetryCount, maxRetries, priority, originalRoutingKey);
  }

  private static String requireNonBlank(String value, String field) {
    Objects.requireNonNull(value, field);
    if (value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be blank");
    }
    return value;
  }
}
