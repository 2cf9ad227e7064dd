package io.taskhive.task.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.time.Instant;
import java.util.Objects;

/**
 * Unit of work travelling through the task queues.
 * <p>
 * The payload is opaque to the queue layer and is kept as a JSON tree so it survives retries and
 * dead-lettering byte-for-byte.
 */
public record TaskMessage(String id, JsonNode payload, MessageMetadata metadata, Instant enqueuedAt) {

  public TaskMessage {
    Objects.requireNonNull(id, "id");
    if (id.isBlank()) {
      throw new IllegalArgumentException("id must not be blank");
    }
    payload = payload == null ? NullNode.getInstance() : payload;
    Objects.requireNonNull(metadata, "metadata");
    Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    if (!id.equals(metadata.id())) {
      throw new IllegalArgumentException("metadata id must match message id");
    }
  }

  public int retryCount() {
    return metadata.retryCount();
  }

  public TaskPriority priority() {
    return metadata.priority();
  }

  /**
   * Copy of this message with an incremented retry count. Id, correlation id and payload are kept.
   */
  public TaskMessage withRetry(int nextRetryCount, Instant retriedAt) {
    return new TaskMessage(id, payload, metadata.withRetry(nextRetryCount, retriedAt), enqueuedAt);
  }
}
