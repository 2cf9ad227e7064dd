package io.taskhive.task.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.Objects;

/**
 * A message that exhausted its retries or failed permanently.
 */
public record DeadLetterMessage(
    TaskMessage message,
    String originalQueue,
    String failureReason,
    Instant failedAt,
    @JsonIgnore Throwable originalError) {

  public DeadLetterMessage {
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(originalQueue, "originalQueue");
    failureReason = failureReason == null ? "unknown" : failureReason;
    Objects.requireNonNull(failedAt, "failedAt");
  }
}
