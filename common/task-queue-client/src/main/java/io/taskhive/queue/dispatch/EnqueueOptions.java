package io.taskhive.queue.dispatch;

import io.taskhive.task.model.TaskPriority;
import java.time.Duration;
import java.util.Objects;

/**
 * Per-call enqueue settings.
 *
 * @param correlationId correlation id to stamp; {@code null} falls back to a fresh random UUID
 * @param delay         zero publishes directly, anything positive goes through the delayed exchange
 */
public record EnqueueOptions(TaskPriority priority, String correlationId, Duration delay, int maxRetries) {

  public static final int DEFAULT_MAX_RETRIES = 3;

  public EnqueueOptions {
    priority = priority == null ? TaskPriority.NORMAL : priority;
    delay = delay == null ? Duration.ZERO : delay;
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative");
    }
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must not be negative");
    }
    if (correlationId != null && correlationId.isBlank()) {
      correlationId = null;
    }
  }

  public static EnqueueOptions defaults() {
    return new EnqueueOptions(TaskPriority.NORMAL, null, Duration.ZERO, DEFAULT_MAX_RETRIES);
  }

  public static EnqueueOptions withPriority(TaskPriority priority) {
    return defaults().priority(priority);
  }

  public EnqueueOptions priority(TaskPriority value) {
    return new EnqueueOptions(Objects.requireNonNull(value, "priority"), correlationId, delay, maxRetries);
  }

  public EnqueueOptions correlationId(String value) {
    return new EnqueueOptions(priority, value, delay, maxRetries);
  }

  public EnqueueOptions delay(Duration value) {
    return new EnqueueOptions(priority, correlationId, Objects.requireNonNull(value, "delay"), maxRetries);
  }

  public EnqueueOptions maxRetries(int value) {
    return new EnqueueOptions(priority, correlationId, delay, value);
  }
}
