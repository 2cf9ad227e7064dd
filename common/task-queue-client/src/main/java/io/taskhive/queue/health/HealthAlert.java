package io.taskhive.queue.health;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Alert raised by the {@link HealthMonitor}.
 *
 * @param queueName affected queue, {@code null} for connection-wide alerts
 * @param metrics   values that triggered the alert (current value, threshold, priority)
 */
public record HealthAlert(
    AlertType type,
    AlertSeverity severity,
    String queueName,
    String message,
    Instant timestamp,
    Map<String, Object> metrics) {

  public HealthAlert {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(timestamp, "timestamp");
    metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
  }

  /**
   * Key identifying "the same issue" for de-duplication: {@code type-queue-severity}.
   */
  public String deduplicationKey() {
    return type + "-" + (queueName == null ? "global" : queueName) + "-" + severity;
  }
}
