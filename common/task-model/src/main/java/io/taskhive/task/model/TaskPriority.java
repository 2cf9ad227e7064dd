package io.taskhive.task.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Priority tiers a task can be enqueued at.
 * <p>
 * Each tier carries the broker priority weight stamped on published messages, the message TTL of its
 * queue and the number of retries its queue allows by default.
 */
public enum TaskPriority {
  CRITICAL("critical", 10, Duration.ofMinutes(5), 5),
  HIGH("high", 7, Duration.ofMinutes(15), 4),
  NORMAL("normal", 5, Duration.ofHours(1), 3),
  LOW("low", 1, Duration.ofHours(6), 2);

  private final String wireName;
  private final int weight;
  private final Duration messageTtl;
  private final int defaultMaxRetries;

  TaskPriority(String wireName, int weight, Duration messageTtl, int defaultMaxRetries) {
    this.wireName = wireName;
    this.weight = weight;
    this.messageTtl = messageTtl;
    this.defaultMaxRetries = defaultMaxRetries;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public int weight() {
    return weight;
  }

  public Duration messageTtl() {
    return messageTtl;
  }

  public int defaultMaxRetries() {
    return defaultMaxRetries;
  }

  @JsonCreator
  public static TaskPriority fromWireName(String value) {
    Objects.requireNonNull(value, "value");
    String normalised = value.trim().toLowerCase(Locale.ROOT);
    for (TaskPriority priority : values()) {
      if (priority.wireName.equals(normalised)) {
        return priority;
      }
    }
    throw new IllegalArgumentException("Unknown task priority: " + value);
  }
}
