package io.taskhive.queue.health;

import io.taskhive.task.model.TaskPriority;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Limits a queue is evaluated against, per priority tier, plus the global error rate and system limits.
 */
public record HealthThresholds(
    Map<TaskPriority, PriorityThresholds> priorities,
    double maxErrorRate,
    int maxHistorySize,
    Duration alertCooldown,
    long maxHeapBytes,
    Duration maxSchedulingLag) {

  public HealthThresholds {
    Objects.requireNonNull(priorities, "priorities");
    Objects.requireNonNull(alertCooldown, "alertCooldown");
    Objects.requireNonNull(maxSchedulingLag, "maxSchedulingLag");
    for (TaskPriority priority : TaskPriority.values()) {
      if (!priorities.containsKey(priority)) {
        throw new IllegalArgumentException("missing thresholds for priority " + priority);
      }
    }
    priorities = Map.copyOf(priorities);
    if (maxErrorRate < 0.0 || maxErrorRate > 1.0) {
      throw new IllegalArgumentException("maxErrorRate must be within [0, 1]");
    }
    if (maxHistorySize <= 0) {
      throw new IllegalArgumentException("maxHistorySize must be positive");
    }
  }

  public static HealthThresholds defaults() {
    Map<TaskPriority, PriorityThresholds> priorities = new EnumMap<>(TaskPriority.class);
    priorities.put(TaskPriority.CRITICAL, new PriorityThresholds(10, 5.0, Duration.ofSeconds(30)));
    priorities.put(TaskPriority.HIGH, new PriorityThresholds(50, 2.0, Duration.ofMinutes(2)));
    priorities.put(TaskPriority.NORMAL, new PriorityThresholds(100, 1.0, Duration.ofMinutes(5)));
    priorities.put(TaskPriority.LOW, new PriorityThresholds(200, 0.5, Duration.ofMinutes(15)));
    return new HealthThresholds(priorities, 0.05, 100, AlertHistory.DEFAULT_COOLDOWN, 1024L * 1024 * 1024,
        Duration.ofMillis(100));
  }

  public PriorityThresholds forPriority(TaskPriority priority) {
    return priorities.get(Objects.requireNonNull(priority, "priority"));
  }

  public record PriorityThresholds(long maxQueueDepth, double minThroughputPerSecond, Duration maxAvgWaitTime) {

    public PriorityThresholds {
      Objects.requireNonNull(maxAvgWaitTime, "maxAvgWaitTime");
      if (maxQueueDepth < 0) {
        throw new IllegalArgumentException("maxQueueDepth must not be negative");
      }
      if (minThroughputPerSecond < 0) {
        throw new IllegalArgumentException("minThroughputPerSecond must not be negative");
      }
    }
  }
}
