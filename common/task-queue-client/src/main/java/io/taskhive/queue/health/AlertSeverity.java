package io.taskhive.queue.health;

import io.taskhive.task.model.TaskPriority;

public enum AlertSeverity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  /**
   * Severity used for depth, throughput and wait-time violations of a queue of the given tier.
   */
  public static AlertSeverity forPriority(TaskPriority priority) {
    return switch (priority) {
      case CRITICAL -> CRITICAL;
      case HIGH -> HIGH;
      case NORMAL -> MEDIUM;
      case LOW -> LOW;
    };
  }
}
