package io.taskhive.queue.health;

import io.taskhive.queue.connection.TaskQueueTopology;
import io.taskhive.task.model.QueueHealthStats;
import io.taskhive.task.model.TaskPriority;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates queue statistics against {@link HealthThresholds}: threshold alerts, a 0..100 score and a trend
 * over recent history.
 * <p>
 * Depth, throughput and wait-time limits only apply to queues whose name identifies a priority tier; the error
 * rate and consumer checks apply to every queue.
 */
public final class HealthScorer {

  public static final int HEALTHY_SCORE = 80;
  static final int TREND_WINDOW = 3;
  static final int TREND_DELTA = 10;

  private final HealthThresholds thresholds;

  public HealthScorer(HealthThresholds thresholds) {
    this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
  }

  public HealthThresholds thresholds() {
    return thresholds;
  }

  public int score(QueueHealthStats stats) {
    Objects.requireNonNull(stats, "stats");
    Optional<TaskPriority> priority = TaskQueueTopology.priorityOf(stats.queueName());
    if (priority.isEmpty()) {
      return 100;
    }
    HealthThresholds.PriorityThresholds limits = thresholds.forPriority(priority.get());
    int score = 100;
    if (stats.messageCount() > limits.maxQueueDepth()) {
      score -= 30;
    }
    if (stats.throughputPerSecond() < limits.minThroughputPerSecond()) {
      score -= 25;
    }
    if (stats.errorRate() > thresholds.maxErrorRate()) {
      score -= 25;
    }
    if (stats.consumerCount() == 0) {
      score -= 50;
    }
    if (stats.avgWaitTime() > limits.maxAvgWaitTime().toMillis()) {
      score -= 20;
    }
    return Math.max(0, score);
  }

  /**
   * Compares the score of the third-most-recent entry with the most recent one.
   *
   * @param history chronological history, oldest first
   */
  public HealthTrend trend(List<QueueHealthStats> history) {
    if (history == null || history.size() < TREND_WINDOW) {
      return HealthTrend.STABLE;
    }
    int first = score(history.get(history.size() - TREND_WINDOW));
    int last = score(history.get(history.size() - 1));
    int delta = last - first;
    if (delta > TREND_DELTA) {
      return HealthTrend.IMPROVING;
    }
    if (delta < -TREND_DELTA) {
      return HealthTrend.DEGRADING;
    }
    return HealthTrend.STABLE;
  }

  public List<HealthAlert> evaluate(QueueHealthStats stats, Instant now) {
    Objects.requireNonNull(stats, "stats");
    Objects.requireNonNull(now, "now");
    List<HealthAlert> alerts = new ArrayList<>();
    String queue = stats.queueName();
    Optional<TaskPriority> priority = TaskQueueTopology.priorityOf(queue);

    if (priority.isPresent()) {
      TaskPriority tier = priority.get();
      HealthThresholds.PriorityThresholds limits = thresholds.forPriority(tier);
      AlertSeverity severity = AlertSeverity.forPriority(tier);
      if (stats.messageCount() > limits.maxQueueDepth()) {
        alerts.add(new HealthAlert(AlertType.HIGH_QUEUE_DEPTH, severity, queue,
            "High queue depth: " + stats.messageCount() + " messages (threshold: " + limits.maxQueueDepth() + ")",
            now, metrics("currentDepth", stats.messageCount(), "threshold", limits.maxQueueDepth(), tier)));
      }
      if (stats.throughputPerSecond() < limits.minThroughputPerSecond()) {
        alerts.add(new HealthAlert(AlertType.LOW_THROUGHPUT, severity, queue,
            String.format(Locale.ROOT, "Low throughput: %.2f msg/s (threshold: %s)",
                stats.throughputPerSecond(), limits.minThroughputPerSecond()),
            now, metrics("currentThroughput", stats.throughputPerSecond(), "threshold",
                limits.minThroughputPerSecond(), tier)));
      }
    }

    if (stats.errorRate() > thresholds.maxErrorRate()) {
      alerts.add(new HealthAlert(AlertType.HIGH_ERROR_RATE, AlertSeverity.HIGH, queue,
          String.format(Locale.ROOT, "High error rate: %.2f%% (threshold: %.2f%%)",
              stats.errorRate() * 100, thresholds.maxErrorRate() * 100),
          now, metrics("currentErrorRate", stats.errorRate(), "threshold", thresholds.maxErrorRate(), null)));
    }

    if (priority.isPresent()) {
      TaskPriority tier = priority.get();
      HealthThresholds.PriorityThresholds limits = thresholds.forPriority(tier);
      long maxWait = limits.maxAvgWaitTime().toMillis();
      if (stats.avgWaitTime() > maxWait) {
        // wait-time violations share the depth alert type
        alerts.add(new HealthAlert(AlertType.HIGH_QUEUE_DEPTH, AlertSeverity.forPriority(tier), queue,
            String.format(Locale.ROOT, "High average wait time: %.0fms (threshold: %dms)", stats.avgWaitTime(), maxWait),
            now, metrics("currentWaitTime", stats.avgWaitTime(), "threshold", maxWait, tier)));
      }
    }

    if (stats.consumerCount() == 0) {
      alerts.add(new HealthAlert(AlertType.CONSUMER_DOWN, AlertSeverity.CRITICAL, queue,
          "No active consumers for queue " + queue, now, Map.of("consumerCount", 0)));
    }
    return alerts;
  }

  private static Map<String, Object> metrics(String currentKey, Object current, String thresholdKey,
                                             Object threshold, TaskPriority priority) {
    Map<String, Object> metrics = new LinkedHashMap<>();
    metrics.put(currentKey, current);
    metrics.put(thresholdKey, threshold);
    if (priority != null) {
      metrics.put("priority", priority.wireName());
    }
    return metrics;
  }
}
