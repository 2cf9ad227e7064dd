package io.taskhive.queue.health;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import io.taskhive.task.model.QueueHealthStats;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Periodic snapshot of connection, queue and process health.
 */
public record HealthReport(
    Instant timestamp,
    String connectionStatus,
    List<QueueReport> queues,
    SystemMetrics systemMetrics,
    AlertSummary alerts) {

  public static final String CONNECTED = "connected";
  public static final String DISCONNECTED = "disconnected";

  public HealthReport {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(connectionStatus, "connectionStatus");
    queues = List.copyOf(Objects.requireNonNull(queues, "queues"));
    Objects.requireNonNull(systemMetrics, "systemMetrics");
    Objects.requireNonNull(alerts, "alerts");
  }

  public record QueueReport(@JsonUnwrapped QueueHealthStats stats, int health, HealthTrend trend) {

    public QueueReport {
      Objects.requireNonNull(stats, "stats");
      Objects.requireNonNull(trend, "trend");
    }
  }

  public record SystemMetrics(
      long heapUsedBytes,
      long heapMaxBytes,
      long nonHeapUsedBytes,
      long uptimeMillis,
      String javaVersion,
      int availableProcessors) {
  }

  public record AlertSummary(int total, List<AlertHistory.Entry> recent) {

    public AlertSummary {
      recent = List.copyOf(Objects.requireNonNull(recent, "recent"));
    }
  }
}
