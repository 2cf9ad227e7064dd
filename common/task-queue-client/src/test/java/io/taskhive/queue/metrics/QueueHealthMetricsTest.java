package io.taskhive.queue.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.taskhive.queue.event.QueueEvent;
import io.taskhive.task.model.QueueHealthStats;
import io.taskhive.task.model.TaskPriority;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class QueueHealthMetricsTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final QueueHealthMetrics metrics = new QueueHealthMetrics(registry);

  @Test
  void gaugesFollowTheLatestStats() {
    metrics.update(new QueueHealthStats("tasks.high", 12, 2, 35.5, 4.0, 0.25, NOW));
    metrics.update(new QueueHealthStats("tasks.high", 3, 1, 40.0, 6.5, 0.1, NOW));

    assertThat(gauge(QueueHealthMetrics.DEPTH, "tasks.high")).isEqualTo(3.0);
    assertThat(gauge(QueueHealthMetrics.CONSUMERS, "tasks.high")).isEqualTo(1.0);
    assertThat(gauge(QueueHealthMetrics.THROUGHPUT, "tasks.high")).isEqualTo(6.5);
    assertThat(gauge(QueueHealthMetrics.ERROR_RATE, "tasks.high")).isEqualTo(0.1);
    assertThat(gauge(QueueHealthMetrics.AVG_PROCESSING, "tasks.high")).isEqualTo(40.0);
    assertThat(registry.find(QueueHealthMetrics.DEPTH).gauges()).hasSize(1);
  }

  @Test
  void updateAllRegistersEveryQueueAndUnregisterRemovesThem() {
    metrics.updateAll(List.of(
        new QueueHealthStats("tasks.low", 1, 1, 1, 1, 0, NOW),
        new QueueHealthStats("tasks.normal", 2, 1, 1, 1, 0, NOW)));

    assertThat(registry.find(QueueHealthMetrics.DEPTH).gauges()).hasSize(2);

    metrics.unregister("tasks.low");

    assertThat(registry.find(QueueHealthMetrics.DEPTH).tag("queue", "tasks.low").gauge()).isNull();
    assertThat(registry.find(QueueHealthMetrics.DEPTH).tag("queue", "tasks.normal").gauge()).isNotNull();
  }

  @Test
  void countsLifecycleEventsByNameAndQueue() {
    QueueEvent enqueued = new QueueEvent.TaskEnqueued("m-1", "index", TaskPriority.LOW, "task.low.index", "m-1",
        Duration.ZERO, NOW);
    metrics.onEvent(enqueued);
    metrics.onEvent(enqueued);
    metrics.onEvent(new QueueEvent.TaskProcessingStarted("m-1", "tasks.low", "m-1", 0, NOW));

    assertThat(registry.get(QueueHealthMetrics.EVENTS)
        .tags("event", QueueEvent.TASK_ENQUEUED, "queue", "tasks.low").counter().count()).isEqualTo(2.0);
    assertThat(registry.get(QueueHealthMetrics.EVENTS)
        .tags("event", QueueEvent.TASK_PROCESSING_STARTED, "queue", "tasks.low").counter().count()).isEqualTo(1.0);
  }

  private double gauge(String name, String queue) {
    return registry.get(name).tag("queue", queue).gauge().value();
  }
}
