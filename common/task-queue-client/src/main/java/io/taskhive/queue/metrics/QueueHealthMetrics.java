package io.taskhive.queue.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Tags;
import io.taskhive.queue.event.QueueEvent;
import io.taskhive.queue.event.QueueEventListener;
import io.taskhive.task.model.QueueHealthStats;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Publishes per-queue health gauges and per-event counters to Micrometer.
 * <p>
 * Gauges are registered on the first update of a queue and read from a holder refreshed by
 * {@link #update(QueueHealthStats)}; counters are incremented from the lifecycle event stream.
 */
public final class QueueHealthMetrics implements QueueEventListener {

  static final String DEPTH = "taskhive_queue_depth";
  static final String CONSUMERS = "taskhive_queue_consumers";
  static final String THROUGHPUT = "taskhive_queue_throughput_per_second";
  static final String ERROR_RATE = "taskhive_queue_error_rate";
  static final String AVG_PROCESSING = "taskhive_queue_avg_processing_ms";
  static final String EVENTS = "taskhive_task_events_total";

  private static final String NO_QUEUE = "none";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, QueueValues> queueValues = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, List<Meter>> queueGauges = new ConcurrentHashMap<>();

  public QueueHealthMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
  }

  public void updateAll(Collection<QueueHealthStats> stats) {
    Objects.requireNonNull(stats, "stats");
    stats.forEach(this::update);
  }

  public void update(QueueHealthStats stats) {
    Objects.requireNonNull(stats, "stats");
    QueueValues values = queueValues.computeIfAbsent(stats.queueName(), this::registerGauges);
    values.depth = stats.messageCount();
    values.consumers = stats.consumerCount();
    values.throughput = stats.throughputPerSecond();
    values.errorRate = stats.errorRate();
    values.avgProcessingMillis = stats.avgWaitTime();
  }

  public void unregister(String queueName) {
    if (queueName == null || queueName.isBlank()) {
      return;
    }
    queueValues.remove(queueName);
    List<Meter> gauges = queueGauges.remove(queueName);
    if (gauges != null) {
      gauges.forEach(meterRegistry::remove);
    }
  }

  @Override
  public void onEvent(QueueEvent event) {
    String queue = event.queueName() == null ? NO_QUEUE : event.queueName();
    Counter.builder(EVENTS)
        .description("Task queue lifecycle events")
        .tags(Tags.of("event", event.name(), "queue", queue))
        .register(meterRegistry)
        .increment();
  }

  private QueueValues registerGauges(String queueName) {
    QueueValues holder = new QueueValues();
    Tags tags = Tags.of("queue", queueName);
    List<Meter> gauges = new ArrayList<>(5);
    gauges.add(Gauge.builder(DEPTH, holder, v -> v.depth)
        .description("Depth of a task queue as last reported by the broker")
        .tags(tags)
        .register(meterRegistry));
    gauges.add(Gauge.builder(CONSUMERS, holder, v -> v.consumers)
        .description("Consumers attached to a task queue")
        .tags(tags)
        .register(meterRegistry));
    gauges.add(Gauge.builder(THROUGHPUT, holder, v -> v.throughput)
        .description("Completed messages per second over the last refresh interval")
        .tags(tags)
        .register(meterRegistry));
    gauges.add(Gauge.builder(ERROR_RATE, holder, v -> v.errorRate)
        .description("Fraction of processed messages that failed")
        .tags(tags)
        .register(meterRegistry));
    gauges.add(Gauge.builder(AVG_PROCESSING, holder, v -> v.avgProcessingMillis)
        .description("Cumulative average processing time in milliseconds")
        .tags(tags)
        .register(meterRegistry));
    queueGauges.put(queueName, gauges);
    return holder;
  }

  private static final class QueueValues {
    volatile double depth;
    volatile double consumers;
    volatile double throughput;
    volatile double errorRate;
    volatile double avgProcessingMillis;
  }
}
