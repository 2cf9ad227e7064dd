package io.taskhive.taskqueue;

import io.taskhive.queue.dispatch.TaskDispatcher;
import io.taskhive.queue.metrics.QueueHealthMetrics;
import io.taskhive.task.model.QueueHealthStats;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Copies the dispatcher's queue statistics into the Micrometer gauges.
 */
public class QueueMetricsScheduler {

  private static final Logger log = LoggerFactory.getLogger(QueueMetricsScheduler.class);

  private final TaskDispatcher dispatcher;
  private final QueueHealthMetrics metrics;

  public QueueMetricsScheduler(TaskDispatcher dispatcher, QueueHealthMetrics metrics) {
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Scheduled(fixedRateString = "#{@'taskhive.task-queue-io.taskhive.taskqueue.config.TaskQueueProperties'.dispatcher.metricsInterval().toMillis()}")
  public void publishQueueMetrics() {
    List<QueueHealthStats> stats = dispatcher.getQueueHealth();
    if (log.isTraceEnabled()) {
      log.trace("Publishing gauges for {} queue(s)", stats.size());
    }
    metrics.updateAll(stats);
  }
}
