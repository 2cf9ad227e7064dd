package io.taskhive.queue.event;

import io.taskhive.queue.connection.TaskQueueTopology;
import io.taskhive.queue.health.HealthAlert;
import io.taskhive.queue.health.HealthReport;
import io.taskhive.task.model.DeadLetterMessage;
import io.taskhive.task.model.TaskPriority;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Lifecycle events emitted by the dispatcher and the health monitor.
 * <p>
 * {@link #name()} is the stable event name observers key on.
 */
public sealed interface QueueEvent permits QueueEvent.TaskEnqueued,
    QueueEvent.TaskProcessingStarted,
    QueueEvent.TaskProcessingCompleted,
    QueueEvent.TaskRetryScheduled,
    QueueEvent.TaskDeadLettered,
    QueueEvent.HealthAlertRaised,
    QueueEvent.HealthReportGenerated {

  String TASK_ENQUEUED = "task.enqueued";
  String TASK_PROCESSING_STARTED = "task.processing.started";
  String TASK_PROCESSING_COMPLETED = "task.processing.completed";
  String TASK_RETRY_SCHEDULED = "task.retry.scheduled";
  String TASK_DEAD_LETTER = "task.dead.letter";
  String HEALTH_ALERT = "health.alert";
  String HEALTH_REPORT_GENERATED = "health.report.generated";

  String name();

  Instant timestamp();

  /**
   * Queue the event relates to, or {@code null} for connection-wide events.
   */
  String queueName();

  record TaskEnqueued(
      String messageId,
      String taskType,
      TaskPriority priority,
      String routingKey,
      String correlationId,
      Duration delay,
      Instant timestamp) implements QueueEvent {

    public TaskEnqueued {
      Objects.requireNonNull(messageId, "messageId");
      Objects.requireNonNull(taskType, "taskType");
      Objects.requireNonNull(priority, "priority");
      Objects.requireNonNull(routingKey, "routingKey");
      Objects.requireNonNull(delay, "delay");
      Objects.requireNonNull(timestamp, "timestamp");
    }

    @Override
    public String name() {
      return TASK_ENQUEUED;
    }

    @Override
    public String queueName() {
      return TaskQueueTopology.queueName(priority);
    }
  }

  record TaskProcessingStarted(
      String messageId,
      String queueName,
      String correlationId,
      int retryCount,
      Instant timestamp) implements QueueEvent {

    public TaskProcessingStarted {
      Objects.requireNonNull(messageId, "messageId");
      Objects.requireNonNull(queueName, "queueName");
      Objects.requireNonNull(timestamp, "timestamp");
    }

    @Override
    public String name() {
      return TASK_PROCESSING_STARTED;
    }
  }

  record TaskProcessingCompleted(
      String messageId,
      String queueName,
      String correlationId,
      Object result,
      long elapsedMillis,
      Instant timestamp) implements QueueEvent {

    public TaskProcessingCompleted {
      Objects.requireNonNull(messageId, "messageId");
      Objects.requireNonNull(queueName, "queueName");
      Objects.requireNonNull(timestamp, "timestamp");
    }

    @Override
    public String name() {
      return TASK_PROCESSING_COMPLETED;
    }
  }

  record TaskRetryScheduled(
      String messageId,
      String queueName,
      String correlationId,
      int retryCount,
      long delayMillis,
      String error,
      Instant timestamp) implements QueueEvent {

    public TaskRetryScheduled {
      Objects.requireNonNull(messageId, "messageId");
      Objects.requireNonNull(queueName, "queueName");
      Objects.requireNonNull(timestamp, "timestamp");
    }

    @Override
    public String name() {
      return TASK_RETRY_SCHEDULED;
    }
  }

  record TaskDeadLettered(DeadLetterMessage deadLetter, Instant timestamp) implements QueueEvent {

    public TaskDeadLettered {
      Objects.requireNonNull(deadLetter, "deadLetter");
      Objects.requireNonNull(timestamp, "timestamp");
    }

    public String messageId() {
      return deadLetter.message().id();
    }

    @Override
    public String name() {
      return TASK_DEAD_LETTER;
    }

    @Override
    public String queueName() {
      return deadLetter.originalQueue();
    }
  }

  record HealthAlertRaised(HealthAlert alert) implements QueueEvent {

    public HealthAlertRaised {
      Objects.requireNonNull(alert, "alert");
    }

    @Override
    public String name() {
      return HEALTH_ALERT;
    }

    @Override
    public Instant timestamp() {
      return alert.timestamp();
    }

    @Override
    public String queueName() {
      return alert.queueName();
    }
  }

  record HealthReportGenerated(HealthReport report) implements QueueEvent {

    public HealthReportGenerated {
      Objects.requireNonNull(report, "report");
    }

    @Override
    public String name() {
      return HEALTH_REPORT_GENERATED;
    }

    @Override
    public Instant timestamp() {
      return report.timestamp();
    }

    @Override
    public String queueName() {
      return null;
    }
  }
}
