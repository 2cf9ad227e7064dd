package io.taskhive.queue.connection;

import io.taskhive.task.model.QueueConfiguration;
import io.taskhive.task.model.TaskPriority;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed exchange, queue and routing key names of the task topology.
 */
public final class TaskQueueTopology {

  public static final String PROCESSING_EXCHANGE = "processing";
  public static final String DELAYED_EXCHANGE = "processing.delayed";
  public static final String DEAD_LETTER_EXCHANGE = "dlx";
  public static final String DELAYED_PENDING_QUEUE = "processing.delayed.pending";
  public static final String DELAYED_WAIT_EXCHANGE = "processing.delayed.wait";
  public static final String HEALTH_QUEUE = "health";

  public static final Duration DEAD_LETTER_TTL = Duration.ofDays(7);
  public static final Duration HEALTH_TTL = Duration.ofSeconds(30);
  public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);
  public static final Duration WAIT_BUCKET_GRANULARITY = Duration.ofSeconds(1);
  /** How long an empty wait queue outlives the TTL of its last message before the broker deletes it. */
  public static final Duration WAIT_QUEUE_IDLE_EXPIRY = Duration.ofMinutes(1);

  private TaskQueueTopology() {
  }

  public static String queueName(TaskPriority priority) {
    return "tasks." + priority.wireName();
  }

  public static String deadLetterQueueName(TaskPriority priority) {
    return "dlq." + priority.wireName();
  }

  public static String deadLetterRoutingKey(TaskPriority priority) {
    return "failed." + priority.wireName();
  }

  public static String waitQueueName(long bucketMillis) {
    return DELAYED_WAIT_EXCHANGE + "." + bucketMillis;
  }

  /**
   * Rounds a remaining delay up to the next wait bucket, so messages parked in one wait queue share a TTL
   * and expire in arrival order.
   */
  public static long waitBucket(long remainingMillis) {
    if (remainingMillis <= 0) {
      throw new IllegalArgumentException("remainingMillis must be positive");
    }
    long granularity = WAIT_BUCKET_GRANULARITY.toMillis();
    return ((remainingMillis + granularity - 1) / granularity) * granularity;
  }

  public static String bindingPattern(TaskPriority priority) {
    return "task." + priority.wireName() + ".*";
  }

  public static String routingKey(TaskPriority priority, String taskType) {
    Objects.requireNonNull(priority, "priority");
    Objects.requireNonNull(taskType, "taskType");
    if (taskType.isBlank()) {
      throw new IllegalArgumentException("taskType must not be blank");
    }
    return "task." + priority.wireName() + "." + taskType;
  }

  public static List<String> taskQueueNames() {
    List<String> names = new ArrayList<>();
    for (TaskPriority priority : TaskPriority.values()) {
      names.add(queueName(priority));
    }
    return List.copyOf(names);
  }

  public static QueueConfiguration queueConfiguration(TaskPriority priority) {
    return new QueueConfiguration(
        queueName(priority),
        priority.weight(),
        true,
        DEAD_LETTER_EXCHANGE,
        deadLetterRoutingKey(priority),
        priority.messageTtl(),
        priority.defaultMaxRetries(),
        DEFAULT_RETRY_DELAY);
  }

  public static List<QueueConfiguration> queueConfigurations() {
    List<QueueConfiguration> configurations = new ArrayList<>();
    for (TaskPriority priority : TaskPriority.values()) {
      configurations.add(queueConfiguration(priority));
    }
    return List.copyOf(configurations);
  }

  /**
   * Resolves the priority tier a queue belongs to by looking for the tier name inside the queue name,
   * so both {@code tasks.high} and {@code dlq.high} map to {@link TaskPriority#HIGH}.
   */
  public static Optional<TaskPriority> priorityOf(String queueName) {
    if (queueName == null) {
      return Optional.empty();
    }
    String lower = queueName.toLowerCase(Locale.ROOT);
    for (TaskPriority priority : TaskPriority.values()) {
      if (lower.contains(priority.wireName())) {
        return Optional.of(priority);
      }
    }
    return Optional.empty();
  }
}
