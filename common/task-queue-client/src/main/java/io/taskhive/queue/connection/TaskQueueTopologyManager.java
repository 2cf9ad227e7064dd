package io.taskhive.queue.connection;

import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import io.taskhive.queue.codec.MessageHeaders;
import io.taskhive.task.model.QueueConfiguration;
import io.taskhive.task.model.TaskPriority;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares the exchanges, priority queues, dead-letter queues and bindings of the task topology.
 * <p>
 * Every declaration is idempotent so the same sequence runs on first connect and after each reconnect.
 */
public final class TaskQueueTopologyManager {

  private static final Logger log = LoggerFactory.getLogger(TaskQueueTopologyManager.class);

  private static final String DELAYED_MESSAGE_TYPE = "x-delayed-message";

  private final DelayedDeliveryMode delayedDelivery;

  public TaskQueueTopologyManager(DelayedDeliveryMode delayedDelivery) {
    this.delayedDelivery = Objects.requireNonNull(delayedDelivery, "delayedDelivery");
  }

  public void declare(Channel channel) throws IOException {
    Objects.requireNonNull(channel, "channel");
    declareExchanges(channel);
    for (TaskPriority priority : TaskPriority.values()) {
      declarePriorityQueue(channel, TaskQueueTopology.queueConfiguration(priority), priority);
    }
    if (delayedDelivery == DelayedDeliveryMode.REPUBLISH) {
      channel.queueDeclare(TaskQueueTopology.DELAYED_PENDING_QUEUE, true, false, false, null);
      channel.queueBind(TaskQueueTopology.DELAYED_PENDING_QUEUE, TaskQueueTopology.DELAYED_EXCHANGE, "#");
      log.info("declared delayed pending queue {}", TaskQueueTopology.DELAYED_PENDING_QUEUE);
    }
    Map<String, Object> healthArgs = new HashMap<>();
    healthArgs.put("x-message-ttl", TaskQueueTopology.HEALTH_TTL.toMillis());
    channel.queueDeclare(TaskQueueTopology.HEALTH_QUEUE, false, false, true, healthArgs);
    log.info("RabbitMQ topology initialized ({} delayed delivery)", delayedDelivery);
  }

  private void declareExchanges(Channel channel) throws IOException {
    channel.exchangeDeclare(TaskQueueTopology.PROCESSING_EXCHANGE, BuiltinExchangeType.TOPIC, true);
    if (delayedDelivery == DelayedDeliveryMode.PLUGIN) {
      Map<String, Object> args = new HashMap<>();
      args.put("x-delayed-type", BuiltinExchangeType.TOPIC.getType());
      channel.exchangeDeclare(TaskQueueTopology.DELAYED_EXCHANGE, DELAYED_MESSAGE_TYPE, true, false, args);
    } else {
      channel.exchangeDeclare(TaskQueueTopology.DELAYED_EXCHANGE, BuiltinExchangeType.TOPIC, true);
      channel.exchangeDeclare(TaskQueueTopology.DELAYED_WAIT_EXCHANGE, BuiltinExchangeType.HEADERS, true);
    }
    channel.exchangeDeclare(TaskQueueTopology.DEAD_LETTER_EXCHANGE, BuiltinExchangeType.DIRECT, true);
    log.debug("declared exchanges {}, {}, {}", TaskQueueTopology.PROCESSING_EXCHANGE,
        TaskQueueTopology.DELAYED_EXCHANGE, TaskQueueTopology.DEAD_LETTER_EXCHANGE);
  }

  /**
   * Declares the wait queue for one delay bucket. Messages expire after {@code bucketMillis} and are
   * dead-lettered to the processing exchange under the routing key they were published with.
   * <p>
   * The queue deletes itself once it has been unused for the bucket TTL plus
   * {@link TaskQueueTopology#WAIT_QUEUE_IDLE_EXPIRY}. Publishers redeclare it before every publish, which
   * resets that timer, so a parked message always expires before its queue does.
   *
   * @return the wait queue name
   */
  public String declareWaitQueue(Channel channel, long bucketMillis) throws IOException {
    Objects.requireNonNull(channel, "channel");
    if (bucketMillis <= 0) {
      throw new IllegalArgumentException("bucketMillis must be positive");
    }
    String name = TaskQueueTopology.waitQueueName(bucketMillis);
    Map<String, Object> args = new HashMap<>();
    args.put("x-message-ttl", bucketMillis);
    args.put("x-dead-letter-exchange", TaskQueueTopology.PROCESSING_EXCHANGE);
    args.put("x-expires", bucketMillis + TaskQueueTopology.WAIT_QUEUE_IDLE_EXPIRY.toMillis());
    channel.queueDeclare(name, true, false, false, args);
    Map<String, Object> bindArgs = new HashMap<>();
    bindArgs.put("x-match", "all");
    bindArgs.put(MessageHeaders.DELAY_BUCKET, Long.toString(bucketMillis));
    channel.queueBind(name, TaskQueueTopology.DELAYED_WAIT_EXCHANGE, "", bindArgs);
    return name;
  }

  private void declarePriorityQueue(Channel channel, QueueConfiguration config, TaskPriority priority)
      throws IOException {
    Map<String, Object> args = new HashMap<>();
    args.put("x-max-priority", config.priorityWeight());
    args.put("x-dead-letter-exchange", config.deadLetterExchange());
    args.put("x-dead-letter-routing-key", config.deadLetterRoutingKey());
    args.put("x-message-ttl", config.messageTtl().toMillis());
    channel.queueDeclare(config.name(), config.durable(), false, false, args);
    String pattern = TaskQueueTopology.bindingPattern(priority);
    channel.queueBind(config.name(), TaskQueueTopology.PROCESSING_EXCHANGE, pattern);
    if (delayedDelivery == DelayedDeliveryMode.PLUGIN) {
      channel.queueBind(config.name(), TaskQueueTopology.DELAYED_EXCHANGE, pattern);
    }

    String dlq = TaskQueueTopology.deadLetterQueueName(priority);
    Map<String, Object> dlqArgs = new HashMap<>();
    dlqArgs.put("x-message-ttl", TaskQueueTopology.DEAD_LETTER_TTL.toMillis());
    channel.queueDeclare(dlq, true, false, false, dlqArgs);
    channel.queueBind(dlq, config.deadLetterExchange(), config.deadLetterRoutingKey());
    log.info("declared queue {} with dead-letter queue {}", config.name(), dlq);
  }
}
