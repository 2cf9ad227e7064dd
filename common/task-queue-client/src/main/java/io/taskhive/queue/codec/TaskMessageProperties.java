package io.taskhive.queue.codec;

import com.rabbitmq.client.AMQP;
import io.taskhive.task.model.TaskMessage;
import java.time.Instant;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;

/**
 * Builds the AMQP properties stamped on task publishes.
 */
public final class TaskMessageProperties {

  public static final String CONTENT_TYPE = "application/json";
  public static final String CONTENT_ENCODING = "utf-8";
  private static final int PERSISTENT = 2;

  private TaskMessageProperties() {
  }

  public static AMQP.BasicProperties forPublish(TaskMessage message, String routingKey, Instant now) {
    return builder(message, headers(message, routingKey), now).build();
  }

  public static AMQP.BasicProperties forDelayedPublish(
      TaskMessage message, String routingKey, long delayMillis, Instant now) {
    if (delayMillis < 0) {
      throw new IllegalArgumentException("delayMillis must not be negative");
    }
    Map<String, Object> headers = headers(message, routingKey);
    headers.put(MessageHeaders.DELAY, delayMillis);
    headers.put(MessageHeaders.DELAYED_AT, now.toString());
    return builder(message, headers, now).build();
  }

  public static AMQP.BasicProperties forWaitQueue(
      TaskMessage message, String routingKey, long bucketMillis, Instant now) {
    if (bucketMillis <= 0) {
      throw new IllegalArgumentException("bucketMillis must be positive");
    }
    Map<String, Object> headers = headers(message, routingKey);
    headers.put(MessageHeaders.DELAY_BUCKET, Long.toString(bucketMillis));
    return builder(message, headers, now).build();
  }

  private static Map<String, Object> headers(TaskMessage message, String routingKey) {
    Map<String, Object> headers = new HashMap<>();
    headers.put(MessageHeaders.RETRY_COUNT, message.retryCount());
    headers.put(MessageHeaders.ORIGINAL_ROUTING_KEY, routingKey);
    headers.put(MessageHeaders.ENQUEUED_AT, message.enqueuedAt().toString());
    return headers;
  }

  private static AMQP.BasicProperties.Builder builder(TaskMessage message, Map<String, Object> headers, Instant now) {
    return new AMQP.BasicProperties.Builder()
        .contentType(CONTENT_TYPE)
        .contentEncoding(CONTENT_ENCODING)
        .deliveryMode(PERSISTENT)
        .priority(message.priority().weight())
        .messageId(message.id())
        .correlationId(message.metadata().correlationId())
        .timestamp(Date.from(now))
        .headers(headers);
  }
}
