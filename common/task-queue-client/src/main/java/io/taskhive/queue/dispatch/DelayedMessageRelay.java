package io.taskhive.queue.dispatch;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.ShutdownSignalException;
import io.taskhive.queue.codec.MalformedTaskMessageException;
import io.taskhive.queue.codec.MessageHeaders;
import io.taskhive.queue.codec.TaskMessageCodec;
import io.taskhive.queue.connection.BrokerOperationException;
import io.taskhive.queue.connection.ChannelIds;
import io.taskhive.queue.connection.ConnectionManager;
import io.taskhive.queue.connection.ConnectionStateListener;
import io.taskhive.queue.connection.TaskQueueTopology;
import io.taskhive.task.model.TaskMessage;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reinjects delayed messages when the broker has no delayed-message exchange plugin.
 * <p>
 * Consumes {@code processing.delayed.pending} and settles every delivery as soon as it arrives. A message
 * that is already due ({@code x-delayed-at + x-delay} has passed) is republished to the processing exchange
 * under {@code x-original-routing-key}. Any other message is parked in the wait queue of its delay bucket,
 * whose TTL dead-letters it back to the processing exchange. The delivery is acked only once the broker
 * accepted the hand-off and requeued otherwise, so a message may be reinjected more than once.
 */
public class DelayedMessageRelay implements ConnectionStateListener, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(DelayedMessageRelay.class);

  public static final int DEFAULT_PREFETCH = 250;

  private final ConnectionManager connectionManager;
  private final TaskMessageCodec codec;
  private final int prefetch;
  private final Clock clock;

  private volatile boolean running;
  private volatile Channel channel;
  private volatile String consumerTag;

  public DelayedMessageRelay(ConnectionManager connectionManager, TaskMessageCodec codec) {
    this(connectionManager, codec, DEFAULT_PREFETCH, Clock.systemUTC());
  }

  public DelayedMessageRelay(ConnectionManager connectionManager,
                             TaskMessageCodec codec,
                             int prefetch,
                             Clock clock) {
    this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (prefetch <= 0) {
      throw new IllegalArgumentException("prefetch must be positive");
    }
    this.prefetch = prefetch;
  }

  public synchronized void start() {
    if (running) {
      return;
    }
    running = true;
    subscribe();
  }

  private void subscribe() {
    Channel relayChannel = connectionManager.getChannel(ChannelIds.DELAYED_RELAY);
    try {
      relayChannel.basicQos(prefetch);
      consumerTag = relayChannel.basicConsume(TaskQueueTopology.DELAYED_PENDING_QUEUE, false,
          (tag, delivery) -> onDelivery(relayChannel, delivery),
          tag -> log.warn("Delayed relay consumer {} was cancelled by the broker", tag));
      channel = relayChannel;
      log.info("Delayed message relay consuming {}", TaskQueueTopology.DELAYED_PENDING_QUEUE);
    } catch (IOException ex) {
      throw new BrokerOperationException("Failed to start delayed message relay", ex);
    }
  }

  void onDelivery(Channel relayChannel, Delivery delivery) {
    long deliveryTag = delivery.getEnvelope().getDeliveryTag();
    Map<String, Object> headers = delivery.getProperties() == null ? null : delivery.getProperties().getHeaders();
    long delay = MessageHeaders.longValue(headers, MessageHeaders.DELAY).orElse(0L);
    Instant now = clock.instant();
    Instant delayedAt = MessageHeaders.instant(headers, MessageHeaders.DELAYED_AT).orElse(now);
    long dueIn = Math.max(0L, Duration.between(now, delayedAt.plusMillis(delay)).toMillis());
    String routingKey = MessageHeaders.text(headers, MessageHeaders.ORIGINAL_ROUTING_KEY)
        .orElse(delivery.getEnvelope().getRoutingKey());

    TaskMessage message;
    try {
      message = codec.decode(delivery.getBody());
    } catch (MalformedTaskMessageException ex) {
      log.error("Dropping malformed delayed message: {}", ex.getMessage());
      settle(relayChannel, deliveryTag, false, false);
      return;
    }
    try {
      boolean accepted = dueIn == 0
          ? connectionManager.publishMessage(routingKey, message, message.priority())
          : connectionManager.publishToWaitQueue(routingKey, message, TaskQueueTopology.waitBucket(dueIn));
      if (!accepted) {
        log.warn("Broker did not accept delayed message {}; requeueing it", message.id());
        settle(relayChannel, deliveryTag, false, true);
        return;
      }
      settle(relayChannel, deliveryTag, true, false);
      log.debug("Relayed delayed message {} to {} (due in {}ms)", message.id(), routingKey, dueIn);
    } catch (RuntimeException ex) {
      log.warn("Failed to relay delayed message {}: {}", message.id(), ex.getMessage());
      settle(relayChannel, deliveryTag, false, true);
    }
  }

  private static void settle(Channel relayChannel, long deliveryTag, boolean ack, boolean requeue) {
    try {
      synchronized (relayChannel) {
        if (ack) {
          relayChannel.basicAck(deliveryTag, false);
        } else {
          relayChannel.basicNack(deliveryTag, false, requeue);
        }
      }
    } catch (IOException | ShutdownSignalException ex) {
      log.warn("Failed to settle delayed delivery {}: {}", deliveryTag, ex.getMessage());
    }
  }

  @Override
  public void onConnected(boolean reconnect) {
    if (!reconnect || !running) {
      return;
    }
    try {
      subscribe();
    } catch (RuntimeException ex) {
      log.error("Failed to restore delayed message relay: {}", ex.getMessage());
    }
  }

  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    Channel current = channel;
    channel = null;
    if (current == null || !current.isOpen()) {
      return;
    }
    try {
      if (consumerTag != null) {
        current.basicCancel(consumerTag);
      }
      current.close();
    } catch (IOException | TimeoutException | ShutdownSignalException ex) {
      log.warn("Error stopping delayed message relay: {}", ex.getMessage());
    }
  }

  public boolean isRunning() {
    return running;
  }

  @Override
  public void close() {
    stop();
  }
}
