package io.taskhive.queue.dispatch;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.ShutdownSignalException;
import io.taskhive.queue.codec.MalformedTaskMessageException;
import io.taskhive.queue.codec.TaskMessageCodec;
import io.taskhive.queue.codec.TaskMessageProperties;
import io.taskhive.queue.connection.BrokerOperationException;
import io.taskhive.queue.connection.ChannelIds;
import io.taskhive.queue.connection.ConnectionManager;
import io.taskhive.queue.connection.ConnectionStateListener;
import io.taskhive.queue.connection.QueueInfo;
import io.taskhive.queue.connection.TaskPublishException;
import io.taskhive.queue.connection.TaskQueueTopology;
import io.taskhive.queue.event.QueueEvent;
import io.taskhive.queue.event.QueueEventListener;
import io.taskhive.task.model.DeadLetterMessage;
import io.taskhive.task.model.MessageMetadata;
import io.taskhive.task.model.QueueHealthStats;
import io.taskhive.task.model.TaskMessage;
import io.taskhive.task.model.TaskPriority;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Enqueues tasks onto the priority queues and runs consumers that apply the retry / dead-letter policy.
 * <p>
 * Each delivery moves {@code received -> processing -> acked | retry-scheduled | dead-lettered}. Retries are
 * published as new messages through the delayed exchange and the original delivery is acked; dead letters are
 * nacked without requeue so the broker routes them to the queue's dead-letter exchange.
 */
public class TaskDispatcher implements ConnectionStateListener, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);

  static final String MDC_MESSAGE_ID = "messageId";
  static final String MDC_CORRELATION_ID = "correlationId";
  static final String MDC_QUEUE = "queue";

  public static final Duration DEFAULT_METRICS_INTERVAL = Duration.ofSeconds(30);

  private final ConnectionManager connectionManager;
  private final TaskMessageCodec codec;
  private final QueueEventListener events;
  private final PermanentErrorClassifier errorClassifier;
  private final RetryBackoff backoff;
  private final Clock clock;
  private final ScheduledExecutorService scheduler;
  private final Duration metricsInterval;
  private final QueueHealthTracker healthTracker = new QueueHealthTracker();
  private final Map<String, ConsumerRegistration> consumers = new ConcurrentHashMap<>();
  private final Map<String, AtomicLong> messageCounters = new ConcurrentHashMap<>();

  private ScheduledFuture<?> metricsFuture;

  public TaskDispatcher(ConnectionManager connectionManager, TaskMessageCodec codec, QueueEventListener events) {
    this(connectionManager, codec, events, PermanentErrorClassifier.defaults(), new RetryBackoff(),
        Clock.systemUTC(), Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
          @Override
          public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "task-dispatcher-metrics");
            thread.setDaemon(true);
            return thread;
          }
        }), DEFAULT_METRICS_INTERVAL);
  }

  public TaskDispatcher(ConnectionManager connectionManager,
                        TaskMessageCodec codec,
                        QueueEventListener events,
                        PermanentErrorClassifier errorClassifier,
                        RetryBackoff backoff,
                        Clock clock,
                        ScheduledExecutorService scheduler,
                        Duration metricsInterval) {
    this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.events = Objects.requireNonNull(events, "events");
    this.errorClassifier = Objects.requireNonNull(errorClassifier, "errorClassifier");
    this.backoff = Objects.requireNonNull(backoff, "backoff");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.metricsInterval = Objects.requireNonNull(metricsInterval, "metricsInterval");
    if (metricsInterval.isNegative() || metricsInterval.isZero()) {
      throw new IllegalArgumentException("metricsInterval must be positive");
    }
  }

  /**
   * Starts the periodic refresh of broker-reported queue metrics.
   */
  public synchronized void start() {
    if (metricsFuture != null) {
      return;
    }
    long period = metricsInterval.toMillis();
    metricsFuture = scheduler.scheduleAtFixedRate(this::refreshQueueMetrics, period, period, TimeUnit.MILLISECONDS);
  }

  public synchronized void stop() {
    if (metricsFuture != null) {
      metricsFuture.cancel(false);
      metricsFuture = null;
    }
  }

  public String enqueueTask(String taskType, Object payload) {
    return enqueueTask(taskType, payload, EnqueueOptions.defaults());
  }

  /**
   * Publishes a task to {@code task.<priority>.<taskType>}, directly or through the delayed exchange.
   *
   * @return the generated message id
   * @throws TaskPublishException when the broker could not take the message
   */
  public String enqueueTask(String taskType, Object payload, EnqueueOptions options) {
    Objects.requireNonNull(options, "options");
    TaskPriority priority = options.priority();
    String routingKey = TaskQueueTopology.routingKey(priority, taskType);
    String messageId = UUID.randomUUID().toString();
    String correlationId = options.correlationId() == null ? UUID.randomUUID().toString() : options.correlationId();
    Instant now = clock.instant();
    TaskMessage message = new TaskMessage(
        messageId,
        codec.toPayload(payload),
        new MessageMetadata(messageId, correlationId, now, 0, options.maxRetries(), priority, routingKey),
        now);

    if (options.delay().isZero()) {
      boolean accepted = connectionManager.publishMessage(routingKey, message, priority);
      if (!accepted) {
        log.warn("Task {} ({}) published under broker back-pressure", messageId, taskType);
      }
    } else {
      enqueueDelayedMessage(message, routingKey, options.delay().toMillis());
    }
    increment("enqueued." + priority.wireName());
    events.onEvent(new QueueEvent.TaskEnqueued(messageId, taskType, priority, routingKey, correlationId,
        options.delay(), now));
    log.debug("Enqueued task {} ({}) with priority {}", messageId, taskType, priority.wireName());
    return messageId;
  }

  /**
   * Publishes a message to the delayed exchange carrying its delay and original routing key in headers.
   *
   * @throws TaskPublishException when the message could not be written or the broker nacked it
   */
  public void enqueueDelayedMessage(TaskMessage message, String routingKey, long delayMillis) {
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(routingKey, "routingKey");
    Channel channel = connectionManager.getChannel(ChannelIds.DELAYED_PUBLISHER);
    AMQP.BasicProperties properties =
        TaskMessageProperties.forDelayedPublish(message, routingKey, delayMillis, clock.instant());
    byte[] body = codec.encode(message);
    boolean confirmed;
    try {
      synchronized (channel) {
        channel.basicPublish(TaskQueueTopology.DELAYED_EXCHANGE, routingKey, properties, body);
        confirmed = connectionManager.awaitPublisherConfirm(channel);
      }
    } catch (IOException ex) {
      log.error("Failed to publish delayed message {}: {}", message.id(), ex.getMessage());
      throw new TaskPublishException("Failed to publish delayed message " + message.id(), ex);
    }
    if (!confirmed) {
      log.error("Broker rejected delayed message {}", message.id());
      throw new TaskPublishException("Broker rejected delayed message " + message.id(), null);
    }
    log.debug("Scheduled delayed message {} in {}ms", message.id(), delayMillis);
  }

  public void createConsumer(String queueName, TaskProcessor processor) {
    createConsumer(queueName, processor, ConsumerOptions.defaults());
  }

  /**
   * Starts consuming {@code queueName} on its own channel. The registration is kept so the consumer is
   * re-created after a reconnect.
   *
   * @throws IllegalStateException when the queue already has a consumer
   */
  public void createConsumer(String queueName, TaskProcessor processor, ConsumerOptions options) {
    Objects.requireNonNull(queueName, "queueName");
    Objects.requireNonNull(processor, "processor");
    Objects.requireNonNull(options, "options");
    ConsumerRegistration registration = new ConsumerRegistration(queueName, processor, options);
    if (consumers.putIfAbsent(queueName, registration) != null) {
      throw new IllegalStateException("Consumer already registered for queue " + queueName);
    }
    try {
      startConsuming(registration);
    } catch (RuntimeException ex) {
      consumers.remove(queueName, registration);
      throw ex;
    }
  }

  private void startConsuming(ConsumerRegistration registration) {
    String queueName = registration.queueName;
    Channel channel = connectionManager.getChannel(ChannelIds.consumer(queueName));
    try {
      channel.basicQos(registration.options.prefetch());
      String tag = channel.basicConsume(queueName, false,
          (consumerTag, delivery) -> handleDelivery(registration, channel, delivery),
          consumerTag -> log.warn("Consumer {} for queue {} was cancelled by the broker", consumerTag, queueName));
      registration.channel = channel;
      registration.consumerTags.clear();
      registration.consumerTags.add(tag);
      log.info("Started consumer for queue {} (tag {}, prefetch {})", queueName, tag,
          registration.options.prefetch());
    } catch (IOException ex) {
      log.error("Failed to create consumer for queue {}: {}", queueName, ex.getMessage());
      throw new BrokerOperationException("Failed to create consumer for queue " + queueName, ex);
    }
  }

  void handleDelivery(ConsumerRegistration registration, Channel channel, Delivery delivery) {
    long startedAt = clock.millis();
    String queueName = registration.queueName;
    long deliveryTag = delivery.getEnvelope().getDeliveryTag();

    TaskMessage message;
    try {
      message = codec.decode(delivery.getBody());
    } catch (MalformedTaskMessageException ex) {
      log.error("Discarding malformed message on queue {}: {}", queueName, ex.getMessage());
      nack(channel, deliveryTag);
      increment("failed." + queueName);
      return;
    }

    MDC.put(MDC_MESSAGE_ID, message.id());
    MDC.put(MDC_CORRELATION_ID, message.metadata().correlationId());
    MDC.put(MDC_QUEUE, queueName);
    try {
      increment("processing." + queueName);
      events.onEvent(new QueueEvent.TaskProcessingStarted(message.id(), queueName,
          message.metadata().correlationId(), message.retryCount(), clock.instant()));

      Object result;
      try {
        result = registration.processor.process(message);
      } catch (Exception ex) {
        handleProcessingError(registration, channel, delivery, message, ex);
        healthTracker.record(queueName, clock.millis() - startedAt, false, clock.instant());
        increment("failed." + queueName);
        return;
      }

      ack(channel, deliveryTag);
      long elapsed = clock.millis() - startedAt;
      healthTracker.record(queueName, elapsed, true, clock.instant());
      increment("completed." + queueName);
      events.onEvent(new QueueEvent.TaskProcessingCompleted(message.id(), queueName,
          message.metadata().correlationId(), result, elapsed, clock.instant()));
      log.debug("Processed message {} in {}ms", message.id(), elapsed);
    } finally {
      MDC.remove(MDC_MESSAGE_ID);
      MDC.remove(MDC_CORRELATION_ID);
      MDC.remove(MDC_QUEUE);
    }
  }

  private void handleProcessingError(ConsumerRegistration registration,
                                     Channel channel,
                                     Delivery delivery,
                                     TaskMessage message,
                                     Exception error) {
    ConsumerOptions options = registration.options;
    int retryCount = message.retryCount() + 1;
    boolean retryable = shouldRetryError(error);
    boolean willRetry = retryCount <= options.maxRetries() && retryable;
    log.warn("Processing of message {} failed (attempt {}/{}, retry: {}): {}", message.id(), retryCount,
        options.maxRetries(), willRetry, error.getMessage());

    if (willRetry) {
      long delay = backoff.delayMillis(retryCount, options.retryDelay());
      TaskMessage retry = message.withRetry(retryCount, clock.instant());
      try {
        enqueueDelayedMessage(retry, delivery.getEnvelope().getRoutingKey(), delay);
        ack(channel, delivery.getEnvelope().getDeliveryTag());
        events.onEvent(new QueueEvent.TaskRetryScheduled(message.id(), registration.queueName,
            message.metadata().correlationId(), retryCount, delay, String.valueOf(error.getMessage()),
            clock.instant()));
        log.info("Scheduled retry {} for message {} in {}ms", retryCount, message.id(), delay);
        return;
      } catch (RuntimeException retryError) {
        log.error("Failed to schedule retry for message {}: {}", message.id(), retryError.getMessage());
      }
    }
    sendToDeadLetter(registration, channel, delivery, message.withRetry(retryCount, clock.instant()), error);
  }

  private void sendToDeadLetter(ConsumerRegistration registration,
                                Channel channel,
                                Delivery delivery,
                                TaskMessage message,
                                Exception error) {
    nack(channel, delivery.getEnvelope().getDeliveryTag());
    if (!registration.options.enableDeadLetter()) {
      log.warn("Discarded message {} from queue {} (dead-lettering disabled)", message.id(),
          registration.queueName);
      return;
    }
    Instant now = clock.instant();
    DeadLetterMessage deadLetter =
        new DeadLetterMessage(message, registration.queueName, error.getMessage(), now, error);
    events.onEvent(new QueueEvent.TaskDeadLettered(deadLetter, now));
    log.error("Sent message {} to dead letter queue after {} attempt(s): {}", message.id(), message.retryCount(),
        error.getMessage());
  }

  boolean shouldRetryError(Throwable error) {
    return !errorClassifier.isPermanentError(error);
  }

  private static void ack(Channel channel, long deliveryTag) {
    try {
      channel.basicAck(deliveryTag, false);
    } catch (IOException | ShutdownSignalException ex) {
      log.error("Failed to ack delivery {}; the broker will redeliver it: {}", deliveryTag, ex.getMessage());
    }
  }

  private static void nack(Channel channel, long deliveryTag) {
    try {
      channel.basicNack(deliveryTag, false, false);
    } catch (IOException | ShutdownSignalException ex) {
      log.error("Failed to nack delivery {}: {}", deliveryTag, ex.getMessage());
    }
  }

  /**
   * Refreshes depth and consumer count from the broker and recomputes throughput for every consumed queue
   * that already has statistics.
   */
  public void refreshQueueMetrics() {
    for (String queueName : consumers.keySet()) {
      if (!healthTracker.isTracked(queueName)) {
        continue;
      }
      try {
        QueueInfo info = connectionManager.getQueueInfo(queueName);
        healthTracker.refresh(queueName, info, clock.instant());
      } catch (RuntimeException ex) {
        log.debug("Could not refresh metrics for queue {}: {}", queueName, ex.getMessage());
      }
    }
  }

  public List<QueueHealthStats> getQueueHealth() {
    return healthTracker.snapshots();
  }

  public List<QueueHealthStats> getQueueHealth(String queueName) {
    if (queueName == null) {
      return getQueueHealth();
    }
    return healthTracker.snapshot(queueName).map(List::of).orElse(List.of());
  }

  public Map<String, Long> getMessageCounters() {
    Map<String, Long> snapshot = new TreeMap<>();
    messageCounters.forEach((key, value) -> snapshot.put(key, value.get()));
    return snapshot;
  }

  public List<String> activeConsumers() {
    return new ArrayList<>(consumers.keySet());
  }

  private void increment(String key) {
    messageCounters.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
  }

  /**
   * Cancels the consumer tags of {@code queueName} and closes its channel. Failures are logged; in-flight
   * processing finishes normally.
   */
  public void stopConsumer(String queueName) {
    ConsumerRegistration registration = consumers.get(queueName);
    if (registration == null) {
      return;
    }
    Channel channel = registration.channel;
    try {
      if (channel != null && channel.isOpen()) {
        for (String tag : registration.consumerTags) {
          channel.basicCancel(tag);
        }
        channel.close();
      }
      consumers.remove(queueName, registration);
      log.info("Stopped consumer for queue {}", queueName);
    } catch (IOException | TimeoutException | ShutdownSignalException ex) {
      log.error("Failed to stop consumer for queue {}: {}", queueName, ex.getMessage());
    }
  }

  public void stopAllConsumers() {
    List<CompletableFuture<Void>> stops = new ArrayList<>();
    for (String queueName : List.copyOf(consumers.keySet())) {
      stops.add(CompletableFuture.runAsync(() -> stopConsumer(queueName)));
    }
    CompletableFuture.allOf(stops.toArray(new CompletableFuture[0])).join();
  }

  @Override
  public void onConnected(boolean reconnect) {
    if (!reconnect) {
      return;
    }
    for (ConsumerRegistration registration : consumers.values()) {
      try {
        startConsuming(registration);
      } catch (RuntimeException ex) {
        log.error("Failed to restore consumer for queue {}: {}", registration.queueName, ex.getMessage());
      }
    }
  }

  @Override
  public void onConnectionLost(Throwable cause) {
    if (!consumers.isEmpty()) {
      log.warn("Connection lost; {} consumer(s) will be restored on reconnect", consumers.size());
    }
  }

  @Override
  public void close() {
    stop();
    scheduler.shutdownNow();
  }

  static final class ConsumerRegistration {
    final String queueName;
    final TaskProcessor processor;
    final ConsumerOptions options;
    final List<String> consumerTags = new CopyOnWriteArrayList<>();
    volatile Channel channel;

    ConsumerRegistration(String queueName, TaskProcessor processor, ConsumerOptions options) {
      this.queueName = queueName;
      this.processor = processor;
      this.options = options;
    }
  }
}
