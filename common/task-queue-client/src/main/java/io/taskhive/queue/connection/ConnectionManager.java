package io.taskhive.queue.connection;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import io.taskhive.queue.codec.TaskMessageCodec;
import io.taskhive.queue.codec.TaskMessageProperties;
import io.taskhive.task.model.TaskMessage;
import io.taskhive.task.model.TaskPriority;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the single broker connection, a cache of named channels and the task topology.
 * <p>
 * Automatic recovery of the AMQP client is disabled: reconnects follow a linear backoff
 * ({@code reconnectDelay * attempt}) capped at {@link ConnectionPoolConfig#maxConnectionAttempts()}, after
 * which the connection is declared lost with a {@link ConnectionFatalException}. Channels never survive a
 * connection and are recreated lazily on next use.
 */
public class ConnectionManager implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  private final ConnectionPoolConfig config;
  private final ConnectionFactory connectionFactory;
  private final TaskMessageCodec codec;
  private final TaskQueueTopologyManager topologyManager;
  private final ScheduledExecutorService reconnectScheduler;
  private final ExecutorService consumerPool;
  private final Clock clock;

  private final Map<String, Channel> channels = new ConcurrentHashMap<>();
  private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();
  private final Object channelLock = new Object();
  private final AtomicBoolean connecting = new AtomicBoolean();
  private final AtomicBoolean blocked = new AtomicBoolean();
  private final AtomicInteger connectionAttempts = new AtomicInteger();

  private volatile Connection connection;
  private volatile CompletableFuture<Void> connected = new CompletableFuture<>();
  private volatile boolean shuttingDown;
  private volatile boolean everConnected;
  private ScheduledFuture<?> reconnectFuture;

  public ConnectionManager(ConnectionPoolConfig config, TaskMessageCodec codec) {
    this(config,
        createConnectionFactory(config),
        codec,
        Executors.newSingleThreadScheduledExecutor(daemonThreads("taskhive-reconnect")),
        Executors.newFixedThreadPool(config.maxConnections(), daemonThreads("taskhive-consumer")),
        Clock.systemUTC());
  }

  public ConnectionManager(ConnectionPoolConfig config,
                           ConnectionFactory connectionFactory,
                           TaskMessageCodec codec,
                           ScheduledExecutorService reconnectScheduler,
                           ExecutorService consumerPool,
                           Clock clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.reconnectScheduler = Objects.requireNonNull(reconnectScheduler, "reconnectScheduler");
    this.consumerPool = Objects.requireNonNull(consumerPool, "consumerPool");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.topologyManager = new TaskQueueTopologyManager(config.delayedDelivery());
  }

  static ConnectionFactory createConnectionFactory(ConnectionPoolConfig config) {
    ConnectionFactory factory = new ConnectionFactory();
    factory.setHost(config.host());
    factory.setPort(config.port());
    factory.setUsername(config.username());
    factory.setPassword(config.password());
    factory.setVirtualHost(config.vhost());
    factory.setRequestedHeartbeat((int) config.heartbeat().toSeconds());
    factory.setAutomaticRecoveryEnabled(false);
    factory.setTopologyRecoveryEnabled(false);
    return factory;
  }

  private static ThreadFactory daemonThreads(String name) {
    AtomicInteger counter = new AtomicInteger();
    return new ThreadFactory() {
      @Override
      public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, name + "-" + counter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      }
    };
  }

  public ConnectionPoolConfig config() {
    return config;
  }

  public void addConnectionStateListener(ConnectionStateListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  /**
   * Connects, waits until the first connection is up and declares the topology.
   *
   * @throws ConnectionFatalException when the reconnect attempts are exhausted before a connection is made
   */
  public void initialize() {
    shuttingDown = false;
    if (connected.isCompletedExceptionally()) {
      connected = new CompletableFuture<>();
      connectionAttempts.set(0);
    }
    connect();
    awaitConnection();
    initializeTopology();
  }

  /**
   * Opens the broker connection. Concurrent attempts are rejected, not queued. A failed attempt schedules
   * the next one.
   */
  public void connect() {
    if (!connecting.compareAndSet(false, true)) {
      log.warn("Connection attempt already in progress");
      return;
    }
    Connection opened;
    try {
      log.info("Connecting to RabbitMQ at {}:{}{}", config.host(), config.port(), config.vhost());
      opened = connectionFactory.newConnection(consumerPool, config.connectionName());
    } catch (IOException | TimeoutException ex) {
      connecting.set(false);
      log.error("Failed to connect to RabbitMQ: {}", ex.getMessage());
      handleConnectionError(ex);
      return;
    }
    opened.addShutdownListener(cause -> onShutdown(opened, cause));
    opened.addBlockedListener(
        reason -> {
          blocked.set(true);
          log.warn("RabbitMQ connection blocked: {}", reason);
        },
        () -> {
          blocked.set(false);
          log.info("RabbitMQ connection unblocked");
        });
    connection = opened;
    blocked.set(false);
    connectionAttempts.set(0);
    boolean reconnect = everConnected;
    everConnected = true;
    connecting.set(false);
    log.info("Successfully connected to RabbitMQ");
    if (reconnect) {
      try {
        initializeTopology();
      } catch (RuntimeException ex) {
        log.error("Failed to re-declare topology after reconnect: {}", ex.getMessage(), ex);
      }
    }
    connected.complete(null);
    for (ConnectionStateListener listener : listeners) {
      try {
        listener.onConnected(reconnect);
      } catch (RuntimeException ex) {
        log.warn("Connection listener {} failed: {}", listener, ex.getMessage(), ex);
      }
    }
  }

  private void awaitConnection() {
    try {
      connected.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for RabbitMQ connection", ex);
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof ConnectionFatalException fatal) {
        throw fatal;
      }
      throw new ConnectionFatalException("Failed to establish RabbitMQ connection", ex.getCause());
    }
  }

  private void onShutdown(Connection source, ShutdownSignalException cause) {
    if (source != connection) {
      return;
    }
    if (shuttingDown || cause.isInitiatedByApplication()) {
      log.info("RabbitMQ connection closed");
      clearConnectionState();
      return;
    }
    try {
      if (cause.getCause() != null) {
        log.error("RabbitMQ connection error: {}", cause.getMessage());
        handleConnectionError(cause);
      } else {
        log.warn("RabbitMQ connection closed by broker: {}", cause.getMessage());
        handleConnectionClose(cause);
      }
    } catch (ConnectionFatalException ex) {
      log.error("Giving up on RabbitMQ connection: {}", ex.getMessage());
    }
  }

  /**
   * Drops the current connection and schedules the next attempt with a delay growing per attempt.
   *
   * @throws ConnectionFatalException once the attempt cap is exceeded
   */
  void handleConnectionError(Throwable cause) {
    connectionLost(cause);
    if (shuttingDown) {
      return;
    }
    int attempt = connectionAttempts.incrementAndGet();
    if (attempt > config.maxConnectionAttempts()) {
      log.error("Max connection attempts reached. Manual intervention required.");
      ConnectionFatalException fatal = new ConnectionFatalException(
          "Failed to establish RabbitMQ connection after " + config.maxConnectionAttempts() + " attempts", cause);
      connected.completeExceptionally(fatal);
      throw fatal;
    }
    long delay = config.reconnectDelay().toMillis() * attempt;
    log.info("Attempting reconnection {}/{} in {}ms", attempt, config.maxConnectionAttempts(), delay);
    scheduleReconnect(delay);
  }

  void handleConnectionClose(Throwable cause) {
    connectionLost(cause);
    if (shuttingDown) {
      return;
    }
    scheduleReconnect(config.reconnectDelay().toMillis());
  }

  private void connectionLost(Throwable cause) {
    boolean wasConnected = connection != null;
    clearConnectionState();
    if (connected.isDone() && !connected.isCompletedExceptionally()) {
      connected = new CompletableFuture<>();
    }
    if (!wasConnected) {
      return;
    }
    for (ConnectionStateListener listener : listeners) {
      try {
        listener.onConnectionLost(cause);
      } catch (RuntimeException ex) {
        log.warn("Connection listener {} failed: {}", listener, ex.getMessage(), ex);
      }
    }
  }

  private synchronized void scheduleReconnect(long delayMillis) {
    if (reconnectScheduler.isShutdown()) {
      return;
    }
    reconnectFuture = reconnectScheduler.schedule(this::reconnect, delayMillis, TimeUnit.MILLISECONDS);
  }

  private void reconnect() {
    if (shuttingDown) {
      return;
    }
    try {
      connect();
    } catch (ConnectionFatalException ex) {
      log.debug("Reconnect sequence ended: {}", ex.getMessage());
    }
  }

  private void clearConnectionState() {
    connection = null;
    channels.clear();
  }

  /**
   * Returns the cached channel registered under {@code channelId}, creating it when missing or closed.
   *
   * @throws NotConnectedException when there is no live connection
   */
  public Channel getChannel(String channelId) {
    Objects.requireNonNull(channelId, "channelId");
    Connection current = connection;
    if (current == null || !current.isOpen()) {
      throw new NotConnectedException("RabbitMQ connection not established");
    }
    Channel cached = channels.get(channelId);
    if (cached != null && cached.isOpen()) {
      return cached;
    }
    synchronized (channelLock) {
      cached = channels.get(channelId);
      if (cached != null && cached.isOpen()) {
        return cached;
      }
      Channel created = openChannel(current, channelId);
      channels.put(channelId, created);
      return created;
    }
  }

  private Channel openChannel(Connection current, String channelId) {
    try {
      Channel channel = current.createChannel();
      if (channel == null) {
        throw new BrokerOperationException("No channel available for " + channelId, null);
      }
      channel.basicQos(config.defaultPrefetch());
      if (config.publisherConfirms() && ChannelIds.isPublisher(channelId)) {
        channel.confirmSelect();
      }
      channel.addShutdownListener(cause -> {
        if (cause.isInitiatedByApplication()) {
          log.warn("Channel {} closed", channelId);
        } else {
          log.error("Channel {} error: {}", channelId, cause.getMessage());
        }
        channels.remove(channelId, channel);
      });
      log.debug("Created new channel: {}", channelId);
      return channel;
    } catch (IOException ex) {
      throw new BrokerOperationException("Failed to create channel " + channelId, ex);
    }
  }

  public void initializeTopology() {
    Channel channel = getChannel(ChannelIds.TOPOLOGY);
    try {
      synchronized (channel) {
        topologyManager.declare(channel);
      }
    } catch (IOException ex) {
      log.error("Failed to initialize topology: {}", ex.getMessage());
      throw new BrokerOperationException("Failed to initialize RabbitMQ topology", ex);
    }
  }

  /**
   * Publishes a task envelope to the processing exchange.
   *
   * @return {@code false} when the broker refused the message or applies flow control and the caller should
   *     back off
   * @throws TaskPublishException when the message could not be written to the broker
   */
  public boolean publishMessage(String routingKey, TaskMessage message, TaskPriority priority) {
    Objects.requireNonNull(routingKey, "routingKey");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(priority, "priority");
    if (priority != message.priority()) {
      throw new IllegalArgumentException("priority " + priority + " does not match message priority " + message.priority());
    }
    Channel channel = getChannel(ChannelIds.PUBLISHER);
    byte[] body = codec.encode(message);
    AMQP.BasicProperties properties = TaskMessageProperties.forPublish(message, routingKey, clock.instant());
    boolean accepted;
    try {
      synchronized (channel) {
        channel.basicPublish(TaskQueueTopology.PROCESSING_EXCHANGE, routingKey, properties, body);
        accepted = awaitAcknowledgement(channel);
      }
    } catch (IOException ex) {
      log.error("Failed to publish message {}: {}", message.id(), ex.getMessage());
      throw new TaskPublishException("Failed to publish message " + message.id(), ex);
    }
    if (accepted) {
      log.debug("Published message {} to {}", message.id(), routingKey);
    } else {
      log.warn("Broker did not accept message {} on {}; publisher should back off", message.id(), routingKey);
    }
    return accepted;
  }

  /**
   * Parks a delayed message in the wait queue of {@code bucketMillis}. When the bucket TTL elapses the broker
   * dead-letters it to the processing exchange under {@code routingKey}.
   *
   * @return {@code false} when the broker refused the message or applies flow control
   * @throws TaskPublishException when the wait queue could not be declared or the message not written
   */
  public boolean publishToWaitQueue(String routingKey, TaskMessage message, long bucketMillis) {
    Objects.requireNonNull(routingKey, "routingKey");
    Objects.requireNonNull(message, "message");
    Channel channel = getChannel(ChannelIds.DELAYED_PUBLISHER);
    byte[] body = codec.encode(message);
    AMQP.BasicProperties properties =
        TaskMessageProperties.forWaitQueue(message, routingKey, bucketMillis, clock.instant());
    boolean accepted;
    try {
      synchronized (channel) {
        topologyManager.declareWaitQueue(channel, bucketMillis);
        channel.basicPublish(TaskQueueTopology.DELAYED_WAIT_EXCHANGE, routingKey, properties, body);
        accepted = awaitAcknowledgement(channel);
      }
    } catch (IOException ex) {
      log.error("Failed to park delayed message {}: {}", message.id(), ex.getMessage());
      throw new TaskPublishException("Failed to park delayed message " + message.id(), ex);
    }
    if (accepted) {
      log.debug("Parked message {} for {}ms before {}", message.id(), bucketMillis, routingKey);
    } else {
      log.warn("Broker did not accept delayed message {} for {}", message.id(), routingKey);
    }
    return accepted;
  }

  private boolean awaitAcknowledgement(Channel channel) {
    if (!config.publisherConfirms()) {
      return !blocked.get();
    }
    return awaitPublisherConfirm(channel);
  }

  /**
   * Waits for the broker to confirm every publish outstanding on {@code channel}. Callers hold the channel
   * monitor across the publish and this call.
   *
   * @return {@code true} when publisher confirms are off or every publish was acked, {@code false} on a nack
   * @throws TaskPublishException when the wait is interrupted or times out
   */
  public boolean awaitPublisherConfirm(Channel channel) {
    Objects.requireNonNull(channel, "channel");
    if (!config.publisherConfirms()) {
      return true;
    }
    try {
      return channel.waitForConfirms(config.confirmTimeout().toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new TaskPublishException("Interrupted while waiting for publisher confirm", ex);
    } catch (TimeoutException ex) {
      throw new TaskPublishException("Timed out waiting for publisher confirm", ex);
    }
  }

  public boolean isConnected() {
    Connection current = connection;
    return current != null && current.isOpen();
  }

  public QueueInfo getQueueInfo(String queueName) {
    Objects.requireNonNull(queueName, "queueName");
    Channel channel = getChannel(ChannelIds.ADMIN);
    try {
      AMQP.Queue.DeclareOk ok;
      synchronized (channel) {
        ok = channel.queueDeclarePassive(queueName);
      }
      return new QueueInfo(ok.getQueue(), ok.getMessageCount(), ok.getConsumerCount());
    } catch (IOException ex) {
      throw new BrokerOperationException("Failed to inspect queue " + queueName, ex);
    }
  }

  public long purgeQueue(String queueName) {
    Objects.requireNonNull(queueName, "queueName");
    Channel channel = getChannel(ChannelIds.ADMIN);
    try {
      AMQP.Queue.PurgeOk ok;
      synchronized (channel) {
        ok = channel.queuePurge(queueName);
      }
      log.info("Purged {} messages from queue {}", ok.getMessageCount(), queueName);
      return ok.getMessageCount();
    } catch (IOException ex) {
      throw new BrokerOperationException("Failed to purge queue " + queueName, ex);
    }
  }

  /**
   * Cancels pending reconnects, closes every cached channel and the connection. Close failures are logged.
   */
  public void disconnect() {
    shuttingDown = true;
    synchronized (this) {
      if (reconnectFuture != null) {
        reconnectFuture.cancel(false);
        reconnectFuture = null;
      }
    }
    for (Map.Entry<String, Channel> entry : channels.entrySet()) {
      Channel channel = entry.getValue();
      try {
        if (channel.isOpen()) {
          channel.close();
        }
      } catch (IOException | TimeoutException | ShutdownSignalException ex) {
        log.warn("Error closing channel {}: {}", entry.getKey(), ex.getMessage());
      }
    }
    channels.clear();
    Connection current = connection;
    connection = null;
    if (current != null) {
      try {
        if (current.isOpen()) {
          current.close();
        }
      } catch (IOException | ShutdownSignalException ex) {
        log.warn("Error closing RabbitMQ connection: {}", ex.getMessage());
      }
    }
    log.info("Disconnected from RabbitMQ");
  }

  @Override
  public void close() {
    disconnect();
    reconnectScheduler.shutdownNow();
    consumerPool.shutdown();
  }
}
