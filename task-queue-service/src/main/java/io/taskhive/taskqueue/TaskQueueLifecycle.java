package io.taskhive.taskqueue;

import io.taskhive.queue.connection.ConnectionManager;
import io.taskhive.queue.connection.DelayedDeliveryMode;
import io.taskhive.queue.dispatch.DelayedMessageRelay;
import io.taskhive.queue.dispatch.TaskDispatcher;
import io.taskhive.queue.health.HealthMonitor;
import io.taskhive.taskqueue.config.TaskQueueProperties;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Connects to the broker when the application context is ready and tears the task queue down on shutdown.
 */
public final class TaskQueueLifecycle implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(TaskQueueLifecycle.class);

  private final ConnectionManager connectionManager;
  private final TaskDispatcher dispatcher;
  private final HealthMonitor healthMonitor;
  private final DelayedMessageRelay relay;
  private final TaskQueueProperties properties;
  private volatile boolean running;

  public TaskQueueLifecycle(ConnectionManager connectionManager,
                            TaskDispatcher dispatcher,
                            HealthMonitor healthMonitor,
                            DelayedMessageRelay relay,
                            TaskQueueProperties properties) {
    this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor");
    this.relay = Objects.requireNonNull(relay, "relay");
    this.properties = Objects.requireNonNull(properties, "properties");
    connectionManager.addConnectionStateListener(dispatcher);
    connectionManager.addConnectionStateListener(relay);
  }

  /**
   * Initializes the connection and topology, then starts metrics refresh, health checks and, without the
   * delayed-message plugin, the delayed relay. A fatal connection failure propagates and fails startup.
   */
  @Override
  public void start() {
    if (running) {
      return;
    }
    connectionManager.initialize();
    dispatcher.start();
    healthMonitor.start();
    if (usesRelay()) {
      relay.start();
    }
    running = true;
    log.info("Task queue started (broker {}:{}, delayed delivery {})", properties.getRabbit().host(),
        properties.getRabbit().port(), properties.getRabbit().delayedDelivery());
  }

  @Override
  public void stop() {
    if (!running) {
      return;
    }
    healthMonitor.stop();
    dispatcher.stopAllConsumers();
    dispatcher.stop();
    relay.stop();
    connectionManager.disconnect();
    running = false;
    log.info("Task queue stopped");
  }

  @Override
  public void stop(Runnable callback) {
    try {
      stop();
    } finally {
      callback.run();
    }
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public boolean isAutoStartup() {
    return properties.isAutoStartup();
  }

  @Override
  public int getPhase() {
    return 0;
  }

  private boolean usesRelay() {
    return properties.getRabbit().delayedDelivery() == DelayedDeliveryMode.REPUBLISH;
  }
}
