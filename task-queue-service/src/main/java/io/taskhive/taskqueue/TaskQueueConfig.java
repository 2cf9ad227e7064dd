package io.taskhive.taskqueue;

import io.micrometer.core.instrument.MeterRegistry;
import io.taskhive.queue.codec.TaskMessageCodec;
import io.taskhive.queue.connection.ConnectionManager;
import io.taskhive.queue.dispatch.DelayedMessageRelay;
import io.taskhive.queue.dispatch.PermanentErrorClassifier;
import io.taskhive.queue.dispatch.RetryBackoff;
import io.taskhive.queue.dispatch.TaskDispatcher;
import io.taskhive.queue.event.CompositeQueueEventListener;
import io.taskhive.queue.event.LoggingQueueEventListener;
import io.taskhive.queue.event.QueueEventListener;
import io.taskhive.queue.health.HealthMonitor;
import io.taskhive.queue.metrics.QueueHealthMetrics;
import io.taskhive.taskqueue.config.TaskQueueProperties;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Wires the task queue client components from {@link TaskQueueProperties}.
 */
@Configuration
public class TaskQueueConfig {
  private final TaskQueueProperties properties;

  public TaskQueueConfig(TaskQueueProperties properties) {
    this.properties = properties;
  }

  @Bean
  TaskMessageCodec taskMessageCodec() {
    return new TaskMessageCodec();
  }

  @Bean(destroyMethod = "close")
  ConnectionManager connectionManager(TaskMessageCodec codec) {
    return new ConnectionManager(properties.toConnectionPoolConfig(), codec);
  }

  @Bean
  Clock taskQueueClock() {
    return Clock.systemUTC();
  }

  @Bean
  QueueHealthMetrics queueHealthMetrics(MeterRegistry meterRegistry) {
    return new QueueHealthMetrics(meterRegistry);
  }

  @Bean
  SpringQueueEventBridge springQueueEventBridge(ApplicationEventPublisher publisher) {
    return new SpringQueueEventBridge(publisher);
  }

  @Bean
  @Primary
  QueueEventListener queueEventListener(QueueHealthMetrics metrics, SpringQueueEventBridge bridge) {
    return new CompositeQueueEventListener(List.of(new LoggingQueueEventListener(), metrics, bridge));
  }

  @Bean(destroyMethod = "close")
  TaskDispatcher taskDispatcher(ConnectionManager connectionManager,
                                TaskMessageCodec codec,
                                QueueEventListener queueEventListener,
                                Clock clock) {
    return new TaskDispatcher(connectionManager, codec, queueEventListener, PermanentErrorClassifier.defaults(),
        new RetryBackoff(), clock, scheduler("task-dispatcher-metrics"),
        properties.getDispatcher().metricsInterval());
  }

  @Bean(destroyMethod = "close")
  HealthMonitor healthMonitor(ConnectionManager connectionManager,
                              TaskDispatcher dispatcher,
                              QueueEventListener queueEventListener,
                              Clock clock) {
    TaskQueueProperties.Health health = properties.getHealth();
    return new HealthMonitor(connectionManager, dispatcher, queueEventListener, properties.toHealthThresholds(),
        clock, scheduler("queue-health-monitor"), health.checkInterval(), health.reportInterval());
  }

  @Bean(destroyMethod = "close")
  DelayedMessageRelay delayedMessageRelay(ConnectionManager connectionManager, TaskMessageCodec codec, Clock clock) {
    return new DelayedMessageRelay(connectionManager, codec, properties.getDispatcher().relayPrefetch(), clock);
  }

  @Bean
  TaskQueueLifecycle taskQueueLifecycle(ConnectionManager connectionManager,
                                        TaskDispatcher dispatcher,
                                        HealthMonitor healthMonitor,
                                        DelayedMessageRelay relay) {
    return new TaskQueueLifecycle(connectionManager, dispatcher, healthMonitor, relay, properties);
  }

  @Bean
  QueueMetricsScheduler queueMetricsScheduler(TaskDispatcher dispatcher, QueueHealthMetrics metrics) {
    return new QueueMetricsScheduler(dispatcher, metrics);
  }

  private static ScheduledExecutorService scheduler(String name) {
    return Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
      @Override
      public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, name);
        thread.setDaemon(true);
        return thread;
      }
    });
  }
}
