package io.taskhive.queue.health;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.Channel;
import io.taskhive.queue.connection.ChannelIds;
import io.taskhive.queue.connection.ConnectionManager;
import io.taskhive.queue.connection.TaskQueueTopology;
import io.taskhive.queue.dispatch.TaskDispatcher;
import io.taskhive.queue.event.QueueEvent;
import io.taskhive.queue.event.QueueEventListener;
import io.taskhive.task.model.QueueHealthStats;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically diagnoses the connection, the consumed queues and the process, raising rate-limited alerts and
 * producing health reports. It reads dispatcher and broker state and never mutates it.
 */
public class HealthMonitor implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(30);
  public static final Duration DEFAULT_REPORT_INTERVAL = Duration.ofMinutes(5);
  public static final int DEFAULT_HISTORY_LIMIT = 50;
  static final int RECENT_ALERTS = 10;

  private final ConnectionManager connectionManager;
  private final TaskDispatcher dispatcher;
  private final QueueEventListener events;
  private final HealthScorer scorer;
  private final AlertHistory alertHistory;
  private final Clock clock;
  private final ScheduledExecutorService scheduler;
  private final Duration checkInterval;
  private final Duration reportInterval;
  private final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
  private final Map<String, Deque<QueueHealthStats>> history = new ConcurrentHashMap<>();

  private ScheduledFuture<?> checkFuture;
  private ScheduledFuture<?> reportFuture;

  public HealthMonitor(ConnectionManager connectionManager,
                       TaskDispatcher dispatcher,
                       QueueEventListener events,
                       HealthThresholds thresholds) {
    this(connectionManager, dispatcher, events, thresholds, Clock.systemUTC(),
        Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
          @Override
          public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "queue-health-monitor");
            thread.setDaemon(true);
            return thread;
          }
        }), DEFAULT_CHECK_INTERVAL, DEFAULT_REPORT_INTERVAL);
  }

  public HealthMonitor(ConnectionManager connectionManager,
                       TaskDispatcher dispatcher,
                       QueueEventListener events,
                       HealthThresholds thresholds,
                       Clock clock,
                       ScheduledExecutorService scheduler,
                       Duration checkInterval,
                       Duration reportInterval) {
    this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.events = Objects.requireNonNull(events, "events");
    Objects.requireNonNull(thresholds, "thresholds");
    this.scorer = new HealthScorer(thresholds);
    this.alertHistory = new AlertHistory(thresholds.alertCooldown());
    this.clock = Objects.requireNonNull(clock, "clock");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.checkInterval = requirePositive(checkInterval, "checkInterval");
    this.reportInterval = requirePositive(reportInterval, "reportInterval");
  }

  private static Duration requirePositive(Duration value, String field) {
    Objects.requireNonNull(value, field);
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(field + " must be positive");
    }
    return value;
  }

  public synchronized void start() {
    if (checkFuture != null) {
      return;
    }
    long check = checkInterval.toMillis();
    long report = reportInterval.toMillis();
    checkFuture = scheduler.scheduleAtFixedRate(this::performHealthCheck, check, check, TimeUnit.MILLISECONDS);
    reportFuture = scheduler.scheduleAtFixedRate(this::generateHealthReport, report, report, TimeUnit.MILLISECONDS);
    log.info("Health monitor started (check every {}s, report every {}s)", checkInterval.toSeconds(),
        reportInterval.toSeconds());
  }

  public synchronized void stop() {
    if (checkFuture != null) {
      checkFuture.cancel(false);
      checkFuture = null;
    }
    if (reportFuture != null) {
      reportFuture.cancel(false);
      reportFuture = null;
    }
  }

  public void performHealthCheck() {
    try {
      checkConnectionHealth();
      checkQueueHealth();
      checkSystemHealth();
    } catch (RuntimeException ex) {
      log.error("Health check failed: {}", ex.getMessage(), ex);
    }
  }

  public void generateHealthReport() {
    try {
      HealthReport report = generateDetailedHealthReport();
      log.info("Health report: connection={}, queues={}, alerts={}", report.connectionStatus(),
          report.queues().size(), report.alerts().total());
      events.onEvent(new QueueEvent.HealthReportGenerated(report));
    } catch (RuntimeException ex) {
      log.error("Failed to generate health report: {}", ex.getMessage(), ex);
    }
  }

  void checkConnectionHealth() {
    if (!connectionManager.isConnected()) {
      raiseAlert(new HealthAlert(AlertType.CONNECTION_LOST, AlertSeverity.CRITICAL, null,
          "RabbitMQ connection lost", clock.instant(), Map.of("connectionStatus", HealthReport.DISCONNECTED)));
      return;
    }
    try {
      Channel channel = connectionManager.getChannel(ChannelIds.HEALTH_CHECK);
      byte[] ping = pingBody();
      synchronized (channel) {
        channel.queueDeclarePassive(TaskQueueTopology.HEALTH_QUEUE);
        channel.basicPublish("", TaskQueueTopology.HEALTH_QUEUE, null, ping);
      }
      log.debug("Connection health check passed");
    } catch (IOException | RuntimeException ex) {
      raiseAlert(new HealthAlert(AlertType.CONNECTION_LOST, AlertSeverity.HIGH, null,
          "Connection health check failed: " + ex.getMessage(), clock.instant(),
          Map.of("error", String.valueOf(ex.getMessage()))));
    }
  }

  private byte[] pingBody() {
    Map<String, Object> ping = new LinkedHashMap<>();
    ping.put("type", "ping");
    ping.put("timestamp", clock.instant().toString());
    try {
      return MAPPER.writeValueAsBytes(ping);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialise health ping", ex);
    }
  }

  void checkQueueHealth() {
    Instant now = clock.instant();
    for (QueueHealthStats stats : dispatcher.getQueueHealth()) {
      for (HealthAlert alert : scorer.evaluate(stats, now)) {
        raiseAlert(alert);
      }
      updateHealthHistory(stats, now);
    }
    checkCriticalQueues();
  }

  private void checkCriticalQueues() {
    for (String queueName : TaskQueueTopology.taskQueueNames()) {
      try {
        connectionManager.getQueueInfo(queueName);
      } catch (RuntimeException ex) {
        raiseAlert(new HealthAlert(AlertType.CONSUMER_DOWN, AlertSeverity.HIGH, queueName,
            "Critical queue " + queueName + " is not available: " + ex.getMessage(), clock.instant(),
            Map.of("error", String.valueOf(ex.getMessage()))));
      }
    }
  }

  void checkSystemHealth() {
    long heapUsed = memory.getHeapMemoryUsage().getUsed();
    long maxHeap = scorer.thresholds().maxHeapBytes();
    if (heapUsed > maxHeap) {
      log.warn("High memory usage detected: {}MB", heapUsed / (1024 * 1024));
    }
    long submitted = System.nanoTime();
    long maxLag = scorer.thresholds().maxSchedulingLag().toMillis();
    scheduler.execute(() -> {
      long lagMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - submitted);
      if (lagMillis > maxLag) {
        log.warn("High scheduling lag detected: {}ms", lagMillis);
      }
    });
  }

  /**
   * Appends a copy of {@code stats} stamped with the check time, so entries recorded while a queue is idle
   * stay distinguishable.
   */
  private void updateHealthHistory(QueueHealthStats stats, Instant checkedAt) {
    Deque<QueueHealthStats> entries = history.computeIfAbsent(stats.queueName(), name -> new ArrayDeque<>());
    int max = scorer.thresholds().maxHistorySize();
    QueueHealthStats entry = stats.withLastProcessedAt(checkedAt);
    synchronized (entries) {
      entries.addLast(entry);
      while (entries.size() > max) {
        entries.removeFirst();
      }
    }
  }

  void raiseAlert(HealthAlert alert) {
    if (!alertHistory.tryRecord(alert, clock.instant())) {
      log.debug("Suppressed repeated alert {}", alert.deduplicationKey());
      return;
    }
    log.error("Health alert [{}] {}: {} metrics={}", alert.severity(), alert.type(), alert.message(),
        alert.metrics());
    events.onEvent(new QueueEvent.HealthAlertRaised(alert));
  }

  public HealthReport generateDetailedHealthReport() {
    List<HealthReport.QueueReport> queues = new ArrayList<>();
    for (QueueHealthStats stats : dispatcher.getQueueHealth()) {
      queues.add(new HealthReport.QueueReport(stats, scorer.score(stats), calculateHealthTrend(stats.queueName())));
    }
    MemoryUsage heap = memory.getHeapMemoryUsage();
    HealthReport.SystemMetrics system = new HealthReport.SystemMetrics(
        heap.getUsed(),
        heap.getMax(),
        memory.getNonHeapMemoryUsage().getUsed(),
        ManagementFactory.getRuntimeMXBean().getUptime(),
        System.getProperty("java.version"),
        Runtime.getRuntime().availableProcessors());
    return new HealthReport(
        clock.instant(),
        connectionManager.isConnected() ? HealthReport.CONNECTED : HealthReport.DISCONNECTED,
        queues,
        system,
        new HealthReport.AlertSummary(alertHistory.size(), alertHistory.recent(RECENT_ALERTS)));
  }

  public HealthStatus getCurrentHealthStatus() {
    List<String> issues = new ArrayList<>();
    if (!connectionManager.isConnected()) {
      issues.add("RabbitMQ connection lost");
    }
    for (QueueHealthStats stats : dispatcher.getQueueHealth()) {
      int score = scorer.score(stats);
      if (score < HealthScorer.HEALTHY_SCORE) {
        issues.add("Queue " + stats.queueName() + " health score: " + score);
      }
    }
    return new HealthStatus(issues.isEmpty(), issues);
  }

  public int calculateQueueHealthScore(QueueHealthStats stats) {
    return scorer.score(stats);
  }

  public HealthTrend calculateHealthTrend(String queueName) {
    return scorer.trend(getHealthHistory(queueName, HealthScorer.TREND_WINDOW));
  }

  public List<QueueHealthStats> getHealthHistory(String queueName) {
    return getHealthHistory(queueName, DEFAULT_HISTORY_LIMIT);
  }

  /**
   * Most recent {@code limit} history entries of a queue, oldest first.
   */
  public List<QueueHealthStats> getHealthHistory(String queueName, int limit) {
    Deque<QueueHealthStats> entries = history.get(queueName);
    if (entries == null || limit <= 0) {
      return List.of();
    }
    synchronized (entries) {
      List<QueueHealthStats> all = new ArrayList<>(entries);
      return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }
  }

  @Override
  public void close() {
    stop();
    scheduler.shutdownNow();
  }
}
