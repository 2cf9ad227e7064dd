package io.taskhive.taskqueue.config;

import io.taskhive.queue.connection.ConnectionPoolConfig;
import io.taskhive.queue.connection.DelayedDeliveryMode;
import io.taskhive.queue.dispatch.DelayedMessageRelay;
import io.taskhive.queue.dispatch.TaskDispatcher;
import io.taskhive.queue.health.HealthMonitor;
import io.taskhive.queue.health.HealthThresholds;
import io.taskhive.task.model.TaskPriority;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

/**
 * Settings bound from {@code taskhive.task-queue.*}. Every value has a default, so an empty configuration
 * connects to a local broker as {@code guest}.
 */
@Validated
@ConfigurationProperties(prefix = "taskhive.task-queue")
public class TaskQueueProperties {

    private final boolean autoStartup;
    private final Rabbit rabbit;
    private final Dispatcher dispatcher;
    private final Health health;

    public TaskQueueProperties(Boolean autoStartup,
                               @Valid Rabbit rabbit,
                               @Valid Dispatcher dispatcher,
                               @Valid Health health) {
        this.autoStartup = autoStartup == null || autoStartup;
        this.rabbit = rabbit != null ? rabbit : new Rabbit(null, null, null, null, null, null, null, null, null, null,
            null, null, null, null);
        this.dispatcher = dispatcher != null ? dispatcher : new Dispatcher(null, null);
        this.health = health != null ? health : new Health(null, null, null, null, null, null, null, null);
    }

    public boolean isAutoStartup() {
        return autoStartup;
    }

    public Rabbit getRabbit() {
        return rabbit;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Health getHealth() {
        return health;
    }

    public ConnectionPoolConfig toConnectionPoolConfig() {
        return ConnectionPoolConfig.builder()
            .host(rabbit.host())
            .port(rabbit.port())
            .username(rabbit.username())
            .password(rabbit.password())
            .vhost(rabbit.vhost())
            .heartbeat(rabbit.heartbeat())
            .reconnectDelay(rabbit.reconnectDelay())
            .maxConnections(rabbit.maxConnections())
            .maxConnectionAttempts(rabbit.maxConnectionAttempts())
            .connectionName(rabbit.connectionName())
            .publisherConfirms(rabbit.publisherConfirms())
            .confirmTimeout(rabbit.confirmTimeout())
            .delayedDelivery(rabbit.delayedDelivery())
            .defaultPrefetch(rabbit.defaultPrefetch())
            .build();
    }

    /**
     * Default thresholds with any configured per-priority limits and global limits applied on top.
     */
    public HealthThresholds toHealthThresholds() {
        HealthThresholds defaults = HealthThresholds.defaults();
        Map<TaskPriority, HealthThresholds.PriorityThresholds> priorities = new EnumMap<>(TaskPriority.class);
        for (TaskPriority priority : TaskPriority.values()) {
            HealthThresholds.PriorityThresholds base = defaults.forPriority(priority);
            PriorityLimits override = health.priorities().get(priority);
            priorities.put(priority, override == null ? base : override.applyTo(base));
        }
        return new HealthThresholds(
            priorities,
            health.maxErrorRate(),
            health.maxHistorySize(),
            health.alertCooldown(),
            health.maxHeap().toBytes(),
            health.maxSchedulingLag());
    }

    @Validated
    public static final class Rabbit {
        private final String host;
        private final int port;
        private final String username;
        private final String password;
        private final String vhost;
        private final Duration heartbeat;
        private final Duration reconnectDelay;
        private final int maxConnections;
        private final int maxConnectionAttempts;
        private final String connectionName;
        private final boolean publisherConfirms;
        private final Duration confirmTimeout;
        private final DelayedDeliveryMode delayedDelivery;
        private final int defaultPrefetch;

        public Rabbit(String host,
                      @Positive Integer port,
                      String username,
                      String password,
                      String vhost,
                      @DurationUnit(ChronoUnit.SECONDS) Duration heartbeat,
                      Duration reconnectDelay,
                      @Positive Integer maxConnections,
                      @Positive Integer maxConnectionAttempts,
                      String connectionName,
                      Boolean publisherConfirms,
                      Duration confirmTimeout,
                      DelayedDeliveryMode delayedDelivery,
                      @Positive Integer defaultPrefetch) {
            this.host = defaultIfBlank(host, "localhost");
            this.port = requirePositive(port != null ? port : 5672, "port");
            this.username = defaultIfBlank(username, "guest");
            this.password = password != null ? password : "guest";
            this.vhost = defaultIfBlank(vhost, "/");
            this.heartbeat = heartbeat != null ? heartbeat : Duration.ofSeconds(60);
            this.reconnectDelay = reconnectDelay != null ? reconnectDelay : Duration.ofMillis(5000);
            this.maxConnections = requirePositive(maxConnections != null ? maxConnections : 10, "maxConnections");
            this.maxConnectionAttempts =
                requirePositive(maxConnectionAttempts != null ? maxConnectionAttempts : 10, "maxConnectionAttempts");
            this.connectionName = defaultIfBlank(connectionName, ConnectionPoolConfig.DEFAULT_CONNECTION_NAME);
            this.publisherConfirms = Boolean.TRUE.equals(publisherConfirms);
            this.confirmTimeout = confirmTimeout != null ? confirmTimeout : Duration.ofSeconds(5);
            this.delayedDelivery = delayedDelivery != null ? delayedDelivery : DelayedDeliveryMode.REPUBLISH;
            this.defaultPrefetch = requirePositive(defaultPrefetch != null ? defaultPrefetch : 1, "defaultPrefetch");
        }

        public String host() {
            return host;
        }

        public int port() {
            return port;
        }

        public String username() {
            return username;
        }

        public String password() {
            return password;
        }

        public String vhost() {
            return vhost;
        }

        public Duration heartbeat() {
            return heartbeat;
        }

        public Duration reconnectDelay() {
            return reconnectDelay;
        }

        public int maxConnections() {
            return maxConnections;
        }

        public int maxConnectionAttempts() {
            return maxConnectionAttempts;
        }

        public String connectionName() {
            return connectionName;
        }

        public boolean publisherConfirms() {
            return publisherConfirms;
        }

        public Duration confirmTimeout() {
            return confirmTimeout;
        }

        public DelayedDeliveryMode delayedDelivery() {
            return delayedDelivery;
        }

        public int defaultPrefetch() {
            return defaultPrefetch;
        }
    }

    @Validated
    public static final class Dispatcher {
        private final Duration metricsInterval;
        private final int relayPrefetch;

        public Dispatcher(Duration metricsInterval, @Positive Integer relayPrefetch) {
            this.metricsInterval = metricsInterval != null ? metricsInterval : TaskDispatcher.DEFAULT_METRICS_INTERVAL;
            this.relayPrefetch =
                requirePositive(relayPrefetch != null ? relayPrefetch : DelayedMessageRelay.DEFAULT_PREFETCH, "relayPrefetch");
        }

        public Duration metricsInterval() {
            return metricsInterval;
        }

        public int relayPrefetch() {
            return relayPrefetch;
        }
    }

    @Validated
    public static final class Health {
        private final Duration checkInterval;
        private final Duration reportInterval;
        private final double maxErrorRate;
        private final int maxHistorySize;
        private final Duration alertCooldown;
        private final DataSize maxHeap;
        private final Duration maxSchedulingLag;
        private final Map<TaskPriority, PriorityLimits> priorities;

        public Health(Duration checkInterval,
                      Duration reportInterval,
                      @DecimalMin("0.0") @DecimalMax("1.0") Double maxErrorRate,
                      @Positive Integer maxHistorySize,
                      Duration alertCooldown,
                      DataSize maxHeap,
                      Duration maxSchedulingLag,
                      Map<TaskPriority, @Valid PriorityLimits> priorities) {
            HealthThresholds defaults = HealthThresholds.defaults();
            this.checkInterval = checkInterval != null ? checkInterval : HealthMonitor.DEFAULT_CHECK_INTERVAL;
            this.reportInterval = reportInterval != null ? reportInterval : HealthMonitor.DEFAULT_REPORT_INTERVAL;
            this.maxErrorRate = maxErrorRate != null ? maxErrorRate : defaults.maxErrorRate();
            if (this.maxErrorRate < 0.0 || this.maxErrorRate > 1.0) {
                throw new IllegalArgumentException("maxErrorRate must be within [0, 1]");
            }
            this.maxHistorySize = requirePositive(maxHistorySize != null ? maxHistorySize : defaults.maxHistorySize(),
                "maxHistorySize");
            this.alertCooldown = alertCooldown != null ? alertCooldown : defaults.alertCooldown();
            this.maxHeap = maxHeap != null ? maxHeap : DataSize.ofBytes(defaults.maxHeapBytes());
            this.maxSchedulingLag = maxSchedulingLag != null ? maxSchedulingLag : defaults.maxSchedulingLag();
            this.priorities = priorities == null ? Map.of() : Map.copyOf(priorities);
        }

        public Duration checkInterval() {
            return checkInterval;
        }

        public Duration reportInterval() {
            return reportInterval;
        }

        public double maxErrorRate() {
            return maxErrorRate;
        }

        public int maxHistorySize() {
            return maxHistorySize;
        }

        public Duration alertCooldown() {
            return alertCooldown;
        }

        public DataSize maxHeap() {
            return maxHeap;
        }

        public Duration maxSchedulingLag() {
            return maxSchedulingLag;
        }

        public Map<TaskPriority, PriorityLimits> priorities() {
            return priorities;
        }
    }

    /**
     * Partial override of one tier's limits; unset values keep the defaults.
     */
    @Validated
    public static final class PriorityLimits {
        private final Long maxQueueDepth;
        private final Double minThroughput;
        private final Duration maxAvgWaitTime;

        public PriorityLimits(@Positive Long maxQueueDepth, Double minThroughput, Duration maxAvgWaitTime) {
            this.maxQueueDepth = maxQueueDepth;
            this.minThroughput = minThroughput;
            this.maxAvgWaitTime = maxAvgWaitTime;
        }

        HealthThresholds.PriorityThresholds applyTo(HealthThresholds.PriorityThresholds base) {
            Objects.requireNonNull(base, "base");
            return new HealthThresholds.PriorityThresholds(
                maxQueueDepth != null ? maxQueueDepth : base.maxQueueDepth(),
                minThroughput != null ? minThroughput : base.minThroughputPerSecond(),
                maxAvgWaitTime != null ? maxAvgWaitTime : base.maxAvgWaitTime());
        }
    }

    private static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    private static String defaultIfBlank(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
