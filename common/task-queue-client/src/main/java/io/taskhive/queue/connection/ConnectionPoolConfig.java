package io.taskhive.queue.connection;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable broker connection settings.
 *
 * @param maxConnections        size of the consumer dispatch pool backing the single connection
 * @param maxConnectionAttempts reconnect attempts before the connection is declared lost for good
 * @param publisherConfirms     wait for broker confirms on the publisher channels
 * @param confirmTimeout        upper bound of a confirm wait
 * @param defaultPrefetch       prefetch applied to every freshly created channel
 */
public record ConnectionPoolConfig(
    String host,
    int port,
    String username,
    String password,
    String vhost,
    Duration heartbeat,
    Duration reconnectDelay,
    int maxConnections,
    int maxConnectionAttempts,
    String connectionName,
    boolean publisherConfirms,
    Duration confirmTimeout,
    DelayedDeliveryMode delayedDelivery,
    int defaultPrefetch) {

  public static final String DEFAULT_CONNECTION_NAME = "TaskHive-BackgroundProcessor";

  public ConnectionPoolConfig {
    host = requireNonBlank(host, "host");
    username = requireNonBlank(username, "username");
    Objects.requireNonNull(password, "password");
    vhost = requireNonBlank(vhost, "vhost");
    Objects.requireNonNull(heartbeat, "heartbeat");
    Objects.requireNonNull(reconnectDelay, "reconnectDelay");
    connectionName = connectionName == null || connectionName.isBlank() ? DEFAULT_CONNECTION_NAME : connectionName;
    Objects.requireNonNull(confirmTimeout, "confirmTimeout");
    delayedDelivery = delayedDelivery == null ? DelayedDeliveryMode.REPUBLISH : delayedDelivery;
    if (port <= 0 || port > 65535) {
      throw new IllegalArgumentException("port must be within 1..65535");
    }
    if (reconnectDelay.isNegative() || reconnectDelay.isZero()) {
      throw new IllegalArgumentException("reconnectDelay must be positive");
    }
    if (maxConnections <= 0) {
      throw new IllegalArgumentException("maxConnections must be positive");
    }
    if (maxConnectionAttempts < 0) {
      throw new IllegalArgumentException("maxConnectionAttempts must not be negative");
    }
    if (defaultPrefetch <= 0) {
      throw new IllegalArgumentException("defaultPrefetch must be positive");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  private static String requireNonBlank(String value, String field) {
    Objects.requireNonNull(value, field);
    if (value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be blank");
    }
    return value;
  }

  public static final class Builder {
    private String host = "localhost";
    private int port = 5672;
    private String username = "guest";
    private String password = "guest";
    private String vhost = "/";
    private Duration heartbeat = Duration.ofSeconds(60);
    private Duration reconnectDelay = Duration.ofMillis(5000);
    private int maxConnections = 10;
    private int maxConnectionAttempts = 10;
    private String connectionName = DEFAULT_CONNECTION_NAME;
    private boolean publisherConfirms;
    private Duration confirmTimeout = Duration.ofSeconds(5);
    private DelayedDeliveryMode delayedDelivery = DelayedDeliveryMode.REPUBLISH;
    private int defaultPrefetch = 1;

    private Builder() {
    }

    public Builder host(String host) {
      this.host = host;
      return this;
    }

    public Builder port(int port) {
      this.port = port;
      return this;
    }

    public Builder username(String username) {
      this.username = username;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    public Builder vhost(String vhost) {
      this.vhost = vhost;
      return this;
    }

    public Builder heartbeat(Duration heartbeat) {
      this.heartbeat = heartbeat;
      return this;
    }

    public Builder reconnectDelay(Duration reconnectDelay) {
      this.reconnectDelay = reconnectDelay;
      return this;
    }

    public Builder maxConnections(int maxConnections) {
      this.maxConnections = maxConnections;
      return this;
    }

    public Builder maxConnectionAttempts(int maxConnectionAttempts) {
      this.maxConnectionAttempts = maxConnectionAttempts;
      return this;
    }

    public Builder connectionName(String connectionName) {
      this.connectionName = connectionName;
      return this;
    }

    public Builder publisherConfirms(boolean publisherConfirms) {
      this.publisherConfirms = publisherConfirms;
      return this;
    }

    public Builder confirmTimeout(Duration confirmTimeout) {
      this.confirmTimeout = confirmTimeout;
      return this;
    }

    public Builder delayedDelivery(DelayedDeliveryMode delayedDelivery) {
      this.delayedDelivery = delayedDelivery;
      return this;
    }

    public Builder defaultPrefetch(int defaultPrefetch) {
      this.defaultPrefetch = defaultPrefetch;
      return this;
    }

    public ConnectionPoolConfig build() {
      return new ConnectionPoolConfig(host, port, username, password, vhost, heartbeat, reconnectDelay,
          maxConnections, maxConnectionAttempts, connectionName, publisherConfirms, confirmTimeout,
          delayedDelivery, defaultPrefetch);
    }
  }
}
