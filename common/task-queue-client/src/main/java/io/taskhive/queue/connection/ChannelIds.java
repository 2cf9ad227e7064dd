package io.taskhive.queue.connection;

/**
 * Names of the cached channels. Each usage pattern gets its own channel and they are never shared.
 */
public final class ChannelIds {

  public static final String PUBLISHER = "publisher";
  public static final String DELAYED_PUBLISHER = "delayed-publisher";
  public static final String DELAYED_RELAY = "delayed-relay";
  public static final String ADMIN = "admin";
  public static final String HEALTH_CHECK = "health-check";
  public static final String TOPOLOGY = "topology";

  private ChannelIds() {
  }

  public static String consumer(String queueName) {
    return "consumer-" + queueName;
  }

  static boolean isPublisher(String channelId) {
    return PUBLISHER.equals(channelId) || DELAYED_PUBLISHER.equals(channelId);
  }
}
