package io.taskhive.queue.connection;

/**
 * How messages published to the delayed exchange are reinjected into the task queues.
 */
public enum DelayedDeliveryMode {
  /** The client relays messages from a pending queue back to the processing exchange once due. */
  REPUBLISH,
  /** The broker's delayed-message exchange plugin performs the delay. */
  PLUGIN
}
