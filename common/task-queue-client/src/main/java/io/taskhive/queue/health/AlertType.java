package io.taskhive.queue.health;

public enum AlertType {
  HIGH_QUEUE_DEPTH,
  LOW_THROUGHPUT,
  HIGH_ERROR_RATE,
  CONSUMER_DOWN,
  CONNECTION_LOST
}
