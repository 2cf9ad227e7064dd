package io.taskhive.queue.dispatch;

import java.time.Duration;
import java.util.Objects;

/**
 * Consumer settings: prefetch, base retry delay, retry budget and whether exhausted messages are reported as
 * dead letters.
 */
public record ConsumerOptions(int prefetch, Duration retryDelay, int maxRetries, boolean enableDeadLetter) {

  public ConsumerOptions {
    Objects.requireNonNull(retryDelay, "retryDelay");
    if (prefetch <= 0) {
      throw new IllegalArgumentException("prefetch must be positive");
    }
    if (retryDelay.isNegative()) {
      throw new IllegalArgumentException("retryDelay must not be negative");
    }
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must not be negative");
    }
  }

  public static ConsumerOptions defaults() {
    return new ConsumerOptions(1, Duration.ofSeconds(1), 3, true);
  }

  public ConsumerOptions prefetch(int value) {
    return new ConsumerOptions(value, retryDelay, maxRetries, enableDeadLetter);
  }

  public ConsumerOptions retryDelay(Duration value) {
    return new ConsumerOptions(prefetch, value, maxRetries, enableDeadLetter);
  }

  public ConsumerOptions maxRetries(int value) {
    return new ConsumerOptions(prefetch, retryDelay, value, enableDeadLetter);
  }

  public ConsumerOptions enableDeadLetter(boolean value) {
    return new ConsumerOptions(prefetch, retryDelay, maxRetries, value);
  }
}
