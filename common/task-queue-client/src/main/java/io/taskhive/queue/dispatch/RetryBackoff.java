package io.taskhive.queue.dispatch;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Jittered exponential backoff: {@code min(2^(retry-1) * retryDelay + uniform(0, 1000ms), 300000ms)}.
 */
public final class RetryBackoff {

  public static final long MAX_DELAY_MILLIS = 300_000L;
  public static final long MAX_JITTER_MILLIS = 1_000L;

  private final DoubleSupplier random;

  public RetryBackoff() {
    this(() -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * @param random source of values in [0, 1)
   */
  public RetryBackoff(DoubleSupplier random) {
    this.random = Objects.requireNonNull(random, "random");
  }

  public long delayMillis(int retryCount, Duration retryDelay) {
    Objects.requireNonNull(retryDelay, "retryDelay");
    if (retryCount < 1) {
      throw new IllegalArgumentException("retryCount must be at least 1");
    }
    double base = Math.pow(2, retryCount - 1) * retryDelay.toMillis();
    double jitter = random.getAsDouble() * MAX_JITTER_MILLIS;
    return (long) Math.min(base + jitter, MAX_DELAY_MILLIS);
  }
}
