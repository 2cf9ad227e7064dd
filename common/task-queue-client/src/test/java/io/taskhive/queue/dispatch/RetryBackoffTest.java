package io.taskhive.queue.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RetryBackoffTest {

  @ParameterizedTest
  @CsvSource({
      "1, 1000, 1000",
      "2, 1000, 2000",
      "3, 1000, 4000",
      "4, 500, 4000"
  })
  void doublesPerAttemptWithoutJitter(int retry, long retryDelay, long expected) {
    RetryBackoff backoff = new RetryBackoff(() -> 0.0);

    assertThat(backoff.delayMillis(retry, Duration.ofMillis(retryDelay))).isEqualTo(expected);
  }

  @Test
  void jitterStaysWithinOneSecond() {
    RetryBackoff lowest = new RetryBackoff(() -> 0.0);
    RetryBackoff highest = new RetryBackoff(() -> 0.999);
    RetryBackoff random = new RetryBackoff();

    for (int retry = 1; retry <= 6; retry++) {
      long base = (1L << (retry - 1)) * 1000;
      assertThat(lowest.delayMillis(retry, Duration.ofSeconds(1))).isEqualTo(base);
      assertThat(highest.delayMillis(retry, Duration.ofSeconds(1))).isBetween(base, base + 1000);
      assertThat(random.delayMillis(retry, Duration.ofSeconds(1))).isBetween(base, base + 1000);
    }
  }

  @Test
  void capsAtFiveMinutes() {
    RetryBackoff backoff = new RetryBackoff(() -> 0.5);

    assertThat(backoff.delayMillis(12, Duration.ofSeconds(1))).isEqualTo(RetryBackoff.MAX_DELAY_MILLIS);
    assertThat(backoff.delayMillis(60, Duration.ofMinutes(1))).isEqualTo(RetryBackoff.MAX_DELAY_MILLIS);
  }

  @Test
  void rejectsRetryCountBelowOne() {
    assertThatThrownBy(() -> new RetryBackoff().delayMillis(0, Duration.ofSeconds(1)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
