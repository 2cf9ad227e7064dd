package io.taskhive.queue.codec;

import com.rabbitmq.client.LongString;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * AMQP header names stamped on task messages and helpers for reading them back.
 * <p>
 * Header values arrive as {@link LongString}, boxed numbers or strings depending on the publisher, so
 * reads coerce rather than cast.
 */
public final class MessageHeaders {

  public static final String RETRY_COUNT = "x-retry-count";
  public static final String ORIGINAL_ROUTING_KEY = "x-original-routing-key";
  public static final String ENQUEUED_AT = "x-enqueued-at";
  public static final String DELAY = "x-delay";
  /** Time a delayed message was handed to the delay exchange; the relay computes the due time from it. */
  public static final String DELAYED_AT = "x-delayed-at";
  /** Wait bucket a relayed message is parked in. Headers exchanges ignore {@code x-} headers when matching. */
  public static final String DELAY_BUCKET = "delay-bucket";

  private MessageHeaders() {
  }

  public static Optional<String> text(Map<String, Object> headers, String name) {
    if (headers == null) {
      return Optional.empty();
    }
    Object value = headers.get(name);
    if (value == null) {
      return Optional.empty();
    }
    String text;
    if (value instanceof LongString longString) {
      text = new String(longString.getBytes(), StandardCharsets.UTF_8);
    } else if (value instanceof byte[] bytes) {
      text = new String(bytes, StandardCharsets.UTF_8);
    } else {
      text = value.toString();
    }
    return text.isBlank() ? Optional.empty() : Optional.of(text);
  }

  public static OptionalLong longValue(Map<String, Object> headers, String name) {
    if (headers == null) {
      return OptionalLong.empty();
    }
    Object value = headers.get(name);
    if (value instanceof Number number) {
      return OptionalLong.of(number.longValue());
    }
    Optional<String> text = text(headers, name);
    if (text.isEmpty()) {
      return OptionalLong.empty();
    }
    try {
      return OptionalLong.of(Long.parseLong(text.get().trim()));
    } catch (NumberFormatException ignored) {
      return OptionalLong.empty();
    }
  }

  public static Optional<Instant> instant(Map<String, Object> headers, String name) {
    Optional<String> text = text(headers, name);
    if (text.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Instant.parse(text.get().trim()));
    } catch (DateTimeParseException ignored) {
      return Optional.empty();
    }
  }
}
