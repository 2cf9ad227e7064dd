package io.taskhive.queue.codec;

import static org.assertj.core.api.Assertions.assertThat;

import com.rabbitmq.client.LongString;
import com.rabbitmq.client.impl.LongStringHelper;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MessageHeadersTest {

  @Test
  void readsLongStringHeadersAsText() {
    LongString routingKey = LongStringHelper.asLongString("task.normal.index");
    Map<String, Object> headers = Map.of(MessageHeaders.ORIGINAL_ROUTING_KEY, routingKey);

    assertThat(MessageHeaders.text(headers, MessageHeaders.ORIGINAL_ROUTING_KEY)).contains("task.normal.index");
  }

  @Test
  void coercesNumericHeaders() {
    Map<String, Object> headers = new HashMap<>();
    headers.put(MessageHeaders.DELAY, 1500);
    headers.put(MessageHeaders.RETRY_COUNT, LongStringHelper.asLongString("2"));
    headers.put("x-garbage", "abc");

    assertThat(MessageHeaders.longValue(headers, MessageHeaders.DELAY)).hasValue(1500L);
    assertThat(MessageHeaders.longValue(headers, MessageHeaders.RETRY_COUNT)).hasValue(2L);
    assertThat(MessageHeaders.longValue(headers, "x-garbage")).isEmpty();
    assertThat(MessageHeaders.longValue(null, MessageHeaders.DELAY)).isEmpty();
  }

  @Test
  void parsesInstantHeaders() {
    Map<String, Object> headers = Map.of(
        MessageHeaders.DELAYED_AT, "2024-05-01T12:00:00Z",
        MessageHeaders.ENQUEUED_AT, "yesterday");

    assertThat(MessageHeaders.instant(headers, MessageHeaders.DELAYED_AT))
        .contains(Instant.parse("2024-05-01T12:00:00Z"));
    assertThat(MessageHeaders.instant(headers, MessageHeaders.ENQUEUED_AT)).isEmpty();
  }
}
