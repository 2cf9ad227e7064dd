package io.taskhive.queue.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskhive.task.model.MessageMetadata;
import io.taskhive.task.model.TaskMessage;
import io.taskhive.task.model.TaskPriority;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TaskMessageCodecTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private final TaskMessageCodec codec = new TaskMessageCodec();

  @Test
  void encodesEnvelopeLayout() throws Exception {
    TaskMessage message = new TaskMessage(
        "m-1",
        codec.toPayload(Map.of("documentId", "doc-7")),
        new MessageMetadata("m-1", "c-1", NOW, 2, 3, TaskPriority.HIGH, "task.high.index"),
        NOW.minusSeconds(60));

    JsonNode json = codec.mapper().readTree(codec.encode(message));

    assertThat(json.path("id").asText()).isEqualTo("m-1");
    assertThat(json.path("payload").path("documentId").asText()).isEqualTo("doc-7");
    assertThat(json.path("enqueuedAt").asText()).isEqualTo("2024-05-01T11:59:00Z");
    JsonNode metadata = json.path("metadata");
    assertThat(metadata.path("correlationId").asText()).isEqualTo("c-1");
    assertThat(metadata.path("timestamp").asText()).isEqualTo("2024-05-01T12:00:00Z");
    assertThat(metadata.path("retryCount").asInt()).isEqualTo(2);
    assertThat(metadata.path("maxRetries").asInt()).isEqualTo(3);
    assertThat(metadata.path("priority").asText()).isEqualTo("high");
    assertThat(metadata.path("originalRoutingKey").asText()).isEqualTo("task.high.index");
  }

  @Test
  void decodesEnvelopeWrittenByAnotherProducer() {
    String body = """
        {"id":"m-2","payload":{"n":[1,2]},"enqueuedAt":"2024-05-01T12:00:00.000Z",
         "metadata":{"id":"m-2","correlationId":"c-2","timestamp":"2024-05-01T12:00:01.500Z",
                     "retryCount":1,"maxRetries":3,"priority":"critical",
                     "originalRoutingKey":"task.critical.notify"}}
        """;

    TaskMessage message = codec.decode(body.getBytes(StandardCharsets.UTF_8));

    assertThat(message.id()).isEqualTo("m-2");
    assertThat(message.priority()).isEqualTo(TaskPriority.CRITICAL);
    assertThat(message.retryCount()).isEqualTo(1);
    assertThat(message.metadata().timestamp()).isEqualTo(Instant.parse("2024-05-01T12:00:01.500Z"));
    assertThat(message.payload().path("n").size()).isEqualTo(2);
  }

  @Test
  void payloadIsKeptOpaque() {
    ObjectNode payload = codec.mapper().createObjectNode();
    payload.putObject("nested").put("metadata", "not-envelope-metadata");
    TaskMessage message = new TaskMessage("m-3", payload,
        new MessageMetadata("m-3", "m-3", NOW, 0, 3, TaskPriority.LOW, "task.low.x"), NOW);

    TaskMessage decoded = codec.decode(codec.encode(message));

    assertThat(decoded.payload()).isEqualTo(payload);
  }

  @Test
  void rejectsBodiesThatAreNotEnvelopes() {
    assertThatThrownBy(() -> codec.decode("not json".getBytes(StandardCharsets.UTF_8)))
        .isInstanceOf(MalformedTaskMessageException.class);
    assertThatThrownBy(() -> codec.decode(new byte[0]))
        .isInstanceOf(MalformedTaskMessageException.class);
    assertThatThrownBy(() -> codec.decode("{\"id\":\"x\"}".getBytes(StandardCharsets.UTF_8)))
        .isInstanceOf(MalformedTaskMessageException.class)
        .hasMessageContaining("metadata");
    String badPriority = """
        {"id":"x","enqueuedAt":"2024-05-01T12:00:00Z","metadata":{"timestamp":"2024-05-01T12:00:00Z",
         "priority":"urgent","originalRoutingKey":"task.x.y"}}
        """;
    assertThatThrownBy(() -> codec.decode(badPriority.getBytes(StandardCharsets.UTF_8)))
        .isInstanceOf(MalformedTaskMessageException.class)
        .hasMessageContaining("urgent");
  }
}
