package io.taskhive.queue.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.taskhive.task.model.MessageMetadata;
import io.taskhive.task.model.TaskMessage;
import io.taskhive.task.model.TaskPriority;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Serialises/deserialises {@link TaskMessage} envelopes while keeping payload content opaque.
 * <p>
 * Envelope layout:
 * <pre>
 * {"id": "...", "payload": {...}, "metadata": {"id", "correlationId", "timestamp", "retryCount",
 *  "maxRetries", "priority", "originalRoutingKey"}, "enqueuedAt": "..."}
 * </pre>
 */
public final class TaskMessageCodec {

  private final ObjectMapper mapper;

  public TaskMessageCodec() {
    this(defaultMapper());
  }

  public TaskMessageCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public static ObjectMapper defaultMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  public ObjectMapper mapper() {
    return mapper;
  }

  /**
   * Converts an arbitrary caller payload into the JSON tree carried by the envelope.
   */
  public JsonNode toPayload(Object payload) {
    if (payload instanceof JsonNode node) {
      return node.deepCopy();
    }
    return mapper.valueToTree(payload);
  }

  public byte[] encode(TaskMessage message) {
    Objects.requireNonNull(message, "message");
    try {
      return mapper.writeValueAsBytes(encodeToJson(message));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialise task message " + message.id(), ex);
    }
  }

  public ObjectNode encodeToJson(TaskMessage message) {
    Objects.requireNonNull(message, "message");
    MessageMetadata metadata = message.metadata();
    ObjectNode node = mapper.createObjectNode();
    node.put("id", message.id());
    node.set("payload", message.payload().deepCopy());
    ObjectNode meta = node.putObject("metadata");
    meta.put("id", metadata.id());
    meta.put("correlationId", metadata.correlationId());
    meta.put("timestamp", metadata.timestamp().toString());
    meta.put("retryCount", metadata.retryCount());
    meta.put("maxRetries", metadata.maxRetries());
    meta.put("priority", metadata.priority().wireName());
    meta.put("originalRoutingKey", metadata.originalRoutingKey());
    node.put("enqueuedAt", message.enqueuedAt().toString());
    return node;
  }

  public TaskMessage decode(byte[] body) {
    if (body == null || body.length == 0) {
      throw new MalformedTaskMessageException("message body is empty");
    }
    JsonNode node;
    try {
      node = mapper.readTree(body);
    } catch (IOException ex) {
      throw new MalformedTaskMessageException("message body is not valid JSON", ex);
    }
    return decode(node);
  }

  public TaskMessage decode(JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new MalformedTaskMessageException("envelope must be a JSON object");
    }
    JsonNode meta = node.get("metadata");
    if (meta == null || !meta.isObject()) {
      throw new MalformedTaskMessageException("metadata must be a JSON object");
    }
    try {
      String id = requireText(node, "id");
      MessageMetadata metadata = new MessageMetadata(
          textOrDefault(meta, "id", id),
          textOrDefault(meta, "correlationId", id),
          parseTimestamp(requireText(meta, "timestamp"), "metadata.timestamp"),
          meta.path("retryCount").asInt(0),
          meta.path("maxRetries").asInt(0),
          TaskPriority.fromWireName(requireText(meta, "priority")),
          requireText(meta, "originalRoutingKey"));
      Instant enqueuedAt = parseTimestamp(requireText(node, "enqueuedAt"), "enqueuedAt");
      JsonNode payload = node.get("payload");
      return new TaskMessage(id, payload == null ? null : payload.deepCopy(), metadata, enqueuedAt);
    } catch (MalformedTaskMessageException ex) {
      throw ex;
    } catch (IllegalArgumentException | NullPointerException ex) {
      throw new MalformedTaskMessageException("invalid task envelope: " + ex.getMessage(), ex);
    }
  }

  private static String requireText(JsonNode node, String field) {
    String value = textOrNull(node.get(field));
    if (value == null) {
      throw new MalformedTaskMessageException(field + " must not be null or blank");
    }
    return value;
  }

  private static String textOrDefault(JsonNode node, String field, String fallback) {
    String value = textOrNull(node.get(field));
    return value == null ? fallback : value;
  }

  private static Instant parseTimestamp(String value, String field) {
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException ex) {
      throw new MalformedTaskMessageException(field + " must be an ISO-8601 instant", ex);
    }
  }

  private static String textOrNull(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    String text = node.asText();
    return text != null && text.isBlank() ? null : text;
  }
}
