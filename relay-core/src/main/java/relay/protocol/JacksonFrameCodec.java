package relay.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@link FrameCodec} backed by Jackson's tree model.
 *
 * <p>Commands are strict: unknown {@code op} values, unknown fields, wrong types and blank
 * conversation ids are all rejected with {@link ErrorCode#INVALID_COMMAND}.
 */
public final class JacksonFrameCodec implements FrameCodec {
  private static final Set<String> LIST_FIELDS = Set.of("op", "conversation_ids");
  private static final Set<String> PING_FIELDS = Set.of("op", "ts");

  private final ObjectMapper mapper;

  public JacksonFrameCodec() {
    this(new ObjectMapper());
  }

  public JacksonFrameCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public ClientCommand decode(String text) throws ProtocolException {
    JsonNode root;
    try {
      root = mapper.readTree(text);
    } catch (JsonProcessingException e) {
      throw new ProtocolException(ErrorCode.INVALID_COMMAND, "Invalid JSON payload", e);
    }
    if (root == null || !root.isObject()) {
      throw new ProtocolException(ErrorCode.INVALID_COMMAND, "Command payload must be an object");
    }
    JsonNode op = root.get("op");
    if (op == null || !op.isTextual()) {
      throw new ProtocolException(ErrorCode.INVALID_COMMAND, "Unsupported command");
    }
    switch (op.textValue()) {
      case "subscribe":
        requireOnly(root, LIST_FIELDS);
        return new ClientCommand.Subscribe(conversationIds(root));
      case "unsubscribe":
        requireOnly(root, LIST_FIELDS);
        return new ClientCommand.Unsubscribe(conversationIds(root));
      case "ping":
        requireOnly(root, PING_FIELDS);
        return new ClientCommand.Ping(timestamp(root));
      default:
        throw new ProtocolException(ErrorCode.INVALID_COMMAND, "Unsupported command");
    }
  }

  private static void requireOnly(JsonNode root, Set<String> allowed) throws ProtocolException {
    Iterator<String> names = root.fieldNames();
    while (names.hasNext()) {
      String name = names.next();
      if (!allowed.contains(name)) {
        throw new ProtocolException(ErrorCode.INVALID_COMMAND, "Unexpected field: " + name);
      }
    }
  }

  private static List<String> conversationIds(JsonNode root) throws ProtocolException {
    JsonNode ids = root.get("conversation_ids");
    if (ids == null || !ids.isArray()) {
      throw new ProtocolException(ErrorCode.INVALID_COMMAND, "conversation_ids is required");
    }
    List<String> result = new ArrayList<>(ids.size());
    for (JsonNode id : ids) {
      if (!id.isTextual() || id.textValue().isBlank()) {
        throw new ProtocolException(ErrorCode.INVALID_COMMAND, "conversation_ids must be non-empty strings");
      }
      result.add(id.textValue());
    }
    return result;
  }

  private static Long timestamp(JsonNode root) throws ProtocolException {
    JsonNode ts = root.get("ts");
    if (ts == null || ts.isNull()) {
      return null;
    }
    if (!ts.isIntegralNumber() || !ts.canConvertToLong()) {
      throw new ProtocolException(ErrorCode.INVALID_COMMAND, "ts must be an integer");
    }
    return ts.longValue();
  }

  @Override
  public String encode(ServerFrame frame) {
    ObjectNode node = mapper.createObjectNode();
    node.put("type", frame.type());
    if (frame instanceof ServerFrame.Welcome welcome) {
      node.put("connection_id", welcome.connectionId());
      node.put("user_id", welcome.userId());
      node.put("server_time", welcome.serverTime());
      node.put("heartbeat_sec", welcome.heartbeatSec());
      node.put("protocol_version", welcome.protocolVersion());
    } else if (frame instanceof ServerFrame.Ack ack) {
      node.put("op", ack.op());
      node.put("ok", ack.ok());
      if (ack.accepted() != null) {
        putStrings(node.putArray("accepted"), ack.accepted());
      }
      if (ack.rejected() != null) {
        putStrings(node.putArray("rejected"), ack.rejected());
      }
    } else if (frame instanceof ServerFrame.Pong pong) {
      if (pong.ts() != null) {
        node.put("ts", pong.ts());
      }
    } else if (frame instanceof ServerFrame.Error error) {
      ObjectNode body = node.putObject("error");
      body.put("code", error.code().name());
      body.put("message", error.message());
      if (!error.details().isEmpty()) {
        body.set("details", mapper.valueToTree(error.details()));
      }
    } else if (frame instanceof ServerFrame.Event event) {
      node.put("event_id", event.eventId());
      node.put("conversation_id", event.conversationId());
      node.put("seq", event.seq());
      node.put("occurred_at", event.occurredAt());
      node.set("payload", mapper.valueToTree(event.payload()));
    }
    try {
      return mapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot encode " + frame.type() + " frame", e);
    }
  }

  private static void putStrings(ArrayNode array, List<String> values) {
    for (String value : values) {
      array.add(value);
    }
  }
}
