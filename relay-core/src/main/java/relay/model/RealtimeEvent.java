package relay.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * An event to be appended to the outbox inside a write transaction.
 *
 * @param type           event kind
 * @param conversationId conversation whose subscribers receive it
 * @param seq            sequence number of the message that caused it
 * @param occurredAt     time of the underlying write
 * @param payload        event-specific fields, serialized as a JSON object
 */
public record RealtimeEvent(
    EventType type,
    String conversationId,
    long seq,
    Instant occurredAt,
    Map<String, Object> payload
) {
  public RealtimeEvent {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(conversationId, "conversationId");
    Objects.requireNonNull(occurredAt, "occurredAt");
    payload = payload == null ? Map.of() : payload;
  }
}
