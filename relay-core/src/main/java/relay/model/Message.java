package relay.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A persisted chat message.
 *
 * <p>{@code (senderId, clientMessageId)} is the idempotency key; {@code seq} is unique and
 * gapless within {@code conversationId}.
 *
 * @param id              server-generated ULID
 * @param conversationId  conversation the message belongs to
 * @param senderId        user who sent it
 * @param clientMessageId client-chosen idempotency token
 * @param seq             per-conversation sequence number, starting at 1
 * @param content         opaque message body
 * @param createdAt       time the message was first persisted
 */
public record Message(
    String id,
    String conversationId,
    String senderId,
    String clientMessageId,
    long seq,
    String content,
    Instant createdAt
) {
  public Message {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(conversationId, "conversationId");
    Objects.requireNonNull(senderId, "senderId");
    Objects.requireNonNull(clientMessageId, "clientMessageId");
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(createdAt, "createdAt");
    if (seq < 1) {
      throw new IllegalArgumentException("seq must be >= 1, got: " + seq);
    }
  }
}
