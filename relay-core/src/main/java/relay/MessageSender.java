package relay;

import relay.model.EventType;
import relay.model.Message;
import relay.model.RealtimeEvent;
import relay.sequence.MessageSequencer;
import relay.sequence.SequencedMessage;
import relay.spi.TxContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Write path for a new message: sequencing, insert and outbox events in one transaction.
 *
 * <p>A new message appends {@code message.created} and {@code conversation.updated}, both
 * carrying the message's seq. A replayed idempotency key appends nothing. Any exception
 * leaves the caller's transaction to be rolled back.
 */
public final class MessageSender {
  public static final int DEFAULT_MAX_CONTENT_LENGTH = 2000;
  static final int PREVIEW_LENGTH = 280;

  private final TxContext txContext;
  private final MessageSequencer sequencer;
  private final OutboxWriter writer;
  private final int maxContentLength;

  public MessageSender(TxContext txContext, MessageSequencer sequencer, OutboxWriter writer) {
    this(txContext, sequencer, writer, DEFAULT_MAX_CONTENT_LENGTH);
  }

  public MessageSender(TxContext txContext, MessageSequencer sequencer, OutboxWriter writer, int maxContentLength) {
    this.txContext = Objects.requireNonNull(txContext, "txContext");
    this.sequencer = Objects.requireNonNull(sequencer, "sequencer");
    this.writer = Objects.requireNonNull(writer, "writer");
    if (maxContentLength <= 0) {
      throw new IllegalArgumentException("maxContentLength must be > 0");
    }
    this.maxContentLength = maxContentLength;
  }

  /**
   * Stores a message in the current transaction.
   *
   * @throws IllegalStateException    if no transaction is active
   * @throws IllegalArgumentException if the content is empty or too long
   * @throws relay.sequence.ConflictException if the idempotency key is reused across
   *                                  conversations or the seq collides
   */
  public SendResult send(SendMessageRequest request) {
    Objects.requireNonNull(request, "request");
    if (!txContext.isTransactionActive()) {
      throw new IllegalStateException("No active transaction");
    }
    String content = request.content();
    if (content.isBlank()) {
      throw new IllegalArgumentException("content must not be empty");
    }
    if (content.length() > maxContentLength) {
      throw new IllegalArgumentException("content exceeds " + maxContentLength + " characters");
    }

    SequencedMessage sequenced = sequencer.allocateAndInsert(txContext.currentConnection(),
        request.conversationId(), request.senderId(), request.clientMessageId(), content);
    Message message = sequenced.message();
    if (sequenced.isNew()) {
      writer.appendAll(List.of(messageCreated(message), conversationUpdated(message)));
    }
    return new SendResult(message, sequenced.isNew());
  }

  static RealtimeEvent messageCreated(Message message) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("id", message.id());
    payload.put("sender_id", message.senderId());
    payload.put("client_message_id", message.clientMessageId());
    payload.put("content", message.content());
    payload.put("created_at", message.createdAt().toString());
    return new RealtimeEvent(EventType.MESSAGE_CREATED, message.conversationId(), message.seq(),
        message.createdAt(), payload);
  }

  static RealtimeEvent conversationUpdated(Message message) {
    String content = message.content();
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("id", message.conversationId());
    payload.put("updated_at", message.createdAt().toString());
    payload.put("last_message_preview", content.length() > PREVIEW_LENGTH ? content.substring(0, PREVIEW_LENGTH) : content);
    payload.put("last_message_at", message.createdAt().toString());
    return new RealtimeEvent(EventType.CONVERSATION_UPDATED, message.conversationId(), message.seq(),
        message.createdAt(), payload);
  }
}
