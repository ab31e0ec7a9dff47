package relay;

import java.util.Objects;

/**
 * Input of {@link MessageSender#send}.
 *
 * @param conversationId  target conversation; the caller has already checked membership
 * @param senderId        authenticated sender
 * @param clientMessageId client-chosen idempotency token
 * @param content         message body
 */
public record SendMessageRequest(String conversationId, String senderId, String clientMessageId, String content) {
  public SendMessageRequest {
    Objects.requireNonNull(conversationId, "conversationId");
    Objects.requireNonNull(senderId, "senderId");
    Objects.requireNonNull(clientMessageId, "clientMessageId");
    Objects.requireNonNull(content, "content");
  }
}
