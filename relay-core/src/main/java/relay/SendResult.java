package relay;

import relay.model.Message;

/**
 * Outcome of {@link MessageSender#send}.
 *
 * @param message the stored message
 * @param created {@code false} if the request replayed an earlier send
 */
public record SendResult(Message message, boolean created) {
}
