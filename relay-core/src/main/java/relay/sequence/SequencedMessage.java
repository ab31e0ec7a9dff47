package relay.sequence;

import relay.model.Message;

/**
 * Result of {@link MessageSequencer#allocateAndInsert}.
 *
 * @param message the stored message (new or previously stored)
 * @param isNew   {@code false} when the idempotency key was already used
 */
public record SequencedMessage(Message message, boolean isNew) {
}
