package relay.spi;

import relay.model.Message;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Persistence operations on messages and per-conversation counters. Every method runs on
 * the caller's transactional connection.
 */
public interface MessageStore {

  /**
   * Finds the message already stored for an idempotency key.
   */
  Optional<Message> findByIdempotencyKey(Connection conn, String senderId, String clientMessageId);

  /**
   * Acquires the row lock on the conversation's counter and returns its {@code next_seq}.
   * The lock is held until the transaction ends.
   *
   * @return the next sequence number, or empty if the conversation has no counter yet
   */
  OptionalLong lockCounter(Connection conn, String conversationId);

  /**
   * Creates a counter row with {@code next_seq = 1}.
   *
   * @throws DuplicateKeyException if another transaction created it first
   */
  void insertCounter(Connection conn, String conversationId);

  /**
   * Stores the counter value for the next message of the conversation.
   */
  void updateCounter(Connection conn, String conversationId, long nextSeq);

  /**
   * Inserts a message.
   *
   * @throws DuplicateKeyException if the idempotency key or {@code (conversation_id, seq)}
   *                               is already taken
   */
  void insertMessage(Connection conn, Message message);

  /**
   * Returns messages of a conversation with {@code seq > afterSeq} in ascending order.
   */
  List<Message> findByConversation(Connection conn, String conversationId, long afterSeq, int limit);
}
