package relay.sequence;

import com.github.f4b6a3.ulid.UlidCreator;
import relay.model.Message;
import relay.spi.DuplicateKeyException;
import relay.spi.MessageStore;
import relay.spi.RelayStoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Assigns gapless per-conversation sequence numbers and stores messages idempotently.
 *
 * <p>Runs entirely on the caller's transactional connection. Only the counter row of the
 * target conversation is locked, so writes to different conversations never wait on each
 * other. The lock is released when the caller commits or rolls back.
 *
 * <p>This class is stateless and thread-safe.
 */
public final class MessageSequencer {
  private static final Logger logger = Logger.getLogger(MessageSequencer.class.getName());

  private final MessageStore messageStore;
  private final Clock clock;

  public MessageSequencer(MessageStore messageStore) {
    this(messageStore, Clock.systemUTC());
  }

  public MessageSequencer(MessageStore messageStore, Clock clock) {
    this.messageStore = Objects.requireNonNull(messageStore, "messageStore");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Stores a message with the next sequence number of its conversation, or returns the
   * message already stored under {@code (senderId, clientMessageId)}.
   *
   * @param conn connection of the caller's open transaction (auto-commit off)
   * @return the stored message and whether this call created it
   * @throws ConflictException if the idempotency key belongs to another conversation, or
   *                           the allocated sequence number is already taken
   */
  public SequencedMessage allocateAndInsert(Connection conn, String conversationId, String senderId,
      String clientMessageId, String content) {
    Objects.requireNonNull(conn, "conn");
    Objects.requireNonNull(conversationId, "conversationId");
    Objects.requireNonNull(senderId, "senderId");
    Objects.requireNonNull(clientMessageId, "clientMessageId");
    Objects.requireNonNull(content, "content");

    Optional<Message> existing = messageStore.findByIdempotencyKey(conn, senderId, clientMessageId);
    if (existing.isPresent()) {
      return replay(existing.get(), conversationId);
    }

    long seq = lockOrCreateCounter(conn, conversationId);

    // A concurrent send with the same key may have committed while we waited for the lock.
    existing = messageStore.findByIdempotencyKey(conn, senderId, clientMessageId);
    if (existing.isPresent()) {
      return replay(existing.get(), conversationId);
    }

    Message message = new Message(
        UlidCreator.getMonotonicUlid().toString(),
        conversationId,
        senderId,
        clientMessageId,
        seq,
        content,
        clock.instant().truncatedTo(ChronoUnit.MICROS));

    Savepoint savepoint = setSavepoint(conn);
    try {
      messageStore.insertMessage(conn, message);
    } catch (DuplicateKeyException e) {
      rollbackTo(conn, savepoint);
      Optional<Message> winner = messageStore.findByIdempotencyKey(conn, senderId, clientMessageId);
      if (winner.isPresent()) {
        return replay(winner.get(), conversationId);
      }
      throw new ConflictException(
          "Sequence " + seq + " already taken in conversation " + conversationId, e);
    }
    release(conn, savepoint);

    messageStore.updateCounter(conn, conversationId, seq + 1);
    return new SequencedMessage(message, true);
  }

  private long lockOrCreateCounter(Connection conn, String conversationId) {
    OptionalLong next = messageStore.lockCounter(conn, conversationId);
    if (next.isPresent()) {
      return next.getAsLong();
    }
    Savepoint savepoint = setSavepoint(conn);
    try {
      messageStore.insertCounter(conn, conversationId);
      release(conn, savepoint);
    } catch (DuplicateKeyException e) {
      logger.log(Level.FINE, "Counter for conversation {0} created concurrently", conversationId);
      rollbackTo(conn, savepoint);
    }
    next = messageStore.lockCounter(conn, conversationId);
    if (next.isEmpty()) {
      throw new RelayStoreException("Counter row missing for conversation " + conversationId);
    }
    return next.getAsLong();
  }

  private static SequencedMessage replay(Message message, String conversationId) {
    if (!message.conversationId().equals(conversationId)) {
      throw new ConflictException("client_message_id already used in conversation "
          + message.conversationId());
    }
    return new SequencedMessage(message, false);
  }

  private static Savepoint setSavepoint(Connection conn) {
    try {
      return conn.setSavepoint();
    } catch (SQLException e) {
      throw new RelayStoreException("Failed to set savepoint", e);
    }
  }

  private static void rollbackTo(Connection conn, Savepoint savepoint) {
    try {
      conn.rollback(savepoint);
    } catch (SQLException e) {
      throw new RelayStoreException("Failed to roll back to savepoint", e);
    }
  }

  private static void release(Connection conn, Savepoint savepoint) {
    try {
      conn.releaseSavepoint(savepoint);
    } catch (SQLException e) {
      throw new RelayStoreException("Failed to release savepoint", e);
    }
  }
}
