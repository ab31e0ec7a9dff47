package relay.jdbc.store;

import relay.jdbc.JdbcTemplate;
import relay.model.Message;
import relay.spi.MessageStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * {@link MessageStore} over the {@code message} and {@code conversation_counter} tables.
 *
 * <p>The counter row is locked with a no-op {@code UPDATE}, which takes a row lock on both
 * H2 and PostgreSQL without dialect-specific {@code FOR UPDATE} syntax. The lock is held
 * until the caller's transaction ends.
 */
public class JdbcMessageStore implements MessageStore {
  private static final String MESSAGE_COLUMNS =
      "id, conversation_id, sender_id, client_message_id, seq, content, created_at";

  static final JdbcTemplate.RowMapper<Message> ROW_MAPPER = rs -> new Message(
      rs.getString("id"),
      rs.getString("conversation_id"),
      rs.getString("sender_id"),
      rs.getString("client_message_id"),
      rs.getLong("seq"),
      rs.getString("content"),
      rs.getTimestamp("created_at").toInstant());

  @Override
  public Optional<Message> findByIdempotencyKey(Connection conn, String senderId, String clientMessageId) {
    String sql = "SELECT " + MESSAGE_COLUMNS + " FROM message WHERE sender_id=? AND client_message_id=?";
    return JdbcTemplate.queryOne(conn, sql, ROW_MAPPER, senderId, clientMessageId);
  }

  @Override
  public OptionalLong lockCounter(Connection conn, String conversationId) {
    int locked = JdbcTemplate.update(conn,
        "UPDATE conversation_counter SET next_seq=next_seq WHERE conversation_id=?", conversationId);
    if (locked == 0) {
      return OptionalLong.empty();
    }
    Optional<Long> next = JdbcTemplate.queryOne(conn,
        "SELECT next_seq FROM conversation_counter WHERE conversation_id=?",
        rs -> rs.getLong(1), conversationId);
    return next.map(OptionalLong::of).orElseGet(OptionalLong::empty);
  }

  @Override
  public void insertCounter(Connection conn, String conversationId) {
    JdbcTemplate.update(conn,
        "INSERT INTO conversation_counter (conversation_id, next_seq) VALUES (?, 1)", conversationId);
  }

  @Override
  public void updateCounter(Connection conn, String conversationId, long nextSeq) {
    JdbcTemplate.update(conn,
        "UPDATE conversation_counter SET next_seq=? WHERE conversation_id=?", nextSeq, conversationId);
  }

  @Override
  public void insertMessage(Connection conn, Message message) {
    Objects.requireNonNull(message, "message");
    JdbcTemplate.update(conn,
        "INSERT INTO message (" + MESSAGE_COLUMNS + ") VALUES (?,?,?,?,?,?,?)",
        message.id(), message.conversationId(), message.senderId(), message.clientMessageId(),
        message.seq(), message.content(), Timestamp.from(message.createdAt()));
  }

  @Override
  public List<Message> findByConversation(Connection conn, String conversationId, long afterSeq, int limit) {
    String sql = "SELECT " + MESSAGE_COLUMNS + " FROM message WHERE conversation_id=? AND seq>?"
        + " ORDER BY seq LIMIT ?";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, conversationId, afterSeq, limit);
  }
}
