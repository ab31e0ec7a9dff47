package relay.jdbc.store;

import relay.jdbc.JdbcTemplate;
import relay.jdbc.TableNames;
import relay.model.OutboxEvent;
import relay.spi.OutboxStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * {@link OutboxStore} over the {@code realtime_outbox_event} table, in SQL that runs
 * unchanged on H2 and PostgreSQL.
 *
 * <p>Rows are never deleted. Status updates only touch unpublished rows, so a late retry
 * update cannot resurrect a published event.
 */
public class JdbcOutboxStore implements OutboxStore {
  public static final String DEFAULT_TABLE = "realtime_outbox_event";
  static final int MAX_ERROR_LENGTH = 1000;

  private static final String COLUMNS = "event_id, event_type, conversation_id, payload, created_at, "
      + "published_at, attempts, next_attempt_at, last_error";

  static final JdbcTemplate.RowMapper<OutboxEvent> ROW_MAPPER = rs -> new OutboxEvent(
      rs.getString("event_id"),
      rs.getString("event_type"),
      rs.getString("conversation_id"),
      rs.getString("payload"),
      rs.getTimestamp("created_at").toInstant(),
      toInstant(rs.getTimestamp("published_at")),
      rs.getInt("attempts"),
      rs.getTimestamp("next_attempt_at").toInstant(),
      rs.getString("last_error"));

  private final String tableName;

  public JdbcOutboxStore() {
    this(DEFAULT_TABLE);
  }

  public JdbcOutboxStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  protected String tableName() {
    return tableName;
  }

  @Override
  public void insert(Connection conn, OutboxEvent event) {
    Objects.requireNonNull(event, "event");
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        event.eventId(), event.eventType(), event.conversationId(), event.payloadJson(),
        Timestamp.from(event.createdAt()),
        event.publishedAt() == null ? null : Timestamp.from(event.publishedAt()),
        event.attempts(),
        Timestamp.from(event.nextAttemptAt()),
        truncateError(event.lastError()));
  }

  @Override
  public List<OutboxEvent> pollPending(Connection conn, Instant now, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE published_at IS NULL AND next_attempt_at <= ?"
        + " ORDER BY created_at, event_id LIMIT ?";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, Timestamp.from(now), limit);
  }

  @Override
  public int markPublished(Connection conn, String eventId, Instant publishedAt) {
    String sql = "UPDATE " + tableName() + " SET published_at=?, last_error=NULL"
        + " WHERE event_id=? AND published_at IS NULL";
    return JdbcTemplate.update(conn, sql, Timestamp.from(publishedAt), eventId);
  }

  @Override
  public int markRetry(Connection conn, String eventId, Instant nextAttemptAt, String error) {
    String sql = "UPDATE " + tableName() + " SET attempts=attempts+1, next_attempt_at=?, last_error=?"
        + " WHERE event_id=? AND published_at IS NULL";
    return JdbcTemplate.update(conn, sql, Timestamp.from(nextAttemptAt), truncateError(error), eventId);
  }

  @Override
  public OutboxEvent findById(Connection conn, String eventId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE event_id=?";
    return JdbcTemplate.queryOne(conn, sql, ROW_MAPPER, eventId).orElse(null);
  }

  /**
   * Counts rows not yet published, for health checks and tests.
   */
  public long countPending(Connection conn) {
    String sql = "SELECT COUNT(*) FROM " + tableName() + " WHERE published_at IS NULL";
    return JdbcTemplate.queryOne(conn, sql, rs -> rs.getLong(1)).orElse(0L);
  }

  static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }

  private static Instant toInstant(Timestamp ts) {
    return ts == null ? null : ts.toInstant();
  }
}
