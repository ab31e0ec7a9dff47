package relay.spi;

import relay.model.OutboxEvent;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * Persistence operations on the realtime outbox table.
 *
 * <p>{@link #insert} runs on the caller's transactional connection. The other methods are
 * used by the dispatcher on an auto-commit connection.
 */
public interface OutboxStore {

  /**
   * Inserts a new pending row ({@code attempts=0}, {@code next_attempt_at=created_at}).
   */
  void insert(Connection conn, OutboxEvent event);

  /**
   * Returns up to {@code limit} unpublished rows whose {@code next_attempt_at} is at or
   * before {@code now}, ordered by {@code created_at} then {@code event_id} ascending.
   */
  List<OutboxEvent> pollPending(Connection conn, Instant now, int limit);

  /**
   * Sets {@code published_at} and clears {@code last_error}. A row that is already
   * published is left unchanged.
   *
   * @return number of rows updated (0 or 1)
   */
  int markPublished(Connection conn, String eventId, Instant publishedAt);

  /**
   * Increments {@code attempts}, moves {@code next_attempt_at} and records the failure.
   *
   * @return number of rows updated (0 or 1)
   */
  int markRetry(Connection conn, String eventId, Instant nextAttemptAt, String error);

  /**
   * Looks up a single row by id, published or not.
   *
   * @return the row, or {@code null} if absent
   */
  OutboxEvent findById(Connection conn, String eventId);
}
