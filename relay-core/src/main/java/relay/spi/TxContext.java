package relay.spi;

import java.sql.Connection;

/**
 * Abstracts the transaction lifecycle so the message write path can join the caller's
 * transaction without depending on a specific transaction manager.
 *
 * <p>Implementations: {@code relay.jdbc.tx.ThreadLocalTxContext} (manual JDBC),
 * {@code relay.spring.SpringTxContext} (Spring-managed).
 */
public interface TxContext {

  /**
   * Returns {@code true} if a transaction is currently active on this thread.
   */
  boolean isTransactionActive();

  /**
   * Returns the JDBC connection bound to the current transaction.
   *
   * @throws IllegalStateException if no transaction is active
   */
  Connection currentConnection();

  /**
   * Registers a callback to run after the current transaction commits.
   * Callbacks are not run on rollback.
   *
   * @param callback action to execute post-commit
   * @throws IllegalStateException if no transaction is active
   */
  void afterCommit(Runnable callback);
}
