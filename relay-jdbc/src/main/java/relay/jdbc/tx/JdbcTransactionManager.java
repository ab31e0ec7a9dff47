package relay.jdbc.tx;

import relay.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transaction demarcation for applications that manage JDBC connections themselves.
 * Binds one non-auto-commit connection per thread to a {@link ThreadLocalTxContext}, so
 * that {@code MessageSender.send} and the outbox insert share it.
 *
 * <pre>{@code
 * SendResult result = txManager.inTransaction(() -> relay.sender().send(request));
 * }</pre>
 *
 * or, when the caller needs the connection for its own statements:
 *
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *   relay.sender().send(request);
 *   tx.commit();
 * }
 * }</pre>
 *
 * @see ThreadLocalTxContext
 */
public final class JdbcTransactionManager {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ThreadLocalTxContext txContext;

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
  }

  /**
   * Work run inside {@link #inTransaction}.
   */
  @FunctionalInterface
  public interface TxWork<T> {
    T run() throws SQLException;
  }

  /**
   * Runs {@code work} in a new transaction. Commits when it returns, rolls back when it
   * throws; the work's exception is rethrown unchanged.
   */
  public <T> T inTransaction(TxWork<T> work) throws SQLException {
    Objects.requireNonNull(work, "work");
    try (Transaction tx = begin()) {
      T result = work.run();
      tx.commit();
      return result;
    }
  }

  /**
   * Opens a connection, disables auto-commit and binds it to the current thread.
   *
   * @throws SQLException          if no connection can be obtained
   * @throws IllegalStateException if this thread already has a transaction
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
      txContext.bind(connection);
    } catch (SQLException | RuntimeException e) {
      connection.close();
      throw e;
    }
    return new Transaction(connection, txContext);
  }

  /**
   * Handle of one bound transaction. Closing it without {@link #commit()} rolls back.
   *
   * <p>Commit callbacks (the dispatcher wake-up) run after the connection has committed; a
   * callback failure is rethrown from {@link #commit()} but the data stays committed.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final ThreadLocalTxContext txContext;
    private boolean completed;

    private Transaction(Connection connection, ThreadLocalTxContext txContext) {
      this.connection = connection;
      this.txContext = txContext;
    }

    public Connection connection() {
      return connection;
    }

    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.commit();
      } catch (SQLException e) {
        try {
          connection.rollback();
        } catch (SQLException rollbackFailure) {
          e.addSuppressed(rollbackFailure);
        }
        release(false);
        throw e;
      }
      release(true);
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        release(false);
      }
    }

    @Override
    public void close() throws SQLException {
      rollback();
    }

    private void release(boolean committed) throws SQLException {
      completed = true;
      try {
        if (committed) {
          txContext.clearAfterCommit();
        } else {
          txContext.clearAfterRollback();
        }
      } finally {
        try {
          connection.setAutoCommit(true);
        } catch (SQLException e) {
          logger.log(Level.FINE, "Failed to restore auto-commit", e);
        }
        connection.close();
      }
    }
  }
}
