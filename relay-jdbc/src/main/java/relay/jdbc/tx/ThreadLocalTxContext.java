package relay.jdbc.tx;

import relay.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link TxContext} implementation that stores transaction state in a {@link ThreadLocal}.
 *
 * <p>Designed for manual JDBC transaction management. Use with
 * {@link JdbcTransactionManager} which handles binding, commit callbacks and cleanup.
 *
 * @see JdbcTransactionManager
 */
public final class ThreadLocalTxContext implements TxContext {
  private final ThreadLocal<TxState> state = new ThreadLocal<>();

  @Override
  public boolean isTransactionActive() {
    return state.get() != null;
  }

  @Override
  public Connection currentConnection() {
    return current().connection;
  }

  @Override
  public void afterCommit(Runnable callback) {
    current().afterCommit.add(callback);
  }

  private TxState current() {
    TxState current = state.get();
    if (current == null) {
      throw new IllegalStateException("No active transaction");
    }
    return current;
  }

  void bind(Connection connection) {
    if (state.get() != null) {
      throw new IllegalStateException("Transaction already active");
    }
    state.set(new TxState(connection));
  }

  /**
   * Runs the commit callbacks in registration order and unbinds. Every callback runs even
   * if an earlier one throws; the first failure is rethrown with the rest suppressed.
   */
  void clearAfterCommit() {
    TxState current = state.get();
    if (current == null) {
      return;
    }
    try {
      RuntimeException first = null;
      for (Runnable callback : current.afterCommit) {
        try {
          callback.run();
        } catch (RuntimeException e) {
          if (first == null) first = e;
          else first.addSuppressed(e);
        }
      }
      if (first != null) throw first;
    } finally {
      state.remove();
    }
  }

  /** Unbinds and discards the commit callbacks. */
  void clearAfterRollback() {
    state.remove();
  }

  private static final class TxState {
    private final Connection connection;
    private final List<Runnable> afterCommit = new ArrayList<>();

    private TxState(Connection connection) {
      this.connection = connection;
    }
  }
}
