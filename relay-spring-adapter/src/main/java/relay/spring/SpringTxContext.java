package relay.spring;

import relay.spi.TxContext;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;

/**
 * {@link TxContext} over Spring-managed transactions.
 *
 * <p>Message, counter and outbox writes must share the caller's {@code @Transactional}
 * connection, so {@link #currentConnection()} refuses to run unless the active transaction
 * holds a connection of the relay's {@link DataSource}. A transaction managed for another
 * resource would otherwise hand out a separate auto-commit connection and the outbox row
 * could commit without its message.
 *
 * <p>After-commit callbacks are registered as {@link TransactionSynchronization} instances.
 */
public final class SpringTxContext implements TxContext {
  private final DataSource dataSource;

  public SpringTxContext(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public boolean isTransactionActive() {
    return TransactionSynchronizationManager.isActualTransactionActive();
  }

  @Override
  public Connection currentConnection() {
    requireTransaction();
    if (!TransactionSynchronizationManager.hasResource(dataSource)) {
      throw new IllegalStateException(
          "Active transaction is not bound to the relay DataSource; use a transaction manager for it");
    }
    return DataSourceUtils.getConnection(dataSource);
  }

  @Override
  public void afterCommit(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    requireTransaction();
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      throw new IllegalStateException(
          "Transaction synchronization is not active; cannot register afterCommit callback");
    }
    TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
      @Override
      public void afterCommit() {
        callback.run();
      }
    });
  }

  private void requireTransaction() {
    if (!isTransactionActive()) {
      throw new IllegalStateException("No active transaction");
    }
  }
}
