package relay.jdbc.tx;

import relay.jdbc.DataSourceConnectionProvider;
import relay.jdbc.JdbcTemplate;
import relay.jdbc.TestDatabase;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTransactionManagerTest {
  private JdbcDataSource dataSource;
  private ThreadLocalTxContext txContext;
  private JdbcTransactionManager txManager;

  @BeforeEach
  void setUp() throws Exception {
    dataSource = TestDatabase.h2();
    txContext = new ThreadLocalTxContext();
    txManager = new JdbcTransactionManager(new DataSourceConnectionProvider(dataSource), txContext);
  }

  @Test
  void commitPersistsAndRunsCallbacks() throws Exception {
    AtomicInteger callbacks = new AtomicInteger();

    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      assertTrue(txContext.isTransactionActive());
      assertFalse(tx.connection().getAutoCommit());
      insertCounter("c1");
      txContext.afterCommit(callbacks::incrementAndGet);
      tx.commit();
    }

    assertEquals(1, callbacks.get());
    assertFalse(txContext.isTransactionActive());
    assertEquals(1, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM conversation_counter"));
  }

  @Test
  void closeWithoutCommitRollsBack() throws Exception {
    AtomicInteger callbacks = new AtomicInteger();

    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      insertCounter("c1");
      txContext.afterCommit(callbacks::incrementAndGet);
    }

    assertEquals(0, callbacks.get());
    assertFalse(txContext.isTransactionActive());
    assertEquals(0, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM conversation_counter"));
  }

  @Test
  void callbackFailureSurfacesAfterCommit() throws Exception {
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      insertCounter("c1");
      txContext.afterCommit(() -> {
        throw new IllegalStateException("listener broke");
      });
      assertThrows(IllegalStateException.class, tx::commit);
    }

    assertEquals(1, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM conversation_counter"));
    assertFalse(txContext.isTransactionActive());
  }

  @Test
  void commitAndRollbackAreIdempotent() throws Exception {
    JdbcTransactionManager.Transaction tx = txManager.begin();
    insertCounter("c1");
    tx.commit();
    tx.commit();
    tx.rollback();
    tx.close();

    assertEquals(1, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM conversation_counter"));
  }

  @Test
  void inTransactionCommitsResult() throws Exception {
    String result = txManager.inTransaction(() -> {
      insertCounter("c1");
      return "done";
    });

    assertEquals("done", result);
    assertFalse(txContext.isTransactionActive());
    assertEquals(1, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM conversation_counter"));
  }

  @Test
  void inTransactionRollsBackOnFailure() throws Exception {
    IllegalArgumentException failure = assertThrows(IllegalArgumentException.class,
        () -> txManager.inTransaction(() -> {
          insertCounter("c1");
          throw new IllegalArgumentException("content too long");
        }));

    assertEquals("content too long", failure.getMessage());
    assertFalse(txContext.isTransactionActive());
    assertEquals(0, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM conversation_counter"));
  }

  @Test
  void nestedBeginIsRejected() throws Exception {
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      assertThrows(IllegalStateException.class, () -> txManager.begin());
      assertTrue(txContext.isTransactionActive());
    }
    assertFalse(txContext.isTransactionActive());
  }

  private void insertCounter(String conversationId) {
    JdbcTemplate.update(txContext.currentConnection(),
        "INSERT INTO conversation_counter (conversation_id, next_seq) VALUES (?, 1)", conversationId);
  }
}
