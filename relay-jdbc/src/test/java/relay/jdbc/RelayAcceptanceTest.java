package relay.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import relay.Relay;
import relay.SendMessageRequest;
import relay.dispatch.OutboxDispatcher;
import relay.jdbc.store.JdbcMembershipChecker;
import relay.jdbc.store.JdbcMessageStore;
import relay.jdbc.store.JdbcOutboxStore;
import relay.jdbc.tx.JdbcTransactionManager;
import relay.jdbc.tx.ThreadLocalTxContext;
import relay.protocol.HandshakeRequest;
import relay.publish.DeliveryException;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end: send through the write path, dispatch from the outbox table, receive on a
 * subscribed connection.
 */
class RelayAcceptanceTest {
  private final ObjectMapper mapper = new ObjectMapper();
  private JdbcDataSource dataSource;
  private ThreadLocalTxContext txContext;
  private JdbcTransactionManager txManager;
  private JdbcOutboxStore outboxStore;
  private Relay relay;

  @BeforeEach
  void setUp() throws Exception {
    dataSource = TestDatabase.h2();
    TestDatabase.addMember(dataSource, "c1", "alice");
    TestDatabase.addMember(dataSource, "c1", "bob");
    DataSourceConnectionProvider connections = new DataSourceConnectionProvider(dataSource);
    txContext = new ThreadLocalTxContext();
    txManager = new JdbcTransactionManager(connections, txContext);
    outboxStore = new JdbcOutboxStore();
    relay = relay(connections, false);
  }

  @AfterEach
  void tearDown() {
    relay.close();
  }

  private Relay relay(DataSourceConnectionProvider connections, boolean autoStart) {
    return Relay.builder()
        .connectionProvider(connections)
        .txContext(txContext)
        .outboxStore(outboxStore)
        .messageStore(new JdbcMessageStore())
        .credentialVerifier(token -> token)
        .membershipChecker(new JdbcMembershipChecker(connections))
        .intervalMs(50)
        .autoStart(autoStart)
        .build();
  }

  @Test
  void subscribedClientReceivesMessageCreated() throws Exception {
    CapturingHandle bob = connect("bob", "c1");

    send("c1", "alice", "m1", "hi");
    relay.dispatcher().dispatchOnce();

    JsonNode created = mapper.readTree(bob.frames.get(0));
    assertEquals("message.created", created.get("type").asText());
    assertEquals("c1", created.get("conversation_id").asText());
    assertEquals(1, created.get("seq").asLong());
    assertEquals("hi", created.get("payload").get("content").asText());
    assertEquals("alice", created.get("payload").get("sender_id").asText());
    assertEquals("conversation.updated", mapper.readTree(bob.frames.get(1)).get("type").asText());
    assertEquals(0, pending());
  }

  @Test
  void rolledBackSendIsNeverDelivered() throws Exception {
    CapturingHandle bob = connect("bob", "c1");

    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      relay.sender().send(new SendMessageRequest("c1", "alice", "m1", "oops"));
      tx.rollback();
    }
    relay.dispatcher().dispatchOnce();

    assertTrue(bob.frames.isEmpty());
    assertEquals(0, TestDatabase.count(dataSource, "SELECT COUNT(*) FROM realtime_outbox_event"));
  }

  @Test
  void disconnectedClientStillGetsEventMarkedPublished() throws Exception {
    CapturingHandle bob = connect("bob", "c1");
    bob.broken = true;

    send("c1", "alice", "m1", "hi");
    relay.dispatcher().dispatchOnce();

    assertEquals(0, pending());
    assertEquals(0, relay.registry().connectionCount());
    assertEquals(2, TestDatabase.count(dataSource,
        "SELECT COUNT(*) FROM realtime_outbox_event WHERE published_at IS NOT NULL AND attempts=0"));
  }

  @Test
  void replayedSendProducesNoSecondPush() throws Exception {
    CapturingHandle bob = connect("bob", "c1");

    send("c1", "alice", "m1", "hi");
    send("c1", "alice", "m1", "hi");
    relay.dispatcher().dispatchOnce();

    assertEquals(2, bob.frames.size());
  }

  @Test
  void nonMemberCannotListen() throws Exception {
    CapturingHandle bob = connect("bob", "c1");
    CapturingHandle carol = connect("carol", "c1");

    send("c1", "alice", "m1", "hi");
    relay.dispatcher().dispatchOnce();

    assertEquals(2, bob.frames.size());
    assertTrue(carol.frames.isEmpty());
  }

  @Test
  void pendingRowsSurviveRestartAndDeliverLater() throws Exception {
    send("c1", "alice", "m1", "hi");
    relay.close();

    DataSourceConnectionProvider connections = new DataSourceConnectionProvider(dataSource);
    relay = relay(connections, false);
    CapturingHandle bob = connect("bob", "c1");
    relay.dispatcher().dispatchOnce();

    assertEquals(2, bob.frames.size());
    assertEquals(0, pending());
  }

  @Test
  void commitWakesRunningDispatcher() throws Exception {
    relay.close();
    relay = relay(new DataSourceConnectionProvider(dataSource), true);
    CapturingHandle bob = connect("bob", "c1");

    send("c1", "alice", "m1", "hi");

    long deadline = System.currentTimeMillis() + Duration.ofSeconds(5).toMillis();
    while (bob.frames.size() < 2 && System.currentTimeMillis() < deadline) {
      Thread.sleep(20);
    }
    assertEquals(2, bob.frames.size());
  }

  @Test
  void failedDeliveryLeavesRowsPendingWithError() throws Exception {
    send("c1", "alice", "m1", "hi");

    try (OutboxDispatcher failing = OutboxDispatcher.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .outboxStore(outboxStore)
        .publisher(event -> {
          throw new DeliveryException("socket layer down");
        })
        .build()) {
      failing.dispatchOnce();
    }

    assertEquals(2, pending());
    assertEquals(2, TestDatabase.count(dataSource,
        "SELECT COUNT(*) FROM realtime_outbox_event WHERE attempts=1 AND last_error='socket layer down'"));

    // Not due yet for the regular dispatcher either.
    assertEquals(0, relay.dispatcher().dispatchOnce());
  }

  private CapturingHandle connect(String userId, String conversationId) {
    CapturingHandle handle = new CapturingHandle();
    String id = relay.engine().open(handle, new HandshakeRequest("Bearer " + userId, null, null));
    relay.engine().onFrame(id, "{\"op\":\"subscribe\",\"conversation_ids\":[\"" + conversationId + "\"]}");
    handle.frames.clear();
    return handle;
  }

  private void send(String conversationId, String senderId, String key, String content) throws Exception {
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      relay.sender().send(new SendMessageRequest(conversationId, senderId, key, content));
      tx.commit();
    }
  }

  private long pending() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      return outboxStore.countPending(conn);
    }
  }
}
