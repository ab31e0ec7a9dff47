package relay;

import relay.model.EventType;
import relay.model.OutboxEvent;
import relay.model.RealtimeEvent;
import relay.util.JsonCodec;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutboxWriterTest {
  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  @Test
  void appendThrowsWhenNoActiveTransaction() {
    OutboxWriter writer = new OutboxWriter(new StubTxContext(false), new InMemoryOutboxStore());

    assertThrows(IllegalStateException.class, () -> writer.append(event(1)));
  }

  @Test
  void appendInsertsPendingRowWithEnvelope() {
    InMemoryOutboxStore store = new InMemoryOutboxStore();
    OutboxWriter writer = new OutboxWriter(new StubTxContext(true), store, null, JsonCodec.getDefault(), CLOCK);

    String eventId = writer.append(event(7));

    OutboxEvent row = store.findById(null, eventId);
    assertEquals("message.created", row.eventType());
    assertEquals("c1", row.conversationId());
    assertEquals(0, row.attempts());
    assertNull(row.publishedAt());
    assertNull(row.lastError());
    assertEquals(NOW, row.createdAt());
    assertEquals(row.createdAt(), row.nextAttemptAt());

    Map<String, Object> body = JsonCodec.getDefault().parseObject(row.payloadJson());
    assertEquals(7, ((Number) body.get("seq")).intValue());
    assertEquals("2024-05-01T09:59:00Z", body.get("occurred_at"));
    assertEquals(Map.of("content", "hi"), body.get("payload"));
  }

  @Test
  void appendAllKeepsOrderAndMonotonicIds() {
    InMemoryOutboxStore store = new InMemoryOutboxStore();
    OutboxWriter writer = new OutboxWriter(new StubTxContext(true), store);

    List<String> ids = writer.appendAll(List.of(event(1), event(2), event(3)));

    assertEquals(3, ids.size());
    assertTrue(ids.get(0).compareTo(ids.get(1)) < 0);
    assertTrue(ids.get(1).compareTo(ids.get(2)) < 0);
    assertEquals(3, store.all().size());
  }

  @Test
  void commitSignalRegisteredOncePerBatch() {
    StubTxContext txContext = new StubTxContext(true);
    AtomicInteger signals = new AtomicInteger();
    OutboxWriter writer = new OutboxWriter(txContext, new InMemoryOutboxStore(), signals::incrementAndGet,
        JsonCodec.getDefault(), CLOCK);

    writer.appendAll(List.of(event(1), event(2)));

    assertEquals(0, signals.get());
    assertEquals(1, txContext.pendingCallbacks());
    txContext.runAfterCommit();
    assertEquals(1, signals.get());
  }

  @Test
  void commitSignalFailureIsSwallowed() {
    StubTxContext txContext = new StubTxContext(true);
    OutboxWriter writer = new OutboxWriter(txContext, new InMemoryOutboxStore(),
        () -> { throw new RuntimeException("boom"); }, JsonCodec.getDefault(), CLOCK);

    writer.append(event(1));

    assertDoesNotThrow(txContext::runAfterCommit);
  }

  @Test
  void emptyBatchRegistersNothing() {
    StubTxContext txContext = new StubTxContext(true);
    InMemoryOutboxStore store = new InMemoryOutboxStore();
    OutboxWriter writer = new OutboxWriter(txContext, store, () -> { }, JsonCodec.getDefault(), CLOCK);

    assertEquals(List.of(), writer.appendAll(List.of()));
    assertEquals(0, txContext.pendingCallbacks());
    assertTrue(store.all().isEmpty());
  }

  private static RealtimeEvent event(long seq) {
    return new RealtimeEvent(EventType.MESSAGE_CREATED, "c1", seq, NOW.minusSeconds(60), Map.of("content", "hi"));
  }
}
