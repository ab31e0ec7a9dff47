package relay.dispatch;

import relay.FakeConnections;
import relay.InMemoryOutboxStore;
import relay.model.OutboxEvent;
import relay.publish.DeliveryException;
import relay.publish.DeliveryOutcome;
import relay.publish.Publisher;
import relay.spi.ConnectionProvider;
import relay.spi.MetricsExporter;
import relay.spi.RelayStoreException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutboxDispatcherTest {
  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private final InMemoryOutboxStore store = new InMemoryOutboxStore();
  private final MutableClock clock = new MutableClock(T0);
  private final ConnectionProvider connections = FakeConnections::noop;
  private OutboxDispatcher dispatcher;

  @AfterEach
  void tearDown() {
    if (dispatcher != null) {
      dispatcher.close();
    }
  }

  @Test
  void deliversOldestFirstAndMarksPublished() {
    store.insert(null, row("e2", T0.minusSeconds(5)));
    store.insert(null, row("e1", T0.minusSeconds(10)));
    store.insert(null, row("e3", T0.minusSeconds(1)));
    List<String> delivered = new ArrayList<>();
    dispatcher = dispatcher(event -> {
      delivered.add(event.eventId());
      return DeliveryOutcome.NO_RECIPIENTS;
    }, 10);

    assertEquals(3, dispatcher.dispatchOnce());

    assertEquals(List.of("e1", "e2", "e3"), delivered);
    for (OutboxEvent row : store.all()) {
      assertEquals(T0, row.publishedAt());
    }
    assertEquals(0, dispatcher.dispatchOnce());
  }

  @Test
  void sameTimestampOrdersByEventId() {
    store.insert(null, row("01B", T0));
    store.insert(null, row("01A", T0));
    List<String> delivered = new ArrayList<>();
    dispatcher = dispatcher(event -> {
      delivered.add(event.eventId());
      return DeliveryOutcome.NO_RECIPIENTS;
    }, 10);

    dispatcher.dispatchOnce();

    assertEquals(List.of("01A", "01B"), delivered);
  }

  @Test
  void batchSizeLimitsRowsPerCycle() {
    for (int i = 0; i < 5; i++) {
      store.insert(null, row("e" + i, T0.minusSeconds(10 - i)));
    }
    dispatcher = dispatcher(event -> DeliveryOutcome.NO_RECIPIENTS, 2);

    assertEquals(2, dispatcher.dispatchOnce());
    assertEquals(2, dispatcher.dispatchOnce());
    assertEquals(1, dispatcher.dispatchOnce());
  }

  @Test
  void failedDeliveryIsRescheduledWithBackoffAndRetriedUntilPublished() {
    store.insert(null, row("e1", T0));
    AtomicInteger calls = new AtomicInteger();
    Publisher flaky = event -> {
      if (calls.incrementAndGet() <= 3) {
        throw new DeliveryException("boom " + calls.get());
      }
      return DeliveryOutcome.NO_RECIPIENTS;
    };
    dispatcher = OutboxDispatcher.builder()
        .connectionProvider(connections)
        .outboxStore(store)
        .publisher(flaky)
        .retryPolicy(attempts -> 1000L * attempts)
        .clock(clock)
        .build();

    dispatcher.dispatchOnce();
    OutboxEvent afterFirst = store.findById(null, "e1");
    assertEquals(1, afterFirst.attempts());
    assertEquals(T0.plusMillis(1000), afterFirst.nextAttemptAt());
    assertEquals("boom 1", afterFirst.lastError());
    assertNull(afterFirst.publishedAt());

    // Not due yet: skipped.
    assertEquals(0, dispatcher.dispatchOnce());
    assertEquals(1, calls.get());

    clock.advance(Duration.ofMillis(1000));
    dispatcher.dispatchOnce();
    assertEquals(2, store.findById(null, "e1").attempts());
    assertEquals(clock.instant().plusMillis(2000), store.findById(null, "e1").nextAttemptAt());

    clock.advance(Duration.ofMillis(2000));
    dispatcher.dispatchOnce();
    clock.advance(Duration.ofMillis(3000));
    dispatcher.dispatchOnce();

    OutboxEvent done = store.findById(null, "e1");
    assertNotNull(done.publishedAt());
    assertNull(done.lastError());
    assertEquals(3, done.attempts());
    assertEquals(4, calls.get());
  }

  @Test
  void runtimeFailureIsTreatedLikeDeliveryFailure() {
    store.insert(null, row("e1", T0));
    dispatcher = dispatcher(event -> {
      throw new IllegalStateException("registry gone");
    }, 10);

    dispatcher.dispatchOnce();

    OutboxEvent row = store.findById(null, "e1");
    assertEquals(1, row.attempts());
    assertEquals("registry gone", row.lastError());
  }

  @Test
  void oneFailingRowDoesNotBlockOthers() {
    store.insert(null, row("bad", T0.minusSeconds(2)));
    store.insert(null, row("good", T0.minusSeconds(1)));
    dispatcher = dispatcher(event -> {
      if (event.eventId().equals("bad")) {
        throw new DeliveryException("nope");
      }
      return DeliveryOutcome.NO_RECIPIENTS;
    }, 10);

    dispatcher.dispatchOnce();

    assertNull(store.findById(null, "bad").publishedAt());
    assertNotNull(store.findById(null, "good").publishedAt());
  }

  @Test
  void fetchFailureIsContained() {
    dispatcher = OutboxDispatcher.builder()
        .connectionProvider(() -> {
          throw new SQLException("db down");
        })
        .outboxStore(store)
        .publisher(event -> DeliveryOutcome.NO_RECIPIENTS)
        .build();

    assertEquals(0, dispatcher.dispatchOnce());
  }

  @Test
  void recordsLagAndOutcomeMetrics() {
    store.insert(null, row("e1", T0.minusSeconds(3)));
    store.insert(null, row("e2", T0.minusSeconds(1)));
    RecordingMetrics metrics = new RecordingMetrics();
    dispatcher = OutboxDispatcher.builder()
        .connectionProvider(connections)
        .outboxStore(store)
        .publisher(event -> {
          if (event.eventId().equals("e2")) {
            throw new DeliveryException("x");
          }
          return DeliveryOutcome.NO_RECIPIENTS;
        })
        .metrics(metrics)
        .clock(clock)
        .build();

    dispatcher.dispatchOnce();

    assertEquals(1, metrics.success.get());
    assertEquals(1, metrics.failure.get());
    assertEquals(List.of(3000L), metrics.lags);
  }

  @Test
  void closesConnectionsItOpens() {
    AtomicInteger closed = new AtomicInteger();
    AtomicInteger opened = new AtomicInteger();
    store.insert(null, row("e1", T0));
    dispatcher = OutboxDispatcher.builder()
        .connectionProvider(() -> {
          opened.incrementAndGet();
          return FakeConnections.noop(closed);
        })
        .outboxStore(store)
        .publisher(event -> DeliveryOutcome.NO_RECIPIENTS)
        .clock(clock)
        .build();

    dispatcher.dispatchOnce();

    assertEquals(opened.get(), closed.get());
  }

  @Test
  void wakeUpTriggersImmediateCycleAfterStart() throws Exception {
    CountDownLatch delivered = new CountDownLatch(1);
    dispatcher = OutboxDispatcher.builder()
        .connectionProvider(connections)
        .outboxStore(store)
        .publisher(event -> {
          delivered.countDown();
          return DeliveryOutcome.NO_RECIPIENTS;
        })
        .intervalMs(60_000)
        .build();
    dispatcher.start();
    Thread.sleep(50); // let the initial empty cycle pass

    store.insert(null, row("e1", Instant.now()));
    dispatcher.wakeUp();

    assertTrue(delivered.await(2, TimeUnit.SECONDS));
  }

  @Test
  void wakeUpBeforeStartIsNoop() {
    dispatcher = dispatcher(event -> DeliveryOutcome.NO_RECIPIENTS, 10);

    dispatcher.wakeUp();
  }

  @Test
  void startAfterCloseThrows() {
    dispatcher = dispatcher(event -> DeliveryOutcome.NO_RECIPIENTS, 10);
    dispatcher.close();

    assertThrows(IllegalStateException.class, dispatcher::start);
  }

  @Test
  void refusedStatusUpdateLeavesRowPendingAndUncounted() {
    ReadOnlyOutboxStore readOnly = new ReadOnlyOutboxStore();
    readOnly.insert(null, row("ok", T0.minusSeconds(2)));
    readOnly.insert(null, row("bad", T0.minusSeconds(1)));
    RecordingMetrics metrics = new RecordingMetrics();
    dispatcher = OutboxDispatcher.builder()
        .connectionProvider(connections)
        .outboxStore(readOnly)
        .publisher(event -> {
          if (event.eventId().equals("bad")) {
            throw new DeliveryException("socket gone");
          }
          return DeliveryOutcome.NO_RECIPIENTS;
        })
        .metrics(metrics)
        .clock(clock)
        .build();

    assertEquals(0, dispatcher.dispatchOnce());

    assertNull(readOnly.findById(null, "ok").publishedAt());
    assertEquals(0, readOnly.findById(null, "bad").attempts());
    assertEquals(0, metrics.success.get());
  }

  @Test
  void refusedStatusUpdateWaitsForNextInterval() throws Exception {
    ReadOnlyOutboxStore readOnly = new ReadOnlyOutboxStore();
    readOnly.insert(null, row("e1", T0));
    AtomicInteger deliveries = new AtomicInteger();
    dispatcher = OutboxDispatcher.builder()
        .connectionProvider(connections)
        .outboxStore(readOnly)
        .publisher(event -> {
          deliveries.incrementAndGet();
          return DeliveryOutcome.NO_RECIPIENTS;
        })
        .batchSize(1)
        .intervalMs(1000)
        .build();

    dispatcher.start();
    Thread.sleep(300);

    assertEquals(1, deliveries.get());
    assertNull(readOnly.findById(null, "e1").publishedAt());
  }

  @Test
  void builderValidatesSettings() {
    assertThrows(NullPointerException.class, () -> OutboxDispatcher.builder()
        .outboxStore(store).publisher(event -> DeliveryOutcome.NO_RECIPIENTS).build());
    assertThrows(IllegalArgumentException.class, () -> OutboxDispatcher.builder()
        .connectionProvider(connections).outboxStore(store)
        .publisher(event -> DeliveryOutcome.NO_RECIPIENTS).batchSize(0).build());
    assertThrows(IllegalArgumentException.class, () -> OutboxDispatcher.builder()
        .connectionProvider(connections).outboxStore(store)
        .publisher(event -> DeliveryOutcome.NO_RECIPIENTS).intervalMs(0).build());
  }

  private OutboxDispatcher dispatcher(Publisher publisher, int batchSize) {
    return OutboxDispatcher.builder()
        .connectionProvider(connections)
        .outboxStore(store)
        .publisher(publisher)
        .batchSize(batchSize)
        .clock(clock)
        .build();
  }

  private static OutboxEvent row(String eventId, Instant createdAt) {
    return new OutboxEvent(eventId, "message.created", "c1",
        "{\"seq\":1,\"occurred_at\":\"" + createdAt + "\",\"payload\":{}}",
        createdAt, null, 0, createdAt, null);
  }

  /** Store whose status updates fail, as on a database that has gone read-only. */
  static final class ReadOnlyOutboxStore extends InMemoryOutboxStore {
    @Override
    public int markPublished(Connection conn, String eventId, Instant publishedAt) {
      throw new RelayStoreException("cannot execute UPDATE in a read-only transaction");
    }

    @Override
    public int markRetry(Connection conn, String eventId, Instant nextAttemptAt, String error) {
      throw new RelayStoreException("cannot execute UPDATE in a read-only transaction");
    }
  }

  static final class MutableClock extends Clock {
    private volatile Instant now;

    MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }

  static final class RecordingMetrics implements MetricsExporter {
    final AtomicInteger success = new AtomicInteger();
    final AtomicInteger failure = new AtomicInteger();
    final List<Long> lags = new CopyOnWriteArrayList<>();

    @Override
    public void incrementDispatchSuccess() {
      success.incrementAndGet();
    }

    @Override
    public void incrementDispatchFailure() {
      failure.incrementAndGet();
    }

    @Override
    public void recordOldestLagMs(long lagMs) {
      lags.add(lagMs);
    }
  }
}
