package relay;

import com.github.f4b6a3.ulid.UlidCreator;
import relay.model.OutboxEvent;
import relay.model.RealtimeEvent;
import relay.spi.OutboxStore;
import relay.spi.TxContext;
import relay.util.JsonCodec;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Appends realtime events to the outbox table inside the caller's transaction.
 *
 * <p>Every call requires an active transaction via {@link TxContext}; the rows become
 * visible to the dispatcher only when that transaction commits and disappear with it on
 * rollback. After commit the {@code onCommit} signal runs once per transaction batch; it
 * carries no event data.
 *
 * @see relay.dispatch.OutboxDispatcher#wakeUp()
 */
public final class OutboxWriter {
    private static final Logger logger = Logger.getLogger(OutboxWriter.class.getName());

    private final TxContext txContext;
    private final OutboxStore outboxStore;
    private final Runnable onCommit;
    private final JsonCodec jsonCodec;
    private final Clock clock;

    /**
     * Creates a writer without a commit signal (the dispatcher finds rows on its next poll).
     */
    public OutboxWriter(TxContext txContext, OutboxStore outboxStore) {
        this(txContext, outboxStore, null, JsonCodec.getDefault(), Clock.systemUTC());
    }

    /**
     * @param onCommit  run after commit; {@code null} for none
     * @param jsonCodec codec for the stored payload document
     * @param clock     source of {@code created_at}
     */
    public OutboxWriter(
            TxContext txContext,
            OutboxStore outboxStore,
            Runnable onCommit,
            JsonCodec jsonCodec,
            Clock clock
    ) {
        this.txContext = Objects.requireNonNull(txContext, "txContext");
        this.outboxStore = Objects.requireNonNull(outboxStore, "outboxStore");
        this.onCommit = onCommit;
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Appends a single event.
     *
     * @return the event id (monotonic ULID)
     * @throws IllegalStateException if no transaction is active
     */
    public String append(RealtimeEvent event) {
        Objects.requireNonNull(event, "event");
        return appendAll(List.of(event)).get(0);
    }

    /**
     * Appends events in list order. One commit signal is registered for the whole list.
     *
     * @return event ids in the same order as the input
     * @throws IllegalStateException if no transaction is active
     */
    public List<String> appendAll(List<RealtimeEvent> events) {
        if (!txContext.isTransactionActive()) {
            throw new IllegalStateException("No active transaction");
        }
        Objects.requireNonNull(events, "events");
        if (events.isEmpty()) {
            return List.of();
        }

        Connection conn = txContext.currentConnection();
        List<String> ids = new ArrayList<>(events.size());
        for (RealtimeEvent event : events) {
            OutboxEvent row = toRow(event);
            outboxStore.insert(conn, row);
            ids.add(row.eventId());
        }

        if (onCommit != null) {
            txContext.afterCommit(this::signalCommit);
        }
        return ids;
    }

    private OutboxEvent toRow(RealtimeEvent event) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("seq", event.seq());
        body.put("occurred_at", event.occurredAt().toString());
        body.put("payload", event.payload());
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        return new OutboxEvent(
            UlidCreator.getMonotonicUlid().toString(),
            event.type().wireName(),
            event.conversationId(),
            jsonCodec.toJson(body),
            now,
            null,
            0,
            now,
            null);
    }

    private void signalCommit() {
        try {
            onCommit.run();
        } catch (RuntimeException ex) {
            logger.log(Level.WARNING, "Outbox commit signal failed", ex);
        }
    }
}
