package relay.publish;

import relay.model.EventType;
import relay.model.OutboxEvent;
import relay.protocol.FrameCodec;
import relay.protocol.JacksonFrameCodec;
import relay.protocol.ServerFrame;
import relay.registry.CloseReason;
import relay.registry.ConnectionRegistry;
import relay.registry.Session;
import relay.spi.MetricsExporter;
import relay.util.JsonCodec;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link Publisher}: decodes the stored event once, encodes one frame and writes it
 * to every session in the registry's fanout snapshot for the event's conversation.
 *
 * <p>Socket writes happen outside the registry lock. A session whose write fails is handed
 * to the {@link DeadSessionHandler} and counted as dropped; that never fails the call.
 * Only problems with the event itself (unknown type, unreadable payload, encoding) or with
 * the registry lookup raise {@link DeliveryException}.
 */
public final class FanoutPublisher implements Publisher {
  private static final Logger logger = Logger.getLogger(FanoutPublisher.class.getName());

  private final ConnectionRegistry registry;
  private final FrameCodec frameCodec;
  private final JsonCodec jsonCodec;
  private final DeadSessionHandler deadSessionHandler;
  private final MetricsExporter metrics;

  public FanoutPublisher(ConnectionRegistry registry) {
    this(registry, new JacksonFrameCodec(), JsonCodec.getDefault(), null, MetricsExporter.NOOP);
  }

  /**
   * @param deadSessionHandler called for sessions whose write failed; {@code null} means
   *                           deregister the session and close it with
   *                           {@link CloseReason#TRY_AGAIN_LATER}
   */
  public FanoutPublisher(ConnectionRegistry registry, FrameCodec frameCodec, JsonCodec jsonCodec,
      DeadSessionHandler deadSessionHandler, MetricsExporter metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.frameCodec = Objects.requireNonNull(frameCodec, "frameCodec");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.deadSessionHandler = deadSessionHandler != null ? deadSessionHandler : this::dropSession;
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  @Override
  public DeliveryOutcome deliver(OutboxEvent event) throws DeliveryException {
    Objects.requireNonNull(event, "event");
    ServerFrame.Event frame = toFrame(event);
    String text;
    try {
      text = frameCodec.encode(frame);
    } catch (RuntimeException e) {
      throw new DeliveryException("Cannot encode outbox event " + event.eventId(), e);
    }

    List<Session> recipients;
    try {
      recipients = registry.fanout(event.conversationId());
    } catch (RuntimeException e) {
      throw new DeliveryException("Fanout lookup failed for conversation " + event.conversationId(), e);
    }
    if (recipients.isEmpty()) {
      return DeliveryOutcome.NO_RECIPIENTS;
    }

    int delivered = 0;
    int dropped = 0;
    for (Session session : recipients) {
      try {
        session.handle().send(text);
        delivered++;
      } catch (IOException | RuntimeException e) {
        dropped++;
        logger.log(Level.FINE, "Dropping session " + session.connectionId()
            + " after failed write of eventId=" + event.eventId(), e);
        handleDeadSession(session, e);
      }
    }
    metrics.incrementFanoutDelivered(delivered);
    if (dropped > 0) {
      metrics.incrementFanoutDropped(dropped);
    }
    return new DeliveryOutcome(recipients.size(), delivered, dropped);
  }

  /**
   * Rebuilds the typed event frame from a stored outbox row.
   *
   * @throws DeliveryException if the row's type or payload cannot be read
   */
  ServerFrame.Event toFrame(OutboxEvent event) throws DeliveryException {
    EventType type;
    Map<String, Object> body;
    try {
      type = EventType.fromWireName(event.eventType());
      body = jsonCodec.parseObject(event.payloadJson());
    } catch (IllegalArgumentException e) {
      throw new DeliveryException("Unreadable outbox event " + event.eventId(), e);
    }
    Object seq = body.get("seq");
    Object occurredAt = body.get("occurred_at");
    Object payload = body.getOrDefault("payload", Map.of());
    if (!(seq instanceof Number) || !(occurredAt instanceof String) || !(payload instanceof Map)) {
      throw new DeliveryException("Outbox event " + event.eventId() + " is missing seq, occurred_at or payload");
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> fields = (Map<String, Object>) payload;
    return new ServerFrame.Event(type.wireName(), event.eventId(), event.conversationId(),
        ((Number) seq).longValue(), (String) occurredAt, fields);
  }

  private void handleDeadSession(Session session, Exception failure) {
    try {
      deadSessionHandler.onWriteFailure(session, failure);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Dead session handler failed for " + session.connectionId(), e);
      dropSession(session, failure);
    }
  }

  private void dropSession(Session session, Exception failure) {
    registry.deregister(session.connectionId());
    try {
      session.handle().close(CloseReason.TRY_AGAIN_LATER);
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Close failed for " + session.connectionId(), e);
    }
  }
}
