package relay.protocol;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outbound frames. {@link #type()} is the value of the {@code type} field on the wire.
 */
public sealed interface ServerFrame {

  int PROTOCOL_VERSION = 1;

  String type();

  /**
   * First frame after a successful handshake.
   */
  record Welcome(String connectionId, String userId, String serverTime, long heartbeatSec,
      int protocolVersion) implements ServerFrame {
    @Override
    public String type() {
      return "connection.welcome";
    }
  }

  /**
   * Reply to subscribe and unsubscribe. {@code accepted} and {@code rejected} are omitted
   * from the wire form when {@code null}.
   */
  record Ack(String op, boolean ok, List<String> accepted, List<String> rejected) implements ServerFrame {
    @Override
    public String type() {
      return "ack";
    }
  }

  /**
   * Reply to ping; {@code ts} echoes the client's value and is omitted when {@code null}.
   */
  record Pong(Long ts) implements ServerFrame {
    @Override
    public String type() {
      return "pong";
    }
  }

  /**
   * Structured error. {@code details} is omitted from the wire form when empty.
   */
  record Error(ErrorCode code, String message, Map<String, Object> details) implements ServerFrame {
    public Error {
      Objects.requireNonNull(code, "code");
      Objects.requireNonNull(message, "message");
      details = details == null ? Map.of() : details;
    }

    public Error(ErrorCode code, String message) {
      this(code, message, Map.of());
    }

    @Override
    public String type() {
      return "error";
    }
  }

  /**
   * A durable event pushed from the outbox, for example {@code message.created}.
   */
  record Event(String eventType, String eventId, String conversationId, long seq, String occurredAt,
      Map<String, Object> payload) implements ServerFrame {
    @Override
    public String type() {
      return eventType;
    }
  }
}
