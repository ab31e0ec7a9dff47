package relay.protocol;

import java.util.Objects;

/**
 * Thrown when an inbound frame cannot be turned into a {@link ClientCommand}.
 * The connection stays open; the sender gets an error frame with {@link #code()}.
 */
public class ProtocolException extends Exception {
  private final ErrorCode code;

  public ProtocolException(ErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
  }

  public ProtocolException(ErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
  }

  public ErrorCode code() {
    return code;
  }
}
