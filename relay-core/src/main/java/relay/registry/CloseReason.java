package relay.registry;

/**
 * Why the server closes a connection, with the WebSocket close code it maps to.
 */
public enum CloseReason {
  NORMAL(1000, "normal closure"),
  GOING_AWAY(1001, "server shutting down"),
  POLICY_VIOLATION(1008, "policy violation"),
  SERVER_ERROR(1011, "internal error"),
  TRY_AGAIN_LATER(1013, "slow consumer");

  private final int code;
  private final String description;

  CloseReason(int code, String description) {
    this.code = code;
    this.description = description;
  }

  public int code() {
    return code;
  }

  public String description() {
    return description;
  }
}
