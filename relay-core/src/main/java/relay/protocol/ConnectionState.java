package relay.protocol;

/**
 * Lifecycle of one realtime connection. Transitions only move forward.
 */
public enum ConnectionState {
  CONNECTING,
  AUTHENTICATING,
  OPEN,
  CLOSING,
  CLOSED
}
