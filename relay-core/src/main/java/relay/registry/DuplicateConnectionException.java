package relay.registry;

/**
 * Thrown when a connection id is registered twice.
 */
public class DuplicateConnectionException extends RuntimeException {

  public DuplicateConnectionException(String connectionId) {
    super("Connection already registered: " + connectionId);
  }
}
