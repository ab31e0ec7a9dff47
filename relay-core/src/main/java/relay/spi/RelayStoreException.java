package relay.spi;

/**
 * Thrown when a store operation fails at the database level.
 */
public class RelayStoreException extends RuntimeException {

  public RelayStoreException(String message) {
    super(message);
  }

  public RelayStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
