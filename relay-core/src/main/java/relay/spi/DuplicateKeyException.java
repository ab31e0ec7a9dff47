package relay.spi;

/**
 * Thrown by a store when an insert violates a unique constraint.
 *
 * <p>After this exception the current transaction may be unusable until rolled back to a
 * savepoint taken before the failing statement.
 */
public class DuplicateKeyException extends RelayStoreException {

  public DuplicateKeyException(String message, Throwable cause) {
    super(message, cause);
  }
}
