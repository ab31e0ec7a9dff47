package relay.sequence;

/**
 * Thrown when a message write collides with an existing row in a way that cannot be
 * resolved as an idempotent replay. The caller's transaction must be rolled back.
 */
public class ConflictException extends RuntimeException {

  public ConflictException(String message) {
    super(message);
  }

  public ConflictException(String message, Throwable cause) {
    super(message, cause);
  }
}
