package relay.spi;

/**
 * Thrown by a {@link CredentialVerifier} when a connection credential is not accepted.
 */
public class CredentialException extends Exception {

  /**
   * Why the credential was refused.
   */
  public enum Kind {
    /** Missing, malformed, forged or of the wrong type. */
    UNAUTHORIZED,
    /** Well-formed and genuine but past its expiry. */
    EXPIRED
  }

  private final Kind kind;

  public CredentialException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public CredentialException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
