package relay.spi;

/**
 * Maps an opaque connection credential to the id of the user it authenticates.
 * Issuance and rotation of credentials happen elsewhere.
 */
@FunctionalInterface
public interface CredentialVerifier {

  /**
   * @param token the bearer credential presented at handshake
   * @return the authenticated user id
   * @throws CredentialException if the credential is invalid or expired
   */
  String verify(String token) throws CredentialException;
}
