package relay.protocol;

import java.util.Locale;
import java.util.Optional;

/**
 * Credential-bearing parts of the opening request.
 *
 * @param authorization value of the {@code Authorization} header, or {@code null}
 * @param accessToken   value of the {@code access_token} query parameter, or {@code null}
 * @param remoteAddress peer address for logging, or {@code null}
 */
public record HandshakeRequest(String authorization, String accessToken, String remoteAddress) {
  public static final String QUERY_PARAMETER = "access_token";
  private static final String BEARER_PREFIX = "bearer ";

  /**
   * Returns the credential: the bearer header when present, otherwise the query parameter.
   */
  public Optional<String> credential() {
    if (authorization != null) {
      String trimmed = authorization.trim();
      if (trimmed.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
        String token = trimmed.substring(BEARER_PREFIX.length()).trim();
        if (!token.isEmpty()) {
          return Optional.of(token);
        }
      }
    }
    if (accessToken != null && !accessToken.isBlank()) {
      return Optional.of(accessToken.trim());
    }
    return Optional.empty();
  }
}
