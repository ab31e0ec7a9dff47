package relay.spring.boot;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import relay.spi.CredentialException;
import relay.spi.CredentialVerifier;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;
import java.util.Objects;

/**
 * {@link CredentialVerifier} for HMAC-signed JWT access tokens.
 *
 * <p>The {@code sub} claim is the user id. Tokens carrying a {@code type} claim other than
 * {@code "access"} (refresh tokens, for one) are refused.
 */
public final class JwtCredentialVerifier implements CredentialVerifier {
  static final String TYPE_CLAIM = "type";
  static final String ACCESS_TYPE = "access";

  private final JwtParser parser;

  public JwtCredentialVerifier(String secret) {
    this(secret, Clock.systemUTC());
  }

  public JwtCredentialVerifier(String secret, Clock clock) {
    Objects.requireNonNull(secret, "secret");
    Objects.requireNonNull(clock, "clock");
    SecretKey key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    this.parser = Jwts.parser()
        .verifyWith(key)
        .clock(() -> Date.from(clock.instant()))
        .build();
  }

  @Override
  public String verify(String token) throws CredentialException {
    if (token == null || token.isBlank()) {
      throw new CredentialException(CredentialException.Kind.UNAUTHORIZED, "Empty token");
    }
    Claims claims;
    try {
      claims = parser.parseSignedClaims(token).getPayload();
    } catch (ExpiredJwtException e) {
      throw new CredentialException(CredentialException.Kind.EXPIRED, "Token expired", e);
    } catch (JwtException | IllegalArgumentException e) {
      throw new CredentialException(CredentialException.Kind.UNAUTHORIZED, "Invalid token", e);
    }
    Object type = claims.get(TYPE_CLAIM);
    if (type != null && !ACCESS_TYPE.equals(type)) {
      throw new CredentialException(CredentialException.Kind.UNAUTHORIZED, "Not an access token");
    }
    String subject = claims.getSubject();
    if (subject == null || subject.isBlank()) {
      throw new CredentialException(CredentialException.Kind.UNAUTHORIZED, "Token has no subject");
    }
    return subject;
  }
}
