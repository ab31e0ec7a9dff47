package relay.spring.boot;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.Test;
import relay.spi.CredentialException;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JwtCredentialVerifierTest {
  private static final String SECRET = "relay-test-secret-with-at-least-32-bytes";
  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private final SecretKey key = Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8));
  private final JwtCredentialVerifier verifier =
      new JwtCredentialVerifier(SECRET, Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void acceptsAccessToken() throws Exception {
    String token = Jwts.builder()
        .subject("alice")
        .claim("type", "access")
        .expiration(Date.from(NOW.plus(Duration.ofMinutes(15))))
        .signWith(key)
        .compact();

    assertEquals("alice", verifier.verify(token));
  }

  @Test
  void acceptsTokenWithoutTypeClaim() throws Exception {
    String token = Jwts.builder().subject("bob").signWith(key).compact();

    assertEquals("bob", verifier.verify(token));
  }

  @Test
  void expiredTokenReportsExpired() {
    String token = Jwts.builder()
        .subject("alice")
        .expiration(Date.from(NOW.minus(Duration.ofMinutes(1))))
        .signWith(key)
        .compact();

    CredentialException e = assertThrows(CredentialException.class, () -> verifier.verify(token));
    assertEquals(CredentialException.Kind.EXPIRED, e.kind());
  }

  @Test
  void refreshTokenRejected() {
    String token = Jwts.builder().subject("alice").claim("type", "refresh").signWith(key).compact();

    CredentialException e = assertThrows(CredentialException.class, () -> verifier.verify(token));
    assertEquals(CredentialException.Kind.UNAUTHORIZED, e.kind());
  }

  @Test
  void foreignSignatureRejected() {
    SecretKey other = Keys.hmacShaKeyFor("another-secret-that-is-32-bytes-long!!".getBytes(StandardCharsets.UTF_8));
    String token = Jwts.builder().subject("mallory").signWith(other).compact();

    CredentialException e = assertThrows(CredentialException.class, () -> verifier.verify(token));
    assertEquals(CredentialException.Kind.UNAUTHORIZED, e.kind());
  }

  @Test
  void garbageRejected() {
    CredentialException e = assertThrows(CredentialException.class, () -> verifier.verify("not.a.jwt"));
    assertEquals(CredentialException.Kind.UNAUTHORIZED, e.kind());
    assertThrows(CredentialException.class, () -> verifier.verify("  "));
  }

  @Test
  void tokenWithoutSubjectRejected() {
    String token = Jwts.builder().claim("type", "access").signWith(key).compact();

    CredentialException e = assertThrows(CredentialException.class, () -> verifier.verify(token));
    assertEquals(CredentialException.Kind.UNAUTHORIZED, e.kind());
  }

  @Test
  void shortSecretRefused() {
    assertThrows(RuntimeException.class, () -> new JwtCredentialVerifier("too-short"));
  }
}
