/**
 * Spring Boot auto-configuration for the realtime relay.
 *
 * <p>{@link relay.spring.boot.RelayAutoConfiguration} wires a {@link relay.Relay} instance
 * from {@code relay.*} application properties and the application's {@code DataSource}.
 * {@link relay.spring.boot.RelayWebSocketAutoConfiguration} exposes the protocol engine as a
 * WebSocket endpoint, and {@link relay.spring.boot.JwtCredentialVerifier} authenticates
 * connections when {@code relay.jwt.secret} is set.
 *
 * @see relay.spring.boot.RelayAutoConfiguration
 * @see relay.spring.boot.RelayProperties
 */
package relay.spring.boot;
