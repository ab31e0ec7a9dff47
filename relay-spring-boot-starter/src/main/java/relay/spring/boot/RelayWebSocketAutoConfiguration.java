package relay.spring.boot;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import relay.Relay;

/**
 * Exposes the relay's {@link relay.protocol.ProtocolEngine} as a WebSocket endpoint at
 * {@code relay.websocket.path} in servlet web applications.
 */
@AutoConfiguration(after = RelayAutoConfiguration.class)
@ConditionalOnClass(WebSocketConfigurer.class)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnBean(Relay.class)
@EnableWebSocket
@EnableConfigurationProperties(RelayProperties.class)
public class RelayWebSocketAutoConfiguration implements WebSocketConfigurer {
  private final RelayProperties.Websocket ws;
  // Bean methods are not proxied here, so the handler is built once and shared.
  private final RelayWebSocketHandler handler;

  public RelayWebSocketAutoConfiguration(Relay relay, RelayProperties props) {
    this.ws = props.getWebsocket();
    this.handler = new RelayWebSocketHandler(
        relay.engine(), Math.toIntExact(ws.getSendTimeLimit().toMillis()), ws.getSendBufferSizeBytes());
  }

  @Bean
  public RelayWebSocketHandler relayWebSocketHandler() {
    return handler;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry.addHandler(handler, ws.getPath())
        .setAllowedOriginPatterns(ws.getAllowedOrigins().toArray(String[]::new));
  }
}
