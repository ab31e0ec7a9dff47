package relay.spring.boot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;
import relay.protocol.HandshakeRequest;
import relay.protocol.ProtocolEngine;

import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Bridges Spring WebSocket callbacks to the {@link ProtocolEngine}.
 *
 * <p>The connection id assigned by the engine is kept in the session attributes under
 * {@link #CONNECTION_ID_ATTRIBUTE}.
 */
public class RelayWebSocketHandler extends TextWebSocketHandler {
  public static final String CONNECTION_ID_ATTRIBUTE = "relay.connectionId";

  private static final Logger log = LoggerFactory.getLogger(RelayWebSocketHandler.class);

  private final ProtocolEngine engine;
  private final int sendTimeLimitMs;
  private final int sendBufferSizeBytes;

  public RelayWebSocketHandler(ProtocolEngine engine, int sendTimeLimitMs, int sendBufferSizeBytes) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.sendTimeLimitMs = sendTimeLimitMs;
    this.sendBufferSizeBytes = sendBufferSizeBytes;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    HandshakeRequest request = new HandshakeRequest(
        session.getHandshakeHeaders().getFirst(HttpHeaders.AUTHORIZATION),
        queryParameter(session.getUri(), HandshakeRequest.QUERY_PARAMETER),
        remoteAddress(session.getRemoteAddress()));
    String connectionId = engine.open(
        new WebSocketSessionHandle(session, sendTimeLimitMs, sendBufferSizeBytes), request);
    session.getAttributes().put(CONNECTION_ID_ATTRIBUTE, connectionId);
    log.debug("Session {} mapped to connection {}", session.getId(), connectionId);
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    String connectionId = connectionId(session);
    if (connectionId != null) {
      engine.onFrame(connectionId, message.getPayload());
    }
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.debug("Transport error on session {}", session.getId(), exception);
    String connectionId = connectionId(session);
    if (connectionId != null) {
      engine.onClose(connectionId);
    }
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    String connectionId = connectionId(session);
    if (connectionId != null) {
      engine.onClose(connectionId);
    }
  }

  private static String connectionId(WebSocketSession session) {
    Object value = session.getAttributes().get(CONNECTION_ID_ATTRIBUTE);
    return value instanceof String id ? id : null;
  }

  static String queryParameter(URI uri, String name) {
    if (uri == null) {
      return null;
    }
    String raw = UriComponentsBuilder.fromUri(uri).build(true).getQueryParams().getFirst(name);
    return raw == null ? null : UriUtils.decode(raw, StandardCharsets.UTF_8);
  }

  private static String remoteAddress(InetSocketAddress address) {
    return address == null ? null : address.toString();
  }
}
