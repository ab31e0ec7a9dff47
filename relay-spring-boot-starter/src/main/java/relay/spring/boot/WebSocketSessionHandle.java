package relay.spring.boot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;
import relay.registry.CloseReason;
import relay.registry.ConnectionHandle;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link ConnectionHandle} over a Spring {@link WebSocketSession}.
 *
 * <p>Writes go through a {@link ConcurrentWebSocketSessionDecorator}, so concurrent senders
 * are serialized and a peer that stops reading overflows its own buffer instead of
 * blocking the dispatcher.
 */
final class WebSocketSessionHandle implements ConnectionHandle {
  private static final Logger log = LoggerFactory.getLogger(WebSocketSessionHandle.class);

  private final WebSocketSession session;

  WebSocketSessionHandle(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
    Objects.requireNonNull(session, "session");
    this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
  }

  @Override
  public void send(String text) throws IOException {
    try {
      session.sendMessage(new TextMessage(text));
    } catch (SessionLimitExceededException e) {
      throw new IOException("Send limit exceeded for session " + session.getId(), e);
    }
  }

  @Override
  public void close(CloseReason reason) {
    if (!session.isOpen()) {
      return;
    }
    try {
      session.close(toCloseStatus(reason));
    } catch (IOException e) {
      log.debug("Close of session {} failed", session.getId(), e);
    }
  }

  @Override
  public boolean isOpen() {
    return session.isOpen();
  }

  static CloseStatus toCloseStatus(CloseReason reason) {
    return new CloseStatus(reason.code(), reason.description());
  }
}
