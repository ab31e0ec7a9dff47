package relay.registry;

import java.time.Instant;
import java.util.Objects;

/**
 * A registered connection. Subscriptions are held by the {@link ConnectionRegistry}, not
 * by the session, so a snapshot taken for fanout never changes underneath the caller.
 */
public final class Session {
  private final String connectionId;
  private final String userId;
  private final ConnectionHandle handle;
  private final Instant connectedAt;
  private volatile Instant lastActivity;

  Session(String connectionId, String userId, ConnectionHandle handle, Instant connectedAt) {
    this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
    this.userId = Objects.requireNonNull(userId, "userId");
    this.handle = Objects.requireNonNull(handle, "handle");
    this.connectedAt = Objects.requireNonNull(connectedAt, "connectedAt");
    this.lastActivity = connectedAt;
  }

  public String connectionId() {
    return connectionId;
  }

  public String userId() {
    return userId;
  }

  public ConnectionHandle handle() {
    return handle;
  }

  public Instant connectedAt() {
    return connectedAt;
  }

  public Instant lastActivity() {
    return lastActivity;
  }

  public void touch(Instant now) {
    this.lastActivity = now;
  }

  @Override
  public String toString() {
    return "Session{" + connectionId + ", user=" + userId + "}";
  }
}
