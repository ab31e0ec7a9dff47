package relay.registry;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process index of live connections and their conversation subscriptions.
 *
 * <p>All three maps (connection to session, connection to subscribed conversations,
 * conversation to subscribed connections) are updated under one lock, so they always
 * agree with each other. {@link #fanout} returns a copy; callers write to sockets after
 * the lock is released. No I/O ever happens while the lock is held.
 *
 * <p>One registry per process, passed explicitly to the components that need it.
 */
public final class ConnectionRegistry {
  public static final int DEFAULT_MAX_SUBSCRIPTIONS = 200;

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, Session> sessions = new HashMap<>();
  private final Map<String, Set<String>> subscriptionsByConnection = new HashMap<>();
  private final Map<String, Map<String, Session>> subscribersByConversation = new HashMap<>();
  private final int maxSubscriptionsPerConnection;
  private final Clock clock;

  public ConnectionRegistry() {
    this(DEFAULT_MAX_SUBSCRIPTIONS, Clock.systemUTC());
  }

  public ConnectionRegistry(int maxSubscriptionsPerConnection) {
    this(maxSubscriptionsPerConnection, Clock.systemUTC());
  }

  public ConnectionRegistry(int maxSubscriptionsPerConnection, Clock clock) {
    if (maxSubscriptionsPerConnection <= 0) {
      throw new IllegalArgumentException("maxSubscriptionsPerConnection must be > 0");
    }
    this.maxSubscriptionsPerConnection = maxSubscriptionsPerConnection;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Adds a connection with no subscriptions.
   *
   * @throws DuplicateConnectionException if {@code connectionId} is already registered
   */
  public Session register(String connectionId, String userId, ConnectionHandle handle) {
    Session session = new Session(connectionId, userId, handle, clock.instant());
    lock.lock();
    try {
      if (sessions.containsKey(connectionId)) {
        throw new DuplicateConnectionException(connectionId);
      }
      sessions.put(connectionId, session);
      subscriptionsByConnection.put(connectionId, new LinkedHashSet<>());
      return session;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Adds subscriptions. Duplicate ids and ids already subscribed are accepted without
   * effect.
   *
   * @return the de-duplicated ids, in request order
   * @throws SubscriptionLimitExceededException if the resulting set would exceed the limit;
   *                                            nothing is applied in that case
   * @throws IllegalStateException              if the connection is not registered
   */
  public List<String> subscribe(String connectionId, Collection<String> conversationIds) {
    Set<String> requested = new LinkedHashSet<>(conversationIds);
    lock.lock();
    try {
      Session session = requireSession(connectionId);
      Set<String> current = subscriptionsByConnection.get(connectionId);
      int projected = current.size();
      for (String id : requested) {
        if (!current.contains(id)) {
          projected++;
        }
      }
      if (projected > maxSubscriptionsPerConnection) {
        throw new SubscriptionLimitExceededException(maxSubscriptionsPerConnection, projected);
      }
      for (String id : requested) {
        if (current.add(id)) {
          subscribersByConversation.computeIfAbsent(id, k -> new LinkedHashMap<>()).put(connectionId, session);
        }
      }
      return List.copyOf(requested);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes subscriptions. Ids that are not subscribed, and unknown connections, are
   * ignored.
   */
  public void unsubscribe(String connectionId, Collection<String> conversationIds) {
    lock.lock();
    try {
      Set<String> current = subscriptionsByConnection.get(connectionId);
      if (current == null) {
        return;
      }
      for (String id : conversationIds) {
        if (current.remove(id)) {
          detach(id, connectionId);
        }
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns a snapshot of the sessions subscribed to a conversation.
   */
  public List<Session> fanout(String conversationId) {
    lock.lock();
    try {
      Map<String, Session> subscribers = subscribersByConversation.get(conversationId);
      return subscribers == null ? List.of() : new ArrayList<>(subscribers.values());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes a connection and every subscription it held. Safe to call more than once.
   *
   * @return the removed session, or empty if it was not registered
   */
  public Optional<Session> deregister(String connectionId) {
    lock.lock();
    try {
      Session removed = sessions.remove(connectionId);
      Set<String> subscribed = subscriptionsByConnection.remove(connectionId);
      if (subscribed != null) {
        for (String id : subscribed) {
          detach(id, connectionId);
        }
      }
      return Optional.ofNullable(removed);
    } finally {
      lock.unlock();
    }
  }

  public Optional<Session> session(String connectionId) {
    lock.lock();
    try {
      return Optional.ofNullable(sessions.get(connectionId));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns a snapshot of every session authenticated as {@code userId}.
   */
  public List<Session> sessionsForUser(String userId) {
    lock.lock();
    try {
      List<Session> result = new ArrayList<>();
      for (Session session : sessions.values()) {
        if (session.userId().equals(userId)) {
          result.add(session);
        }
      }
      return result;
    } finally {
      lock.unlock();
    }
  }

  public Set<String> subscriptionsOf(String connectionId) {
    lock.lock();
    try {
      Set<String> current = subscriptionsByConnection.get(connectionId);
      return current == null ? Set.of() : Set.copyOf(current);
    } finally {
      lock.unlock();
    }
  }

  public int connectionCount() {
    lock.lock();
    try {
      return sessions.size();
    } finally {
      lock.unlock();
    }
  }

  public int maxSubscriptionsPerConnection() {
    return maxSubscriptionsPerConnection;
  }

  private Session requireSession(String connectionId) {
    Session session = sessions.get(connectionId);
    if (session == null) {
      throw new IllegalStateException("Connection not registered: " + connectionId);
    }
    return session;
  }

  // Caller holds the lock
  private void detach(String conversationId, String connectionId) {
    Map<String, Session> subscribers = subscribersByConversation.get(conversationId);
    if (subscribers != null) {
      subscribers.remove(connectionId);
      if (subscribers.isEmpty()) {
        subscribersByConversation.remove(conversationId);
      }
    }
  }
}
