package relay.protocol;

import com.github.f4b6a3.ulid.UlidCreator;
import relay.registry.CloseReason;
import relay.registry.ConnectionHandle;
import relay.registry.ConnectionRegistry;
import relay.registry.DuplicateConnectionException;
import relay.registry.Session;
import relay.registry.SubscriptionLimitExceededException;
import relay.spi.CredentialException;
import relay.spi.CredentialVerifier;
import relay.spi.MembershipChecker;
import relay.spi.MetricsExporter;
import relay.util.NamedThreadFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives the per-connection state machine of the realtime channel.
 *
 * <p>The transport calls {@link #open} when a socket is accepted, {@link #onFrame} for each
 * inbound text frame and {@link #onClose} when the peer goes away. Everything else
 * (handshake, welcome, command validation, rate limiting, idle and handshake timeouts,
 * registry bookkeeping) happens here.
 *
 * <pre>
 * CONNECTING -&gt; AUTHENTICATING -&gt; OPEN -&gt; CLOSING -&gt; CLOSED
 *                     |                                 ^
 *                     +---------- bad credential -------+
 * </pre>
 *
 * <p>A connection that reached {@code OPEN} is deregistered exactly once on its way to
 * {@code CLOSED}, whatever triggered the close. Failures on one connection never touch
 * another.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class ProtocolEngine implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ProtocolEngine.class.getName());

  private final ConnectionRegistry registry;
  private final CredentialVerifier credentialVerifier;
  private final MembershipChecker membershipChecker;
  private final FrameCodec codec;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final int maxFrameBytes;
  private final int maxIdsPerSubscribe;
  private final int rateLimitMaxCommands;
  private final Duration rateLimitWindow;
  private final Duration idleTimeout;
  private final Duration heartbeatInterval;
  private final Duration handshakeTimeout;
  private final ScheduledExecutorService timer;
  private final boolean ownsTimer;

  private final Map<String, Channel> channels = new ConcurrentHashMap<>();
  private volatile boolean closed;

  private ProtocolEngine(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.credentialVerifier = Objects.requireNonNull(builder.credentialVerifier, "credentialVerifier");
    this.membershipChecker = Objects.requireNonNull(builder.membershipChecker, "membershipChecker");
    this.codec = builder.codec != null ? builder.codec : new JacksonFrameCodec();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.maxFrameBytes <= 0) {
      throw new IllegalArgumentException("maxFrameBytes must be > 0");
    }
    if (builder.maxIdsPerSubscribe <= 0) {
      throw new IllegalArgumentException("maxIdsPerSubscribe must be > 0");
    }
    if (builder.rateLimitMaxCommands <= 0) {
      throw new IllegalArgumentException("rateLimitMaxCommands must be > 0");
    }
    this.maxFrameBytes = builder.maxFrameBytes;
    this.maxIdsPerSubscribe = builder.maxIdsPerSubscribe;
    this.rateLimitMaxCommands = builder.rateLimitMaxCommands;
    this.rateLimitWindow = requirePositive(builder.rateLimitWindow, "rateLimitWindow");
    this.idleTimeout = requirePositive(builder.idleTimeout, "idleTimeout");
    this.heartbeatInterval = requirePositive(builder.heartbeatInterval, "heartbeatInterval");
    this.handshakeTimeout = requirePositive(builder.handshakeTimeout, "handshakeTimeout");
    if (builder.timer != null) {
      this.timer = builder.timer;
      this.ownsTimer = false;
    } else {
      this.timer = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("relay-timer-"));
      this.ownsTimer = true;
    }
  }

  private static Duration requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
    return value;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs the handshake for a newly accepted socket.
   *
   * <p>On success the connection is registered, a welcome frame is sent and the state is
   * {@code OPEN}. On a missing, invalid or expired credential an error frame is sent, the
   * socket is closed with {@link CloseReason#POLICY_VIOLATION} and the state is
   * {@code CLOSED}.
   *
   * @return the id assigned to the connection, used for all later calls
   */
  public String open(ConnectionHandle handle, HandshakeRequest request) {
    Objects.requireNonNull(handle, "handle");
    Objects.requireNonNull(request, "request");
    String connectionId = UlidCreator.getMonotonicUlid().toString();
    Channel channel = new Channel(connectionId, handle);
    if (closed) {
      channel.state.set(ConnectionState.CLOSED);
      closeQuietly(handle, CloseReason.GOING_AWAY);
      return connectionId;
    }
    channels.put(connectionId, channel);
    channel.handshakeTask = schedule(() -> onHandshakeTimeout(channel), handshakeTimeout);

    if (!channel.state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.AUTHENTICATING)) {
      return connectionId;
    }
    Optional<String> credential = request.credential();
    if (credential.isEmpty()) {
      rejectHandshake(channel, ErrorCode.UNAUTHORIZED, "Missing access token");
      return connectionId;
    }
    String userId;
    try {
      userId = credentialVerifier.verify(credential.get());
    } catch (CredentialException e) {
      ErrorCode code = e.kind() == CredentialException.Kind.EXPIRED
          ? ErrorCode.TOKEN_EXPIRED : ErrorCode.UNAUTHORIZED;
      rejectHandshake(channel, code, e.getMessage() == null ? "Invalid access token" : e.getMessage());
      return connectionId;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Credential verification failed for connection " + connectionId, e);
      rejectHandshake(channel, ErrorCode.UNAUTHORIZED, "Invalid access token");
      return connectionId;
    }

    Session session;
    try {
      session = registry.register(connectionId, userId, handle);
    } catch (DuplicateConnectionException e) {
      logger.log(Level.SEVERE, "Connection id collision: " + connectionId, e);
      channel.state.set(ConnectionState.CLOSED);
      channels.remove(connectionId);
      cancel(channel.handshakeTask);
      closeQuietly(handle, CloseReason.SERVER_ERROR);
      return connectionId;
    }
    channel.session = session;
    if (!channel.state.compareAndSet(ConnectionState.AUTHENTICATING, ConnectionState.OPEN)) {
      // Handshake timer fired while verifying; it has already closed the socket.
      registry.deregister(connectionId);
      channels.remove(connectionId);
      return connectionId;
    }
    cancel(channel.handshakeTask);
    channel.idleTask = schedule(() -> onIdleCheck(channel), idleTimeout);
    metrics.recordActiveConnections(registry.connectionCount());
    logger.log(Level.INFO, "Connection {0} opened for user {1}", new Object[] {connectionId, userId});

    send(channel, new ServerFrame.Welcome(
        connectionId,
        userId,
        clock.instant().toString(),
        heartbeatInterval.toSeconds(),
        ServerFrame.PROTOCOL_VERSION));
    return connectionId;
  }

  /**
   * Handles one inbound text frame. Frames for unknown or non-open connections are ignored.
   */
  public void onFrame(String connectionId, String text) {
    Channel channel = channels.get(connectionId);
    if (channel == null || channel.state.get() != ConnectionState.OPEN) {
      logger.log(Level.FINE, "Ignoring frame for connection {0} that is not open", connectionId);
      return;
    }
    touch(channel);

    if (!channel.rateLimiter.tryAcquire()) {
      sendError(channel, new ServerFrame.Error(ErrorCode.RATE_LIMITED, "Command rate limit exceeded"));
      return;
    }

    ClientCommand command;
    try {
      if (text == null || text.getBytes(StandardCharsets.UTF_8).length > maxFrameBytes) {
        throw new ProtocolException(ErrorCode.INVALID_COMMAND, "Frame is too large");
      }
      command = codec.decode(text);
    } catch (ProtocolException e) {
      sendError(channel, new ServerFrame.Error(e.code(), e.getMessage()));
      return;
    }

    try {
      if (command instanceof ClientCommand.Subscribe subscribe) {
        handleSubscribe(channel, subscribe);
      } else if (command instanceof ClientCommand.Unsubscribe unsubscribe) {
        handleUnsubscribe(channel, unsubscribe);
      } else if (command instanceof ClientCommand.Ping ping) {
        send(channel, new ServerFrame.Pong(ping.ts()));
      }
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Command " + command.op() + " failed on connection " + connectionId, e);
      sendError(channel, new ServerFrame.Error(ErrorCode.INTERNAL_ERROR, "Internal error"));
    }
  }

  private void handleSubscribe(Channel channel, ClientCommand.Subscribe command) {
    List<String> requested = new ArrayList<>(new LinkedHashSet<>(command.conversationIds()));
    if (requested.isEmpty()) {
      sendError(channel, new ServerFrame.Error(ErrorCode.INVALID_COMMAND, "conversation_ids is required"));
      return;
    }
    if (requested.size() > maxIdsPerSubscribe) {
      sendError(channel, new ServerFrame.Error(ErrorCode.INVALID_COMMAND, "Too many conversation ids",
          Map.of("max", maxIdsPerSubscribe)));
      return;
    }

    Set<String> members;
    try {
      members = membershipChecker.membersOf(channel.session.userId(), requested);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Membership lookup failed on connection " + channel.connectionId, e);
      sendError(channel, new ServerFrame.Error(ErrorCode.INTERNAL_ERROR, "Membership lookup failed"));
      return;
    }
    List<String> accepted = new ArrayList<>();
    List<String> rejected = new ArrayList<>();
    for (String id : requested) {
      if (members.contains(id)) {
        accepted.add(id);
      } else {
        rejected.add(id);
      }
    }

    if (!accepted.isEmpty()) {
      try {
        registry.subscribe(channel.connectionId, accepted);
      } catch (SubscriptionLimitExceededException e) {
        sendError(channel, new ServerFrame.Error(ErrorCode.INVALID_COMMAND, "Subscription limit exceeded",
            Map.of("limit", e.limit())));
        return;
      } catch (IllegalStateException e) {
        logger.log(Level.FINE, "Connection {0} deregistered during subscribe", channel.connectionId);
        return;
      }
    }

    send(channel, new ServerFrame.Ack("subscribe", rejected.isEmpty(), accepted, rejected));
    if (!rejected.isEmpty()) {
      sendError(channel, new ServerFrame.Error(ErrorCode.FORBIDDEN_CONVERSATION,
          "Not a member of one or more conversations", Map.of("conversation_ids", rejected)));
    }
  }

  private void handleUnsubscribe(Channel channel, ClientCommand.Unsubscribe command) {
    List<String> requested = new ArrayList<>(new LinkedHashSet<>(command.conversationIds()));
    if (requested.isEmpty()) {
      sendError(channel, new ServerFrame.Error(ErrorCode.INVALID_COMMAND, "conversation_ids is required"));
      return;
    }
    registry.unsubscribe(channel.connectionId, requested);
    send(channel, new ServerFrame.Ack("unsubscribe", true, requested, null));
  }

  /**
   * Reports that the peer closed the socket or the transport failed. No close frame is sent.
   */
  public void onClose(String connectionId) {
    Channel channel = channels.get(connectionId);
    if (channel != null) {
      finish(channel, null);
    }
  }

  /**
   * Closes a connection from the server side, for example after its credential was revoked.
   *
   * @return {@code true} if the connection was open and is now closed by this call
   */
  public boolean forceClose(String connectionId, CloseReason reason) {
    Objects.requireNonNull(reason, "reason");
    Channel channel = channels.get(connectionId);
    return channel != null && finish(channel, reason);
  }

  /**
   * Closes every connection authenticated as {@code userId}.
   *
   * @return number of connections closed
   */
  public int closeAllForUser(String userId, CloseReason reason) {
    int count = 0;
    for (Session session : registry.sessionsForUser(userId)) {
      if (forceClose(session.connectionId(), reason)) {
        count++;
      }
    }
    return count;
  }

  /**
   * Returns the state of a connection; unknown ids report {@code CLOSED}.
   */
  public ConnectionState state(String connectionId) {
    Channel channel = channels.get(connectionId);
    return channel == null ? ConnectionState.CLOSED : channel.state.get();
  }

  public int openConnections() {
    return channels.size();
  }

  /**
   * Closes every connection with {@link CloseReason#GOING_AWAY} and stops the timer thread
   * if this engine created it.
   */
  @Override
  public void close() {
    closed = true;
    for (Channel channel : List.copyOf(channels.values())) {
      finish(channel, CloseReason.GOING_AWAY);
    }
    if (ownsTimer) {
      timer.shutdownNow();
      try {
        timer.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private boolean finish(Channel channel, CloseReason reason) {
    ConnectionState previous = channel.state.get();
    while (previous != ConnectionState.CLOSING && previous != ConnectionState.CLOSED) {
      if (channel.state.compareAndSet(previous, ConnectionState.CLOSING)) {
        break;
      }
      previous = channel.state.get();
    }
    if (previous == ConnectionState.CLOSING || previous == ConnectionState.CLOSED) {
      return false;
    }
    cancel(channel.handshakeTask);
    cancel(channel.idleTask);
    if (previous == ConnectionState.OPEN) {
      registry.deregister(channel.connectionId);
      metrics.recordActiveConnections(registry.connectionCount());
    }
    if (reason != null) {
      closeQuietly(channel.handle, reason);
    }
    channel.state.set(ConnectionState.CLOSED);
    channels.remove(channel.connectionId);
    logger.log(Level.INFO, "Connection {0} closed ({1})",
        new Object[] {channel.connectionId, reason == null ? "peer" : reason.description()});
    return true;
  }

  private void rejectHandshake(Channel channel, ErrorCode code, String message) {
    logger.log(Level.INFO, "Handshake rejected for connection {0}: {1}",
        new Object[] {channel.connectionId, code});
    cancel(channel.handshakeTask);
    sendError(channel, new ServerFrame.Error(code, message));
    channel.state.set(ConnectionState.CLOSED);
    channels.remove(channel.connectionId);
    closeQuietly(channel.handle, CloseReason.POLICY_VIOLATION);
  }

  private void onHandshakeTimeout(Channel channel) {
    if (channel.state.compareAndSet(ConnectionState.AUTHENTICATING, ConnectionState.CLOSED)
        || channel.state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.CLOSED)) {
      logger.log(Level.INFO, "Handshake timed out for connection {0}", channel.connectionId);
      channels.remove(channel.connectionId);
      closeQuietly(channel.handle, CloseReason.POLICY_VIOLATION);
    }
  }

  private void onIdleCheck(Channel channel) {
    if (channel.state.get() != ConnectionState.OPEN) {
      return;
    }
    long idleMs = clock.millis() - channel.lastActivityMs;
    if (idleMs >= idleTimeout.toMillis()) {
      logger.log(Level.INFO, "Connection {0} idle for {1} ms", new Object[] {channel.connectionId, idleMs});
      finish(channel, CloseReason.NORMAL);
    } else {
      channel.idleTask = schedule(() -> onIdleCheck(channel), Duration.ofMillis(idleTimeout.toMillis() - idleMs));
    }
  }

  private void touch(Channel channel) {
    channel.lastActivityMs = clock.millis();
    if (channel.session != null) {
      channel.session.touch(clock.instant());
    }
    ScheduledFuture<?> previous = channel.idleTask;
    channel.idleTask = schedule(() -> onIdleCheck(channel), idleTimeout);
    cancel(previous);
  }

  private void sendError(Channel channel, ServerFrame.Error error) {
    metrics.incrementProtocolRejected(error.code().name());
    send(channel, error);
  }

  private void send(Channel channel, ServerFrame frame) {
    try {
      channel.handle.send(codec.encode(frame));
    } catch (IOException e) {
      logger.log(Level.FINE, "Write failed on connection " + channel.connectionId, e);
      finish(channel, CloseReason.SERVER_ERROR);
    }
  }

  private ScheduledFuture<?> schedule(Runnable task, Duration delay) {
    try {
      return timer.schedule(() -> {
        try {
          task.run();
        } catch (RuntimeException e) {
          logger.log(Level.SEVERE, "Connection timer task failed", e);
        }
      }, delay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Timer rejected task, engine is shutting down");
      return null;
    }
  }

  private static void cancel(ScheduledFuture<?> task) {
    if (task != null) {
      task.cancel(false);
    }
  }

  private static void closeQuietly(ConnectionHandle handle, CloseReason reason) {
    try {
      handle.close(reason);
    } catch (RuntimeException e) {
      logger.log(Level.FINE, "Close failed", e);
    }
  }

  private final class Channel {
    private final String connectionId;
    private final ConnectionHandle handle;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private final CommandRateLimiter rateLimiter;
    private volatile Session session;
    private volatile long lastActivityMs;
    private volatile ScheduledFuture<?> handshakeTask;
    private volatile ScheduledFuture<?> idleTask;

    private Channel(String connectionId, ConnectionHandle handle) {
      this.connectionId = connectionId;
      this.handle = handle;
      this.rateLimiter = new CommandRateLimiter(rateLimitMaxCommands, rateLimitWindow, clock);
      this.lastActivityMs = clock.millis();
    }
  }

  /**
   * Builder for {@link ProtocolEngine}.
   */
  public static final class Builder {
    private ConnectionRegistry registry;
    private CredentialVerifier credentialVerifier;
    private MembershipChecker membershipChecker;
    private FrameCodec codec;
    private MetricsExporter metrics;
    private Clock clock;
    private ScheduledExecutorService timer;
    private int maxFrameBytes = 4096;
    private int maxIdsPerSubscribe = 100;
    private int rateLimitMaxCommands = 30;
    private Duration rateLimitWindow = Duration.ofSeconds(10);
    private Duration idleTimeout = Duration.ofSeconds(60);
    private Duration heartbeatInterval = Duration.ofSeconds(25);
    private Duration handshakeTimeout = Duration.ofSeconds(10);

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder registry(ConnectionRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the verifier that maps handshake credentials to user ids.
     *
     * <p><b>Required.</b>
     */
    public Builder credentialVerifier(CredentialVerifier credentialVerifier) {
      this.credentialVerifier = credentialVerifier;
      return this;
    }

    /**
     * Sets the membership check consulted for every subscribe.
     *
     * <p><b>Required.</b>
     */
    public Builder membershipChecker(MembershipChecker membershipChecker) {
      this.membershipChecker = membershipChecker;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link JacksonFrameCodec}.
     */
    public Builder codec(FrameCodec codec) {
      this.codec = codec;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the executor for idle and handshake timers. An executor passed here is not shut
     * down by {@link ProtocolEngine#close()}.
     *
     * <p>Optional. Defaults to a private single-thread scheduler.
     */
    public Builder timer(ScheduledExecutorService timer) {
      this.timer = timer;
      return this;
    }

    /**
     * Sets the maximum UTF-8 size of an inbound frame.
     *
     * <p>Optional. Defaults to {@code 4096}.
     */
    public Builder maxFrameBytes(int maxFrameBytes) {
      this.maxFrameBytes = maxFrameBytes;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 100}.
     */
    public Builder maxIdsPerSubscribe(int maxIdsPerSubscribe) {
      this.maxIdsPerSubscribe = maxIdsPerSubscribe;
      return this;
    }

    /**
     * Sets the fixed-window command limit per connection.
     *
     * <p>Optional. Defaults to 30 commands per 10 seconds.
     */
    public Builder rateLimit(int maxCommands, Duration window) {
      this.rateLimitMaxCommands = maxCommands;
      this.rateLimitWindow = window;
      return this;
    }

    /**
     * Sets how long a connection may stay silent before the server closes it.
     *
     * <p>Optional. Defaults to 60 seconds.
     */
    public Builder idleTimeout(Duration idleTimeout) {
      this.idleTimeout = idleTimeout;
      return this;
    }

    /**
     * Sets the ping interval advertised to clients in the welcome frame.
     *
     * <p>Optional. Defaults to 25 seconds.
     */
    public Builder heartbeatInterval(Duration heartbeatInterval) {
      this.heartbeatInterval = heartbeatInterval;
      return this;
    }

    /**
     * <p>Optional. Defaults to 10 seconds.
     */
    public Builder handshakeTimeout(Duration handshakeTimeout) {
      this.handshakeTimeout = handshakeTimeout;
      return this;
    }

    /**
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if a limit or duration is not positive
     */
    public ProtocolEngine build() {
      return new ProtocolEngine(this);
    }
  }
}
