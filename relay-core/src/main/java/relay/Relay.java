package relay;

import relay.dispatch.OutboxDispatcher;
import relay.dispatch.RetryPolicy;
import relay.protocol.FrameCodec;
import relay.protocol.JacksonFrameCodec;
import relay.protocol.ProtocolEngine;
import relay.publish.FanoutPublisher;
import relay.registry.CloseReason;
import relay.registry.ConnectionRegistry;
import relay.sequence.MessageSequencer;
import relay.spi.ConnectionProvider;
import relay.spi.CredentialVerifier;
import relay.spi.MembershipChecker;
import relay.spi.MessageStore;
import relay.spi.MetricsExporter;
import relay.spi.OutboxStore;
import relay.spi.TxContext;
import relay.util.JsonCodec;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Composite entry point that wires the write path, the outbox dispatcher, the connection
 * registry, the protocol engine and the fanout publisher into a single
 * {@link AutoCloseable} unit with process lifetime.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Relay relay = Relay.builder()
 *     .connectionProvider(connProvider)
 *     .txContext(txContext)
 *     .outboxStore(outboxStore)
 *     .messageStore(messageStore)
 *     .credentialVerifier(verifier)
 *     .membershipChecker(membership)
 *     .build()) {
 *
 *   try (var tx = txManager.begin()) {
 *     relay.sender().send(new SendMessageRequest("c1", "alice", "m1", "hi"));
 *     tx.commit();
 *   }
 * }
 * }</pre>
 *
 * <p>The transport hands sockets to {@link #engine()}; everything else runs inside.
 */
public final class Relay implements AutoCloseable {
  private final ConnectionRegistry registry;
  private final ProtocolEngine engine;
  private final FanoutPublisher publisher;
  private final OutboxDispatcher dispatcher;
  private final OutboxWriter writer;
  private final MessageSender sender;
  private final MetricsExporter metrics;

  private Relay(ConnectionRegistry registry, ProtocolEngine engine, FanoutPublisher publisher,
      OutboxDispatcher dispatcher, OutboxWriter writer, MessageSender sender, MetricsExporter metrics) {
    this.registry = registry;
    this.engine = engine;
    this.publisher = publisher;
    this.dispatcher = dispatcher;
    this.writer = writer;
    this.sender = sender;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ConnectionRegistry registry() {
    return registry;
  }

  public ProtocolEngine engine() {
    return engine;
  }

  public FanoutPublisher publisher() {
    return publisher;
  }

  public OutboxDispatcher dispatcher() {
    return dispatcher;
  }

  public OutboxWriter writer() {
    return writer;
  }

  public MessageSender sender() {
    return sender;
  }

  /**
   * Shuts down in order: protocol engine (closing every connection), then dispatcher, then
   * the metrics exporter if it is closeable.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      engine.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      dispatcher.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link Relay}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private TxContext txContext;
    private OutboxStore outboxStore;
    private MessageStore messageStore;
    private CredentialVerifier credentialVerifier;
    private MembershipChecker membershipChecker;
    private MetricsExporter metrics;
    private JsonCodec jsonCodec;
    private FrameCodec frameCodec;
    private RetryPolicy retryPolicy;
    private Clock clock;
    private int batchSize = 100;
    private long intervalMs = 1000;
    private int maxSubscriptionsPerConnection = ConnectionRegistry.DEFAULT_MAX_SUBSCRIPTIONS;
    private int maxContentLength = MessageSender.DEFAULT_MAX_CONTENT_LENGTH;
    private int maxFrameBytes = 4096;
    private int maxIdsPerSubscribe = 100;
    private int rateLimitMaxCommands = 30;
    private Duration rateLimitWindow = Duration.ofSeconds(10);
    private Duration idleTimeout = Duration.ofSeconds(60);
    private Duration heartbeatInterval = Duration.ofSeconds(25);
    private Duration handshakeTimeout = Duration.ofSeconds(10);
    private boolean autoStart = true;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /**
     * Sets the connection provider used by the dispatcher.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the transaction context the write path joins.
     *
     * <p><b>Required.</b>
     */
    public Builder txContext(TxContext txContext) {
      this.txContext = txContext;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder outboxStore(OutboxStore outboxStore) {
      this.outboxStore = outboxStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder messageStore(MessageStore messageStore) {
      this.messageStore = messageStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder credentialVerifier(CredentialVerifier credentialVerifier) {
      this.credentialVerifier = credentialVerifier;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder membershipChecker(MembershipChecker membershipChecker) {
      this.membershipChecker = membershipChecker;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}. Closed with the relay when it
     * implements {@link AutoCloseable}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
     */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link JacksonFrameCodec}.
     */
    public Builder frameCodec(FrameCodec frameCodec) {
      this.frameCodec = frameCodec;
      return this;
    }

    /**
     * <p>Optional. Defaults to exponential backoff, 500 ms base, 30 s cap.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
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
     * Sets the maximum number of outbox rows per dispatcher cycle.
     *
     * <p>Optional. Defaults to {@code 100}.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the dispatcher's idle poll interval.
     *
     * <p>Optional. Defaults to {@code 1000} ms.
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 200}.
     */
    public Builder maxSubscriptionsPerConnection(int maxSubscriptionsPerConnection) {
      this.maxSubscriptionsPerConnection = maxSubscriptionsPerConnection;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 2000} characters.
     */
    public Builder maxContentLength(int maxContentLength) {
      this.maxContentLength = maxContentLength;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 4096} bytes.
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
     * <p>Optional. Defaults to 30 commands per 10 seconds.
     */
    public Builder rateLimit(int maxCommands, Duration window) {
      this.rateLimitMaxCommands = maxCommands;
      this.rateLimitWindow = window;
      return this;
    }

    /**
     * <p>Optional. Defaults to 60 seconds.
     */
    public Builder idleTimeout(Duration idleTimeout) {
      this.idleTimeout = idleTimeout;
      return this;
    }

    /**
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
     * Whether {@link #build()} starts the dispatcher loop.
     *
     * <p>Optional. Defaults to {@code true}. Tests drive
     * {@link OutboxDispatcher#dispatchOnce()} directly with {@code false}.
     */
    public Builder autoStart(boolean autoStart) {
      this.autoStart = autoStart;
      return this;
    }

    /**
     * Builds the relay and, unless disabled, starts the dispatcher.
     *
     * @throws NullPointerException     if a required component is missing
     * @throws IllegalStateException    if called twice
     */
    public Relay build() {
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(txContext, "txContext");
      Objects.requireNonNull(outboxStore, "outboxStore");
      Objects.requireNonNull(messageStore, "messageStore");
      Objects.requireNonNull(credentialVerifier, "credentialVerifier");
      Objects.requireNonNull(membershipChecker, "membershipChecker");
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      MetricsExporter effectiveMetrics = metrics != null ? metrics : MetricsExporter.NOOP;
      JsonCodec effectiveJson = jsonCodec != null ? jsonCodec : JsonCodec.getDefault();
      FrameCodec effectiveFrames = frameCodec != null ? frameCodec : new JacksonFrameCodec();
      Clock effectiveClock = clock != null ? clock : Clock.systemUTC();

      ConnectionRegistry registry = new ConnectionRegistry(maxSubscriptionsPerConnection, effectiveClock);
      ProtocolEngine engine = ProtocolEngine.builder()
          .registry(registry)
          .credentialVerifier(credentialVerifier)
          .membershipChecker(membershipChecker)
          .codec(effectiveFrames)
          .metrics(effectiveMetrics)
          .clock(effectiveClock)
          .maxFrameBytes(maxFrameBytes)
          .maxIdsPerSubscribe(maxIdsPerSubscribe)
          .rateLimit(rateLimitMaxCommands, rateLimitWindow)
          .idleTimeout(idleTimeout)
          .heartbeatInterval(heartbeatInterval)
          .handshakeTimeout(handshakeTimeout)
          .build();

      FanoutPublisher publisher = new FanoutPublisher(registry, effectiveFrames, effectiveJson,
          (session, failure) -> {
            if (!engine.forceClose(session.connectionId(), CloseReason.TRY_AGAIN_LATER)) {
              registry.deregister(session.connectionId());
            }
          },
          effectiveMetrics);

      OutboxDispatcher dispatcher;
      try {
        dispatcher = OutboxDispatcher.builder()
            .connectionProvider(connectionProvider)
            .outboxStore(outboxStore)
            .publisher(publisher)
            .retryPolicy(retryPolicy)
            .batchSize(batchSize)
            .intervalMs(intervalMs)
            .metrics(effectiveMetrics)
            .clock(effectiveClock)
            .build();
      } catch (RuntimeException e) {
        engine.close();
        throw e;
      }

      OutboxWriter writer = new OutboxWriter(txContext, outboxStore, dispatcher::wakeUp, effectiveJson,
          effectiveClock);
      MessageSender sender = new MessageSender(txContext, new MessageSequencer(messageStore, effectiveClock),
          writer, maxContentLength);

      if (autoStart) {
        try {
          dispatcher.start();
        } catch (RuntimeException e) {
          dispatcher.close();
          engine.close();
          throw e;
        }
      }
      return new Relay(registry, engine, publisher, dispatcher, writer, sender, effectiveMetrics);
    }
  }
}
