package relay.dispatch;

import relay.model.OutboxEvent;
import relay.publish.DeliveryException;
import relay.publish.DeliveryOutcome;
import relay.publish.Publisher;
import relay.spi.ConnectionProvider;
import relay.spi.MetricsExporter;
import relay.spi.OutboxStore;
import relay.util.NamedThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-threaded loop that drains the outbox table into the {@link Publisher}.
 *
 * <p>Each cycle selects up to {@code batchSize} unpublished rows that are due, oldest
 * first, and delivers them one by one in that order. A delivered row is marked published;
 * a row whose delivery threw {@link DeliveryException} gets {@code attempts+1} and a
 * {@code next_attempt_at} from the {@link RetryPolicy}. Rows are never dropped.
 *
 * <p>After a full batch the next cycle runs immediately; otherwise the loop waits for
 * {@code intervalMs} or until {@link #wakeUp()} is called after a commit.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe; {@link #start()}
 * and {@link #close()} are synchronized.
 */
public final class OutboxDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(OutboxDispatcher.class.getName());

  private final ConnectionProvider connectionProvider;
  private final OutboxStore outboxStore;
  private final Publisher publisher;
  private final RetryPolicy retryPolicy;
  private final int batchSize;
  private final long intervalMs;
  private final MetricsExporter metrics;
  private final Clock clock;

  private final AtomicBoolean wakePending = new AtomicBoolean(false);
  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> pollTask;
  private volatile boolean closed;

  private OutboxDispatcher(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.outboxStore = Objects.requireNonNull(builder.outboxStore, "outboxStore");
    this.publisher = Objects.requireNonNull(builder.publisher, "publisher");
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    this.batchSize = builder.batchSize;
    this.intervalMs = builder.intervalMs;
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new ExponentialBackoffRetryPolicy();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled dispatch loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("OutboxDispatcher has been closed");
    }
    if (pollTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("relay-dispatcher-"));
    pollTask = scheduler.scheduleWithFixedDelay(this::drain, 0L, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Requests an immediate cycle. Carries no event data: the table is the only source of
   * work. Multiple calls before the cycle runs collapse into one. No-op before
   * {@link #start()} or after {@link #close()}.
   */
  public void wakeUp() {
    ScheduledExecutorService current = scheduler;
    if (closed || current == null || !wakePending.compareAndSet(false, true)) {
      return;
    }
    try {
      current.execute(() -> {
        wakePending.set(false);
        drain();
      });
    } catch (RejectedExecutionException e) {
      wakePending.set(false);
      logger.log(Level.FINE, "Wake-up rejected, dispatcher is shutting down");
    }
  }

  private void drain() {
    try {
      int processed;
      do {
        processed = dispatchOnce();
      } while (processed >= batchSize && !closed);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Dispatch cycle failed", t);
    }
  }

  /**
   * Executes a single cycle. Called by the scheduler, but may also be invoked directly for
   * testing. Must not run concurrently with itself.
   *
   * @return number of rows whose outcome was recorded in the table; rows whose status update
   *     failed are not counted, so a refused update never triggers an immediate re-run
   */
  public int dispatchOnce() {
    if (closed) {
      return 0;
    }
    Instant now = clock.instant();
    List<OutboxEvent> rows = fetchPending(now);
    if (rows == null) {
      return 0; // fetch failed, keep the previous lag value
    }
    if (rows.isEmpty()) {
      metrics.recordOldestLagMs(0L);
      return 0;
    }
    // Rows are sorted oldest-first by the store
    long lagMs = Duration.between(rows.get(0).createdAt(), now).toMillis();
    metrics.recordOldestLagMs(Math.max(0L, lagMs));

    int processed = 0;
    for (OutboxEvent row : rows) {
      if (closed) {
        break;
      }
      if (dispatchRow(row)) {
        processed++;
      }
    }
    return processed;
  }

  private List<OutboxEvent> fetchPending(Instant now) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return outboxStore.pollPending(conn, now, batchSize);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to fetch pending outbox rows", e);
      return null;
    }
  }

  private boolean dispatchRow(OutboxEvent row) {
    DeliveryOutcome outcome;
    try {
      outcome = publisher.deliver(row);
    } catch (DeliveryException | RuntimeException e) {
      return handleFailure(row, e);
    }
    if (!withConnection("mark published", row.eventId(),
        conn -> outboxStore.markPublished(conn, row.eventId(), clock.instant()))) {
      return false;
    }
    metrics.incrementDispatchSuccess();
    if (logger.isLoggable(Level.FINE)) {
      logger.log(Level.FINE, "Published eventId={0} to {1}/{2} sessions",
          new Object[] {row.eventId(), outcome.delivered(), outcome.recipients()});
    }
    return true;
  }

  private boolean handleFailure(OutboxEvent row, Exception failure) {
    int attempts = row.attempts() + 1;
    long delayMs = retryPolicy.computeDelayMs(attempts);
    Instant nextAt = clock.instant().plusMillis(delayMs);
    logger.log(Level.WARNING, "Delivery failed for eventId=" + row.eventId()
        + " (attempt " + attempts + "), retrying in " + delayMs + " ms", failure);
    metrics.incrementDispatchFailure();
    return withConnection("mark retry", row.eventId(),
        conn -> outboxStore.markRetry(conn, row.eventId(), nextAt, describe(failure)));
  }

  private static String describe(Exception failure) {
    String message = failure.getMessage();
    return message == null ? failure.getClass().getName() : message;
  }

  /**
   * Runs one status update on its own auto-commit connection.
   *
   * @return {@code false} if the update failed; the row stays due and is picked up again
   *     after the poll interval
   */
  private boolean withConnection(String action, String eventId, SqlAction op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      op.execute(conn);
      return true;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to " + action + " for eventId=" + eventId, e);
      return false;
    }
  }

  @FunctionalInterface
  private interface SqlAction {
    void execute(Connection conn) throws SQLException;
  }

  /**
   * Stops the loop. A cycle in progress finishes its current row.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (pollTask != null) {
      pollTask.cancel(false);
      pollTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdown();
      try {
        if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
          logger.log(Level.WARNING, "Dispatcher did not stop within 5s; interrupting");
          scheduler.shutdownNow();
        }
      } catch (InterruptedException e) {
        scheduler.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Builder for {@link OutboxDispatcher}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private OutboxStore outboxStore;
    private Publisher publisher;
    private RetryPolicy retryPolicy;
    private int batchSize = 100;
    private long intervalMs = 1000;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {
    }

    /**
     * Sets the connection provider for polling and status updates.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the outbox store.
     *
     * <p><b>Required.</b>
     *
     * @param outboxStore the persistence backend
     * @return this builder
     */
    public Builder outboxStore(OutboxStore outboxStore) {
      this.outboxStore = outboxStore;
      return this;
    }

    /**
     * Sets the publisher that pushes each event to its subscribers.
     *
     * <p><b>Required.</b>
     *
     * @param publisher the publisher
     * @return this builder
     */
    public Builder publisher(Publisher publisher) {
      this.publisher = publisher;
      return this;
    }

    /**
     * Sets the retry policy for failed deliveries.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with 500 ms base and
     * 30 s cap.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the maximum number of rows selected per cycle.
     *
     * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
     *
     * @param batchSize max rows per cycle
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the idle wait between cycles in milliseconds.
     *
     * <p>Optional. Defaults to {@code 1000} ms. Must be &gt; 0.
     *
     * @param intervalMs polling interval in milliseconds
     * @return this builder
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the clock used for due-time checks and status timestamps.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the dispatcher. Call {@link OutboxDispatcher#start()} to begin the loop.
     *
     * @return a new {@link OutboxDispatcher} instance
     * @throws NullPointerException     if {@code connectionProvider}, {@code outboxStore},
     *                                  or {@code publisher} is null
     * @throws IllegalArgumentException if {@code batchSize <= 0} or {@code intervalMs <= 0}
     */
    public OutboxDispatcher build() {
      return new OutboxDispatcher(this);
    }
  }
}
