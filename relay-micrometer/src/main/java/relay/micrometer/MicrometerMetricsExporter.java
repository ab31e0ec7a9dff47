package relay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import relay.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code relay.dispatch.success} - outbox events delivered and marked published</li>
 *   <li>{@code relay.dispatch.failure} - outbox events rescheduled after a failed delivery</li>
 *   <li>{@code relay.fanout.delivered} - event frames written to sockets</li>
 *   <li>{@code relay.fanout.dropped} - sessions dropped after a failed write</li>
 *   <li>{@code relay.protocol.rejected} - error frames sent, tagged with {@code code}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code relay.connections.active} - registered connections</li>
 *   <li>{@code relay.lag.oldest.ms} - age of the oldest due event at the last poll</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter dispatchSuccess;
  private final Counter dispatchFailure;
  private final Counter fanoutDelivered;
  private final Counter fanoutDropped;
  private final Gauge connectionsGauge;
  private final Gauge lagGauge;
  private final Map<String, Counter> rejectedByCode = new ConcurrentHashMap<>();

  private final AtomicInteger activeConnections = new AtomicInteger();
  private final AtomicLong oldestLagMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "relay"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "relay");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "chat.relay"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.dispatchSuccess = Counter.builder(namePrefix + ".dispatch.success")
        .description("Outbox events delivered and marked published")
        .register(registry);
    this.dispatchFailure = Counter.builder(namePrefix + ".dispatch.failure")
        .description("Outbox events rescheduled after a failed delivery")
        .register(registry);
    this.fanoutDelivered = Counter.builder(namePrefix + ".fanout.delivered")
        .description("Event frames written to sockets")
        .register(registry);
    this.fanoutDropped = Counter.builder(namePrefix + ".fanout.dropped")
        .description("Sessions dropped after a failed write")
        .register(registry);

    this.connectionsGauge = Gauge.builder(namePrefix + ".connections.active", activeConnections, AtomicInteger::get)
        .register(registry);
    this.lagGauge = Gauge.builder(namePrefix + ".lag.oldest.ms", oldestLagMs, AtomicLong::get)
        .register(registry);
  }

  @Override
  public void incrementDispatchSuccess() {
    if (closed) return;
    dispatchSuccess.increment();
  }

  @Override
  public void incrementDispatchFailure() {
    if (closed) return;
    dispatchFailure.increment();
  }

  @Override
  public void recordOldestLagMs(long lagMs) {
    if (closed) return;
    this.oldestLagMs.set(lagMs);
  }

  @Override
  public void incrementFanoutDelivered(int count) {
    if (closed || count <= 0) return;
    fanoutDelivered.increment(count);
  }

  @Override
  public void incrementFanoutDropped(int count) {
    if (closed || count <= 0) return;
    fanoutDropped.increment(count);
  }

  @Override
  public void incrementProtocolRejected(String code) {
    if (closed) return;
    rejectedByCode.computeIfAbsent(code, c -> Counter.builder(namePrefix + ".protocol.rejected")
        .description("Error frames sent to clients")
        .tag("code", c)
        .register(registry))
        .increment();
  }

  @Override
  public void recordActiveConnections(int count) {
    if (closed) return;
    activeConnections.set(count);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link relay.Relay#close()} so a stopped relay leaves no stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(dispatchSuccess, dispatchFailure,
        fanoutDelivered, fanoutDropped, connectionsGauge, lagGauge));
    meters.addAll(rejectedByCode.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
