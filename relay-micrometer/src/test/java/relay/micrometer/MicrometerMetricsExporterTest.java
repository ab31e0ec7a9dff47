package relay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void dispatchCounters() {
    exporter.incrementDispatchSuccess();
    exporter.incrementDispatchSuccess();
    exporter.incrementDispatchFailure();

    assertEquals(2.0, counter("relay.dispatch.success").count());
    assertEquals(1.0, counter("relay.dispatch.failure").count());
  }

  @Test
  void fanoutCountersAddBatchSizes() {
    exporter.incrementFanoutDelivered(3);
    exporter.incrementFanoutDelivered(0);
    exporter.incrementFanoutDropped(1);

    assertEquals(3.0, counter("relay.fanout.delivered").count());
    assertEquals(1.0, counter("relay.fanout.dropped").count());
  }

  @Test
  void protocolRejectionsAreTaggedByCode() {
    exporter.incrementProtocolRejected("RATE_LIMITED");
    exporter.incrementProtocolRejected("RATE_LIMITED");
    exporter.incrementProtocolRejected("INVALID_COMMAND");

    assertEquals(2.0, registry.find("relay.protocol.rejected").tag("code", "RATE_LIMITED").counter().count());
    assertEquals(1.0, registry.find("relay.protocol.rejected").tag("code", "INVALID_COMMAND").counter().count());
  }

  @Test
  void gaugesTrackLatestValue() {
    exporter.recordActiveConnections(12);
    exporter.recordOldestLagMs(12345L);
    assertEquals(12.0, gauge("relay.connections.active").value());
    assertEquals(12345.0, gauge("relay.lag.oldest.ms").value());

    exporter.recordActiveConnections(0);
    exporter.recordOldestLagMs(0L);
    assertEquals(0.0, gauge("relay.connections.active").value());
    assertEquals(0.0, gauge("relay.lag.oldest.ms").value());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "chat.relay");
    custom.incrementDispatchSuccess();
    custom.recordOldestLagMs(500L);

    assertEquals(1.0, counter("chat.relay.dispatch.success").count());
    assertEquals(500.0, gauge("chat.relay.lag.oldest.ms").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementProtocolRejected("UNAUTHORIZED");

    exporter.close();
    exporter.incrementDispatchSuccess();

    assertNull(registry.find("relay.dispatch.success").counter());
    assertNull(registry.find("relay.lag.oldest.ms").gauge());
    assertNull(registry.find("relay.protocol.rejected").counter());
  }

  @Test
  void invalidArgumentsThrow() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "relay."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
