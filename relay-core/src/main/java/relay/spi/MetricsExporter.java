package relay.spi;

/**
 * Observability hook for exporting relay counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of outbox events delivered and marked published.
     */
    void incrementDispatchSuccess();

    /**
     * Increments the count of outbox events that failed and were rescheduled.
     */
    void incrementDispatchFailure();

    /**
     * Records the lag (in milliseconds) of the oldest pending event seen in a poll.
     *
     * @param lagMs lag in milliseconds (always non-negative)
     */
    void recordOldestLagMs(long lagMs);

    /**
     * Adds the number of sockets an event frame was written to.
     */
    default void incrementFanoutDelivered(int count) {
    }

    /**
     * Adds the number of sessions dropped because a write to them failed.
     */
    default void incrementFanoutDropped(int count) {
    }

    /**
     * Increments the count of error frames sent, tagged by error code.
     *
     * @param code wire name of the error code
     */
    default void incrementProtocolRejected(String code) {
    }

    /**
     * Records the number of registered connections.
     */
    default void recordActiveConnections(int count) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDispatchSuccess() {
        }

        @Override
        public void incrementDispatchFailure() {
        }

        @Override
        public void recordOldestLagMs(long lagMs) {
        }
    }
}
