/**
 * Micrometer binding for relay metrics.
 *
 * @see relay.micrometer.MicrometerMetricsExporter
 */
package relay.micrometer;
