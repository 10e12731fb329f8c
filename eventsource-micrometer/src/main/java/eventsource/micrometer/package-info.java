/**
 * Micrometer bridge for exporting event sourcing metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link eventsource.micrometer.MicrometerMetricsExporter} implements the
 * {@link eventsource.spi.MetricsExporter} SPI using Micrometer counters, timers and gauges.
 *
 * @see eventsource.micrometer.MicrometerMetricsExporter
 */
package eventsource.micrometer;
