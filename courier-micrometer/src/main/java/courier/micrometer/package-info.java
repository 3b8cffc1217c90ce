/**
 * Micrometer bridge for exporting delivery-queue metrics to Prometheus, Grafana, and other
 * backends.
 *
 * <p>{@link courier.micrometer.MicrometerMetricsExporter} implements the
 * {@link courier.spi.MetricsExporter} SPI using Micrometer counters, gauges and a timer.
 *
 * @see courier.micrometer.MicrometerMetricsExporter
 */
package courier.micrometer;
