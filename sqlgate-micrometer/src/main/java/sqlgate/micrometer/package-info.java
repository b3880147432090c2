/**
 * Micrometer bridge for exporting sqlgate metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link sqlgate.micrometer.MicrometerMetricsExporter} implements the
 * {@link sqlgate.spi.MetricsExporter} SPI using Micrometer counters, a gauge and a timer.
 *
 * @see sqlgate.micrometer.MicrometerMetricsExporter
 */
package sqlgate.micrometer;
