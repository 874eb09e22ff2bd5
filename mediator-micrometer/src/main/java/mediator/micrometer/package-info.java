/**
 * Micrometer bridge for exporting dispatch metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link mediator.micrometer.MicrometerMetricsExporter} implements the
 * {@link mediator.spi.MetricsExporter} SPI using Micrometer counters and a distribution summary.
 *
 * @see mediator.micrometer.MicrometerMetricsExporter
 */
package mediator.micrometer;
