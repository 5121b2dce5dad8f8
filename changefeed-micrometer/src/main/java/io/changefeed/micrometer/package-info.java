/**
 * Micrometer bridge for exporting changefeed metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.changefeed.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.changefeed.spi.MetricsExporter} SPI using Micrometer counters, gauges and
 * distribution summaries.
 *
 * @see io.changefeed.micrometer.MicrometerMetricsExporter
 */
package io.changefeed.micrometer;
