/**
 * Micrometer bridge for exporting relay metrics to Prometheus, Grafana, and other backends.
 *
 * @see io.relay.micrometer.MicrometerMetricsExporter
 */
package io.relay.micrometer;
