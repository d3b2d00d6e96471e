/**
 * Micrometer bridge for exporting event store metrics to Prometheus, Grafana, and other backends.
 *
 * @see eventstore.micrometer.MicrometerMetricsExporter
 */
package eventstore.micrometer;
