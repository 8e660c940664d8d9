/**
 * Micrometer bridge for exporting syndication metrics to Prometheus, Grafana, and other backends.
 *
 * @see syndicator.micrometer.MicrometerMetricsExporter
 */
package syndicator.micrometer;
