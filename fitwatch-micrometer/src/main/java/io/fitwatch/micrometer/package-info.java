/**
 * Micrometer bridge for the watcher's counters, gauges and conversion timer.
 *
 * @see io.fitwatch.micrometer.MicrometerMetricsExporter
 */
package io.fitwatch.micrometer;
