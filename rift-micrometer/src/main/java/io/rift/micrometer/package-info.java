/**
 * Micrometer bridge for rift metrics.
 *
 * @see io.rift.micrometer.MicrometerMetricsExporter
 */
package io.rift.micrometer;
