/**
 * Service provider interfaces for the pluggable edges of the pipeline.
 *
 * <ul>
 *   <li>{@link io.fitwatch.spi.FitDecoderFactory} / {@link io.fitwatch.spi.FitDecoder}: FIT decoding</li>
 *   <li>{@link io.fitwatch.spi.MetricsExporter}: counters and gauges</li>
 *   <li>{@link io.fitwatch.spi.ConversionListener}: success, retry and abandon callbacks</li>
 * </ul>
 */
package io.fitwatch.spi;
