/**
 * FIT inbox watcher: converts activity files dropped into a directory into CSV files.
 *
 * <p>Start with {@link io.fitwatch.FitWatcher#builder()}. Conversion outcomes are reported as
 * {@link io.fitwatch.ConversionResult} per attempt and {@link io.fitwatch.ConversionReport}
 * per file.
 */
package io.fitwatch;
