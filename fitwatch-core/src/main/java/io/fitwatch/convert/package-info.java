/**
 * FIT-to-CSV conversion.
 *
 * <p>{@link io.fitwatch.convert.FitCsvConverter} drives two decode passes per file, building a
 * deterministic {@link io.fitwatch.convert.CsvHeader} from the first and streaming rows through
 * {@link io.fitwatch.convert.CsvWriter} in the second.
 *
 * @see io.fitwatch.convert.FileConverter
 */
package io.fitwatch.convert;
