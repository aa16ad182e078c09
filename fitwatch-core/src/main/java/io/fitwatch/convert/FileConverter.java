package io.fitwatch.convert;

import io.fitwatch.ConversionResult;

import java.nio.file.Path;

/**
 * Converts one input file into one output file.
 *
 * <p>Implementations report failures through {@link ConversionResult.Failed} rather than
 * by throwing.
 *
 * @see FitCsvConverter
 */
@FunctionalInterface
public interface FileConverter {

    /**
     * @param input     the FIT file
     * @param output    the CSV file to create or truncate
     * @param transform whether to apply readability transforms
     * @return the outcome of this single attempt
     */
    ConversionResult convert(Path input, Path output, boolean transform);
}
