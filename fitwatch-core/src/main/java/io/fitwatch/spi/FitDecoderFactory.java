package io.fitwatch.spi;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens FIT activity files for decoding.
 *
 * <p>The converter calls {@link #open(Path)} once per conversion attempt and reads the
 * resulting {@link FitDecoder} twice: once to discover the column set and once to write rows.
 *
 * @see io.fitwatch.fit.BinaryFitDecoderFactory
 */
@FunctionalInterface
public interface FitDecoderFactory {

    /**
     * Opens the given file for decoding.
     *
     * @param path the FIT file to read
     * @return a decoder over the file's messages
     * @throws IOException        if the file cannot be read
     * @throws FitDecodeException if the file is not a decodable FIT file
     */
    FitDecoder open(Path path) throws IOException, FitDecodeException;
}
