package io.fitwatch.convert;

import io.fitwatch.ConversionException;
import io.fitwatch.ConversionResult;
import io.fitwatch.FailureKind;
import io.fitwatch.fit.BinaryFitDecoderFactory;
import io.fitwatch.spi.FitDecodeException;
import io.fitwatch.spi.FitDecoder;
import io.fitwatch.spi.FitDecoderFactory;
import io.fitwatch.transform.UnitTransforms;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts the {@code record} messages of a FIT file into a CSV file.
 *
 * <p>The file is decoded twice: the first pass collects the union of keys (record schemas
 * vary from row to row) to build the {@link CsvHeader}, the second pass writes one row per
 * record. With {@code transform} enabled, cadence, speed and position columns are renamed
 * and their values converted through {@link UnitTransforms}.
 *
 * <p>Failure classification: a missing input, undecodable data, a file without records and
 * any I/O error are {@link FailureKind#PERMANENT}; unexpected runtime exceptions are
 * {@link FailureKind#TRANSIENT}. A partially written CSV is deleted on failure.
 *
 * <p>Stateless and thread-safe.
 */
public final class FitCsvConverter implements FileConverter {
    private static final Logger logger = Logger.getLogger(FitCsvConverter.class.getName());

    private final FitDecoderFactory decoderFactory;

    public FitCsvConverter() {
        this(new BinaryFitDecoderFactory());
    }

    public FitCsvConverter(FitDecoderFactory decoderFactory) {
        this.decoderFactory = Objects.requireNonNull(decoderFactory, "decoderFactory");
    }

    @Override
    public ConversionResult convert(Path input, Path output, boolean transform) {
        long startNanos = System.nanoTime();
        try {
            int rows = writeCsv(input, output, transform);
            return ConversionResult.converted(rows, Duration.ofNanos(System.nanoTime() - startNanos));
        } catch (ConversionException e) {
            return new ConversionResult.Failed(e.kind(), e.humanMessage(), e);
        } catch (RuntimeException e) {
            return ConversionResult.transientFailure("could not convert file", e);
        }
    }

    /**
     * Writes the CSV for {@code input} to {@code output}.
     *
     * @return number of data rows written
     * @throws ConversionException if the file cannot be converted
     */
    public int writeCsv(Path input, Path output, boolean transform) throws ConversionException {
        if (!Files.isRegularFile(input)) {
            throw new ConversionException(FailureKind.PERMANENT, "input file not found",
                    "Input file not found: " + input);
        }
        FitDecoder decoder = open(input);

        Set<String> keys = collectKeys(decoder);
        if (keys.isEmpty()) {
            throw new ConversionException(FailureKind.PERMANENT, "no record data in file",
                    "No 'record' messages in FIT file: " + input);
        }
        CsvHeader raw = CsvHeader.fromKeys(keys);
        CsvHeader header = transform ? raw.transformed() : raw;
        logger.fine(() -> "Header for " + input.getFileName() + ": " + header);

        createParentDirectories(output);
        boolean complete = false;
        try (CsvWriter writer = CsvWriter.open(output, header)) {
            Iterator<Map<String, Object>> records = decoder.records(FitDecoder.RECORD);
            while (records.hasNext()) {
                Map<String, Object> values = records.next();
                writer.writeRow(transform ? transformRow(values, header) : values);
            }
            complete = true;
            return writer.rowsWritten();
        } catch (FitDecodeException.Unchecked e) {
            throw decodeFailure(e.getCause());
        } catch (IOException e) {
            throw new ConversionException(FailureKind.PERMANENT, "could not write output",
                    "I/O failure writing " + output + ": " + e.getMessage(), e);
        } finally {
            if (!complete) {
                deleteQuietly(output);
            }
        }
    }

    private FitDecoder open(Path input) throws ConversionException {
        try {
            return decoderFactory.open(input);
        } catch (FitDecodeException e) {
            throw decodeFailure(e);
        } catch (NoSuchFileException e) {
            throw new ConversionException(FailureKind.PERMANENT, "input file not found",
                    "Input file not found: " + input, e);
        } catch (IOException e) {
            // locked or briefly unreadable input; worth another attempt
            throw new ConversionException(FailureKind.TRANSIENT, "could not read file",
                    "I/O failure reading " + input + ": " + e.getMessage(), e);
        }
    }

    private static Set<String> collectKeys(FitDecoder decoder) throws ConversionException {
        Set<String> keys = new HashSet<>();
        try {
            Iterator<Map<String, Object>> records = decoder.records(FitDecoder.RECORD);
            while (records.hasNext()) {
                keys.addAll(records.next().keySet());
            }
        } catch (FitDecodeException.Unchecked e) {
            throw decodeFailure(e.getCause());
        }
        return keys;
    }

    static Map<String, Object> transformRow(Map<String, Object> values, CsvHeader header) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String column : header.columns()) {
            switch (column) {
                case CsvHeader.CADENCE_SPM ->
                        row.put(column, UnitTransforms.cadenceToSpm(values.get(CsvHeader.CADENCE)));
                case CsvHeader.PACE -> {
                    Object speed = values.get(CsvHeader.ENHANCED_SPEED);
                    if (speed == null) {
                        speed = values.get(CsvHeader.SPEED);
                    }
                    row.put(column, UnitTransforms.paceFromSpeed(speed));
                }
                case CsvHeader.LATITUDE_DEG ->
                        row.put(column, UnitTransforms.semicirclesToDegrees(values.get(CsvHeader.POSITION_LAT)));
                case CsvHeader.LONGITUDE_DEG ->
                        row.put(column, UnitTransforms.semicirclesToDegrees(values.get(CsvHeader.POSITION_LONG)));
                default -> row.put(column, values.get(column));
            }
        }
        return row;
    }

    private static ConversionException decodeFailure(FitDecodeException e) {
        return new ConversionException(FailureKind.PERMANENT, e.reason().description(),
                "Bad FIT data: " + e.getMessage(), e);
    }

    private static void createParentDirectories(Path output) throws ConversionException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new ConversionException(FailureKind.PERMANENT, "could not create output directory",
                    "Failed to create " + parent + ": " + e.getMessage(), e);
        }
    }

    private static void deleteQuietly(Path output) {
        try {
            Files.deleteIfExists(output);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to remove partial output " + output, e);
        }
    }
}
