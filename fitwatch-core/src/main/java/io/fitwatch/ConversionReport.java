package io.fitwatch;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Final outcome of processing one input file, after retries.
 *
 * @param ok       whether a CSV was written
 * @param input    the input file
 * @param output   the CSV path (written only when {@code ok})
 * @param rows     rows written, or {@code null} on failure
 * @param elapsed  time of the successful attempt, or {@code null} on failure
 * @param message  human-readable summary
 * @param attempts number of conversion attempts made
 */
public record ConversionReport(
        boolean ok,
        Path input,
        Path output,
        Integer rows,
        Duration elapsed,
        String message,
        int attempts) {

    public ConversionReport {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(message, "message");
    }

    public static ConversionReport success(Path input, Path output, int rows, Duration elapsed, int attempts) {
        String message = String.format(Locale.ROOT, "converted: %s → %s (%d rows, %.2f s)",
                input.getFileName(), output.getFileName(), rows, elapsed.toNanos() / 1e9);
        return new ConversionReport(true, input, output, rows, elapsed, message, attempts);
    }

    public static ConversionReport failure(Path input, Path output, String detail, int attempts) {
        String message = input.getFileName() + " — " + detail;
        return new ConversionReport(false, input, output, null, null, message, attempts);
    }
}
