package io.fitwatch;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of a single conversion attempt.
 *
 * <ul>
 *   <li>{@link Converted}: CSV written; carries the row count and elapsed time.</li>
 *   <li>{@link Failed}: nothing usable written; {@link Failed#kind()} tells the retry
 *       controller whether another attempt can help.</li>
 * </ul>
 *
 * @see io.fitwatch.dispatch.RetryController
 */
public sealed interface ConversionResult permits ConversionResult.Converted, ConversionResult.Failed {

    static Converted converted(int rows, Duration elapsed) {
        return new Converted(rows, elapsed);
    }

    static Failed permanent(String detail, Throwable cause) {
        return new Failed(FailureKind.PERMANENT, detail, cause);
    }

    static Failed transientFailure(String detail, Throwable cause) {
        return new Failed(FailureKind.TRANSIENT, detail, cause);
    }

    /**
     * Conversion succeeded.
     *
     * @param rows    number of data rows written (header excluded)
     * @param elapsed wall time of the attempt
     */
    record Converted(int rows, Duration elapsed) implements ConversionResult {
        public Converted {
            if (rows < 0) {
                throw new IllegalArgumentException("rows must be >= 0");
            }
            Objects.requireNonNull(elapsed, "elapsed");
        }
    }

    /**
     * Conversion failed.
     *
     * @param kind   permanent or transient
     * @param detail user-facing failure description
     * @param cause  underlying exception, may be null
     */
    record Failed(FailureKind kind, String detail, Throwable cause) implements ConversionResult {
        public Failed {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(detail, "detail");
        }

        public boolean isPermanent() {
            return kind == FailureKind.PERMANENT;
        }
    }
}
