package io.fitwatch.spi;

/**
 * Thrown when a file is not a well-formed FIT file: bad header, CRC mismatch,
 * truncated data or an unsupported structure.
 *
 * <p>Decode errors are data errors. Retrying the same bytes cannot succeed.
 */
public class FitDecodeException extends Exception {

    private final Reason reason;

    public FitDecodeException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public FitDecodeException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    /** Broad category of a decode failure, used to build user-facing messages. */
    public enum Reason {
        TRUNCATED("file appears truncated"),
        CRC("file failed CRC check (corrupted data)"),
        UNSUPPORTED("FIT profile not supported"),
        DECODE("could not decode FIT stream");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    /**
     * Unchecked carrier used to surface a {@link FitDecodeException} through
     * {@link java.util.Iterator} methods.
     */
    public static final class Unchecked extends RuntimeException {

        public Unchecked(FitDecodeException cause) {
            super(cause.getMessage(), cause);
        }

        @Override
        public synchronized FitDecodeException getCause() {
            return (FitDecodeException) super.getCause();
        }
    }
}
