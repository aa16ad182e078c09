package io.fitwatch;

import java.util.Objects;

/**
 * Thrown by {@link io.fitwatch.convert.FitCsvConverter} when a file cannot be converted.
 *
 * <p>{@link #getMessage()} holds the technical detail; {@link #humanMessage()} holds the
 * short text shown to users.
 */
public class ConversionException extends Exception {

    private final FailureKind kind;
    private final String humanMessage;

    public ConversionException(FailureKind kind, String humanMessage, String detail) {
        this(kind, humanMessage, detail, null);
    }

    public ConversionException(FailureKind kind, String humanMessage, String detail, Throwable cause) {
        super(detail, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.humanMessage = Objects.requireNonNull(humanMessage, "humanMessage");
    }

    public FailureKind kind() {
        return kind;
    }

    public String humanMessage() {
        return humanMessage;
    }
}
