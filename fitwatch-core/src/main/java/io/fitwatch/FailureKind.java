package io.fitwatch;

/**
 * Classifies a failed conversion for the retry controller.
 */
public enum FailureKind {
    /** The input itself is bad (corrupt, truncated, empty) or the output cannot be written. Never retried. */
    PERMANENT,
    /** Environmental failure; retried with backoff up to the attempt limit. */
    TRANSIENT
}
