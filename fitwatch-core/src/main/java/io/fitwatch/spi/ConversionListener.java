package io.fitwatch.spi;

import io.fitwatch.ConversionReport;

import java.nio.file.Path;

/**
 * Callbacks fired by the retry controller on the worker thread.
 *
 * <p>Files that fail permanently are not moved or recorded anywhere; {@link #onAbandoned}
 * is the hook for escalating them (alerting, notifications). Implementations must be fast
 * and must not throw; exceptions are logged and ignored.
 */
public interface ConversionListener {

    /**
     * No-op listener.
     */
    ConversionListener NOOP = new ConversionListener() {
    };

    /**
     * Called after a file converted successfully.
     *
     * @param report the success report
     */
    default void onConverted(ConversionReport report) {
    }

    /**
     * Called after a transient failure, before the backoff sleep.
     *
     * @param input   the input file
     * @param attempt the attempt that failed (1-based)
     * @param detail  failure description
     */
    default void onRetry(Path input, int attempt, String detail) {
    }

    /**
     * Called once when a file is given up on: a permanent data error or exhausted retries.
     *
     * @param report the failure report
     */
    default void onAbandoned(ConversionReport report) {
    }
}
