package io.fitwatch.spi;

/**
 * Observability hook for exporting pipeline counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of paths accepted into the work queue.
     */
    void incrementEnqueueAccepted();

    /**
     * Increments the count of events dropped because the path was already pending
     * or was enqueued within the debounce window.
     */
    void incrementEnqueueDebounced();

    /**
     * Increments the count of files converted successfully.
     */
    void incrementConversionSuccess();

    /**
     * Increments the count of conversion attempts that failed transiently and will be retried.
     */
    void incrementConversionRetry();

    /**
     * Increments the count of files abandoned after a permanent error or exhausted retries.
     */
    void incrementConversionFailed();

    /**
     * Records the current depth of the work queue and the number of pending paths.
     *
     * @param queueDepth   tasks waiting in the queue
     * @param pendingCount paths enqueued or being processed
     */
    void recordQueueDepth(int queueDepth, int pendingCount);

    /**
     * Records the wall time of one successful conversion.
     *
     * @param durationMs conversion time in milliseconds (always non-negative)
     */
    default void recordConversionDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEnqueueAccepted() {
        }

        @Override
        public void incrementEnqueueDebounced() {
        }

        @Override
        public void incrementConversionSuccess() {
        }

        @Override
        public void incrementConversionRetry() {
        }

        @Override
        public void incrementConversionFailed() {
        }

        @Override
        public void recordQueueDepth(int queueDepth, int pendingCount) {
        }
    }
}
