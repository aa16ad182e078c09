/**
 * Front of the pipeline: turning filesystem events into paths worth converting.
 *
 * <p>{@link io.fitwatch.watch.DirectoryEventSource} reports candidate files,
 * {@link io.fitwatch.watch.DebounceTracker} drops duplicates and event bursts, and
 * {@link io.fitwatch.watch.StabilityProber} waits for a file to stop growing before the
 * worker reads it.
 */
package io.fitwatch.watch;
