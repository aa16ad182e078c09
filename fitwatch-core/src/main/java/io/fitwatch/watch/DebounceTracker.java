package io.fitwatch.watch;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Decides whether a path may enter the work queue.
 *
 * <p>A path is rejected while it is pending (queued or being converted) and for a debounce
 * window after its last accepted enqueue, so the burst of events a single write produces
 * results in one conversion. A pending path stays pending until {@link #complete(Path)} is
 * called, which the retry controller does exactly once per accepted path.
 *
 * <p>This class is thread-safe; all state is guarded by one lock.
 */
public final class DebounceTracker {
  private static final Logger logger = Logger.getLogger(DebounceTracker.class.getName());

  public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(2);

  private final Object lock = new Object();
  private final Set<Path> pending = new HashSet<>();
  private final Map<Path, Long> lastEnqueued = new HashMap<>();
  private final long windowNanos;
  private final LongSupplier clock;

  public DebounceTracker() {
    this(DEFAULT_WINDOW, System::nanoTime);
  }

  public DebounceTracker(Duration window) {
    this(window, System::nanoTime);
  }

  /**
   * @param window minimum time between two accepted enqueues of the same path
   * @param clock  monotonic nanosecond clock
   */
  public DebounceTracker(Duration window, LongSupplier clock) {
    Objects.requireNonNull(window, "window");
    if (window.isNegative()) {
      throw new IllegalArgumentException("window must be >= 0, got: " + window);
    }
    this.windowNanos = window.toNanos();
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Records {@code path} as pending if it is neither pending nor inside its debounce window.
   *
   * @return {@code true} if the caller should enqueue the path
   */
  public boolean accept(Path path) {
    Path key = normalize(path);
    synchronized (lock) {
      if (pending.contains(key)) {
        logger.fine(() -> "Already pending: " + key);
        return false;
      }
      long now = clock.getAsLong();
      Long last = lastEnqueued.get(key);
      if (last != null && now - last < windowNanos) {
        logger.fine(() -> "Debounced: " + key);
        return false;
      }
      pending.add(key);
      lastEnqueued.put(key, now);
      return true;
    }
  }

  /**
   * Removes {@code path} from the pending set. The debounce timestamp is kept.
   */
  public void complete(Path path) {
    Path key = normalize(path);
    synchronized (lock) {
      pending.remove(key);
    }
  }

  /**
   * Undoes an {@link #accept} whose path could not be enqueued: the path leaves the pending
   * set and its debounce timestamp is dropped, so it counts as never enqueued.
   */
  public void cancel(Path path) {
    Path key = normalize(path);
    synchronized (lock) {
      pending.remove(key);
      lastEnqueued.remove(key);
    }
  }

  public boolean isPending(Path path) {
    Path key = normalize(path);
    synchronized (lock) {
      return pending.contains(key);
    }
  }

  public int pendingCount() {
    synchronized (lock) {
      return pending.size();
    }
  }

  private static Path normalize(Path path) {
    return Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
  }
}
