package io.fitwatch.watch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Waits until a file has stopped growing.
 *
 * <p>The size is sampled every poll interval; the file is stable once two consecutive
 * samples are equal. A missing file never counts as stable and resets the comparison.
 */
public final class StabilityProber {
  private static final Logger logger = Logger.getLogger(StabilityProber.class.getName());

  private static final long MISSING = -1L;

  private final Duration pollInterval;

  public StabilityProber(Duration pollInterval) {
    Objects.requireNonNull(pollInterval, "pollInterval");
    if (pollInterval.toMillis() < 1) {
      throw new IllegalArgumentException("pollInterval must be >= 1ms, got: " + pollInterval);
    }
    this.pollInterval = pollInterval;
  }

  /**
   * Blocks until {@code path} is stable or {@code timeout} elapses.
   *
   * @return {@code true} if two consecutive size samples matched; {@code false} on timeout
   *     or interrupt (the interrupt flag is restored)
   */
  public boolean waitStable(Path path, Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    long previous = size(path);
    while (true) {
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        return false;
      }
      try {
        Thread.sleep(Math.min(pollInterval.toMillis(), Math.max(1L, remaining / 1_000_000L)));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
      long current = size(path);
      if (current != MISSING && current == previous) {
        logger.fine(() -> "Stable at " + current + " bytes: " + path);
        return true;
      }
      previous = current;
    }
  }

  public Duration pollInterval() {
    return pollInterval;
  }

  private static long size(Path path) {
    try {
      return Files.size(path);
    } catch (NoSuchFileException e) {
      return MISSING;
    } catch (IOException e) {
      logger.log(Level.FINE, "Cannot stat " + path, e);
      return MISSING;
    }
  }
}
