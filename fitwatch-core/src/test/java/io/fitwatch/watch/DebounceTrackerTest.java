package io.fitwatch.watch;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class DebounceTrackerTest {

  private final AtomicLong clock = new AtomicLong(1_000_000_000L);
  private final DebounceTracker tracker = new DebounceTracker(Duration.ofSeconds(2), clock::get);
  private final Path path = Path.of("inbox", "run.fit");

  @Test
  void firstAcceptSucceeds() {
    assertTrue(tracker.accept(path));
    assertTrue(tracker.isPending(path));
    assertEquals(1, tracker.pendingCount());
  }

  @Test
  void pendingPathIsRejected() {
    assertTrue(tracker.accept(path));
    clock.addAndGet(Duration.ofSeconds(10).toNanos());

    assertFalse(tracker.accept(path));
  }

  @Test
  void completedPathInsideWindowIsDebounced() {
    assertTrue(tracker.accept(path));
    tracker.complete(path);
    clock.addAndGet(Duration.ofMillis(1999).toNanos());

    assertFalse(tracker.accept(path));
    assertFalse(tracker.isPending(path));
  }

  @Test
  void completedPathAfterWindowIsAccepted() {
    assertTrue(tracker.accept(path));
    tracker.complete(path);
    clock.addAndGet(Duration.ofSeconds(2).toNanos());

    assertTrue(tracker.accept(path));
  }

  @Test
  void rejectedAcceptDoesNotExtendWindow() {
    assertTrue(tracker.accept(path));
    tracker.complete(path);
    clock.addAndGet(Duration.ofSeconds(1).toNanos());
    assertFalse(tracker.accept(path));
    clock.addAndGet(Duration.ofSeconds(1).toNanos());

    assertTrue(tracker.accept(path));
  }

  @Test
  void cancelledAcceptLeavesNoDebounceStamp() {
    assertTrue(tracker.accept(path));

    tracker.cancel(path);

    assertFalse(tracker.isPending(path));
    assertTrue(tracker.accept(path));
  }

  @Test
  void equivalentPathsShareState() {
    assertTrue(tracker.accept(path));

    assertFalse(tracker.accept(path.toAbsolutePath()));
    assertFalse(tracker.accept(Path.of("inbox", ".", "run.fit")));
  }

  @Test
  void distinctPathsAreIndependent() {
    assertTrue(tracker.accept(path));
    assertTrue(tracker.accept(Path.of("inbox", "other.fit")));
    assertEquals(2, tracker.pendingCount());
  }

  @Test
  void completeOfUnknownPathIsHarmless() {
    tracker.complete(Path.of("never-seen.fit"));
    assertEquals(0, tracker.pendingCount());
  }

  @Test
  void negativeWindowIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new DebounceTracker(Duration.ofMillis(-1)));
  }

  @Test
  void concurrentAcceptsAdmitOnlyOne() throws Exception {
    DebounceTracker shared = new DebounceTracker();
    int threads = 8;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    AtomicInteger accepted = new AtomicInteger();
    try {
      for (int i = 0; i < threads; i++) {
        pool.submit(() -> {
          start.await();
          if (shared.accept(path)) {
            accepted.incrementAndGet();
          }
          return null;
        });
      }
      start.countDown();
      pool.shutdown();
      assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    } finally {
      pool.shutdownNow();
    }

    assertEquals(1, accepted.get());
  }
}
