package io.fitwatch.watch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DirectoryEventSourceTest {

  @TempDir
  Path inbox;

  private final List<Path> received = new CopyOnWriteArrayList<>();

  // ── Filtering ───────────────────────────────────────────────────

  @Test
  void fitFilesAreForwarded() throws Exception {
    DirectoryEventSource source = new DirectoryEventSource(inbox, c -> received.add(c.path()));
    Path file = Files.createFile(inbox.resolve("run.fit"));

    source.handle(StandardWatchEventKinds.ENTRY_CREATE, file);

    assertEquals(List.of(file.toAbsolutePath().normalize()), received);
  }

  @Test
  void extensionMatchIsCaseInsensitive() throws Exception {
    DirectoryEventSource source = new DirectoryEventSource(inbox, c -> received.add(c.path()));
    Path file = Files.createFile(inbox.resolve("RUN.FIT"));

    source.handle(StandardWatchEventKinds.ENTRY_MODIFY, file);

    assertEquals(1, received.size());
  }

  @Test
  void otherExtensionsAreDiscarded() throws Exception {
    DirectoryEventSource source = new DirectoryEventSource(inbox, c -> received.add(c.path()));

    source.handle(StandardWatchEventKinds.ENTRY_CREATE, Files.createFile(inbox.resolve("notes.txt")));
    source.handle(StandardWatchEventKinds.ENTRY_CREATE, Files.createFile(inbox.resolve("run.fit.part")));

    assertTrue(received.isEmpty());
  }

  @Test
  void directoriesAreDiscarded() throws Exception {
    DirectoryEventSource source = new DirectoryEventSource(inbox, c -> received.add(c.path()));

    source.handle(StandardWatchEventKinds.ENTRY_CREATE, Files.createDirectory(inbox.resolve("folder.fit")));

    assertTrue(received.isEmpty());
  }

  @Test
  void customExtensionWithoutDot() throws Exception {
    DirectoryEventSource source = new DirectoryEventSource(inbox, "gpx", c -> received.add(c.path()));

    source.handle(StandardWatchEventKinds.ENTRY_CREATE, Files.createFile(inbox.resolve("a.gpx")));
    source.handle(StandardWatchEventKinds.ENTRY_CREATE, Files.createFile(inbox.resolve("b.fit")));

    assertEquals(1, received.size());
  }

  // ── Overflow and sink errors ────────────────────────────────────

  @Test
  void overflowRescansMatchingFiles() throws Exception {
    DirectoryEventSource source = new DirectoryEventSource(inbox, c -> received.add(c.path()));
    Files.createFile(inbox.resolve("a.fit"));
    Files.createFile(inbox.resolve("b.FIT"));
    Files.createFile(inbox.resolve("c.csv"));

    source.handle(StandardWatchEventKinds.OVERFLOW, null);

    assertEquals(2, received.size());
  }

  @Test
  void sinkExceptionDoesNotPropagate() throws Exception {
    DirectoryEventSource source = new DirectoryEventSource(inbox, c -> {
      throw new IllegalStateException("boom");
    });

    assertDoesNotThrow(() ->
        source.handle(StandardWatchEventKinds.ENTRY_CREATE, Files.createFile(inbox.resolve("x.fit"))));
  }

  // ── Live watch ──────────────────────────────────────────────────

  @Test
  void liveWatchReportsNewFile() throws Exception {
    CountDownLatch seen = new CountDownLatch(1);
    try (DirectoryEventSource source = new DirectoryEventSource(inbox, c -> {
      if (c.path().getFileName().toString().equals("live.fit")) {
        seen.countDown();
      }
    })) {
      source.start();
      Files.write(inbox.resolve("live.fit"), new byte[] {1, 2, 3});

      assertTrue(seen.await(15, TimeUnit.SECONDS), "live.fit was not reported");
    }
  }

  @Test
  void startAfterCloseFails() {
    DirectoryEventSource source = new DirectoryEventSource(inbox, c -> { });
    source.close();

    assertThrows(IllegalStateException.class, source::start);
  }

  @Test
  void closeIsIdempotent() {
    DirectoryEventSource source = new DirectoryEventSource(inbox, c -> { });
    source.start();

    source.close();
    assertDoesNotThrow(source::close);
  }
}
