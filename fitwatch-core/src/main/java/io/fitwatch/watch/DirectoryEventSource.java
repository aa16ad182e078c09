package io.fitwatch.watch;

import io.fitwatch.util.DaemonThreadFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Watches one directory (non-recursively) and forwards files with a matching extension to a
 * {@link CandidateSink}.
 *
 * <p>Creation, rename-into and modification events are reported. Directories and other
 * extensions are discarded. When the platform drops events ({@code OVERFLOW}) the directory
 * is rescanned and every matching file is reported again; the {@link DebounceTracker}
 * filters the duplicates.
 *
 * <p>Events are handled on a single daemon thread that never performs conversion work. The
 * {@link #start()} and {@link #close()} methods are synchronized.
 */
public final class DirectoryEventSource implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(DirectoryEventSource.class.getName());

    public static final String DEFAULT_EXTENSION = ".fit";

    private final Path directory;
    private final String extension;
    private final CandidateSink sink;

    private WatchService watchService;
    private ExecutorService eventThread;
    private volatile boolean closed;

    public DirectoryEventSource(Path directory, CandidateSink sink) {
        this(directory, DEFAULT_EXTENSION, sink);
    }

    public DirectoryEventSource(Path directory, String extension, CandidateSink sink) {
        this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
        Objects.requireNonNull(extension, "extension");
        if (extension.isEmpty()) {
            throw new IllegalArgumentException("extension must not be empty");
        }
        this.extension = (extension.startsWith(".") ? extension : "." + extension).toLowerCase(Locale.ROOT);
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Registers the watch and starts the event thread. Subsequent calls are no-ops.
     *
     * @throws UncheckedIOException if the directory cannot be watched
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("DirectoryEventSource has been closed");
        }
        if (eventThread != null) {
            return;
        }
        try {
            watchService = directory.getFileSystem().newWatchService();
            directory.register(watchService,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot watch " + directory, e);
        }
        eventThread = Executors.newSingleThreadExecutor(new DaemonThreadFactory("fitwatch-events-"));
        eventThread.submit(this::eventLoop);
        logger.fine(() -> "Watching " + directory + " for *" + extension);
    }

    private void eventLoop() {
        WatchService service = watchService;
        while (!closed && !Thread.currentThread().isInterrupted()) {
            WatchKey key;
            try {
                key = service.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            }
            for (WatchEvent<?> event : key.pollEvents()) {
                handle(event.kind(), event.context() instanceof Path name ? directory.resolve(name) : null);
            }
            if (!key.reset()) {
                logger.warning("Watch on " + directory + " is no longer valid; stopping event source");
                break;
            }
        }
    }

    /**
     * Handles one raw event. Package-private so tests can drive it without a live watch.
     */
    void handle(WatchEvent.Kind<?> kind, Path path) {
        if (kind == StandardWatchEventKinds.OVERFLOW) {
            logger.warning("Filesystem events dropped for " + directory + "; rescanning");
            rescan();
            return;
        }
        if (path != null && matches(path)) {
            deliver(path);
        }
    }

    /**
     * Reports every matching file currently in the directory.
     */
    public void rescan() {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
            for (Path entry : entries) {
                if (matches(entry)) {
                    deliver(entry);
                }
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Rescan of " + directory + " failed", e);
        }
    }

    boolean matches(Path path) {
        Path name = path.getFileName();
        if (name == null || !name.toString().toLowerCase(Locale.ROOT).endsWith(extension)) {
            return false;
        }
        return !Files.isDirectory(path);
    }

    private void deliver(Path path) {
        try {
            sink.onCandidate(CandidatePath.of(path));
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Candidate sink failed for " + path, e);
        }
    }

    public Path directory() {
        return directory;
    }

    /**
     * Stops the event thread and releases the watch. Idempotent.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                logger.log(Level.WARNING, "Failed to close watch service for " + directory, e);
            }
        }
        if (eventThread != null) {
            eventThread.shutdownNow();
            try {
                if (!eventThread.awaitTermination(5, TimeUnit.SECONDS)) {
                    logger.warning("Event thread did not stop within 5s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
