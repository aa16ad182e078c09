package io.fitwatch;

import io.fitwatch.convert.FileConverter;
import io.fitwatch.convert.FitCsvConverter;
import io.fitwatch.dispatch.ConversionDispatcher;
import io.fitwatch.dispatch.LinearBackoffRetryPolicy;
import io.fitwatch.dispatch.RetryController;
import io.fitwatch.dispatch.RetryPolicy;
import io.fitwatch.spi.ConversionListener;
import io.fitwatch.spi.FitDecoderFactory;
import io.fitwatch.spi.MetricsExporter;
import io.fitwatch.watch.CandidatePath;
import io.fitwatch.watch.DebounceTracker;
import io.fitwatch.watch.DirectoryEventSource;
import io.fitwatch.watch.StabilityProber;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link DirectoryEventSource}, {@link DebounceTracker},
 * {@link ConversionDispatcher} and {@link RetryController} into one {@link AutoCloseable}
 * inbox watcher.
 *
 * <p>Files appearing in the inbox are debounced, queued, converted one at a time and written
 * to the outbox as {@code <name>.csv}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (FitWatcher watcher = FitWatcher.builder()
 *     .inbox(Path.of("inbox"))
 *     .outbox(Path.of("outbox"))
 *     .build()) {
 *   watcher.start();
 *   watcher.awaitStop();
 * }
 * }</pre>
 */
public final class FitWatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(FitWatcher.class.getName());

  private final Path inbox;
  private final Path outbox;
  private final Settings settings;
  private final DebounceTracker tracker;
  private final ConversionDispatcher dispatcher;
  private final RetryController retryController;
  private final DirectoryEventSource eventSource;
  private final MetricsExporter metrics;

  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final CountDownLatch stopRequested = new CountDownLatch(1);

  private FitWatcher(Builder builder) {
    this.inbox = Objects.requireNonNull(builder.inbox, "inbox").toAbsolutePath().normalize();
    this.outbox = Objects.requireNonNull(builder.outbox, "outbox").toAbsolutePath().normalize();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.settings = new Settings(builder.transform, builder.maxAttempts, builder.pollInterval,
        builder.stabilityTimeout, builder.debounceWindow, builder.drainTimeout);

    FileConverter converter = builder.converter;
    if (converter == null) {
      converter = builder.decoderFactory != null
          ? new FitCsvConverter(builder.decoderFactory) : new FitCsvConverter();
    }

    this.tracker = new DebounceTracker(builder.debounceWindow);
    this.retryController = RetryController.builder()
        .converter(converter)
        .prober(new StabilityProber(builder.pollInterval))
        .outbox(outbox)
        .transform(builder.transform)
        .maxAttempts(builder.maxAttempts)
        .retryPolicy(builder.retryPolicy != null ? builder.retryPolicy : new LinearBackoffRetryPolicy())
        .stabilityTimeout(builder.stabilityTimeout)
        .metrics(metrics)
        .listener(builder.listener)
        .onFinished(tracker::complete)
        .build();
    this.dispatcher = ConversionDispatcher.builder()
        .handler(retryController::process)
        .metrics(metrics)
        .pendingCount(tracker::pendingCount)
        .drainTimeout(builder.drainTimeout)
        .build();
    this.eventSource = new DirectoryEventSource(inbox, builder.extension, this::onCandidate);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates the inbox and outbox if missing, starts the worker, then the event source, and
   * logs the effective settings.
   *
   * @throws UncheckedIOException if a directory cannot be created or watched
   * @throws IllegalStateException if the watcher has been closed
   */
  public void start() {
    if (closed.get()) {
      throw new IllegalStateException("FitWatcher has been closed");
    }
    if (!started.compareAndSet(false, true)) {
      return;
    }
    try {
      Files.createDirectories(inbox);
      Files.createDirectories(outbox);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create watcher directories", e);
    }
    dispatcher.start();
    eventSource.start();
    logger.info(banner());
  }

  String banner() {
    return "Watching " + inbox + " -> " + outbox
        + " (transform=" + settings.transform()
        + ", retries=" + settings.maxAttempts()
        + ", poll=" + settings.pollInterval().toMillis() + "ms"
        + ", debounce=" + settings.debounceWindow().toMillis() + "ms"
        + ", stabilityTimeout=" + settings.stabilityTimeout().toMillis() + "ms)";
  }

  private void onCandidate(CandidatePath candidate) {
    submit(candidate.path());
  }

  /**
   * Offers a file for conversion, subject to the same dedup and debounce rules as
   * filesystem events.
   *
   * @param path the FIT file
   * @return {@code true} if the file was queued
   */
  public boolean submit(Path path) {
    Path normalized = path.toAbsolutePath().normalize();
    if (!tracker.accept(normalized)) {
      metrics.incrementEnqueueDebounced();
      return false;
    }
    if (!dispatcher.enqueue(normalized)) {
      tracker.cancel(normalized);
      logger.fine(() -> "Shutting down; not queued: " + normalized);
      return false;
    }
    metrics.incrementEnqueueAccepted();
    logger.fine(() -> "Enqueued: " + normalized.getFileName());
    return true;
  }

  /**
   * Blocks until every file queued so far has been processed.
   *
   * @return {@code false} on timeout
   */
  public boolean awaitIdle(Duration timeout) throws InterruptedException {
    return dispatcher.awaitIdle(timeout);
  }

  /** Asks the control thread blocked in {@link #awaitStop()} to return. */
  public void requestStop() {
    if (stopRequested.getCount() > 0) {
      logger.info("Shutdown requested");
      stopRequested.countDown();
    }
  }

  public void awaitStop() throws InterruptedException {
    stopRequested.await();
  }

  public boolean awaitStop(Duration timeout) throws InterruptedException {
    return stopRequested.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  public boolean isStopRequested() {
    return stopRequested.getCount() == 0;
  }

  public Path inbox() {
    return inbox;
  }

  public Path outbox() {
    return outbox;
  }

  public Settings settings() {
    return settings;
  }

  public int pendingCount() {
    return tracker.pendingCount();
  }

  /**
   * Stops the event source, then drains the queue. Idempotent.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    stopRequested.countDown();
    RuntimeException first = null;
    try {
      eventSource.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      dispatcher.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    logger.info("Stopped.");
    if (first != null) {
      throw first;
    }
  }

  /**
   * Effective tuning values, as reported in the startup banner.
   */
  public record Settings(
      boolean transform,
      int maxAttempts,
      Duration pollInterval,
      Duration stabilityTimeout,
      Duration debounceWindow,
      Duration drainTimeout) {
  }

  /** Builder for {@link FitWatcher}. */
  public static final class Builder {
    private Path inbox;
    private Path outbox;
    private boolean transform = true;
    private int maxAttempts = 3;
    private RetryPolicy retryPolicy;
    private Duration pollInterval = Duration.ofMillis(500);
    private Duration stabilityTimeout = Duration.ofSeconds(30);
    private Duration debounceWindow = DebounceTracker.DEFAULT_WINDOW;
    private Duration drainTimeout = Duration.ofSeconds(30);
    private String extension = DirectoryEventSource.DEFAULT_EXTENSION;
    private FileConverter converter;
    private FitDecoderFactory decoderFactory;
    private MetricsExporter metrics;
    private ConversionListener listener;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the directory to watch.
     *
     * <p><b>Required.</b> Relative paths resolve against the working directory.
     *
     * @param inbox the inbox directory
     * @return this builder
     */
    public Builder inbox(Path inbox) {
      this.inbox = inbox;
      return this;
    }

    /**
     * Sets the directory CSV files are written to.
     *
     * <p><b>Required.</b>
     *
     * @param outbox the outbox directory
     * @return this builder
     */
    public Builder outbox(Path outbox) {
      this.outbox = outbox;
      return this;
    }

    /**
     * Enables unit transforms (cadence in steps per minute, pace, degrees).
     *
     * <p>Optional. Defaults to {@code true}.
     *
     * @param transform whether to transform columns
     * @return this builder
     */
    public Builder transform(boolean transform) {
      this.transform = transform;
      return this;
    }

    /**
     * Sets the maximum number of conversion attempts per file.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     *
     * @param maxAttempts attempts per file
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the delay policy between transient failures.
     *
     * <p>Optional. Defaults to {@link LinearBackoffRetryPolicy} (250 ms per attempt, capped at 1 s).
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the interval between file size samples while waiting for a file to stabilize.
     *
     * <p>Optional. Defaults to 500 ms. Must be &gt; 0.
     *
     * @param pollInterval sampling interval
     * @return this builder
     */
    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    /**
     * Sets how long to wait for a file to stabilize before converting it anyway.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param stabilityTimeout stability timeout
     * @return this builder
     */
    public Builder stabilityTimeout(Duration stabilityTimeout) {
      this.stabilityTimeout = stabilityTimeout;
      return this;
    }

    /**
     * Sets the minimum time between two accepted enqueues of the same path.
     *
     * <p>Optional. Defaults to 2 seconds.
     *
     * @param debounceWindow debounce window
     * @return this builder
     */
    public Builder debounceWindow(Duration debounceWindow) {
      this.debounceWindow = debounceWindow;
      return this;
    }

    /**
     * Sets how long {@link FitWatcher#close()} drains before logging a WARNING. Queued files
     * and the conversion in progress always run to completion.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param drainTimeout warning threshold
     * @return this builder
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /**
     * Sets the file extension to watch for (case-insensitive).
     *
     * <p>Optional. Defaults to {@code .fit}.
     *
     * @param extension the extension, with or without the leading dot
     * @return this builder
     */
    public Builder extension(String extension) {
      this.extension = extension;
      return this;
    }

    /**
     * Replaces the converter. Takes precedence over {@link #decoderFactory}.
     *
     * <p>Optional. Defaults to {@link FitCsvConverter}.
     *
     * @param converter the converter
     * @return this builder
     */
    public Builder converter(FileConverter converter) {
      this.converter = converter;
      return this;
    }

    /**
     * Sets the FIT decoder used by the default converter.
     *
     * <p>Optional. Defaults to the built-in binary decoder.
     *
     * @param decoderFactory the decoder factory
     * @return this builder
     */
    public Builder decoderFactory(FitDecoderFactory decoderFactory) {
      this.decoderFactory = decoderFactory;
      return this;
    }

    /**
     * Sets the metrics exporter. An exporter implementing {@link AutoCloseable} is closed
     * with the watcher.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the listener notified of conversions, retries and abandoned files.
     *
     * <p>Optional. Defaults to {@link ConversionListener#NOOP}.
     *
     * @param listener the listener
     * @return this builder
     */
    public Builder listener(ConversionListener listener) {
      this.listener = listener;
      return this;
    }

    /**
     * Builds the watcher. Nothing runs until {@link FitWatcher#start()}.
     *
     * @return a new {@link FitWatcher}
     * @throws NullPointerException if {@code inbox} or {@code outbox} is null
     * @throws IllegalArgumentException if a tuning value is out of range
     * @throws IllegalStateException if this builder was already used
     */
    public FitWatcher build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(pollInterval, "pollInterval");
      Objects.requireNonNull(stabilityTimeout, "stabilityTimeout");
      Objects.requireNonNull(debounceWindow, "debounceWindow");
      Objects.requireNonNull(drainTimeout, "drainTimeout");
      return new FitWatcher(this);
    }
  }
}
