package io.fitwatch.dispatch;

import io.fitwatch.ConversionReport;
import io.fitwatch.ConversionResult;
import io.fitwatch.convert.FileConverter;
import io.fitwatch.spi.ConversionListener;
import io.fitwatch.spi.MetricsExporter;
import io.fitwatch.watch.StabilityProber;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the conversion of one file to completion on the worker thread.
 *
 * <p>Each attempt waits for the file to stop growing, then invokes the converter. A
 * {@link io.fitwatch.FailureKind#PERMANENT permanent} failure ends processing at once; a
 * transient failure (or an exception escaping the converter) is retried after the
 * {@link RetryPolicy} delay until {@code maxAttempts} is reached. Whatever the outcome, the
 * completion callback runs exactly once so the path can be enqueued again later.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class RetryController {
  private static final Logger logger = Logger.getLogger(RetryController.class.getName());

  private final FileConverter converter;
  private final StabilityProber prober;
  private final Path outbox;
  private final boolean transform;
  private final int maxAttempts;
  private final RetryPolicy retryPolicy;
  private final Duration stabilityTimeout;
  private final MetricsExporter metrics;
  private final ConversionListener listener;
  private final Consumer<Path> onFinished;

  private RetryController(Builder builder) {
    this.converter = Objects.requireNonNull(builder.converter, "converter");
    this.prober = Objects.requireNonNull(builder.prober, "prober");
    this.outbox = Objects.requireNonNull(builder.outbox, "outbox").toAbsolutePath().normalize();
    this.stabilityTimeout = Objects.requireNonNull(builder.stabilityTimeout, "stabilityTimeout");
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (stabilityTimeout.isNegative()) {
      throw new IllegalArgumentException("stabilityTimeout must be >= 0");
    }
    this.transform = builder.transform;
    this.maxAttempts = builder.maxAttempts;
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : new LinearBackoffRetryPolicy();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.listener = builder.listener != null ? builder.listener : ConversionListener.NOOP;
    this.onFinished = builder.onFinished != null ? builder.onFinished : path -> { };
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Converts {@code input}, retrying transient failures.
   *
   * @param input the FIT file
   * @return the final outcome
   */
  public ConversionReport process(Path input) {
    Path output = outputFor(input);
    try {
      return attempt(input, output);
    } finally {
      onFinished.accept(input);
    }
  }

  private ConversionReport attempt(Path input, Path output) {
    String lastDetail = "could not convert file";
    Throwable lastCause = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      if (!Files.exists(input)) {
        return abandon(input, output, "input file not found", attempt, Level.WARNING, null);
      }
      if (!prober.waitStable(input, stabilityTimeout)) {
        if (Thread.currentThread().isInterrupted()) {
          return abandon(input, output, "interrupted", attempt, Level.WARNING, null);
        }
        logger.warning("File did not stabilize within " + stabilityTimeout.toMillis()
            + "ms, converting anyway: " + input);
      }

      logger.info("Converting " + input.getFileName() + " (attempt " + attempt + "/" + maxAttempts + ")");
      ConversionResult result;
      try {
        result = converter.convert(input, output, transform);
      } catch (RuntimeException e) {
        result = ConversionResult.transientFailure("could not convert file", e);
      }

      if (result instanceof ConversionResult.Converted converted) {
        ConversionReport report = ConversionReport.success(
            input, output, converted.rows(), converted.elapsed(), attempt);
        metrics.incrementConversionSuccess();
        metrics.recordConversionDurationMs(converted.elapsed().toMillis());
        logger.info(report.message());
        notify(() -> listener.onConverted(report));
        return report;
      }

      ConversionResult.Failed failed = (ConversionResult.Failed) result;
      if (failed.isPermanent()) {
        return abandon(input, output, failed.detail(), attempt, Level.WARNING, failed.cause());
      }
      lastDetail = failed.detail();
      lastCause = failed.cause();
      logger.log(Level.WARNING, "Attempt " + attempt + "/" + maxAttempts + " failed for "
          + input.getFileName() + ": " + failed.detail(), failed.cause());
      if (attempt < maxAttempts) {
        metrics.incrementConversionRetry();
        int failedAttempt = attempt;
        String detail = failed.detail();
        notify(() -> listener.onRetry(input, failedAttempt, detail));
        if (!backOff(attempt)) {
          return abandon(input, output, "interrupted", attempt, Level.WARNING, null);
        }
      }
    }
    return abandon(input, output, lastDetail, maxAttempts, Level.SEVERE, lastCause);
  }

  private ConversionReport abandon(Path input, Path output, String detail, int attempts,
                                   Level level, Throwable cause) {
    ConversionReport report = ConversionReport.failure(input, output, detail, attempts);
    metrics.incrementConversionFailed();
    if (level == Level.SEVERE) {
      logger.log(level, "Giving up on " + input + " after " + attempts + " attempts: " + detail, cause);
    } else {
      logger.log(level, "Conversion failed permanently: " + report.message(), cause);
    }
    notify(() -> listener.onAbandoned(report));
    return report;
  }

  private boolean backOff(int attempt) {
    long delayMs = retryPolicy.computeDelayMs(attempt);
    if (delayMs <= 0) {
      return true;
    }
    try {
      Thread.sleep(delayMs);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private void notify(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "ConversionListener threw", e);
    }
  }

  /**
   * @return {@code <outbox>/<input file name without extension>.csv}
   */
  public Path outputFor(Path input) {
    String name = input.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String stem = dot > 0 ? name.substring(0, dot) : name;
    return outbox.resolve(stem + ".csv");
  }

  /** Builder for {@link RetryController}. */
  public static final class Builder {
    private FileConverter converter;
    private StabilityProber prober;
    private Path outbox;
    private boolean transform = true;
    private int maxAttempts = 3;
    private RetryPolicy retryPolicy;
    private Duration stabilityTimeout = Duration.ofSeconds(30);
    private MetricsExporter metrics;
    private ConversionListener listener;
    private Consumer<Path> onFinished;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder converter(FileConverter converter) {
      this.converter = converter;
      return this;
    }

    /** <b>Required.</b> */
    public Builder prober(StabilityProber prober) {
      this.prober = prober;
      return this;
    }

    /** <b>Required.</b> Directory that receives the CSV files. */
    public Builder outbox(Path outbox) {
      this.outbox = outbox;
      return this;
    }

    /** Optional. Defaults to {@code true}. */
    public Builder transform(boolean transform) {
      this.transform = transform;
      return this;
    }

    /** Optional. Defaults to {@code 3}. Must be &ge; 1. */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /** Optional. Defaults to {@link LinearBackoffRetryPolicy}. */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Optional. Defaults to 30 seconds. */
    public Builder stabilityTimeout(Duration stabilityTimeout) {
      this.stabilityTimeout = stabilityTimeout;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to {@link ConversionListener#NOOP}. */
    public Builder listener(ConversionListener listener) {
      this.listener = listener;
      return this;
    }

    /**
     * Sets the callback run exactly once per {@link RetryController#process(Path)} call,
     * typically {@link io.fitwatch.watch.DebounceTracker#complete(Path)}.
     */
    public Builder onFinished(Consumer<Path> onFinished) {
      this.onFinished = onFinished;
      return this;
    }

    public RetryController build() {
      return new RetryController(this);
    }
  }
}
