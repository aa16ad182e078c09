package io.fitwatch.micrometer;

import io.fitwatch.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code fitwatch.enqueue.accepted}: paths accepted into the work queue</li>
 *   <li>{@code fitwatch.enqueue.debounced}: events dropped as duplicates</li>
 *   <li>{@code fitwatch.conversion.success}: files converted</li>
 *   <li>{@code fitwatch.conversion.retry}: transient failures that will be retried</li>
 *   <li>{@code fitwatch.conversion.failed}: files abandoned</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code fitwatch.queue.depth}: tasks waiting for the worker</li>
 *   <li>{@code fitwatch.pending}: paths enqueued or in flight</li>
 * </ul>
 *
 * <p>{@code fitwatch.conversion.duration} times successful conversions.
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter accepted;
  private final Counter debounced;
  private final Counter success;
  private final Counter retry;
  private final Counter failed;
  private final Timer duration;
  private final Gauge queueDepthGauge;
  private final Gauge pendingGauge;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private final AtomicInteger pending = new AtomicInteger();
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "fitwatch");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "garmin.fitwatch"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.accepted = Counter.builder(namePrefix + ".enqueue.accepted")
        .description("Paths accepted into the work queue")
        .register(registry);
    this.debounced = Counter.builder(namePrefix + ".enqueue.debounced")
        .description("Events dropped because the path was pending or recently enqueued")
        .register(registry);
    this.success = Counter.builder(namePrefix + ".conversion.success")
        .description("Files converted to CSV")
        .register(registry);
    this.retry = Counter.builder(namePrefix + ".conversion.retry")
        .description("Conversion attempts that failed transiently")
        .register(registry);
    this.failed = Counter.builder(namePrefix + ".conversion.failed")
        .description("Files abandoned")
        .register(registry);
    this.duration = Timer.builder(namePrefix + ".conversion.duration")
        .description("Wall time of successful conversions")
        .register(registry);

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
    this.pendingGauge = Gauge.builder(namePrefix + ".pending", pending, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementEnqueueAccepted() {
    if (closed) return;
    accepted.increment();
  }

  @Override
  public void incrementEnqueueDebounced() {
    if (closed) return;
    debounced.increment();
  }

  @Override
  public void incrementConversionSuccess() {
    if (closed) return;
    success.increment();
  }

  @Override
  public void incrementConversionRetry() {
    if (closed) return;
    retry.increment();
  }

  @Override
  public void incrementConversionFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void recordQueueDepth(int queueDepth, int pendingCount) {
    if (closed) return;
    this.queueDepth.set(queueDepth);
    this.pending.set(pendingCount);
  }

  @Override
  public void recordConversionDurationMs(long durationMs) {
    if (closed) return;
    duration.record(Duration.ofMillis(durationMs));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link io.fitwatch.FitWatcher#close()} calls this, so a stopped watcher leaves no stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(accepted, debounced, success, retry, failed, duration,
        queueDepthGauge, pendingGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
