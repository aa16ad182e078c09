package io.fitwatch.dispatch;

import io.fitwatch.spi.MetricsExporter;
import io.fitwatch.util.DaemonThreadFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.IntSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-worker FIFO queue that serializes conversion work.
 *
 * <p>Paths are handed to the worker through an unbounded queue, so {@link #enqueue(Path)}
 * never blocks. Exactly one worker thread takes tasks and passes them to the handler, which
 * guarantees at most one conversion in flight. A handler that throws is logged and the
 * worker moves on to the next task.
 *
 * <p>Create instances via {@link #builder()}; the worker starts with {@link #start()}.
 * {@link #close()} stops accepting paths, queues a {@link Task.Stop} sentinel and waits
 * for every task queued before it.
 *
 * @see RetryController
 */
public final class ConversionDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConversionDispatcher.class.getName());

  private final BlockingQueue<Task> queue = new LinkedBlockingQueue<>();
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final ExecutorService worker;

  private final ReentrantLock idleLock = new ReentrantLock();
  private final Condition idle = idleLock.newCondition();
  private int unfinished;

  private final Consumer<Path> handler;
  private final MetricsExporter metrics;
  private final IntSupplier pendingCount;
  private final long drainTimeoutMs;

  private ConversionDispatcher(Builder builder) {
    this.handler = Objects.requireNonNull(builder.handler, "handler");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.pendingCount = builder.pendingCount != null ? builder.pendingCount : () -> 0;
    Duration drainTimeout = Objects.requireNonNull(builder.drainTimeout, "drainTimeout");
    if (drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must be >= 0");
    }
    this.drainTimeoutMs = drainTimeout.toMillis();
    this.worker = Executors.newSingleThreadExecutor(new DaemonThreadFactory("fitwatch-worker-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the worker thread. Subsequent calls are no-ops.
   */
  public void start() {
    if (started.compareAndSet(false, true)) {
      worker.submit(this::workerLoop);
    }
  }

  /**
   * Appends a conversion task. Never blocks.
   *
   * @param path the file to convert
   * @return {@code false} if shutdown has begun and the path was not queued
   */
  public boolean enqueue(Path path) {
    Task task = new Task.Convert(path);
    // Checked under the lock so no task can land behind the stop sentinel
    idleLock.lock();
    try {
      if (!accepting.get()) {
        return false;
      }
      unfinished++;
      queue.add(task);
    } finally {
      idleLock.unlock();
    }
    recordDepth();
    return true;
  }

  /**
   * Blocks until every task enqueued so far has been processed.
   *
   * @return {@code true} if the queue went idle, {@code false} on timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitIdle(Duration timeout) throws InterruptedException {
    long remaining = timeout.toNanos();
    idleLock.lock();
    try {
      while (unfinished > 0) {
        if (remaining <= 0) {
          return false;
        }
        remaining = idle.awaitNanos(remaining);
      }
      return true;
    } finally {
      idleLock.unlock();
    }
  }

  public int queueDepth() {
    return queue.size();
  }

  public boolean isAccepting() {
    return accepting.get();
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      Task task;
      try {
        task = queue.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
      if (task instanceof Task.Convert convert) {
        try {
          handler.accept(convert.path());
        } catch (Throwable t) {
          logger.log(Level.SEVERE, "Worker failed on " + convert.path(), t);
        } finally {
          taskDone();
          recordDepth();
        }
      } else {
        break;
      }
    }
  }

  private void taskDone() {
    idleLock.lock();
    try {
      if (--unfinished <= 0) {
        unfinished = 0;
        idle.signalAll();
      }
    } finally {
      idleLock.unlock();
    }
  }

  private void recordDepth() {
    metrics.recordQueueDepth(queue.size(), pendingCount.getAsInt());
  }

  /**
   * Stops accepting paths, then waits for the worker to finish every task queued before the
   * stop sentinel. Running conversions are never interrupted: once the drain timeout passes a
   * WARNING is logged and the wait continues. If the calling thread is interrupted, this
   * returns early and the worker keeps draining in the background. Idempotent.
   */
  @Override
  public void close() {
    idleLock.lock();
    try {
      if (!accepting.compareAndSet(true, false)) {
        return;
      }
      queue.add(Task.Stop.INSTANCE);
    } finally {
      idleLock.unlock();
    }
    worker.shutdown();
    if (!started.get()) {
      worker.shutdownNow();
      return;
    }
    try {
      if (!worker.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Still draining after " + drainTimeoutMs + "ms; waiting for "
            + Math.max(0, queue.size() - 1) + " queued task(s) and the conversion in progress");
        while (!worker.awaitTermination(1, TimeUnit.MINUTES)) {
          logger.log(Level.WARNING, "Still draining; " + Math.max(0, queue.size() - 1) + " queued task(s) left");
        }
      }
    } catch (InterruptedException e) {
      logger.log(Level.WARNING, "Interrupted while draining; worker continues in the background");
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link ConversionDispatcher}. */
  public static final class Builder {
    private Consumer<Path> handler;
    private MetricsExporter metrics;
    private IntSupplier pendingCount;
    private Duration drainTimeout = Duration.ofSeconds(30);

    private Builder() {}

    /**
     * Sets the per-path handler run on the worker thread, usually
     * {@link RetryController#process(Path)}.
     *
     * <p><b>Required.</b>
     *
     * @param handler the handler
     * @return this builder
     */
    public Builder handler(Consumer<Path> handler) {
      this.handler = handler;
      return this;
    }

    /**
     * Sets the metrics exporter for queue depth.
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
     * Sets the source of the pending-path count reported alongside queue depth.
     *
     * @param pendingCount pending-path count supplier
     * @return this builder
     */
    public Builder pendingCount(IntSupplier pendingCount) {
      this.pendingCount = pendingCount;
      return this;
    }

    /**
     * Sets how long {@link ConversionDispatcher#close()} drains before logging a WARNING.
     * The drain itself is not cut short.
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

    public ConversionDispatcher build() {
      return new ConversionDispatcher(this);
    }
  }
}
