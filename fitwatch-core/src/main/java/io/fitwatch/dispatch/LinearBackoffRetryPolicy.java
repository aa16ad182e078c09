package io.fitwatch.dispatch;

/**
 * Retry policy whose delay grows linearly with the attempt number.
 *
 * <p>Delay formula: {@code min(maxDelay, baseDelay * attempt)}. The defaults give
 * 250 ms, 500 ms, 750 ms, then 1 s for every later attempt.
 */
public final class LinearBackoffRetryPolicy implements RetryPolicy {
  public static final long DEFAULT_BASE_DELAY_MS = 250;
  public static final long DEFAULT_MAX_DELAY_MS = 1000;

  private final long baseDelayMs;
  private final long maxDelayMs;

  public LinearBackoffRetryPolicy() {
    this(DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS);
  }

  /**
   * @param baseDelayMs delay added per attempt (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   */
  public LinearBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < 0) {
      throw new IllegalArgumentException("maxDelayMs must be >= 0, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    // Guard against overflow before multiplying
    if (baseDelayMs != 0 && attempts > maxDelayMs / baseDelayMs) {
      return maxDelayMs;
    }
    return Math.min(maxDelayMs, baseDelayMs * attempts);
  }
}
