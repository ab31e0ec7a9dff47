package relay.dispatch;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Retry policy using exponential backoff with jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}, then
 * multiplied by a random factor in [0.5, 1.5) and capped again. The interval is bounded,
 * the number of attempts is not.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final long DEFAULT_BASE_DELAY_MS = 500L;
  public static final long DEFAULT_MAX_DELAY_MS = 30_000L;

  private final long baseDelayMs;
  private final long maxDelayMs;
  private final DoubleSupplier jitter;

  public ExponentialBackoffRetryPolicy() {
    this(DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS);
  }

  /**
   * @param baseDelayMs base delay for the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, () -> ThreadLocalRandom.current().nextDouble(0.5, 1.5));
  }

  ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, DoubleSupplier jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long expDelay;
    if (attempts >= 63) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << (attempts - 1);
      // Guard against overflow: if shift exceeds maxDelayMs/baseDelayMs, cap directly
      expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    long withJitter = (long) (capped * jitter.getAsDouble());
    return Math.min(maxDelayMs, Math.max(0L, withJitter));
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }
}
