package courier.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Pause that doubles with each error the requeued message has accumulated, with jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^errorCount}, capped at {@code maxDelay}, multiplied
 * by a random jitter factor in [0.5, 1.5) and capped again. A delayed send of a message that
 * has not failed yet waits roughly {@code baseDelay}.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  /**
   * @param baseDelayMs pause for a message with no errors (milliseconds)
   * @param maxDelayMs  upper bound for any pause (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException(
          "maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs + " < " + baseDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int errorCount) {
    int doublings = Math.max(0, errorCount);
    long expDelay;
    // 2^doublings overflows past the cap long before 62 shifts
    if (doublings >= 62 || (1L << doublings) > maxDelayMs / baseDelayMs) {
      expDelay = maxDelayMs;
    } else {
      expDelay = baseDelayMs << doublings;
    }
    double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, (long) (expDelay * jitter));
  }

  @Override
  public String toString() {
    return "ExponentialBackoffRetryPolicy{baseDelayMs=" + baseDelayMs
        + ", maxDelayMs=" + maxDelayMs + '}';
  }
}
