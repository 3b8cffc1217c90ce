package courier.retry;

/**
 * Pauses for the same delay after every requeue.
 */
public final class FixedDelayRetryPolicy implements RetryPolicy {
  private final long delayMs;

  /**
   * @param delayMs pause in milliseconds; zero disables the pause
   */
  public FixedDelayRetryPolicy(long delayMs) {
    if (delayMs < 0) {
      throw new IllegalArgumentException("delayMs must be >= 0, got: " + delayMs);
    }
    this.delayMs = delayMs;
  }

  @Override
  public long computeDelayMs(int errorCount) {
    return delayMs;
  }

  @Override
  public String toString() {
    return "FixedDelayRetryPolicy{delayMs=" + delayMs + '}';
  }
}
