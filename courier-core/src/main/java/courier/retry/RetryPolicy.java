package courier.retry;

/**
 * Strategy for the pause a {@link courier.DeliveryQueue} worker takes after a message is
 * requeued because of {@link courier.ProcessResult#SEND_FAILURE} or
 * {@link courier.ProcessResult#DELAY_SEND}.
 *
 * <p>The pause keeps the worker from spinning on a link that is failing, or on a message
 * whose dependency has not resolved yet. It is cut short only when the queue is stopped.
 *
 * @see FixedDelayRetryPolicy
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /** Delay used by the queue unless configured otherwise. */
  long DEFAULT_DELAY_MS = 250;

  /**
   * Computes the pause before the worker picks the next message.
   *
   * @param errorCount the requeued message's error count after this attempt; unchanged
   *                   (possibly zero) for a delayed send
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int errorCount);

  static RetryPolicy fixed(long delayMs) {
    return new FixedDelayRetryPolicy(delayMs);
  }

  static RetryPolicy defaultPolicy() {
    return new FixedDelayRetryPolicy(DEFAULT_DELAY_MS);
  }
}
