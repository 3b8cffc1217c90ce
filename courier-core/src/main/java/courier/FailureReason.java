package courier;

/**
 * Reason attached to a message's terminal disposition.
 *
 * <p>Only {@link #NONE}, {@link #INVALID}, {@link #RETRY_MAX} and {@link #REMOVE} ever reach
 * {@link courier.DeliveryDelegate#notify}. {@link #SEND} and {@link #TIMEOUT} are
 * resolved inside the queue as automatic retries and are only visible to the
 * {@linkplain courier.spi.MetricsExporter metrics SPI}.
 */
public enum FailureReason {
  /** Success. */
  NONE,
  /** Malformed or unroutable; never retried. */
  INVALID,
  /** Transient transmission failure. */
  SEND,
  /** No reply within the configured window. */
  TIMEOUT,
  /** Retry budget exhausted. */
  RETRY_MAX,
  /** Removed by {@code remove}, {@code clear} or {@code close}. */
  REMOVE
}
