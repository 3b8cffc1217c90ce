package courier;

/**
 * Lifecycle state of a {@link DeliveryQueue}'s worker.
 *
 * <pre>
 * NOT_RUNNING --start--&gt; RUNNING &lt;--&gt; PROCESSING
 *                          |
 *                        stop
 *                          v
 *                      CANCELING --worker exit--&gt; NOT_RUNNING
 * </pre>
 */
public enum QueueState {
  NOT_RUNNING,
  RUNNING,
  /** The worker is inside {@link DeliveryDelegate#process}. */
  PROCESSING,
  CANCELING
}
