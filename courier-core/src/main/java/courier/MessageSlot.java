package courier;

/**
 * The single logical location of a {@link Message} relative to a {@link DeliveryQueue}.
 *
 * <p>Transitions happen only under the owning queue's lock. A message is never in two
 * slots, and a {@link #RELEASED} message is never re-admitted.
 */
public enum MessageSlot {
  /** Created, not yet appended. */
  UNQUEUED,
  /** Waiting for dispatch; currently rejected by the delegate's filter. */
  PENDING,
  /** Waiting for dispatch and passing the filter. */
  ADMISSIBLE,
  /** Handed to {@code process()}; expects no reply. */
  PROCESSING,
  /** Dispatched and awaiting a reply (possibly still inside {@code process()}). */
  IN_FLIGHT,
  /** Terminal disposition taken: notified, or handed back by {@code completed()}. */
  RELEASED
}
