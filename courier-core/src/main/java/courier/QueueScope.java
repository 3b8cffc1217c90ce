package courier;

/**
 * Set of messages visited by {@link DeliveryQueue#iterate}.
 */
public enum QueueScope {
  /** Every message waiting for dispatch, admissible or not. */
  ALL,
  /** Messages waiting for dispatch that pass the delegate's filter. */
  FILTER,
  /** Messages dispatched and awaiting a reply. */
  SENT
}
