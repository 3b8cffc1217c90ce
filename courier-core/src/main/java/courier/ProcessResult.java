package courier;

/**
 * Outcome of a single {@link courier.DeliveryDelegate#process} call.
 */
public enum ProcessResult {
  /**
   * Handed to the transport. Fire-and-forget messages are notified as successful right away;
   * reply-expecting messages stay in flight until completed or timed out.
   */
  SUCCESS,

  /** Delivered and nothing else is needed, even if the message expected a reply. */
  SUCCESS_HANDLED,

  /** The message can never be delivered. Dropped without retry. */
  INVALID,

  /** Transmission failed. Counts against the message's retry budget. */
  SEND_FAILURE,

  /**
   * The message depends on another message that has not resolved yet. Requeued without
   * touching the retry budget.
   */
  DELAY_SEND
}
