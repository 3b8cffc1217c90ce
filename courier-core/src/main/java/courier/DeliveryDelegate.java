package courier;

/**
 * Contract a transport (a "channel") implements to plug into a {@link DeliveryQueue}.
 *
 * <p>The delegate decides which messages may be sent right now, performs the actual send,
 * and receives each message's terminal disposition. {@link #filter}, {@link #process} and
 * {@link #canBeRemovedFromSentQueue} must not call back into the queue that invokes them.
 *
 * @see courier.channel.CallbackDelegate
 */
public interface DeliveryDelegate {

  /**
   * Whether {@code message} may be dispatched under current conditions (for example, whether
   * the network it needs is reachable). Must be side-effect free.
   *
   * <p>Evaluated on {@link DeliveryQueue#append}, when a message is requeued after a failed
   * attempt, and for every pending message on {@link DeliveryQueue#runFilter()}. A message
   * rejected here stays pending until a later {@code runFilter()} admits it.
   */
  boolean filter(Message message);

  /**
   * Sends the message. May block on I/O; called from the queue's worker thread with no
   * queue lock held.
   *
   * <p>A runtime exception thrown from here counts as {@link ProcessResult#SEND_FAILURE}.
   */
  ProcessResult process(Message message);

  /**
   * Terminal hook, called exactly once per message that the queue disposes of itself.
   * Responsible for running the message's callbacks and {@linkplain Message#destroy()
   * destroying} it. Called with no queue lock held, so it may call back into the queue.
   *
   * <p>Not called for messages handed back by {@link DeliveryQueue#completed}; their
   * receiver takes over disposition.
   *
   * @param message the message, already detached from the queue
   * @param success whether delivery succeeded
   * @param reason  {@link FailureReason#NONE} on success, otherwise {@link FailureReason#INVALID},
   *                {@link FailureReason#RETRY_MAX} or {@link FailureReason#REMOVE}
   */
  void notify(Message message, boolean success, FailureReason reason);

  /**
   * Whether a reply carrying {@code payload} ends {@code message}'s wait in the in-flight
   * set. Returning {@code false} leaves the message in flight; the reply is dropped.
   *
   * <p>Defaults to the message's own {@link SentRemovalCheck}, or {@code true} if it has
   * none.
   */
  default boolean canBeRemovedFromSentQueue(Message message, Object payload) {
    SentRemovalCheck check = message.sentRemovalCheck();
    return check == null || check.canBeRemoved(message, payload);
  }
}
