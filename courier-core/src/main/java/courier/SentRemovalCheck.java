package courier;

/**
 * Message-level veto consulted when a reply arrives for an in-flight message.
 *
 * <p>Lets a message stay in flight when the transport delivers intermediate, non-final
 * replies. A message whose check keeps returning {@code false} stays in flight until it
 * times out or a later reply is accepted.
 */
@FunctionalInterface
public interface SentRemovalCheck {

  /**
   * @param message the in-flight message the reply correlates to
   * @param payload the reply payload, never {@code null}
   * @return {@code true} if the reply is final and the message may leave the in-flight set
   */
  boolean canBeRemoved(Message message, Object payload);
}
