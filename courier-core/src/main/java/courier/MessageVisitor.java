package courier;

/**
 * Callback for {@link DeliveryQueue#iterate}. Runs under the queue lock; must not call the
 * queue.
 */
@FunctionalInterface
public interface MessageVisitor {

  /**
   * @return {@code false} to stop iterating
   */
  boolean visit(Message message);
}
