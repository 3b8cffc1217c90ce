package courier;

/**
 * Locates an in-flight message by something other than its id, for
 * {@link DeliveryQueue#completedCustomSearch}. Runs under the queue lock; must not call the
 * queue.
 *
 * @param <A> type of the search argument, typically the decoded reply
 */
@FunctionalInterface
public interface SentMessageMatcher<A> {

  boolean matches(Message message, A arg);
}
