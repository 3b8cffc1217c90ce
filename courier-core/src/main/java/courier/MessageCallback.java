package courier;

/**
 * Optional producer hook run once a message has been declared a success or a failure.
 *
 * <p>The queue never calls this itself; the delegate's {@code notify} does, by channel
 * convention (see {@link courier.channel.CallbackDelegate}).
 */
@FunctionalInterface
public interface MessageCallback {

  void onDisposition(Message message);
}
