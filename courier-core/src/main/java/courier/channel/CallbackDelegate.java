package courier.channel;

import courier.DeliveryDelegate;
import courier.DeliveryQueue;
import courier.FailureReason;
import courier.Message;
import courier.MessageCallback;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class for channels that follow the callback convention: every terminal disposition
 * runs the message's success or failure callback and then {@linkplain Message#destroy()
 * destroys} the message.
 *
 * <p>Subclasses supply {@link #filter} and {@link #process}. A receive path calls
 * {@link #handleReply} when a server reply arrives so replies are disposed of the same way.
 */
public abstract class CallbackDelegate implements DeliveryDelegate {
  private static final Logger logger = Logger.getLogger(CallbackDelegate.class.getName());

  @Override
  public void notify(Message message, boolean success, FailureReason reason) {
    if (!success) {
      logger.fine(() -> "Message id=" + Long.toUnsignedString(message.id()) + " failed: " + reason);
    }
    try {
      runCallback(message, success ? message.successCallback() : message.failureCallback());
    } finally {
      message.destroy();
    }
  }

  /**
   * Completes the in-flight message {@code messageId} on {@code queue} with a server reply,
   * runs its success callback, and destroys it. A completed message is owned by the caller,
   * so this never waits for an in-progress {@code process()} call.
   *
   * @param queue     the queue the message was dispatched from
   * @param messageId id the reply correlates to
   * @param payload   the reply, may be {@code null}
   * @return the completed message, or empty if nothing was completed
   */
  public Optional<Message> handleReply(DeliveryQueue queue, long messageId, Object payload) {
    Optional<Message> completed = queue.completed(messageId, payload);
    completed.ifPresent(message -> {
      try {
        runCallback(message, message.successCallback());
      } finally {
        message.destroy();
      }
    });
    return completed;
  }

  private static void runCallback(Message message, MessageCallback callback) {
    if (callback == null) {
      return;
    }
    try {
      callback.onDisposition(message);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Callback failed for message id=" + Long.toUnsignedString(message.id()), e);
    }
  }
}
