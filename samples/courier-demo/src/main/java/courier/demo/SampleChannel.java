package courier.demo;

import courier.DeliveryQueue;
import courier.Message;
import courier.ProcessResult;
import courier.channel.CallbackDelegate;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Example channel that delivers messages to a simulated server.
 *
 * <p>Messages carry a {@linkplain Message#deliveryMask() delivery mask} of the networks they
 * may use. Only messages whose mask overlaps the currently connected networks pass the
 * filter; {@link #connect(boolean)} and {@link #disconnect()} change the connected networks
 * and re-run the queue's filter. The simulated server answers each reply-expecting message
 * on a separate receive thread after a short delay.
 */
public final class SampleChannel extends CallbackDelegate implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SampleChannel.class.getName());

  public static final int NETWORK_BROADBAND = 0x1;
  public static final int NETWORK_CELLULAR = 0x2;
  public static final int NETWORK_ANY = NETWORK_BROADBAND | NETWORK_CELLULAR;

  private final ScheduledExecutorService server =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sample-server");
        t.setDaemon(true);
        return t;
      });
  private final long replyDelayMs;

  private volatile DeliveryQueue queue;
  private volatile int connectedNetworks;
  private volatile boolean enabled = true;
  private volatile boolean shutdown;

  private SampleChannel(long replyDelayMs) {
    this.replyDelayMs = replyDelayMs;
  }

  /**
   * Creates a channel with its own started queue. No network is connected yet.
   */
  public static SampleChannel open(int maxInFlight, int timeoutSecs, long replyDelayMs) {
    SampleChannel channel = new SampleChannel(replyDelayMs);
    channel.queue = DeliveryQueue.builder(channel)
        .maxInFlight(maxInFlight)
        .timeoutSecs(timeoutSecs)
        .threadNamePrefix("sample-channel-")
        .build();
    channel.queue.startWorker();
    return channel;
  }

  public DeliveryQueue queue() {
    return queue;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  /**
   * Queues a message for delivery. Ignored while shutting down or disabled.
   *
   * @return whether the message was queued
   */
  public boolean request(Message message) {
    if (shutdown || !enabled) {
      logger.fine("Ignoring request; channel is shut down or disabled");
      return false;
    }
    return queue.append(message);
  }

  /**
   * Connects broadband, or cellular when {@code useCell} is set, and admits the messages
   * that may travel over it.
   */
  public void connect(boolean useCell) {
    if (shutdown) {
      return;
    }
    connectedNetworks |= useCell ? NETWORK_CELLULAR : NETWORK_BROADBAND;
    logger.info("Connected " + (useCell ? "cellular" : "broadband"));
    queue.runFilter();
  }

  public void disconnect() {
    if (shutdown) {
      return;
    }
    connectedNetworks = 0;
    logger.info("Disconnected");
    queue.runFilter();
  }

  @Override
  public boolean filter(Message message) {
    return (message.deliveryMask() & connectedNetworks) != 0;
  }

  @Override
  public ProcessResult process(Message message) {
    if (shutdown) {
      return ProcessResult.SEND_FAILURE;
    }
    if ((message.deliveryMask() & connectedNetworks) == 0) {
      logger.warning("Link lost before sending message id=" + message.id());
      return ProcessResult.SEND_FAILURE;
    }
    logger.info("Sending message id=" + message.id() + " payload=" + message.payload());
    if (message.expectsReply()) {
      long id = message.id();
      server.schedule(() -> responseReceived(id, "ack:" + id), replyDelayMs, TimeUnit.MILLISECONDS);
    }
    return ProcessResult.SUCCESS;
  }

  /**
   * Receive-thread entry point: correlates a server response with its message.
   */
  void responseReceived(long messageId, String payload) {
    if (shutdown) {
      return;
    }
    if (handleReply(queue, messageId, payload).isEmpty()) {
      logger.fine("Dropped response for message id=" + messageId);
    }
  }

  @Override
  public void close() {
    shutdown = true;
    server.shutdownNow();
    queue.close();
  }
}
