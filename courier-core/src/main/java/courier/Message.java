package courier;

import courier.util.TimeTracker;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Unit of work carried by a {@link DeliveryQueue} to a server: a correlation id, a retry
 * budget, a reply-timeout tracker, an opaque producer payload and optional disposition
 * callbacks.
 *
 * <p>Configuration is fixed at construction (see {@link #builder(long)}). Delivery state
 * ({@linkplain #slot() slot}, {@linkplain #errorCount() error count},
 * {@linkplain #sentOnce() sent flag} and the timeout tracker) is owned by the queue the
 * message was appended to and only changes under that queue's lock.
 *
 * <p>Lifecycle: created, {@linkplain DeliveryQueue#append appended}, processed (and possibly
 * requeued up to {@link #numRetries()} more times), then exactly one terminal disposition:
 * {@linkplain DeliveryDelegate#notify notified} by the queue, or handed back to a reply
 * handler by {@link DeliveryQueue#completed}. Whoever receives the terminal disposition
 * calls {@link #destroy()}.
 */
public final class Message {
  private static final Logger logger = Logger.getLogger(Message.class.getName());

  /** Retry budget for messages that should effectively never be dropped (alarms). */
  public static final int NO_MAX_RETRIES_LIMIT = 99;

  /** Fire-and-forget: one attempt only. */
  public static final int NO_RETRIES = 0;

  /** Retry budget applied by {@link #create(long)}. */
  public static final int DEFAULT_MAX_RETRIES = 3;

  static final int MAX_RETRIES_CAP = 0xFFFF;

  private final long id;
  private final long requestId;
  private final int deliveryMask;
  private final boolean expectsReply;
  private final int numRetries;
  private final Object payload;
  private final PayloadReleaser payloadReleaser;
  private final MessageCallback successCallback;
  private final MessageCallback failureCallback;
  private final SentRemovalCheck sentRemovalCheck;
  private final AtomicBoolean destroyed = new AtomicBoolean(false);

  // guarded by the owning queue's lock
  private volatile MessageSlot slot = MessageSlot.UNQUEUED;
  private TimeTracker tracker;
  private volatile int errorCount;
  private volatile boolean sentOnce;

  private Message(Builder builder) {
    if (builder.numRetries < 0 || builder.numRetries > MAX_RETRIES_CAP) {
      throw new IllegalArgumentException(
          "numRetries must be in [0, " + MAX_RETRIES_CAP + "], got: " + builder.numRetries);
    }
    this.id = builder.id;
    this.requestId = builder.requestId;
    this.deliveryMask = builder.deliveryMask;
    this.expectsReply = builder.expectsReply;
    this.numRetries = builder.numRetries;
    this.payload = builder.payload;
    this.payloadReleaser = builder.payloadReleaser;
    this.successCallback = builder.successCallback;
    this.failureCallback = builder.failureCallback;
    this.sentRemovalCheck = builder.sentRemovalCheck;
  }

  /**
   * Creates a fire-and-forget message with the default retry budget and no payload.
   *
   * @param id correlation id, unique among messages in the same queue
   * @return a new message
   */
  public static Message create(long id) {
    return new Builder(id).build();
  }

  public static Builder builder(long id) {
    return new Builder(id);
  }

  public long id() {
    return id;
  }

  /** Id of the server request this message answers, or zero. */
  public long requestId() {
    return requestId;
  }

  /**
   * Channel-specific bit mask of the transports or network interfaces this message may use.
   * Opaque to the queue.
   */
  public int deliveryMask() {
    return deliveryMask;
  }

  public boolean expectsReply() {
    return expectsReply;
  }

  public int numRetries() {
    return numRetries;
  }

  public int errorCount() {
    return errorCount;
  }

  /** Whether a reply wait for this message has expired at least once. */
  public boolean sentOnce() {
    return sentOnce;
  }

  public Object payload() {
    return payload;
  }

  /**
   * Returns the payload cast to {@code type}.
   *
   * @throws ClassCastException if the payload is not a {@code type}
   */
  public <T> T payload(Class<T> type) {
    return type.cast(payload);
  }

  public MessageCallback successCallback() {
    return successCallback;
  }

  public MessageCallback failureCallback() {
    return failureCallback;
  }

  public SentRemovalCheck sentRemovalCheck() {
    return sentRemovalCheck;
  }

  /**
   * Current slot. Only meaningful as a diagnostic snapshot when read outside the queue.
   */
  public MessageSlot slot() {
    return slot;
  }

  public boolean isDestroyed() {
    return destroyed.get();
  }

  /**
   * Ends the message's life: stops the timeout tracker and releases the payload through the
   * configured {@link PayloadReleaser}. Only the first call has an effect.
   */
  public void destroy() {
    if (!destroyed.compareAndSet(false, true)) {
      logger.fine(() -> "Ignoring repeated destroy of message id=" + Long.toUnsignedString(id));
      return;
    }
    TimeTracker t = tracker;
    if (t != null) {
      t.stop();
    }
    if (payload != null && payloadReleaser != null) {
      try {
        payloadReleaser.release(payload);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING,
            "Payload release failed for message id=" + Long.toUnsignedString(id), e);
      }
    }
  }

  // ── queue-owned state ───────────────────────────────────────────

  void slot(MessageSlot slot) {
    this.slot = slot;
  }

  TimeTracker tracker() {
    return tracker;
  }

  /** Returns the tracker, creating it on first use. */
  TimeTracker ensureTracker() {
    if (tracker == null) {
      tracker = new TimeTracker();
    }
    return tracker;
  }

  int incrementErrorCount() {
    return ++errorCount;
  }

  void markSentOnce() {
    this.sentOnce = true;
  }

  @Override
  public String toString() {
    TimeTracker t = tracker;
    return "Message{id=" + Long.toUnsignedString(id)
        + ", mask=" + Integer.toHexString(deliveryMask)
        + ", reply=" + expectsReply
        + ", sent=" + sentOnce
        + ", errors=" + errorCount
        + ", retries=" + numRetries
        + ", slot=" + slot
        + ", timerRunning=" + (t != null && t.isRunning())
        + ", timerRanForSecs=" + (t != null ? t.elapsedSeconds() : 0)
        + '}';
  }

  /** Builder for {@link Message}. */
  public static final class Builder {
    private final long id;
    private long requestId;
    private int deliveryMask;
    private boolean expectsReply;
    private int numRetries = DEFAULT_MAX_RETRIES;
    private Object payload;
    private PayloadReleaser payloadReleaser;
    private MessageCallback successCallback;
    private MessageCallback failureCallback;
    private SentRemovalCheck sentRemovalCheck;

    private Builder(long id) {
      this.id = id;
    }

    public Builder requestId(long requestId) {
      this.requestId = requestId;
      return this;
    }

    public Builder deliveryMask(int deliveryMask) {
      this.deliveryMask = deliveryMask;
      return this;
    }

    /**
     * Whether the message stays in flight after a successful {@code process()} until a reply
     * arrives or its timeout expires. Defaults to {@code false}.
     */
    public Builder expectsReply(boolean expectsReply) {
      this.expectsReply = expectsReply;
      return this;
    }

    /**
     * Number of additional attempts after the first. Defaults to {@link #DEFAULT_MAX_RETRIES}.
     * A message is attempted at most {@code numRetries + 1} times.
     */
    public Builder numRetries(int numRetries) {
      this.numRetries = numRetries;
      return this;
    }

    public Builder payload(Object payload) {
      this.payload = payload;
      return this;
    }

    /**
     * Sets the payload together with the function that releases it when the message is
     * destroyed.
     */
    public Builder payload(Object payload, PayloadReleaser releaser) {
      this.payload = payload;
      this.payloadReleaser = Objects.requireNonNull(releaser, "releaser");
      return this;
    }

    public Builder onSuccess(MessageCallback callback) {
      this.successCallback = callback;
      return this;
    }

    public Builder onFailure(MessageCallback callback) {
      this.failureCallback = callback;
      return this;
    }

    public Builder sentRemovalCheck(SentRemovalCheck check) {
      this.sentRemovalCheck = check;
      return this;
    }

    /**
     * @throws IllegalArgumentException if {@code numRetries} is outside [0, 65535]
     */
    public Message build() {
      return new Message(this);
    }
  }
}
