package courier;

import courier.retry.RetryPolicy;
import courier.spi.MetricsExporter;
import courier.util.DaemonThreadFactory;
import courier.util.TimeTracker;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * FIFO delivery queue that holds outbound {@link Message}s while they wait for delivery to a
 * server over an unreliable, rate-limited link.
 *
 * <p>Internally there are three sets:
 * <ul>
 *   <li><b>pending</b>: every message not yet dispatched, in insertion order</li>
 *   <li><b>admissible</b>: the pending messages currently passing the
 *       {@linkplain DeliveryDelegate#filter delegate's filter}; the worker dispatches from here</li>
 *   <li><b>in flight</b>: dispatched messages waiting for a reply, keyed by id</li>
 * </ul>
 * Messages the filter rejects (for example because the network they need is down) stay
 * pending until {@link #runFilter()} admits them.
 *
 * <p>A single worker thread pops admissible messages and hands them to
 * {@link DeliveryDelegate#process} with no lock held, so replies can be
 * {@linkplain #completed completed} from a receive thread while a send is blocking. At most
 * {@code maxInFlight} messages wait for replies at once; each has a timeout of
 * {@code timeoutSecs}, after which it is retried or, once its budget is spent, dropped with
 * {@link FailureReason#RETRY_MAX}.
 *
 * <p>Every message gets exactly one terminal disposition: a
 * {@linkplain DeliveryDelegate#notify notification} (success, invalid, retry max or removed),
 * or ownership handed back by {@link #completed}/{@link #completedCustomSearch}. Each message
 * lives in exactly one {@linkplain MessageSlot slot} at a time. {@link #remove},
 * {@link #clear()} and {@link #containsMessage} first wait for any in-progress
 * {@code process()} call to return, so a message is never disposed of while the delegate
 * still uses it. Notifications are delivered after the queue lock is released and before the
 * triggering call (or worker step) moves on.
 *
 * <p>Messages are compared by identity; {@link Message} does not override {@code equals}.
 *
 * <p>Create instances via {@link #builder(DeliveryDelegate)}. This class is thread-safe.
 * Apart from {@link DeliveryDelegate#notify}, delegate methods must not call back into the
 * queue that invokes them.
 *
 * @see DeliveryDelegate
 * @see Message
 */
public final class DeliveryQueue implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeliveryQueue.class.getName());

  private static final long STOP_POLL_NANOS = TimeUnit.SECONDS.toNanos(1);

  private final DeliveryDelegate delegate;
  private final RetryPolicy retryPolicy;
  private final MetricsExporter metrics;
  private final ThreadFactory threadFactory;
  private final long idleWaitNanos;
  private final long settleWarnNanos;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();

  // guarded by lock
  private final Set<Message> pending = new LinkedHashSet<>();
  private final Set<Message> admissible = new LinkedHashSet<>();
  private final Map<Long, Message> inFlight = new LinkedHashMap<>();
  private int maxInFlight;
  private int timeoutSecs;
  private QueueState state = QueueState.NOT_RUNNING;
  private Thread worker;
  private Message current;
  private int settleWaiters;

  private DeliveryQueue(Builder builder) {
    this.delegate = Objects.requireNonNull(builder.delegate, "delegate");
    this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : RetryPolicy.defaultPolicy();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    if (builder.idleWaitSecs <= 0) {
      throw new IllegalArgumentException("idleWaitSecs must be > 0");
    }
    if (builder.settleWarnIntervalSecs <= 0) {
      throw new IllegalArgumentException("settleWarnIntervalSecs must be > 0");
    }
    this.idleWaitNanos = TimeUnit.SECONDS.toNanos(builder.idleWaitSecs);
    this.settleWarnNanos = TimeUnit.SECONDS.toNanos(builder.settleWarnIntervalSecs);
    this.threadFactory = new DaemonThreadFactory(
        Objects.requireNonNull(builder.threadNamePrefix, "threadNamePrefix"));

    int max = builder.maxInFlight;
    if (max < 1) {
      logger.warning("maxInFlight=" + max + " is not positive; using 1");
      max = 1;
    }
    int timeout = builder.timeoutSecs;
    if (timeout < 1) {
      logger.warning("timeoutSecs=" + timeout + " is not positive; using 1");
      timeout = 1;
    }
    this.maxInFlight = max;
    this.timeoutSecs = timeout;
  }

  public static Builder builder(DeliveryDelegate delegate) {
    return new Builder(delegate);
  }

  /**
   * Creates a queue with default settings apart from the two bounds. Requires a subsequent
   * {@link #startWorker()} before messages are dispatched.
   *
   * @param delegate    the transport plugged into this queue
   * @param maxInFlight messages allowed to await replies at once (clamped to &ge; 1)
   * @param timeoutSecs reply timeout in seconds (clamped to &ge; 1)
   * @return a new, stopped queue
   */
  public static DeliveryQueue create(DeliveryDelegate delegate, int maxInFlight, int timeoutSecs) {
    return builder(delegate).maxInFlight(maxInFlight).timeoutSecs(timeoutSecs).build();
  }

  // ── Worker lifecycle ────────────────────────────────────────────

  /**
   * Starts the worker thread. Has no effect unless the queue is {@link QueueState#NOT_RUNNING}.
   *
   * @return {@code true} if a worker was started by this call
   */
  public boolean startWorker() {
    lock.lock();
    try {
      if (state != QueueState.NOT_RUNNING) {
        return false;
      }
      state = QueueState.RUNNING;
      Thread thread = threadFactory.newThread(this::workerLoop);
      worker = thread;
      thread.start();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Asks the worker to exit once any in-progress {@code process()} call has returned.
   * Messages stay queued; use {@link #close()} to also drain them.
   *
   * @param waitForExit block until the worker has exited
   */
  public void stopWorker(boolean waitForExit) {
    lock.lock();
    try {
      boolean onWorker = Thread.currentThread() == worker;
      if (!onWorker) {
        awaitSettledLocked();
      }
      if (state == QueueState.RUNNING) {
        state = QueueState.CANCELING;
        changed.signalAll();
      } else if (state == QueueState.NOT_RUNNING) {
        return;
      }
      if (waitForExit && onWorker) {
        logger.warning("stopWorker(true) called from the worker thread; not waiting for exit");
        return;
      }
      if (waitForExit) {
        boolean interrupted = false;
        while (state != QueueState.NOT_RUNNING) {
          try {
            changed.awaitNanos(STOP_POLL_NANOS);
          } catch (InterruptedException e) {
            interrupted = true;
          }
        }
        if (interrupted) {
          Thread.currentThread().interrupt();
        }
      }
    } finally {
      lock.unlock();
    }
  }

  public QueueState state() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Whether the worker is inside {@link DeliveryDelegate#process} right now.
   */
  public boolean isBusy() {
    lock.lock();
    try {
      return state == QueueState.PROCESSING;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stops the worker (waiting for it to exit), then removes every message with
   * {@link FailureReason#REMOVE}.
   */
  @Override
  public void close() {
    stopWorker(true);
    clear();
  }

  // ── Producer side ───────────────────────────────────────────────

  /**
   * Appends a message. It becomes a dispatch candidate right away if it passes the
   * delegate's filter, otherwise it waits until {@link #runFilter()} admits it.
   *
   * @param message a message that is not already queued
   * @return {@code false} if {@code message} is {@code null} or has already been appended
   */
  public boolean append(Message message) {
    if (message == null) {
      logger.warning("Ignoring append of null message");
      return false;
    }
    boolean admitted;
    lock.lock();
    try {
      if (message.slot() != MessageSlot.UNQUEUED) {
        logger.warning("Rejecting append of message id=" + idOf(message)
            + " in slot " + message.slot());
        return false;
      }
      admitted = enqueueLocked(message);
      metrics.incrementAppended();
      recordSizesLocked();
      if (admitted) {
        changed.signalAll();
      }
    } finally {
      lock.unlock();
    }
    logger.fine(() -> (admitted ? "Queued message id=" : "Held back (filtered) message id=")
        + idOf(message));
    return true;
  }

  /**
   * Removes the message with this id, wherever it waits, and notifies the delegate with
   * {@link FailureReason#REMOVE}. Waits for an in-progress {@code process()} call to return
   * first, so a message being sent can be removed once the attempt has settled.
   *
   * @return {@code true} if a message was found and removed
   * @throws IllegalStateException if called from inside {@link DeliveryDelegate#process}
   */
  public boolean remove(long messageId) {
    List<Disposition> out = new ArrayList<>(1);
    lock.lock();
    try {
      awaitSettledLocked();
      Message found = null;
      for (Message m : pending) {
        if (m.id() == messageId) {
          found = m;
          break;
        }
      }
      if (found == null) {
        found = inFlight.get(messageId);
      }
      if (found == null) {
        logger.fine(() -> "remove: no queued message id=" + Long.toUnsignedString(messageId));
        return false;
      }
      disposeLocked(found, false, FailureReason.REMOVE, out);
      changed.signalAll();
    } finally {
      lock.unlock();
    }
    deliver(out);
    return true;
  }

  /**
   * Removes every message (in flight first, then pending) and notifies each with
   * {@link FailureReason#REMOVE}. Waits for an in-progress {@code process()} call to return
   * first.
   *
   * @return number of messages removed
   * @throws IllegalStateException if called from inside {@link DeliveryDelegate#process}
   */
  public int clear() {
    List<Disposition> out = new ArrayList<>();
    lock.lock();
    try {
      awaitSettledLocked();
      for (Message m : new ArrayList<>(inFlight.values())) {
        disposeLocked(m, false, FailureReason.REMOVE, out);
      }
      for (Message m : new ArrayList<>(pending)) {
        disposeLocked(m, false, FailureReason.REMOVE, out);
      }
      changed.signalAll();
    } finally {
      lock.unlock();
    }
    int cleared = out.size();
    if (cleared > 0) {
      logger.fine("Cleared " + cleared + " messages");
    }
    deliver(out);
    return cleared;
  }

  /**
   * Rebuilds the admissible set by running the delegate's filter over every pending message,
   * keeping insertion order. Call when the filter's conditions change (for example a
   * broadband link coming back).
   */
  public void runFilter() {
    lock.lock();
    try {
      logger.fine("Rebuilding admissible set with current filter");
      admissible.clear();
      for (Message m : pending) {
        if (passesFilter(m)) {
          admissible.add(m);
          m.slot(MessageSlot.ADMISSIBLE);
        } else {
          m.slot(MessageSlot.PENDING);
        }
      }
      recordSizesLocked();
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  // ── Reply side ──────────────────────────────────────────────────

  /**
   * Ends an in-flight message's reply wait and hands the message back to the caller, who
   * takes over its disposition (callbacks, {@link Message#destroy()}). The delegate is not
   * notified for it.
   *
   * <p>When {@code payload} is non-null the delegate's
   * {@link DeliveryDelegate#canBeRemovedFromSentQueue} may veto the removal; the reply is then
   * dropped and the message keeps waiting for a later reply or its timeout.
   *
   * <p>If the same message object may be re-sent by {@code process()}, check
   * {@link #containsMessage} before destroying it.
   *
   * @param messageId id of the message the reply correlates to
   * @param payload   the reply, or {@code null}
   * @return the message, or empty if no such message is in flight or the removal was vetoed
   */
  public Optional<Message> completed(long messageId, Object payload) {
    lock.lock();
    try {
      Message m = inFlight.get(messageId);
      if (m == null) {
        logger.warning("Got reply for unknown message id=" + Long.toUnsignedString(messageId));
        return Optional.empty();
      }
      if (payload != null && !allowsRemoval(m, payload)) {
        logger.info("Message id=" + idOf(m)
            + " prevented removal from the in-flight set; ignoring reply");
        return Optional.empty();
      }
      detachLocked(m);
      m.slot(MessageSlot.RELEASED);
      metrics.incrementSucceeded();
      recordSizesLocked();
      changed.signalAll();
      return Optional.of(m);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Like {@link #completed}, but finds the in-flight message with a caller-supplied matcher
   * (first match in dispatch order). No removal veto is consulted.
   *
   * @return the matched message, or empty if none matched or {@code matcher} is {@code null}
   */
  public <A> Optional<Message> completedCustomSearch(SentMessageMatcher<A> matcher, A arg) {
    if (matcher == null) {
      logger.warning("Ignoring completedCustomSearch with null matcher");
      return Optional.empty();
    }
    lock.lock();
    try {
      for (Message m : inFlight.values()) {
        if (matcher.matches(m, arg)) {
          detachLocked(m);
          m.slot(MessageSlot.RELEASED);
          metrics.incrementSucceeded();
          recordSizesLocked();
          changed.signalAll();
          return Optional.of(m);
        }
      }
      return Optional.empty();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Whether {@code message} (by identity) is pending or in flight. Waits for an in-progress
   * {@code process()} call to return first, since a message being sent may be about to
   * re-enter the pending set.
   *
   * @throws IllegalStateException if called from inside {@link DeliveryDelegate#process}
   */
  public boolean containsMessage(Message message) {
    if (message == null) {
      return false;
    }
    lock.lock();
    try {
      awaitSettledLocked();
      return inFlight.get(message.id()) == message || pending.contains(message);
    } finally {
      lock.unlock();
    }
  }

  // ── Inspection and tuning ───────────────────────────────────────

  /**
   * Visits the messages of one set under the queue lock, in order.
   */
  public void iterate(QueueScope scope, MessageVisitor visitor) {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(visitor, "visitor");
    lock.lock();
    try {
      Iterable<Message> source = switch (scope) {
        case ALL -> pending;
        case FILTER -> admissible;
        case SENT -> inFlight.values();
      };
      for (Message m : source) {
        if (!visitor.visit(m)) {
          break;
        }
      }
    } finally {
      lock.unlock();
    }
  }

  /** Number of messages waiting for dispatch, admissible or not. */
  public int pendingCount() {
    lock.lock();
    try {
      return pending.size();
    } finally {
      lock.unlock();
    }
  }

  public int admissibleCount() {
    lock.lock();
    try {
      return admissible.size();
    } finally {
      lock.unlock();
    }
  }

  public int inFlightCount() {
    lock.lock();
    try {
      return inFlight.size();
    } finally {
      lock.unlock();
    }
  }

  public int getMaxInFlight() {
    lock.lock();
    try {
      return maxInFlight;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Sets how many messages may await replies at once, throttling load on the server.
   *
   * @return {@code false} (and no change) if {@code max < 1}
   */
  public boolean setMaxInFlight(int max) {
    if (max < 1) {
      logger.warning("Ignoring maxInFlight=" + max);
      return false;
    }
    lock.lock();
    try {
      maxInFlight = max;
      changed.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  public int getTimeoutSecs() {
    lock.lock();
    try {
      return timeoutSecs;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Sets the reply timeout applied to messages dispatched from now on.
   *
   * @return {@code false} (and no change) if {@code secs < 1}
   */
  public boolean setTimeoutSecs(int secs) {
    if (secs < 1) {
      logger.warning("Ignoring timeoutSecs=" + secs);
      return false;
    }
    lock.lock();
    try {
      timeoutSecs = secs;
      changed.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  // ── Worker ──────────────────────────────────────────────────────

  private void workerLoop() {
    logger.info("Delivery queue worker started");
    List<Disposition> out = new ArrayList<>();
    try {
      while (true) {
        long delayMs;
        try {
          delayMs = step(out);
        } catch (RuntimeException e) {
          logger.log(Level.SEVERE, "Delivery queue loop error", e);
          delayMs = 0;
        }
        deliver(out);
        if (delayMs < 0) {
          break;
        }
        if (delayMs > 0) {
          pause(delayMs);
        }
      }
    } finally {
      lock.lock();
      try {
        state = QueueState.NOT_RUNNING;
        worker = null;
        current = null;
        changed.signalAll();
      } finally {
        lock.unlock();
      }
      logger.info("Delivery queue worker stopped");
    }
  }

  /**
   * One pass of the worker loop. Dispositions are collected into {@code out} for delivery
   * once the lock is released.
   *
   * @return pause in milliseconds before the next pass, or -1 to exit
   */
  private long step(List<Disposition> out) {
    Message msg;
    lock.lock();
    try {
      if (state == QueueState.CANCELING) {
        logger.info("Delivery queue canceling");
        return -1;
      }

      if (settleWaiters > 0) {
        // let callers blocked in awaitSettledLocked() act before the next dispatch
        awaitWorker(idleWaitNanos);
        return 0;
      }

      int sent = inFlight.size();
      if (sent >= maxInFlight) {
        logger.fine(() -> "Pausing dispatch for up to " + timeoutSecs
            + "s; in-flight set has " + sent + " messages");
        awaitWorker(TimeUnit.SECONDS.toNanos(timeoutSecs));
        // whether woken or timed out, expire stale replies so a full in-flight set drains
        scanTimeoutsLocked(out);
        return 0;
      }

      if (admissible.isEmpty()) {
        if (awaitWorker(idleWaitNanos) <= 0) {
          scanTimeoutsLocked(out);
        }
        if (logger.isLoggable(Level.FINEST)) {
          dumpPendingLocked();
        }
        return 0;
      }

      Iterator<Message> head = admissible.iterator();
      msg = head.next();
      head.remove();
      pending.remove(msg);

      if (msg.expectsReply()) {
        if (inFlight.containsKey(msg.id())) {
          logger.severe("Duplicate message id=" + idOf(msg) + " already in flight; dropping as invalid");
          msg.slot(MessageSlot.UNQUEUED);
          disposeLocked(msg, false, FailureReason.INVALID, out);
          return 0;
        }
        inFlight.put(msg.id(), msg);
        msg.slot(MessageSlot.IN_FLIGHT);
        msg.ensureTracker().startSeconds(timeoutSecs);
      } else {
        msg.slot(MessageSlot.PROCESSING);
      }
      recordSizesLocked();
      current = msg;
      state = QueueState.PROCESSING;
    } finally {
      lock.unlock();
    }

    ProcessResult result = invokeProcess(msg);

    lock.lock();
    try {
      current = null;
      if (state == QueueState.PROCESSING) {
        state = QueueState.RUNNING;
      } else {
        logger.severe("Queue state changed to " + state + " during message processing");
      }
      changed.signalAll();
      long delayMs = applyResultLocked(msg, result, out);
      recordSizesLocked();
      return delayMs;
    } finally {
      lock.unlock();
    }
  }

  private ProcessResult invokeProcess(Message msg) {
    logger.finest(() -> "Dispatching message id=" + idOf(msg));
    metrics.incrementDispatched();
    long start = System.nanoTime();
    try {
      ProcessResult result = delegate.process(msg);
      if (result == null) {
        logger.warning("process() returned null for message id=" + idOf(msg) + "; treating as invalid");
        return ProcessResult.INVALID;
      }
      return result;
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "process() failed for message id=" + idOf(msg)
          + "; treating as send failure", e);
      return ProcessResult.SEND_FAILURE;
    } finally {
      metrics.recordProcessDurationMs(
          TimeUnit.NANOSECONDS.toMillis(Math.max(0L, System.nanoTime() - start)));
    }
  }

  /**
   * Routes a {@code process()} result. Lock held.
   *
   * @return pause in milliseconds before the next pass
   */
  private long applyResultLocked(Message msg, ProcessResult result, List<Disposition> out) {
    boolean expectsReply = msg.expectsReply();
    if (expectsReply && msg.slot() != MessageSlot.IN_FLIGHT) {
      // a reply completed the message while process() ran; the reply handler owns it now
      logger.fine(() -> "Message id=" + idOf(msg) + " was completed during processing ("
          + result + "); leaving disposition to the reply handler");
      return 0;
    }

    switch (result) {
      case SUCCESS -> {
        if (!expectsReply) {
          disposeLocked(msg, true, FailureReason.NONE, out);
        }
        return 0;
      }
      case SUCCESS_HANDLED -> {
        disposeLocked(msg, true, FailureReason.NONE, out);
        return 0;
      }
      case INVALID -> {
        logger.severe("Unable to process message id=" + idOf(msg) + "; dropping it as invalid");
        disposeLocked(msg, false, FailureReason.INVALID, out);
        return 0;
      }
      case SEND_FAILURE -> {
        detachLocked(msg);
        int errors = msg.incrementErrorCount();
        if (errors > msg.numRetries()) {
          logger.warning("Message id=" + idOf(msg) + " failed to send; not requeuing since errors exceed retries of "
              + msg.numRetries());
          disposeLocked(msg, false, FailureReason.RETRY_MAX, out);
          return 0;
        }
        logger.warning("Unable to send message id=" + idOf(msg) + "; requeuing (attempt "
            + errors + " of " + (msg.numRetries() + 1) + ")");
        metrics.incrementRetried(FailureReason.SEND);
        requeueLocked(msg);
        return retryPolicy.computeDelayMs(errors);
      }
      case DELAY_SEND -> {
        detachLocked(msg);
        logger.warning("Unable to send message id=" + idOf(msg) + " as it depends on request id="
            + Long.toUnsignedString(msg.requestId()) + "; requeuing");
        requeueLocked(msg);
        return retryPolicy.computeDelayMs(msg.errorCount());
      }
      default -> throw new IllegalStateException("Unhandled process result: " + result);
    }
  }

  /**
   * Expires in-flight messages whose reply wait ran out: requeues those with budget left and
   * drops the rest with {@link FailureReason#RETRY_MAX}. Lock held.
   */
  private void scanTimeoutsLocked(List<Disposition> out) {
    if (inFlight.isEmpty()) {
      return;
    }
    logger.finest(() -> "Checking " + inFlight.size() + " in-flight messages for expired replies");
    List<Message> expired = new ArrayList<>();
    List<Message> corrupt = new ArrayList<>();
    for (Message m : inFlight.values()) {
      TimeTracker tracker = m.tracker();
      if (tracker == null || !tracker.isRunning()) {
        corrupt.add(m);
      } else if (tracker.isExpired()) {
        expired.add(m);
      }
    }

    for (Message m : corrupt) {
      logger.severe("Message id=" + idOf(m)
          + " is in flight without a running timer; dropping it as probably corrupt");
      disposeLocked(m, false, FailureReason.INVALID, out);
    }

    for (Message m : expired) {
      detachLocked(m);
      m.markSentOnce();
      int errors = m.incrementErrorCount();
      if (errors <= m.numRetries()) {
        logger.info("Message id=" + idOf(m) + " expired waiting on reply; requeuing (attempt "
            + errors + " of " + m.numRetries() + ")");
        metrics.incrementRetried(FailureReason.TIMEOUT);
        requeueLocked(m);
      } else {
        logger.warning("Message id=" + idOf(m)
            + " expired waiting on reply; not requeuing since errors exceed retries of " + m.numRetries());
        disposeLocked(m, false, FailureReason.RETRY_MAX, out);
      }
    }
    if (!expired.isEmpty() || !corrupt.isEmpty()) {
      recordSizesLocked();
    }
  }

  private void pause(long delayMs) {
    lock.lock();
    try {
      long remaining = TimeUnit.MILLISECONDS.toNanos(delayMs);
      while (remaining > 0 && state != QueueState.CANCELING) {
        remaining = awaitWorker(remaining);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Worker-side bounded wait. An interrupt stops the worker. Lock held.
   *
   * @return remaining nanoseconds, &le; 0 if the wait timed out
   */
  private long awaitWorker(long nanos) {
    try {
      return changed.awaitNanos(nanos);
    } catch (InterruptedException e) {
      logger.warning("Delivery queue worker interrupted; stopping");
      if (state == QueueState.RUNNING) {
        state = QueueState.CANCELING;
      }
      return 0;
    }
  }

  /**
   * Blocks until the worker is not inside {@code process()}. Lock held. While any caller
   * waits here the worker holds off dispatching the next message, so waiters are not
   * starved by back-to-back sends.
   */
  private void awaitSettledLocked() {
    if (state == QueueState.PROCESSING && Thread.currentThread() == worker) {
      throw new IllegalStateException("Delivery queue must not be called from inside process()");
    }
    if (state != QueueState.PROCESSING) {
      return;
    }
    boolean interrupted = false;
    settleWaiters++;
    try {
      while (state == QueueState.PROCESSING) {
        try {
          if (changed.awaitNanos(settleWarnNanos) <= 0 && state == QueueState.PROCESSING) {
            logger.warning("Waiting for queue to finish processing message "
                + (current == null ? "?" : idOf(current)));
          }
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
    } finally {
      if (--settleWaiters == 0) {
        changed.signalAll();
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  // ── Slot bookkeeping (lock held) ────────────────────────────────

  /**
   * Places an unqueued message in the pending set, and in the admissible set if it passes
   * the filter.
   *
   * @return whether the message is admissible
   */
  private boolean enqueueLocked(Message m) {
    pending.add(m);
    if (passesFilter(m)) {
      admissible.add(m);
      m.slot(MessageSlot.ADMISSIBLE);
      return true;
    }
    m.slot(MessageSlot.PENDING);
    return false;
  }

  private void requeueLocked(Message m) {
    m.slot(MessageSlot.UNQUEUED);
    enqueueLocked(m);
  }

  /**
   * Takes a message out of whichever set its slot says it is in and stops its timer. Leaves
   * the message {@link MessageSlot#UNQUEUED}.
   */
  private void detachLocked(Message m) {
    switch (m.slot()) {
      case ADMISSIBLE -> {
        admissible.remove(m);
        pending.remove(m);
      }
      case PENDING -> pending.remove(m);
      case IN_FLIGHT -> inFlight.remove(m.id(), m);
      default -> {
      }
    }
    TimeTracker tracker = m.tracker();
    if (tracker != null) {
      tracker.stop();
    }
    m.slot(MessageSlot.UNQUEUED);
  }

  private void disposeLocked(Message m, boolean success, FailureReason reason, List<Disposition> out) {
    detachLocked(m);
    m.slot(MessageSlot.RELEASED);
    if (success) {
      metrics.incrementSucceeded();
    } else {
      metrics.incrementFailed(reason);
    }
    out.add(new Disposition(m, success, reason));
  }

  private void recordSizesLocked() {
    metrics.recordSetSizes(pending.size(), admissible.size(), inFlight.size());
  }

  private void dumpPendingLocked() {
    logger.finest("queue-dump: pending count=" + pending.size() + " <START>");
    for (Message m : pending) {
      logger.finest("queue-dump: " + m);
    }
    logger.finest("queue-dump: <END>");
  }

  // ── Delegate calls ──────────────────────────────────────────────

  private boolean passesFilter(Message m) {
    try {
      return delegate.filter(m);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "filter() failed for message id=" + idOf(m) + "; holding it back", e);
      return false;
    }
  }

  private boolean allowsRemoval(Message m, Object payload) {
    try {
      return delegate.canBeRemovedFromSentQueue(m, payload);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Removal check failed for message id=" + idOf(m) + "; ignoring reply", e);
      return false;
    }
  }

  private void deliver(List<Disposition> out) {
    for (Disposition d : out) {
      try {
        delegate.notify(d.message(), d.success(), d.reason());
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "notify() failed for message id=" + idOf(d.message()), e);
      }
    }
    out.clear();
  }

  private static String idOf(Message m) {
    return Long.toUnsignedString(m.id());
  }

  private record Disposition(Message message, boolean success, FailureReason reason) {
  }

  /** Builder for {@link DeliveryQueue}. */
  public static final class Builder {
    private final DeliveryDelegate delegate;
    private int maxInFlight = 1;
    private int timeoutSecs = 30;
    private long idleWaitSecs = 30;
    private long settleWarnIntervalSecs = 5;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private String threadNamePrefix = "courier-queue-";

    private Builder(DeliveryDelegate delegate) {
      this.delegate = delegate;
    }

    /**
     * Sets how many messages may await replies at once.
     *
     * <p>Optional. Defaults to {@code 1}. Values below 1 are raised to 1.
     *
     * @param maxInFlight concurrent reply waits
     * @return this builder
     */
    public Builder maxInFlight(int maxInFlight) {
      this.maxInFlight = maxInFlight;
      return this;
    }

    /**
     * Sets the reply timeout.
     *
     * <p>Optional. Defaults to {@code 30} seconds. Values below 1 are raised to 1.
     *
     * @param timeoutSecs reply timeout in seconds
     * @return this builder
     */
    public Builder timeoutSecs(int timeoutSecs) {
      this.timeoutSecs = timeoutSecs;
      return this;
    }

    /**
     * Sets how long an idle worker waits for work before checking in-flight messages for
     * expired replies.
     *
     * <p>Optional. Defaults to {@code 30} seconds. Must be &gt; 0.
     *
     * @param idleWaitSecs idle wait in seconds
     * @return this builder
     */
    public Builder idleWaitSecs(long idleWaitSecs) {
      this.idleWaitSecs = idleWaitSecs;
      return this;
    }

    /**
     * Sets how often a caller blocked behind an in-progress {@code process()} call logs a
     * warning.
     *
     * <p>Optional. Defaults to {@code 5} seconds. Must be &gt; 0.
     *
     * @param settleWarnIntervalSecs warning interval in seconds
     * @return this builder
     */
    public Builder settleWarnIntervalSecs(long settleWarnIntervalSecs) {
      this.settleWarnIntervalSecs = settleWarnIntervalSecs;
      return this;
    }

    /**
     * Sets the pause taken after a message is requeued.
     *
     * <p>Optional. Defaults to {@link RetryPolicy#defaultPolicy()} (250 ms).
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the worker thread name prefix.
     *
     * <p>Optional. Defaults to {@code "courier-queue-"}.
     *
     * @param threadNamePrefix thread name prefix
     * @return this builder
     */
    public Builder threadNamePrefix(String threadNamePrefix) {
      this.threadNamePrefix = threadNamePrefix;
      return this;
    }

    /**
     * Builds a stopped queue. Call {@link DeliveryQueue#startWorker()} to begin dispatching.
     *
     * @return a new {@link DeliveryQueue}
     * @throws NullPointerException     if {@code delegate} or {@code threadNamePrefix} is null
     * @throws IllegalArgumentException if {@code idleWaitSecs} or {@code settleWarnIntervalSecs}
     *                                  is not positive
     */
    public DeliveryQueue build() {
      return new DeliveryQueue(this);
    }
  }
}
