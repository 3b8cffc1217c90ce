package courier.spi;

import courier.FailureReason;

/**
 * Observability hook for exporting delivery-queue counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implementations are called
 * from the queue's worker thread and from caller threads, sometimes while the queue lock is
 * held, so they must be thread-safe and must not block.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of messages accepted by {@code append}.
   */
  void incrementAppended();

  /**
   * Increments the count of messages handed to the delegate's {@code process}.
   */
  void incrementDispatched();

  /**
   * Increments the count of messages that ended successfully: notified with success, or
   * completed by a reply.
   */
  void incrementSucceeded();

  /**
   * Increments the count of failed attempts that were requeued for another try.
   *
   * @param reason {@link FailureReason#SEND} or {@link FailureReason#TIMEOUT}
   */
  void incrementRetried(FailureReason reason);

  /**
   * Increments the count of messages that ended in failure.
   *
   * @param reason {@link FailureReason#INVALID}, {@link FailureReason#RETRY_MAX} or
   *               {@link FailureReason#REMOVE}
   */
  void incrementFailed(FailureReason reason);

  /**
   * Records the current size of the queue's three sets.
   *
   * @param pending    messages waiting for dispatch
   * @param admissible pending messages passing the filter
   * @param inFlight   messages awaiting a reply
   */
  void recordSetSizes(int pending, int admissible, int inFlight);

  /**
   * Records the time spent inside a single {@code process} call.
   *
   * @param durationMs elapsed milliseconds (always non-negative)
   */
  default void recordProcessDurationMs(long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementAppended() {
    }

    @Override
    public void incrementDispatched() {
    }

    @Override
    public void incrementSucceeded() {
    }

    @Override
    public void incrementRetried(FailureReason reason) {
    }

    @Override
    public void incrementFailed(FailureReason reason) {
    }

    @Override
    public void recordSetSizes(int pending, int admissible, int inFlight) {
    }
  }
}
