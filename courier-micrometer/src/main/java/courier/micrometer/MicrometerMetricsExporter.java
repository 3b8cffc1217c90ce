package courier.micrometer;

import courier.FailureReason;
import courier.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, gauges and a timer with a {@link MeterRegistry}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code courier.messages.appended}: messages accepted by {@code append}</li>
 *   <li>{@code courier.messages.dispatched}: {@code process} calls</li>
 *   <li>{@code courier.messages.succeeded}: messages that ended successfully</li>
 *   <li>{@code courier.messages.retried}: attempts requeued, tagged {@code reason=send|timeout}</li>
 *   <li>{@code courier.messages.failed}: messages that ended in failure, tagged
 *       {@code reason=invalid|retry_max|remove}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code courier.queue.pending}: messages waiting for dispatch</li>
 *   <li>{@code courier.queue.admissible}: pending messages passing the filter</li>
 *   <li>{@code courier.queue.in.flight}: messages awaiting a reply</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code courier.process.duration}: time spent inside {@code process}</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private static final List<FailureReason> RETRY_REASONS =
      List.of(FailureReason.SEND, FailureReason.TIMEOUT);
  private static final List<FailureReason> FAILURE_REASONS =
      List.of(FailureReason.INVALID, FailureReason.RETRY_MAX, FailureReason.REMOVE);

  private final MeterRegistry registry;
  private final Counter appended;
  private final Counter dispatched;
  private final Counter succeeded;
  private final Map<FailureReason, Counter> retried = new EnumMap<>(FailureReason.class);
  private final Map<FailureReason, Counter> failed = new EnumMap<>(FailureReason.class);
  private final Timer processDuration;
  private final List<Meter> meters = new ArrayList<>();

  private final AtomicInteger pending = new AtomicInteger();
  private final AtomicInteger admissible = new AtomicInteger();
  private final AtomicInteger inFlight = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "courier"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "courier");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for processes that run more than
   * one queue.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "cloud.courier"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.appended = register(Counter.builder(namePrefix + ".messages.appended")
        .description("Messages accepted by append")
        .register(registry));
    this.dispatched = register(Counter.builder(namePrefix + ".messages.dispatched")
        .description("Messages handed to the delegate for sending")
        .register(registry));
    this.succeeded = register(Counter.builder(namePrefix + ".messages.succeeded")
        .description("Messages delivered successfully")
        .register(registry));
    for (FailureReason reason : RETRY_REASONS) {
      retried.put(reason, register(Counter.builder(namePrefix + ".messages.retried")
          .description("Failed attempts requeued for another try")
          .tag("reason", tagValue(reason))
          .register(registry)));
    }
    for (FailureReason reason : FAILURE_REASONS) {
      failed.put(reason, register(Counter.builder(namePrefix + ".messages.failed")
          .description("Messages that ended in failure")
          .tag("reason", tagValue(reason))
          .register(registry)));
    }
    this.processDuration = register(Timer.builder(namePrefix + ".process.duration")
        .description("Time spent sending a single message")
        .register(registry));

    register(Gauge.builder(namePrefix + ".queue.pending", pending, AtomicInteger::get)
        .register(registry));
    register(Gauge.builder(namePrefix + ".queue.admissible", admissible, AtomicInteger::get)
        .register(registry));
    register(Gauge.builder(namePrefix + ".queue.in.flight", inFlight, AtomicInteger::get)
        .register(registry));
  }

  @Override
  public void incrementAppended() {
    if (closed) return;
    appended.increment();
  }

  @Override
  public void incrementDispatched() {
    if (closed) return;
    dispatched.increment();
  }

  @Override
  public void incrementSucceeded() {
    if (closed) return;
    succeeded.increment();
  }

  @Override
  public void incrementRetried(FailureReason reason) {
    if (closed) return;
    Counter counter = retried.get(reason);
    if (counter != null) {
      counter.increment();
    }
  }

  @Override
  public void incrementFailed(FailureReason reason) {
    if (closed) return;
    Counter counter = failed.get(reason);
    if (counter != null) {
      counter.increment();
    }
  }

  @Override
  public void recordSetSizes(int pending, int admissible, int inFlight) {
    if (closed) return;
    this.pending.set(pending);
    this.admissible.set(admissible);
    this.inFlight.set(inFlight);
  }

  @Override
  public void recordProcessDurationMs(long durationMs) {
    if (closed) return;
    processDuration.record(Duration.ofMillis(durationMs));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link courier.DeliveryQueue} is closed) to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }

  private <M extends Meter> M register(M meter) {
    meters.add(meter);
    return meter;
  }

  private static String tagValue(FailureReason reason) {
    return reason.name().toLowerCase(Locale.ROOT);
  }
}
