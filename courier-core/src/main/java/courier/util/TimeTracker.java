package courier.util;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Restartable deadline measured on a monotonic clock.
 *
 * <p>A tracker is either stopped or running towards a deadline. {@link #isExpired()} is only
 * ever {@code true} while running. Methods are synchronized; a tracker is normally touched
 * under its owning queue's lock but may be read for diagnostics from any thread.
 */
public final class TimeTracker {
  private final LongSupplier nanoClock;

  private boolean started;
  private boolean running;
  private long startedAtNanos;
  private long durationNanos;
  private long stoppedAtNanos;

  public TimeTracker() {
    this(System::nanoTime);
  }

  /**
   * @param nanoClock monotonic nanosecond source, replaceable for tests
   */
  public TimeTracker(LongSupplier nanoClock) {
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
  }

  /**
   * (Re)starts the tracker with a deadline {@code timeout} from now.
   */
  public synchronized void start(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be >= 0, got: " + timeout);
    }
    this.startedAtNanos = nanoClock.getAsLong();
    this.durationNanos = timeout.toNanos();
    this.running = true;
    this.started = true;
  }

  public void startSeconds(long seconds) {
    start(Duration.ofSeconds(seconds));
  }

  public synchronized void stop() {
    if (running) {
      stoppedAtNanos = nanoClock.getAsLong();
      running = false;
    }
  }

  public synchronized boolean isRunning() {
    return running;
  }

  public synchronized boolean isExpired() {
    return running && nanoClock.getAsLong() - startedAtNanos >= durationNanos;
  }

  /**
   * Seconds elapsed since the last start, up to the stop time if stopped. Zero if never
   * started.
   */
  public synchronized long elapsedSeconds() {
    if (!started) {
      return 0L;
    }
    long end = running ? nanoClock.getAsLong() : stoppedAtNanos;
    return TimeUnit.NANOSECONDS.toSeconds(Math.max(0L, end - startedAtNanos));
  }

  @Override
  public synchronized String toString() {
    return "TimeTracker{running=" + running + ", elapsedSecs=" + elapsedSeconds()
        + ", timeoutSecs=" + TimeUnit.NANOSECONDS.toSeconds(durationNanos) + '}';
  }
}
