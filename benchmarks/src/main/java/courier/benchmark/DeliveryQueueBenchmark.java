package courier.benchmark;

import courier.DeliveryDelegate;
import courier.DeliveryQueue;
import courier.FailureReason;
import courier.Message;
import courier.ProcessResult;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Measures queue round trips with a delegate that sends instantly.
 *
 * <ul>
 *   <li>{@code appendToNotify}: append -> dispatch -> success notification</li>
 *   <li>{@code appendToReply}: append -> dispatch -> {@code completed()} by the caller</li>
 * </ul>
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar DeliveryQueueBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class DeliveryQueueBenchmark {

  @Param({"1", "16"})
  private int maxInFlight;

  private DeliveryQueue queue;
  private final AtomicLong ids = new AtomicLong();
  private final AtomicReference<CountDownLatch> latchRef = new AtomicReference<>();

  @Setup(Level.Trial)
  public void setup() {
    queue = DeliveryQueue.builder(new LatchDelegate())
        .maxInFlight(maxInFlight)
        .build();
    queue.startWorker();
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    queue.close();
  }

  @Benchmark
  public void appendToNotify() throws Exception {
    CountDownLatch latch = new CountDownLatch(1);
    latchRef.set(latch);

    queue.append(Message.create(ids.incrementAndGet()));

    latch.await(5, TimeUnit.SECONDS);
  }

  @Benchmark
  public Object appendToReply() throws Exception {
    CountDownLatch latch = new CountDownLatch(1);
    latchRef.set(latch);
    long id = ids.incrementAndGet();

    queue.append(Message.builder(id).expectsReply(true).build());
    latch.await(5, TimeUnit.SECONDS);

    return queue.completed(id, "ack").orElse(null);
  }

  private final class LatchDelegate implements DeliveryDelegate {
    @Override
    public boolean filter(Message message) {
      return true;
    }

    @Override
    public ProcessResult process(Message message) {
      if (message.expectsReply()) {
        countDown();
      }
      return ProcessResult.SUCCESS;
    }

    @Override
    public void notify(Message message, boolean success, FailureReason reason) {
      message.destroy();
      countDown();
    }

    private void countDown() {
      CountDownLatch latch = latchRef.get();
      if (latch != null) latch.countDown();
    }
  }
}
