package courier.demo;

import courier.Message;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Walks a {@link SampleChannel} through a broadband outage.
 *
 * <p>Run with: {@code mvn -pl samples/courier-demo exec:java}
 */
public final class CourierDemo {

  private CourierDemo() {
  }

  public static void main(String[] args) throws Exception {
    int total = 4;
    CountDownLatch done = new CountDownLatch(total);
    AtomicInteger delivered = new AtomicInteger();

    try (SampleChannel channel = SampleChannel.open(2, 5, 100)) {
      // 1. Queue events while offline; nothing is admissible yet
      for (int i = 1; i <= total; i++) {
        int mask = i % 2 == 0 ? SampleChannel.NETWORK_BROADBAND : SampleChannel.NETWORK_ANY;
        channel.request(Message.builder(i)
            .deliveryMask(mask)
            .expectsReply(true)
            .payload("{\"event\":\"sensorFault\",\"seq\":" + i + "}")
            .onSuccess(m -> {
              System.out.println("[Demo] Delivered message " + m.id());
              delivered.incrementAndGet();
              done.countDown();
            })
            .onFailure(m -> {
              System.out.println("[Demo] Gave up on message " + m.id());
              done.countDown();
            })
            .build());
      }
      System.out.println("[Demo] Offline: pending=" + channel.queue().pendingCount()
          + " admissible=" + channel.queue().admissibleCount());

      // 2. Cellular comes up: only messages allowed on any network go out
      channel.connect(true);
      Thread.sleep(500);
      System.out.println("[Demo] Cellular: pending=" + channel.queue().pendingCount());

      // 3. Broadband restored: the rest follow
      channel.connect(false);

      if (!done.await(10, TimeUnit.SECONDS)) {
        System.out.println("[Demo] Timed out waiting for deliveries");
      }
      System.out.println("[Demo] Delivered " + delivered.get() + " of " + total);
    }
  }
}
