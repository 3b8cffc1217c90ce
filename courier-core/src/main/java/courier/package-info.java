/**
 * Root API for courier, a reliable outbound message queue for gateways that talk to a
 * server over an unreliable, rate-limited link.
 *
 * <h2>Core Design</h2>
 * <p>Producers {@linkplain courier.DeliveryQueue#append append} {@link courier.Message}s. A
 * single worker thread dispatches the messages that pass the delegate's
 * {@linkplain courier.DeliveryDelegate#filter filter} to
 * {@link courier.DeliveryDelegate#process}, with no lock held. Messages that expect a reply
 * wait in a bounded in-flight set until a receive thread
 * {@linkplain courier.DeliveryQueue#completed completes} them or their timeout expires.
 * Failed sends and expired replies are retried up to each message's retry budget; the
 * pause between attempts comes from a {@linkplain courier.retry.RetryPolicy retry policy}.
 *
 * <p>Every message ends in exactly one disposition: a
 * {@linkplain courier.DeliveryDelegate#notify notification} to the delegate, or ownership
 * handed back to the caller of {@code completed}.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>courier-core</b>: message model, queue engine, retry policies, metrics SPI (zero external deps)</li>
 *   <li><b>courier-micrometer</b>: Micrometer bridge for {@link courier.spi.MetricsExporter}</li>
 *   <li><b>courier-spring-boot-starter</b>: auto-configured queue bean and properties</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (DeliveryQueue queue = DeliveryQueue.builder(channel)
 *     .maxInFlight(4)
 *     .timeoutSecs(30)
 *     .build()) {
 *   queue.startWorker();
 *   queue.append(Message.builder(42L)
 *       .expectsReply(true)
 *       .numRetries(Message.DEFAULT_MAX_RETRIES)
 *       .payload(json)
 *       .build());
 *   // on the receive thread:
 *   channel.handleReply(queue, 42L, reply);
 * }
 * }</pre>
 *
 * @see courier.DeliveryQueue
 * @see courier.DeliveryDelegate
 * @see courier.channel.CallbackDelegate
 */
package courier;
