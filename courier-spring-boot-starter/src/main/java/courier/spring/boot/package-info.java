/**
 * Spring Boot auto-configuration for courier.
 *
 * <p>Declare a {@link courier.DeliveryDelegate} bean (usually a
 * {@link courier.channel.CallbackDelegate} subclass) and inject the
 * {@link courier.DeliveryQueue} bean. Settings bind from the {@code courier.*} namespace; see
 * {@link courier.spring.boot.CourierProperties}.
 */
package courier.spring.boot;
