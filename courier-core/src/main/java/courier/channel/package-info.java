/**
 * Reusable {@link courier.DeliveryDelegate} bases for concrete channels.
 */
package courier.channel;
