/**
 * Pause strategies applied by the delivery queue worker after a message is requeued.
 *
 * @see courier.retry.RetryPolicy
 */
package courier.retry;
