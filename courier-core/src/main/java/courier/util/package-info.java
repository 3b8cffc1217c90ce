/**
 * Internal helpers: daemon thread factory and the monotonic reply-timeout tracker.
 */
package courier.util;
