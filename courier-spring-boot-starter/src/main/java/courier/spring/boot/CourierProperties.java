package courier.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the auto-configured delivery queue.
 *
 * @see CourierAutoConfiguration
 */
@ConfigurationProperties(prefix = "courier")
public class CourierProperties {

    private final Queue queue = new Queue();
    private final Retry retry = new Retry();
    private final Metrics metrics = new Metrics();

    public Queue getQueue() {
        return queue;
    }

    public Retry getRetry() {
        return retry;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum RetryStrategy {
        FIXED,
        EXPONENTIAL
    }

    public static class Queue {
        /**
         * Messages allowed to await a reply at the same time.
         */
        private int maxInFlight = 1;

        /**
         * Seconds to wait for a reply before a message is retried.
         */
        private int timeoutSecs = 30;

        /**
         * Seconds an idle worker waits before checking for expired replies.
         */
        private long idleWaitSecs = 30;

        /**
         * Whether to start the worker when the queue bean is created.
         */
        private boolean autoStart = true;

        public int getMaxInFlight() {
            return maxInFlight;
        }

        public void setMaxInFlight(int maxInFlight) {
            this.maxInFlight = maxInFlight;
        }

        public int getTimeoutSecs() {
            return timeoutSecs;
        }

        public void setTimeoutSecs(int timeoutSecs) {
            this.timeoutSecs = timeoutSecs;
        }

        public long getIdleWaitSecs() {
            return idleWaitSecs;
        }

        public void setIdleWaitSecs(long idleWaitSecs) {
            this.idleWaitSecs = idleWaitSecs;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }
    }

    public static class Retry {
        private RetryStrategy strategy = RetryStrategy.FIXED;
        private long delayMs = 250;
        private long maxDelayMs = 30000;

        public RetryStrategy getStrategy() {
            return strategy;
        }

        public void setStrategy(RetryStrategy strategy) {
            this.strategy = strategy;
        }

        public long getDelayMs() {
            return delayMs;
        }

        public void setDelayMs(long delayMs) {
            this.delayMs = delayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "courier";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
