package courier.spring.boot;

import courier.DeliveryDelegate;
import courier.DeliveryQueue;
import courier.retry.ExponentialBackoffRetryPolicy;
import courier.retry.FixedDelayRetryPolicy;
import courier.retry.RetryPolicy;
import courier.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.logging.Logger;

/**
 * Auto-configuration for the delivery queue.
 *
 * <p>Builds a {@link DeliveryQueue} around the application's {@link DeliveryDelegate} bean
 * from {@link CourierProperties}, and starts its worker unless
 * {@code courier.queue.auto-start} is false. The queue is closed with the context, which
 * stops the worker and removes any queued messages.
 *
 * @see CourierProperties
 * @see CourierMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(DeliveryQueue.class)
@ConditionalOnBean(DeliveryDelegate.class)
@EnableConfigurationProperties(CourierProperties.class)
public class CourierAutoConfiguration {
  private static final Logger logger = Logger.getLogger(CourierAutoConfiguration.class.getName());

  @Bean
  @ConditionalOnMissingBean
  public RetryPolicy courierRetryPolicy(CourierProperties props) {
    CourierProperties.Retry retry = props.getRetry();
    return switch (retry.getStrategy()) {
      case FIXED -> new FixedDelayRetryPolicy(retry.getDelayMs());
      case EXPONENTIAL -> new ExponentialBackoffRetryPolicy(retry.getDelayMs(), retry.getMaxDelayMs());
    };
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public DeliveryQueue deliveryQueue(CourierProperties props,
      DeliveryDelegate delegate,
      RetryPolicy retryPolicy,
      ObjectProvider<MetricsExporter> metricsProvider) {

    CourierProperties.Queue q = props.getQueue();
    var builder = DeliveryQueue.builder(delegate)
        .maxInFlight(q.getMaxInFlight())
        .timeoutSecs(q.getTimeoutSecs())
        .idleWaitSecs(q.getIdleWaitSecs())
        .retryPolicy(retryPolicy);
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    DeliveryQueue queue = builder.build();
    if (q.isAutoStart()) {
      queue.startWorker();
    } else {
      logger.info("courier.queue.auto-start is false; call DeliveryQueue.startWorker() to begin delivery");
    }
    return queue;
  }
}
