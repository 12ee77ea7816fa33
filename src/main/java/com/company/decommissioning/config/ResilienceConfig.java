package com.company.decommissioning.config;

import com.company.decommissioning.exception.DeliveryException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Bounded exponential-backoff retry shared by webhook and issue-tracker delivery, and
 * the time limit on metric-source fetches.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    public static final String DELIVERY_RETRY = "decommissioningDelivery";
    public static final String METRIC_FETCH_TIME_LIMITER = "metricFetch";

    @Bean
    public Retry deliveryRetry(RetryRegistry retryRegistry, DecommissioningProperties properties) {
        RetryConfig config = deliveryRetryConfig(properties.getWebhook());
        Retry retry = retryRegistry.retry(DELIVERY_RETRY, config);

        retry.getEventPublisher().onRetry(event ->
                log.warn("Delivery attempt {} failed, retrying in {}ms: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));

        log.info("Delivery retry configured: maxAttempts={}, initialBackoff={}",
                config.getMaxAttempts(), properties.getWebhook().getInitialBackoff());
        return retry;
    }

    public static RetryConfig deliveryRetryConfig(DecommissioningProperties.Webhook webhook) {
        return RetryConfig.custom()
                .maxAttempts(webhook.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        webhook.getInitialBackoff(),
                        webhook.getBackoffMultiplier(),
                        webhook.getMaxBackoff()))
                .retryExceptions(DeliveryException.class)
                .build();
    }

    @Bean
    public TimeLimiter metricFetchTimeLimiter(TimeLimiterRegistry timeLimiterRegistry,
                                             DecommissioningProperties properties) {
        TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(METRIC_FETCH_TIME_LIMITER,
                metricFetchTimeLimiterConfig(properties.getMetricSource()));

        log.info("Metric fetch time limiter configured: timeout={}", properties.getMetricSource().getTimeout());
        return timeLimiter;
    }

    public static TimeLimiterConfig metricFetchTimeLimiterConfig(DecommissioningProperties.MetricSource metricSource) {
        return TimeLimiterConfig.custom()
                .timeoutDuration(metricSource.getTimeout())
                .cancelRunningFuture(true)
                .build();
    }
}
