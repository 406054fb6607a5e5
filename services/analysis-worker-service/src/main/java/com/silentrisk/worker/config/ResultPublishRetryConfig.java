package com.silentrisk.worker.config;

import com.silentrisk.common.config.SilentRiskProperties;
import com.silentrisk.common.error.UpstreamUnavailableException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Bounded retry for the terminal result publish. Losing that write would leave
 * consumers of the result topic without an outcome for the task.
 */
@Slf4j
@Configuration
public class ResultPublishRetryConfig {

    public static final String RESULT_PUBLISH = "resultPublish";

    @Bean
    public Retry resultPublishRetry(RetryRegistry retryRegistry, SilentRiskProperties properties) {
        SilentRiskProperties.ResultPublish settings = properties.getResultPublish();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(settings.getInitialBackoff(), 2.0))
                .retryExceptions(UpstreamUnavailableException.class)
                .build();

        Retry retry = retryRegistry.retry(RESULT_PUBLISH, config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying result publish: attempt={}, error={}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "n/a"));
        log.info("Registered retry: {} (maxAttempts={}, initialBackoff={})",
                RESULT_PUBLISH, settings.getMaxAttempts(), settings.getInitialBackoff());
        return retry;
    }
}
