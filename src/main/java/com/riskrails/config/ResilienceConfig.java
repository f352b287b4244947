package com.riskrails.config;

import com.riskrails.exception.VenueException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Retry policy for venue calls.
 *
 * <p>Only {@link VenueException}s flagged retryable (rate limited, temporarily banned) are
 * retried. The wait grows linearly: {@code base x attempt}, so with the defaults the waits
 * are 0.5s then 1s across three attempts. Everything else fails on the first attempt.
 */
@Configuration
public class ResilienceConfig {

    public static final String VENUE_RETRY = "venueCalls";

    @Bean
    public Retry venueRetry(RetryRegistry retryRegistry, ExecutionProperties executionProperties) {
        ExecutionProperties.Retry settings = executionProperties.getRetry();
        return retryRegistry.retry(VENUE_RETRY, venueRetryConfig(settings.getMaxAttempts(), settings.getBackoffBase()));
    }

    public static RetryConfig venueRetryConfig(int maxAttempts, Duration backoffBase) {
        long baseMillis = backoffBase.toMillis();
        IntervalFunction linear = attempt -> baseMillis * attempt;
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(linear)
                .retryOnException(e -> e instanceof VenueException venueException && venueException.isRetryable())
                .build();
    }
}
