package com.riskrails.unit.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.riskrails.config.ResilienceConfig;
import com.riskrails.exception.VenueErrorType;
import com.riskrails.exception.VenueException;
import io.github.resilience4j.core.IntervalBiFunction;
import io.github.resilience4j.core.functions.Either;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the venue retry policy: linear backoff and which failures are retried.
 */
class ResilienceConfigTest {

    private static final VenueException RATE_LIMITED =
            new VenueException("BINANCE", VenueErrorType.RATE_LIMITED, 429, "slow down");

    @Test
    @DisplayName("Backoff grows linearly: base x attempt")
    void linearBackoff() {
        RetryConfig config = ResilienceConfig.venueRetryConfig(3, Duration.ofMillis(500));
        IntervalBiFunction<Object> interval = config.getIntervalBiFunction();

        assertThat(config.getMaxAttempts()).isEqualTo(3);
        assertThat(interval.apply(1, Either.left(RATE_LIMITED))).isEqualTo(500L);
        assertThat(interval.apply(2, Either.left(RATE_LIMITED))).isEqualTo(1000L);
    }

    @Test
    @DisplayName("Only retryable venue failures are retried")
    void retriesOnlyRetryableVenueFailures() {
        RetryConfig config = ResilienceConfig.venueRetryConfig(3, Duration.ofMillis(500));

        assertThat(config.getExceptionPredicate().test(RATE_LIMITED)).isTrue();
        assertThat(config.getExceptionPredicate().test(
                new VenueException("BINANCE", VenueErrorType.TEMPORARILY_BANNED, 418, "banned"))).isTrue();
        assertThat(config.getExceptionPredicate().test(
                new VenueException("BINANCE", VenueErrorType.REJECTED, 400, "bad qty"))).isFalse();
        assertThat(config.getExceptionPredicate().test(new IllegalStateException("bug"))).isFalse();
    }
}
