package com.riskrails.execution;

import com.riskrails.exception.ExecutionFailedException;
import com.riskrails.exception.VenueException;
import com.riskrails.risk.VenueHealthMonitor;
import io.github.resilience4j.retry.Retry;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs venue calls under the shared venue {@link Retry} and reports every attempt's outcome
 * to the {@link VenueHealthMonitor}.
 *
 * <p>A {@link VenueException} that survives the retry policy is converted to an
 * {@link ExecutionFailedException} carrying the venue's status code, body and the number of
 * attempts made.
 */
@Component
public class VenueCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(VenueCallExecutor.class);

    /** A value returned by the venue together with the attempts it took. */
    public record Attempted<T>(T value, int attempts) {}

    private final Retry venueRetry;
    private final VenueHealthMonitor venueHealthMonitor;

    public VenueCallExecutor(Retry venueRetry, VenueHealthMonitor venueHealthMonitor) {
        this.venueRetry = venueRetry;
        this.venueHealthMonitor = venueHealthMonitor;
    }

    public <T> Attempted<T> call(String venue, String operation, Supplier<T> venueCall) {
        AtomicInteger attempts = new AtomicInteger();
        Supplier<T> reporting = () -> {
            int attempt = attempts.incrementAndGet();
            if (attempt > 1) {
                log.warn("Venue call RETRYING: venue={}, op={}, attempt={}", venue, operation, attempt);
            }
            try {
                T value = venueCall.get();
                venueHealthMonitor.recordResult(true);
                return value;
            } catch (VenueException e) {
                venueHealthMonitor.recordResult(false);
                log.warn("Venue call failed: venue={}, op={}, attempt={}, type={}, status={}",
                        venue, operation, attempt, e.getType(), e.getStatusCode());
                throw e;
            }
        };

        try {
            T value = Retry.decorateSupplier(venueRetry, reporting).get();
            return new Attempted<>(value, attempts.get());
        } catch (VenueException e) {
            log.error("Venue call FAILED: venue={}, op={}, attempts={}, status={}, body={}",
                    venue, operation, attempts.get(), e.getStatusCode(), e.getBody());
            throw new ExecutionFailedException(e, attempts.get());
        }
    }
}
