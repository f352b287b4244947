package com.riskrails.oms;

import com.riskrails.config.IdempotencyProperties;
import com.riskrails.domain.model.OrderIntent;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Picks the idempotency key for an execution.
 *
 * <p>Precedence: the request override, then the key carried on the intent, then a signature
 * {@code sig:{strategy}:{SYMBOL}:{SIDE}:{bucket}} where the bucket is the intent timestamp's
 * epoch second divided by the bucket width. Two signals for the same strategy, symbol and side
 * inside one bucket therefore collapse into one order.
 */
@Component
public class IdempotencyKeyGenerator {

    private final IdempotencyProperties idempotencyProperties;
    private final Clock clock;

    public IdempotencyKeyGenerator(IdempotencyProperties idempotencyProperties, Clock clock) {
        this.idempotencyProperties = idempotencyProperties;
        this.clock = clock;
    }

    public String keyFor(OrderIntent intent, String override) {
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        if (intent.getIdempotencyKey() != null && !intent.getIdempotencyKey().isBlank()) {
            return intent.getIdempotencyKey().trim();
        }
        return signature(intent);
    }

    String signature(OrderIntent intent) {
        Instant at = intent.getTimestamp() != null ? intent.getTimestamp() : clock.instant();
        long bucketSeconds = Math.max(1, idempotencyProperties.getBucket().getSeconds());
        long bucket = at.getEpochSecond() / bucketSeconds;
        String strategy = intent.getStrategy() != null ? intent.getStrategy() : "manual";
        String side = intent.getSide() != null ? intent.getSide().name() : "UNKNOWN";
        return String.join(":", "sig", strategy, String.valueOf(intent.getSymbol()).trim().toUpperCase(Locale.ROOT), side, String.valueOf(bucket));
    }
}
