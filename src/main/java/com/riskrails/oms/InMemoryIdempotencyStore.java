package com.riskrails.oms;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.riskrails.config.IdempotencyProperties;
import com.riskrails.domain.model.ExecutionResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Single-process idempotency store.
 *
 * <p>Responses live in a bounded Caffeine cache with expire-after-write, timed by the
 * injected {@link Clock} like the claims. Claims are a
 * {@code key -> expiry} map updated through {@link ConcurrentMap#compute}, which makes
 * check-and-take atomic per key. Expired claims are replaced on the next attempt.
 */
@Component
@ConditionalOnProperty(name = "riskrails.idempotency.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryIdempotencyStore implements IdempotencyStore {

    private final Cache<String, ExecutionResult> results;
    private final ConcurrentMap<String, Instant> claims = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryIdempotencyStore(IdempotencyProperties idempotencyProperties, Clock clock) {
        this.results = Caffeine.newBuilder()
                .maximumSize(idempotencyProperties.getMaxEntries())
                .expireAfterWrite(idempotencyProperties.getResponseTtl())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
        this.clock = clock;
    }

    @Override
    public Optional<ExecutionResult> findResult(String key) {
        return Optional.ofNullable(results.getIfPresent(key));
    }

    @Override
    public boolean tryClaim(String key, Duration ttl) {
        Instant now = clock.instant();
        AtomicBoolean claimed = new AtomicBoolean(false);
        claims.compute(key, (k, expiry) -> {
            if (expiry != null && expiry.isAfter(now)) {
                return expiry;
            }
            claimed.set(true);
            return now.plus(ttl);
        });
        return claimed.get();
    }

    /**
     * The response TTL is fixed when the cache is built; {@code ttl} is ignored here.
     */
    @Override
    public void saveResult(String key, ExecutionResult result, Duration ttl) {
        results.put(key, result);
    }

    @Override
    public void releaseClaim(String key) {
        claims.remove(key);
    }
}
