package com.riskrails.oms;

import com.riskrails.domain.model.ExecutionResult;
import java.time.Duration;
import java.util.Optional;

/**
 * Storage behind the {@link IdempotencyGuard}: completed responses plus short-lived claims.
 *
 * <p>{@link #tryClaim} must be atomic across every caller that shares the store. The in-memory
 * implementation covers one process; the Redis implementation covers a fleet.
 */
public interface IdempotencyStore {

    Optional<ExecutionResult> findResult(String key);

    /**
     * Takes the claim for {@code key} unless an unexpired claim already exists.
     *
     * @return true if this caller now holds the claim
     */
    boolean tryClaim(String key, Duration ttl);

    void saveResult(String key, ExecutionResult result, Duration ttl);

    void releaseClaim(String key);
}
