package com.riskrails.oms;

import com.riskrails.config.IdempotencyProperties;
import com.riskrails.domain.model.ExecutionResult;
import com.riskrails.exception.IdempotencyConflictException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * At most one in-flight execution per key, and replay of completed ones.
 *
 * <p>Protocol: {@link #reserve} before doing any work, then exactly one of {@link #complete}
 * (the response becomes replayable) or {@link #release} (the key is free again, nothing is
 * replayed). A holder that dies without either loses the claim when its TTL lapses.
 */
@Service
public class IdempotencyGuard {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyGuard.class);

    private final IdempotencyStore idempotencyStore;
    private final IdempotencyProperties idempotencyProperties;

    public IdempotencyGuard(IdempotencyStore idempotencyStore, IdempotencyProperties idempotencyProperties) {
        this.idempotencyStore = idempotencyStore;
        this.idempotencyProperties = idempotencyProperties;
    }

    /**
     * Claims {@code key} for the caller.
     *
     * @throws IdempotencyConflictException REPLAYED with the stored response if the key already
     *     completed, or PENDING if another caller holds an unexpired claim
     */
    public void reserve(String key) {
        Optional<ExecutionResult> stored = idempotencyStore.findResult(key);
        if (stored.isPresent()) {
            log.info("Idempotent replay: key={}", key);
            throw IdempotencyConflictException.replayed(key, stored.get());
        }

        if (!idempotencyStore.tryClaim(key, idempotencyProperties.getClaimTtl())) {
            // The holder may have completed between the two reads.
            stored = idempotencyStore.findResult(key);
            if (stored.isPresent()) {
                log.info("Idempotent replay: key={}", key);
                throw IdempotencyConflictException.replayed(key, stored.get());
            }
            log.warn("Idempotency key in flight: key={}", key);
            throw IdempotencyConflictException.pending(key);
        }
        log.debug("Idempotency key reserved: key={}", key);
    }

    /** Stores the response for replay, then drops the claim. */
    public void complete(String key, ExecutionResult result) {
        idempotencyStore.saveResult(key, result, idempotencyProperties.getResponseTtl());
        idempotencyStore.releaseClaim(key);
    }

    public void release(String key) {
        idempotencyStore.releaseClaim(key);
    }
}
