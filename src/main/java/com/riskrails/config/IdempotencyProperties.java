package com.riskrails.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Idempotency guard settings.
 *
 * <pre>
 * riskrails.idempotency.store=memory        # or redis
 * riskrails.idempotency.claim-ttl=300s
 * riskrails.idempotency.response-ttl=10m
 * riskrails.idempotency.max-entries=10000
 * riskrails.idempotency.bucket=60s
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "riskrails.idempotency")
public class IdempotencyProperties {

    /** Backing store: {@code memory} (single process) or {@code redis} (shared). */
    private String store = "memory";

    /** How long an in-flight claim blocks the key if the holder never completes or releases it. */
    private Duration claimTtl = Duration.ofSeconds(300);

    /** How long a completed response is replayed. */
    private Duration responseTtl = Duration.ofMinutes(10);

    /** Bound on cached responses in the in-memory store; the oldest are evicted first. */
    private long maxEntries = 10_000;

    /** Width of the time bucket in derived signature keys. */
    private Duration bucket = Duration.ofSeconds(60);
}
