package com.riskrails.oms;

import com.riskrails.config.RedisConfig;
import com.riskrails.domain.model.ExecutionResult;
import com.riskrails.mapper.JsonHelper;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Shared idempotency store for multi-instance deployments.
 *
 * <p>Claims are {@code SET NX EX}, so exactly one instance wins a fresh key. Responses are
 * stored as JSON strings with their own TTL.
 *
 * <p>Key schema:
 * <pre>
 *   riskrails:idem:claim:{key}    → "1" (TTL = claim TTL)
 *   riskrails:idem:result:{key}   → ExecutionResult JSON (TTL = response TTL)
 * </pre>
 */
@Component
@ConditionalOnProperty(name = "riskrails.idempotency.store", havingValue = "redis")
public class RedisIdempotencyStore implements IdempotencyStore {

    private static final Logger log = LoggerFactory.getLogger(RedisIdempotencyStore.class);

    public static final String CLAIM_PREFIX = RedisConfig.KEY_PREFIX_IDEMPOTENCY + "claim:";
    public static final String RESULT_PREFIX = RedisConfig.KEY_PREFIX_IDEMPOTENCY + "result:";

    private final RedisTemplate<String, Object> redisTemplate;

    public RedisIdempotencyStore(RedisTemplate<String, Object> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<ExecutionResult> findResult(String key) {
        Object value = redisTemplate.opsForValue().get(RESULT_PREFIX + key);
        if (value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(JsonHelper.fromJson(value.toString(), ExecutionResult.class));
    }

    @Override
    public boolean tryClaim(String key, Duration ttl) {
        Boolean claimed = redisTemplate.opsForValue().setIfAbsent(CLAIM_PREFIX + key, "1", ttl);
        log.debug("Idempotency claim: key={}, claimed={}", key, claimed);
        return Boolean.TRUE.equals(claimed);
    }

    @Override
    public void saveResult(String key, ExecutionResult result, Duration ttl) {
        redisTemplate.opsForValue().set(RESULT_PREFIX + key, JsonHelper.toJson(result), ttl);
    }

    @Override
    public void releaseClaim(String key) {
        redisTemplate.delete(CLAIM_PREFIX + key);
    }
}
