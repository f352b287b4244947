package com.riskrails.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis template for the shared idempotency store.
 *
 * <p>Connections are opened lazily, so a process running the in-memory store never talks to
 * Redis. All keys carry the {@code riskrails:} prefix.
 *
 * <p>Key schema:
 * <pre>
 *   riskrails:idem:claim:{key}    → in-flight claim
 *   riskrails:idem:result:{key}   → completed ExecutionResult JSON
 * </pre>
 */
@Configuration
public class RedisConfig {

    public static final String KEY_PREFIX = "riskrails:";

    public static final String KEY_PREFIX_IDEMPOTENCY = KEY_PREFIX + "idem:";

    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory redisConnectionFactory) {
        RedisTemplate<String, Object> redisTemplate = new RedisTemplate<>();
        redisTemplate.setConnectionFactory(redisConnectionFactory);

        StringRedisSerializer stringRedisSerializer = new StringRedisSerializer();
        GenericJackson2JsonRedisSerializer jsonRedisSerializer = new GenericJackson2JsonRedisSerializer();

        redisTemplate.setKeySerializer(stringRedisSerializer);
        redisTemplate.setValueSerializer(jsonRedisSerializer);
        redisTemplate.setHashKeySerializer(stringRedisSerializer);
        redisTemplate.setHashValueSerializer(jsonRedisSerializer);

        return redisTemplate;
    }
}
