package com.codefarm.shortlink.sequence;

import com.codefarm.shortlink.cache.CacheKeys;
import com.codefarm.shortlink.exception.SequenceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Counter kept under a single well-known Redis key and advanced with {@code INCR}.
 * Durability depends on the Redis deployment persisting writes (AOF with fsync).
 */
@Component
@ConditionalOnProperty(name = "shortener.sequence.backend", havingValue = "redis", matchIfMissing = true)
public class RedisSequenceSource implements SequenceSource {

    private static final Logger log = LoggerFactory.getLogger(RedisSequenceSource.class);

    private final StringRedisTemplate redisTemplate;

    public RedisSequenceSource(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public long next() {
        Long value;
        try {
            value = redisTemplate.opsForValue().increment(CacheKeys.SEQUENCE_KEY);
        } catch (DataAccessException e) {
            log.error("INCR on {} failed: {}", CacheKeys.SEQUENCE_KEY, e.getMessage());
            throw new SequenceUnavailableException("Sequence source is unavailable", e);
        }
        if (value == null) {
            throw new SequenceUnavailableException("Sequence increment returned no value");
        }
        return value;
    }
}
