package com.codefarm.shortlink.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

@Component
public class RedisLinkCache implements LinkCache {

    private static final Logger log = LoggerFactory.getLogger(RedisLinkCache.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisLinkCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void put(String code, String longUrl, Instant logicalExpiry, Duration ttl) {
        // PX 0 is rejected by Redis, and an entry that dies immediately is not worth writing
        if (ttl.toMillis() < 1) {
            log.debug("Not caching code {}: ttl {} already elapsed", code, ttl);
            return;
        }
        Long expiresAtMillis = logicalExpiry == null ? null : logicalExpiry.toEpochMilli();
        try {
            String value = objectMapper.writeValueAsString(new CacheValue(longUrl, expiresAtMillis));
            redisTemplate.opsForValue().set(CacheKeys.link(code), value, ttl);
        } catch (JsonProcessingException | DataAccessException e) {
            log.warn("Failed to cache code {}: {}", code, e.getMessage());
        }
    }

    @Override
    public Optional<CachedLink> get(String code) {
        String raw;
        try {
            raw = redisTemplate.opsForValue().get(CacheKeys.link(code));
        } catch (DataAccessException e) {
            log.warn("Cache read for code {} failed, treating as miss: {}", code, e.getMessage());
            return Optional.empty();
        }
        if (raw == null) {
            return Optional.empty();
        }
        try {
            CacheValue value = objectMapper.readValue(raw, CacheValue.class);
            if (value.longUrl() == null) {
                log.warn("Cache entry for code {} has no URL, treating as miss", code);
                return Optional.empty();
            }
            Instant expiresAt = value.expiresAt() == null ? null : Instant.ofEpochMilli(value.expiresAt());
            return Optional.of(new CachedLink(value.longUrl(), expiresAt));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable cache entry for code {}, treating as miss: {}", code, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void delete(String code) {
        try {
            redisTemplate.delete(CacheKeys.link(code));
        } catch (DataAccessException e) {
            log.warn("Failed to evict code {} from cache: {}", code, e.getMessage());
        }
    }

    // Wire format of the cached value; expiresAt is epoch millis or null.
    record CacheValue(String longUrl, Long expiresAt) {
    }
}
