package com.codefarm.shortlink.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Fast, possibly stale lookup in front of the link store.
 * <p>
 * Implementations never throw for backend failures: a failed read is a miss and a failed write or
 * delete is a no-op. A hit says nothing about validity; callers re-check {@link CachedLink#expiresAt()}.
 */
public interface LinkCache {

    void put(String code, String longUrl, Instant logicalExpiry, Duration ttl);

    Optional<CachedLink> get(String code);

    void delete(String code);
}
