package com.codefarm.shortlink.cache;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

@Component
public class CacheTtlPolicy {

    private final Duration defaultTtl;

    public CacheTtlPolicy(@Value("${shortener.cache.default-ttl:24h}") Duration defaultTtl) {
        if (defaultTtl.isZero() || defaultTtl.isNegative()) {
            throw new IllegalArgumentException("shortener.cache.default-ttl must be positive");
        }
        this.defaultTtl = defaultTtl;
    }

    /**
     * Storage TTL for an entry: time left until the logical expiry, floored at zero, or the default
     * staleness bound for links that never expire.
     */
    public Duration ttlFor(Instant logicalExpiry, Instant now) {
        if (logicalExpiry == null) {
            return defaultTtl;
        }
        Duration remaining = Duration.between(now, logicalExpiry);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }
}
