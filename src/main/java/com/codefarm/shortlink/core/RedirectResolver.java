package com.codefarm.shortlink.core;

import com.codefarm.shortlink.cache.CacheTtlPolicy;
import com.codefarm.shortlink.cache.CachedLink;
import com.codefarm.shortlink.cache.LinkCache;
import com.codefarm.shortlink.model.ShortLink;
import com.codefarm.shortlink.repository.LinkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Read path for redirects: cache first, store on a miss, cache repaired on the way out.
 * <p>
 * The cache is only a hint. Every hit is re-checked against the link's logical expiry because the
 * entry's storage TTL bounds staleness, not validity. Expired links are purged lazily: in the
 * background when found in the cache, inline (best-effort) when found in the store. Once a code
 * resolves to {@code GONE} or {@code NOT_FOUND} it never resolves to {@code FOUND} again, since
 * deletion is one-way and codes are never reissued.
 * <p>
 * Store failures propagate to the caller; cache failures behave as misses.
 */
@Service
public class RedirectResolver {

    private static final Logger log = LoggerFactory.getLogger(RedirectResolver.class);

    private final LinkCache cache;
    private final LinkStore store;
    private final CacheTtlPolicy ttlPolicy;
    private final ExpiredLinkCleaner cleaner;
    private final Clock clock;

    public RedirectResolver(LinkCache cache,
                            LinkStore store,
                            CacheTtlPolicy ttlPolicy,
                            ExpiredLinkCleaner cleaner,
                            Clock clock) {
        this.cache = cache;
        this.store = store;
        this.ttlPolicy = ttlPolicy;
        this.cleaner = cleaner;
        this.clock = clock;
    }

    public Resolution resolve(String code) {
        if (!ShortLink.isWellFormedCode(code)) {
            return Resolution.notFound(code);
        }
        Instant now = clock.instant();

        Optional<CachedLink> cached = cache.get(code);
        if (cached.isPresent()) {
            return resolveCached(code, cached.get(), now);
        }
        return resolveFromStore(code, now);
    }

    private Resolution resolveCached(String code, CachedLink entry, Instant now) {
        if (entry.isExpiredAt(now)) {
            log.debug("Cache hit for code {} is past its expiry {}", code, entry.expiresAt());
            cleaner.purgeInBackground(code);
            return Resolution.gone(code);
        }
        log.debug("Cache hit for code {}", code);
        return Resolution.found(code, entry.longUrl());
    }

    private Resolution resolveFromStore(String code, Instant now) {
        Optional<ShortLink> record = store.findByCode(code);
        if (record.isEmpty()) {
            return Resolution.notFound(code);
        }
        ShortLink link = record.get();
        if (link.isExpiredAt(now)) {
            log.debug("Code {} expired at {}, purging", code, link.getExpiresAt().orElse(null));
            cleaner.purge(code);
            return Resolution.gone(code);
        }
        Instant expiresAt = link.getExpiresAt().orElse(null);
        cache.put(code, link.getLongUrl(), expiresAt, ttlPolicy.ttlFor(expiresAt, now));
        return Resolution.found(code, link.getLongUrl());
    }
}
