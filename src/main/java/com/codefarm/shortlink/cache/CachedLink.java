package com.codefarm.shortlink.cache;

import java.time.Instant;

/**
 * Cached copy of a link. {@code expiresAt} is the link's logical expiry (null = never) and is
 * unrelated to how long Redis keeps the entry.
 */
public record CachedLink(String longUrl, Instant expiresAt) {

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
