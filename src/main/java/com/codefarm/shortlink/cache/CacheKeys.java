package com.codefarm.shortlink.cache;

/**
 * Redis keyspace for the shortener.
 * <ul>
 *   <li>{@code shortlink:code:{code}} - String, JSON {@link CachedLink}, expires per {@link CacheTtlPolicy}</li>
 *   <li>{@code shortlink:seq} - String counter advanced with INCR, never expires</li>
 * </ul>
 * Codes cannot contain ':', so no link key can shadow the counter.
 */
public final class CacheKeys {

    public static final String SEQUENCE_KEY = "shortlink:seq";

    private static final String LINK_PREFIX = "shortlink:code:";

    private CacheKeys() {
    }

    public static String link(String code) {
        return LINK_PREFIX + code;
    }
}
