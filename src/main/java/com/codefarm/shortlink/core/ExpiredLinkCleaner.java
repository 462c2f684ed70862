package com.codefarm.shortlink.core;

import com.codefarm.shortlink.cache.LinkCache;
import com.codefarm.shortlink.repository.LinkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Best-effort removal of an expired link from the store and the cache. Failures are logged and
 * dropped; the next access to the same code detects the expiry again and retries.
 */
@Component
public class ExpiredLinkCleaner {

    private static final Logger log = LoggerFactory.getLogger(ExpiredLinkCleaner.class);

    private final LinkStore store;
    private final LinkCache cache;
    private final Executor executor;

    public ExpiredLinkCleaner(LinkStore store, LinkCache cache, @Qualifier("cleanupExecutor") Executor executor) {
        this.store = store;
        this.cache = cache;
        this.executor = executor;
    }

    public void purgeInBackground(String code) {
        try {
            executor.execute(() -> purge(code));
        } catch (RejectedExecutionException e) {
            log.warn("Cleanup queue rejected purge of expired code {}: {}", code, e.getMessage());
        }
    }

    public void purge(String code) {
        try {
            store.deleteByCode(code);
        } catch (RuntimeException e) {
            log.warn("Lazy purge of expired code {} from store failed: {}", code, e.getMessage());
        }
        cache.delete(code);
        log.debug("Purged expired code {}", code);
    }
}
