package com.codefarm.shortlink.core;

import com.codefarm.shortlink.repository.LinkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Periodic bulk delete of expired links that nobody requested again. Storage cost control only;
 * expiry is enforced on the redirect path regardless. Safe to run on every instance at once.
 */
@Component
public class ExpirationSweeper {

    private static final Logger log = LoggerFactory.getLogger(ExpirationSweeper.class);

    private final LinkStore store;
    private final Clock clock;

    public ExpirationSweeper(LinkStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Scheduled(cron = "${shortener.sweeper.cron:0 0 3 * * *}", zone = "UTC")
    public void sweepExpiredLinks() {
        Instant cutoff = clock.instant();
        try {
            int removed = store.deleteExpiredBefore(cutoff);
            log.info("Expiration sweep removed {} link(s) expired before {}", removed, cutoff);
        } catch (RuntimeException e) {
            log.error("Expiration sweep before {} failed: {}", cutoff, e.getMessage(), e);
        }
    }
}
