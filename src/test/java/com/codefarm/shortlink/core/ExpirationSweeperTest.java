package com.codefarm.shortlink.core;

import com.codefarm.shortlink.model.ShortLink;
import com.codefarm.shortlink.repository.LinkStore;
import com.codefarm.shortlink.support.InMemoryLinkStore;
import com.codefarm.shortlink.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExpirationSweeperTest {

    private static final Instant NOW = Instant.parse("2026-03-01T03:00:00Z");

    @Test
    void sweepExpiredLinks_removesOnlyLinksExpiredBeforeNow() {
        InMemoryLinkStore store = new InMemoryLinkStore();
        store.insert(new ShortLink("past", "https://example.com/1", null, NOW.minusSeconds(1), NOW.minusSeconds(100)));
        store.insert(new ShortLink("future", "https://example.com/2", null, NOW.plusSeconds(60), NOW.minusSeconds(100)));
        store.insert(new ShortLink("forever", "https://example.com/3", null, null, NOW.minusSeconds(100)));

        new ExpirationSweeper(store, new MutableClock(NOW)).sweepExpiredLinks();

        assertThat(store.contains("past")).isFalse();
        assertThat(store.contains("future")).isTrue();
        assertThat(store.contains("forever")).isTrue();
    }

    @Test
    void sweepExpiredLinks_isIdempotent() {
        InMemoryLinkStore store = new InMemoryLinkStore();
        store.insert(new ShortLink("past", "https://example.com/1", null, NOW.minusSeconds(1), NOW.minusSeconds(100)));
        ExpirationSweeper sweeper = new ExpirationSweeper(store, new MutableClock(NOW));

        sweeper.sweepExpiredLinks();
        sweeper.sweepExpiredLinks();

        assertThat(store.size()).isZero();
    }

    @Test
    void sweepExpiredLinks_whenStoreFails_shouldLogAndNotThrow() {
        LinkStore store = mock(LinkStore.class);
        when(store.deleteExpiredBefore(NOW)).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatCode(() -> new ExpirationSweeper(store, new MutableClock(NOW)).sweepExpiredLinks())
                .doesNotThrowAnyException();
        verify(store).deleteExpiredBefore(NOW);
    }
}
