package com.codefarm.shortlink.core;

import com.codefarm.shortlink.cache.CacheTtlPolicy;
import com.codefarm.shortlink.cache.LinkCache;
import com.codefarm.shortlink.exception.CodeAlreadyInUseException;
import com.codefarm.shortlink.exception.InvalidCustomCodeException;
import com.codefarm.shortlink.model.ShortLink;
import com.codefarm.shortlink.repository.LinkStore;
import com.codefarm.shortlink.sequence.SequenceSource;
import com.codefarm.shortlink.util.Base62Encoder;
import com.codefarm.shortlink.web.dto.ShortenRequest;
import com.codefarm.shortlink.web.dto.ShortenResponse;
import com.codefarm.shortlink.web.dto.UserMetricsResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
public class UrlShortenerServiceImpl implements UrlShortenerService {

    private static final Logger log = LoggerFactory.getLogger(UrlShortenerServiceImpl.class);

    // one retry with a fresh sequence value, then the collision is treated as corruption
    private static final int GENERATED_CODE_ATTEMPTS = 2;

    private final LinkStore store;
    private final SequenceSource sequenceSource;
    private final Base62Encoder encoder;
    private final LinkCache cache;
    private final CacheTtlPolicy ttlPolicy;
    private final LinkUrlValidator urlValidator;
    private final Clock clock;
    private final String baseUrl;

    public UrlShortenerServiceImpl(
            LinkStore store,
            SequenceSource sequenceSource,
            Base62Encoder encoder,
            LinkCache cache,
            CacheTtlPolicy ttlPolicy,
            LinkUrlValidator urlValidator,
            Clock clock,
            @Value("${shortener.base-url}") String baseUrl) {
        this.store = store;
        this.sequenceSource = sequenceSource;
        this.encoder = encoder;
        this.cache = cache;
        this.ttlPolicy = ttlPolicy;
        this.urlValidator = urlValidator;
        this.clock = clock;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
    }

    @Override
    public ShortenResponse shortenUrl(ShortenRequest request, String userUuid) {
        String longUrl = urlValidator.validate(request.longUrl());
        String owner = (userUuid == null || userUuid.isBlank()) ? null : userUuid.trim();
        Instant expiresAt = request.expiresAt();

        ShortLink saved;
        if (request.customCode() != null && !request.customCode().isBlank()) {
            String customCode = request.customCode().trim();
            if (!ShortLink.isWellFormedCode(customCode)) {
                throw new InvalidCustomCodeException(customCode);
            }
            // a taken code fails here with CodeAlreadyInUseException; no pre-check, the constraint decides
            saved = store.insert(new ShortLink(customCode, longUrl, owner, expiresAt, clock.instant()));
        } else {
            saved = insertWithGeneratedCode(longUrl, owner, expiresAt);
        }

        log.info("Created short link {} (owner={}, expiresAt={})", saved.getCode(), owner, expiresAt);
        prewarmCache(saved);
        return new ShortenResponse(baseUrl + saved.getCode(), saved.getCode(), expiresAt);
    }

    @Override
    public List<UserMetricsResponse> userMetrics() {
        return store.countLinksPerOwner().entrySet().stream()
                .map(e -> new UserMetricsResponse(e.getKey(), e.getValue()))
                .toList();
    }

    private ShortLink insertWithGeneratedCode(String longUrl, String owner, Instant expiresAt) {
        CodeAlreadyInUseException lastConflict = null;
        for (int attempt = 1; attempt <= GENERATED_CODE_ATTEMPTS; attempt++) {
            String code = encoder.toBase62(sequenceSource.next());
            try {
                return store.insert(new ShortLink(code, longUrl, owner, expiresAt, clock.instant()));
            } catch (CodeAlreadyInUseException e) {
                log.error("Generated code {} already exists in the store (attempt {} of {}); "
                                + "sequence values and stored codes overlap",
                        code, attempt, GENERATED_CODE_ATTEMPTS);
                lastConflict = e;
            }
        }
        throw new IllegalStateException("Generated codes keep colliding with stored links", lastConflict);
    }

    private void prewarmCache(ShortLink link) {
        Instant expiresAt = link.getExpiresAt().orElse(null);
        try {
            cache.put(link.getCode(), link.getLongUrl(), expiresAt, ttlPolicy.ttlFor(expiresAt, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Cache pre-warm for code {} failed: {}", link.getCode(), e.getMessage());
        }
    }
}
