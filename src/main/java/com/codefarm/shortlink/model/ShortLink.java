package com.codefarm.shortlink.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.Optional;
import java.util.regex.Pattern;

@Entity
@Table(name = "short_links")
public class ShortLink {

    public static final int MAX_CODE_LENGTH = 12;
    public static final int MAX_URL_LENGTH = 2048;

    // Superset of the base62 alphabet; '-' and '_' only ever come from custom codes.
    private static final Pattern CODE_PATTERN = Pattern.compile("^[A-Za-z0-9_-]{1," + MAX_CODE_LENGTH + "}$");

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "code", nullable = false, unique = true, updatable = false, length = MAX_CODE_LENGTH)
    private String code;

    @Column(name = "long_url", nullable = false, updatable = false, length = MAX_URL_LENGTH)
    private String longUrl;

    @Column(name = "owner", updatable = false)
    private String owner;

    @Column(name = "expires_at", updatable = false)
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ShortLink() {
        // JPA only
    }

    public ShortLink(String code, String longUrl, String owner, Instant expiresAt, Instant createdAt) {
        this.code = code;
        this.longUrl = longUrl;
        this.owner = owner;
        this.expiresAt = expiresAt;
        this.createdAt = createdAt;
    }

    public static boolean isWellFormedCode(String code) {
        return code != null && CODE_PATTERN.matcher(code).matches();
    }

    public Long getId() {
        return id;
    }

    public String getCode() {
        return code;
    }

    public String getLongUrl() {
        return longUrl;
    }

    public Optional<String> getOwner() {
        return Optional.ofNullable(owner);
    }

    public Optional<Instant> getExpiresAt() {
        return Optional.ofNullable(expiresAt);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * A link is expired from its {@code expires_at} instant onwards; links without one never expire.
     */
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
