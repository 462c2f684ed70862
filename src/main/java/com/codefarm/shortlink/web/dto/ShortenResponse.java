package com.codefarm.shortlink.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ShortenResponse(
        @JsonProperty("short_url") String shortUrl,
        @JsonProperty("code") String code,
        @JsonProperty("expires_at") Instant expiresAt) {
}
