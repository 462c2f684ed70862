package com.codefarm.shortlink.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ShortenRequest(
        @JsonProperty("long_url") String longUrl,
        @JsonProperty("custom_code") String customCode,
        @JsonProperty("expires_at") Instant expiresAt) {
}
