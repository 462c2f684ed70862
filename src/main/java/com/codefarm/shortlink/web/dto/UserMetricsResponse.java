package com.codefarm.shortlink.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UserMetricsResponse(
        @JsonProperty("user_id") String userId,
        @JsonProperty("url_count") long urlCount) {
}
