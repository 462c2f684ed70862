package com.codefarm.shortlink.core;

import com.codefarm.shortlink.web.dto.ShortenRequest;
import com.codefarm.shortlink.web.dto.ShortenResponse;
import com.codefarm.shortlink.web.dto.UserMetricsResponse;

import java.util.List;

public interface UrlShortenerService {
    ShortenResponse shortenUrl(ShortenRequest request, String userUuid);
    List<UserMetricsResponse> userMetrics();
}
