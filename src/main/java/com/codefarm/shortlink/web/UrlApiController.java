package com.codefarm.shortlink.web;

import com.codefarm.shortlink.core.UrlShortenerService;
import com.codefarm.shortlink.web.dto.ShortenRequest;
import com.codefarm.shortlink.web.dto.ShortenResponse;
import com.codefarm.shortlink.web.dto.UserMetricsResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class UrlApiController {

    private final UrlShortenerService service;

    public UrlApiController(UrlShortenerService service) {
        this.service = service;
    }

    @PostMapping("/shorten")
    public ResponseEntity<ShortenResponse> shorten(@RequestBody ShortenRequest request,
                                                   @RequestHeader(value = "user_uuid", required = false) String userUuid) {
        ShortenResponse response = service.shortenUrl(request, userUuid);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/api/v1/metrics/users")
    public ResponseEntity<List<UserMetricsResponse>> usersMetrics() {
        return ResponseEntity.ok(service.userMetrics());
    }
}
