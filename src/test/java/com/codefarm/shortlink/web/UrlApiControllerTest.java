package com.codefarm.shortlink.web;

import com.codefarm.shortlink.core.UrlShortenerService;
import com.codefarm.shortlink.exception.CodeAlreadyInUseException;
import com.codefarm.shortlink.exception.GlobalExceptionHandler;
import com.codefarm.shortlink.exception.InvalidCustomCodeException;
import com.codefarm.shortlink.exception.InvalidUrlException;
import com.codefarm.shortlink.exception.SequenceUnavailableException;
import com.codefarm.shortlink.exception.UnsupportedSchemeException;
import com.codefarm.shortlink.web.dto.ShortenRequest;
import com.codefarm.shortlink.web.dto.ShortenResponse;
import com.codefarm.shortlink.web.dto.UserMetricsResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class UrlApiControllerTest {

    @Mock
    private UrlShortenerService service;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new UrlApiController(service))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void postShorten_whenValid_shouldReturnCreated() throws Exception {
        when(service.shortenUrl(eq(new ShortenRequest("https://example.com/a", null, null)), isNull()))
                .thenReturn(new ShortenResponse("https://sho.rt/4c92", "4c92", null));

        mockMvc.perform(post("/shorten")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"long_url\":\"https://example.com/a\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.short_url", is("https://sho.rt/4c92")))
                .andExpect(jsonPath("$.code", is("4c92")))
                .andExpect(jsonPath("$.expires_at", nullValue()));
    }

    @Test
    void postShorten_shouldPassCustomCodeExpiryAndOwner() throws Exception {
        Instant expiresAt = Instant.parse("2026-12-31T23:59:59Z");
        ShortenRequest expected = new ShortenRequest("https://example.com/a", "my-link", expiresAt);
        when(service.shortenUrl(expected, "user-7"))
                .thenReturn(new ShortenResponse("https://sho.rt/my-link", "my-link", expiresAt));

        mockMvc.perform(post("/shorten")
                        .header("user_uuid", "user-7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"long_url\":\"https://example.com/a\",\"custom_code\":\"my-link\","
                                + "\"expires_at\":\"2026-12-31T23:59:59Z\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.code", is("my-link")))
                .andExpect(jsonPath("$.expires_at", is("2026-12-31T23:59:59Z")));

        verify(service).shortenUrl(expected, "user-7");
    }

    @Test
    void postShorten_whenCodeTaken_shouldReturnConflict() throws Exception {
        when(service.shortenUrl(any(ShortenRequest.class), isNull()))
                .thenThrow(new CodeAlreadyInUseException("my-link", null));

        mockMvc.perform(post("/shorten")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"long_url\":\"https://example.com/a\",\"custom_code\":\"my-link\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error", is("Code already in use: my-link")));
    }

    @Test
    void postShorten_whenSchemeUnsupported_shouldReturnUnprocessableEntity() throws Exception {
        when(service.shortenUrl(any(ShortenRequest.class), isNull()))
                .thenThrow(new UnsupportedSchemeException("ftp"));

        mockMvc.perform(post("/shorten")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"long_url\":\"ftp://example.com\"}"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void postShorten_whenUrlInvalid_shouldReturnBadRequest() throws Exception {
        when(service.shortenUrl(any(ShortenRequest.class), isNull()))
                .thenThrow(new InvalidUrlException("URL cannot be empty"));

        mockMvc.perform(post("/shorten")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"long_url\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("URL cannot be empty")));
    }

    @Test
    void postShorten_whenCustomCodeInvalid_shouldReturnBadRequest() throws Exception {
        when(service.shortenUrl(any(ShortenRequest.class), isNull()))
                .thenThrow(new InvalidCustomCodeException("bad code!"));

        mockMvc.perform(post("/shorten")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"long_url\":\"https://example.com\",\"custom_code\":\"bad code!\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void postShorten_whenBodyMalformed_shouldReturnBadRequest() throws Exception {
        mockMvc.perform(post("/shorten")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"long_url\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", is("Malformed request body")));
    }

    @Test
    void postShorten_whenSequenceUnavailable_shouldReturnServiceUnavailable() throws Exception {
        when(service.shortenUrl(any(ShortenRequest.class), isNull()))
                .thenThrow(new SequenceUnavailableException("down"));

        mockMvc.perform(post("/shorten")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"long_url\":\"https://example.com\"}"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void getUserMetrics_shouldListCountsPerOwner() throws Exception {
        when(service.userMetrics()).thenReturn(List.of(new UserMetricsResponse("alice", 3)));

        mockMvc.perform(get("/api/v1/metrics/users"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].user_id", is("alice")))
                .andExpect(jsonPath("$[0].url_count", is(3)));
    }
}
