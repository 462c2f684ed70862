package com.codefarm.shortlink.core;

import com.codefarm.shortlink.exception.InvalidUrlException;
import com.codefarm.shortlink.exception.UnsupportedSchemeException;
import com.codefarm.shortlink.model.ShortLink;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

@Component
public class LinkUrlValidator {

    private final String serviceHost;

    public LinkUrlValidator(@Value("${shortener.base-url}") String baseUrl) {
        String host;
        try {
            host = new URI(baseUrl).getHost();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("shortener.base-url is not a valid URI: " + baseUrl, e);
        }
        if (host == null) {
            throw new IllegalArgumentException("shortener.base-url has no host: " + baseUrl);
        }
        this.serviceHost = normalizeHost(host);
    }

    /**
     * Checks a destination before anything is written. The URL is returned exactly as submitted.
     *
     * @throws InvalidUrlException for empty, over-long, unparseable, host-less or self-referencing URLs
     * @throws UnsupportedSchemeException for any scheme other than http or https
     */
    public String validate(String longUrl) {
        if (longUrl == null || longUrl.isBlank()) {
            throw new InvalidUrlException("URL cannot be empty");
        }
        if (longUrl.length() > ShortLink.MAX_URL_LENGTH) {
            throw new InvalidUrlException("URL exceeds " + ShortLink.MAX_URL_LENGTH + " characters");
        }
        URI uri;
        try {
            uri = new URI(longUrl);
        } catch (URISyntaxException e) {
            throw new InvalidUrlException("Invalid URL format");
        }
        if (uri.getScheme() == null) {
            throw new InvalidUrlException("URL must be absolute, including http:// or https://");
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new UnsupportedSchemeException(uri.getScheme());
        }
        // getHost() is null when the authority is not a valid server-based host
        if (uri.getHost() == null) {
            throw new InvalidUrlException("URL host is missing or malformed");
        }
        if (normalizeHost(uri.getHost()).equals(serviceHost)) {
            throw new InvalidUrlException("Cannot shorten a URL from this service. Provide the original long URL.");
        }
        return longUrl;
    }

    private static String normalizeHost(String host) {
        String lower = host.toLowerCase(Locale.ROOT);
        return lower.startsWith("www.") ? lower.substring(4) : lower;
    }
}
