package com.codefarm.shortlink.web;

import com.codefarm.shortlink.core.RedirectResolver;
import com.codefarm.shortlink.core.Resolution;
import com.codefarm.shortlink.exception.LinkExpiredException;
import com.codefarm.shortlink.exception.UrlNotFoundException;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

@RestController
public class RedirectController {

    private final RedirectResolver resolver;

    public RedirectController(RedirectResolver resolver) {
        this.resolver = resolver;
    }

    @GetMapping("/{code}")
    public ResponseEntity<Void> redirect(@PathVariable String code) {
        Resolution resolution = resolver.resolve(code);
        switch (resolution.outcome()) {
            case FOUND:
                // no-store: expiry has to be evaluated on every request, not by a browser or proxy
                return ResponseEntity.status(HttpStatus.FOUND)
                        .location(URI.create(resolution.longUrl()))
                        .cacheControl(CacheControl.noStore())
                        .header("X-Robots-Tag", "noindex")
                        .build();
            case GONE:
                throw new LinkExpiredException(code);
            default:
                throw new UrlNotFoundException(code);
        }
    }
}
