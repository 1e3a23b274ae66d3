package com.codefarm.shortlink.service.web;

import com.codefarm.shortlink.service.config.ShortLinkProperties;
import com.codefarm.shortlink.service.core.UrlShortenerService;
import com.codefarm.shortlink.service.exception.ShortLinkNotFoundException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

@RestController
public class RedirectController {

    private final UrlShortenerService service;
    private final ShortLinkProperties properties;

    public RedirectController(UrlShortenerService service, ShortLinkProperties properties) {
        this.service = service;
        this.properties = properties;
    }

    @GetMapping("/")
    public ResponseEntity<Void> root() {
        throw new ShortLinkNotFoundException("Not Found. Please provide a short ID.");
    }

    @GetMapping("/{shortId}")
    public ResponseEntity<Void> redirect(@PathVariable String shortId) {
        String longUrl = service.resolve(shortId);

        HttpHeaders headers = new HttpHeaders();
        // Header values must be ASCII; non-ASCII characters go out percent-encoded as UTF-8.
        headers.add(HttpHeaders.LOCATION, URI.create(longUrl).toASCIIString());
        headers.add(HttpHeaders.CACHE_CONTROL, "private, max-age=90");
        headers.add("X-Robots-Tag", "noindex");
        return new ResponseEntity<>(headers, properties.redirectHttpStatus());
    }
}
