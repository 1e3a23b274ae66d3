package com.codefarm.shortlink.service.web;

import com.codefarm.shortlink.service.core.UrlShortenerService;
import com.codefarm.shortlink.service.web.dto.ShortenRequest;
import com.codefarm.shortlink.service.web.dto.ShortenResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class UrlApiController {

    private final UrlShortenerService service;

    public UrlApiController(UrlShortenerService service) {
        this.service = service;
    }

    @PostMapping(path = "/shorten", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ShortenResponse> shorten(@RequestBody ShortenRequest request,
                                                   HttpServletRequest httpRequest) {
        ShortenResponse response = service.shortenUrl(request, getBaseUrl(httpRequest));
        return ResponseEntity.ok(response);
    }

    private static String getBaseUrl(HttpServletRequest request) {
        String scheme = request.getScheme();
        String host = request.getServerName();
        int port = request.getServerPort();
        boolean isDefault = (scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443);
        return scheme + "://" + host + (isDefault ? "" : (":" + port)) + request.getContextPath();
    }
}
