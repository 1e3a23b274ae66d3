package com.codefarm.shortlink.service.core;

import com.codefarm.shortlink.service.config.ShortLinkProperties;
import com.codefarm.shortlink.service.exception.GenerationExhaustedException;
import com.codefarm.shortlink.service.exception.InvalidInputException;
import com.codefarm.shortlink.service.exception.MalformedShortIdException;
import com.codefarm.shortlink.service.exception.ShortLinkNotFoundException;
import com.codefarm.shortlink.service.model.LinkRecord;
import com.codefarm.shortlink.service.repository.LinkStore;
import com.codefarm.shortlink.service.util.ShortIdFormat;
import com.codefarm.shortlink.service.util.ShortIdGenerator;
import com.codefarm.shortlink.service.web.dto.ShortenRequest;
import com.codefarm.shortlink.service.web.dto.ShortenResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;

@Service
public class UrlShortenerServiceImpl implements UrlShortenerService {

    private static final Logger log = LoggerFactory.getLogger(UrlShortenerServiceImpl.class);

    private final LinkStore store;
    private final ShortIdGenerator idGenerator;
    private final ShortIdFormat idFormat;
    private final ShortLinkProperties properties;

    public UrlShortenerServiceImpl(
            LinkStore store,
            ShortIdGenerator idGenerator,
            ShortIdFormat idFormat,
            ShortLinkProperties properties) {
        this.store = store;
        this.idGenerator = idGenerator;
        this.idFormat = idFormat;
        this.properties = properties;
    }

    @Override
    public ShortenResponse shortenUrl(ShortenRequest request, String requestBaseUrl) {
        String longUrl = validateUrl(request == null ? null : request.url());

        for (int attempt = 1; attempt <= properties.maxAttempts(); attempt++) {
            String shortId = idGenerator.generate();
            if (store.putIfAbsent(shortId, longUrl)) {
                log.info("Stored short_id {} for url {}", shortId, longUrl);
                return new ShortenResponse(shortId, buildShortUrl(baseUrl(requestBaseUrl), shortId));
            }
            log.warn("Short ID {} already exists, retrying ({}/{})", shortId, attempt, properties.maxAttempts());
        }
        log.error("Gave up after {} colliding short IDs for url {}", properties.maxAttempts(), longUrl);
        throw new GenerationExhaustedException(properties.maxAttempts());
    }

    @Override
    public String resolve(String shortId) {
        if (!idFormat.matches(shortId)) {
            log.warn("Rejected malformed short_id {}", printable(shortId));
            throw new MalformedShortIdException();
        }
        String longUrl = store.get(shortId).orElseThrow(() -> {
            log.warn("Short ID {} not found", shortId);
            return new ShortLinkNotFoundException("Short URL not found.");
        });
        log.info("Redirecting short_id {} to {}", shortId, longUrl);
        return longUrl;
    }

    private String baseUrl(String requestBaseUrl) {
        return properties.hasBaseUrl() ? properties.baseUrl() : requestBaseUrl;
    }

    private static String validateUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidInputException("url", "Missing \"url\" in request body.");
        }
        String trimmed = url.trim();
        if (trimmed.length() > LinkRecord.MAX_LONG_URL_LENGTH) {
            throw new InvalidInputException("url",
                    "\"url\" must not exceed " + LinkRecord.MAX_LONG_URL_LENGTH + " characters.");
        }
        try {
            URI uri = new URI(trimmed);
            if (!uri.isAbsolute() || uri.getHost() == null) {
                throw new InvalidInputException("url", "\"url\" must be an absolute URL with scheme and host.");
            }
            String scheme = uri.getScheme().toLowerCase();
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw new InvalidInputException("url", "Only HTTP/HTTPS URLs are allowed.");
            }
            return trimmed;
        } catch (URISyntaxException ex) {
            throw new InvalidInputException("url", "\"url\" is not a well-formed URL.");
        }
    }

    // Path segments arrive decoded, so %0D%0A would otherwise forge log lines.
    static String printable(String value) {
        if (value == null) {
            return null;
        }
        StringBuilder builder = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isISOControl(c)) {
                builder.append(String.format("\\u%04x", (int) c));
            } else {
                builder.append(c);
            }
        }
        return builder.toString();
    }

    private static String buildShortUrl(String baseUrl, String shortId) {
        String normalized = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        return normalized + shortId;
    }
}
