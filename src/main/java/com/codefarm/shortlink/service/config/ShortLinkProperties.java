package com.codefarm.shortlink.service.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Set;

/**
 * Process-wide settings, bound once at startup from the {@code shortlink.*} keys.
 *
 * @param baseUrl        public prefix used to build {@code short_url}; derived from the request when blank
 * @param id             identifier shape shared by generation and lookup validation
 * @param maxAttempts    how many candidates shorten tries before giving up
 * @param redirectStatus status code used by the redirect route
 * @param store          backing store, {@code jpa} or {@code memory}
 * @param cors           cross-origin settings for browser clients
 */
@ConfigurationProperties(prefix = "shortlink")
public record ShortLinkProperties(
        String baseUrl,
        @DefaultValue Id id,
        @DefaultValue("5") int maxAttempts,
        @DefaultValue("302") int redirectStatus,
        @DefaultValue("jpa") String store,
        @DefaultValue Cors cors) {

    public static final String BASE62_ALPHABET =
            "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private static final Set<Integer> REDIRECT_CODES = Set.of(301, 302, 303, 307, 308);

    public ShortLinkProperties {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("shortlink.max-attempts must be at least 1");
        }
        if (!REDIRECT_CODES.contains(redirectStatus)) {
            throw new IllegalArgumentException("shortlink.redirect-status must be one of " + REDIRECT_CODES);
        }
        if (!"jpa".equals(store) && !"memory".equals(store)) {
            throw new IllegalArgumentException("shortlink.store must be 'jpa' or 'memory'");
        }
    }

    public static ShortLinkProperties defaults() {
        return new ShortLinkProperties(null, new Id(BASE62_ALPHABET, 6), 5, 302, "jpa", new Cors(List.of("*")));
    }

    public HttpStatus redirectHttpStatus() {
        return HttpStatus.valueOf(redirectStatus);
    }

    public boolean hasBaseUrl() {
        return baseUrl != null && !baseUrl.isBlank();
    }

    public record Id(@DefaultValue(BASE62_ALPHABET) String alphabet, @DefaultValue("6") int length) {

        public Id {
            if (alphabet == null || alphabet.length() < 2) {
                throw new IllegalArgumentException("shortlink.id.alphabet needs at least two characters");
            }
            if (alphabet.chars().distinct().count() != alphabet.length()) {
                throw new IllegalArgumentException("shortlink.id.alphabet contains duplicate characters");
            }
            if (!alphabet.chars().allMatch(c -> c < 128 && Character.isLetterOrDigit(c))) {
                throw new IllegalArgumentException("shortlink.id.alphabet must be ASCII letters and digits");
            }
            if (length < 1 || length > 32) {
                throw new IllegalArgumentException("shortlink.id.length must be between 1 and 32");
            }
        }
    }

    public record Cors(@DefaultValue("*") List<String> allowedOrigins) {
    }
}
