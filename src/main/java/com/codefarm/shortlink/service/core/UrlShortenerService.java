package com.codefarm.shortlink.service.core;

import com.codefarm.shortlink.service.web.dto.ShortenRequest;
import com.codefarm.shortlink.service.web.dto.ShortenResponse;

public interface UrlShortenerService {

    /**
     * Registers the URL under a freshly generated identifier.
     *
     * @param requestBaseUrl scheme, host and port the request arrived on; used when no base URL is configured
     * @throws com.codefarm.shortlink.service.exception.InvalidInputException if the URL is missing or not absolute http(s)
     * @throws com.codefarm.shortlink.service.exception.GenerationExhaustedException if every candidate collided
     * @throws com.codefarm.shortlink.service.exception.StorageUnavailableException if the store fails
     */
    ShortenResponse shortenUrl(ShortenRequest request, String requestBaseUrl);

    /**
     * Returns the URL stored for the identifier.
     *
     * @throws com.codefarm.shortlink.service.exception.MalformedShortIdException if the id cannot have been generated
     * @throws com.codefarm.shortlink.service.exception.ShortLinkNotFoundException if nothing is stored under the id
     * @throws com.codefarm.shortlink.service.exception.StorageUnavailableException if the store fails
     */
    String resolve(String shortId);
}
