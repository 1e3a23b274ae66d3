package com.codefarm.shortlink.service.repository;

import java.util.Optional;

/**
 * Owns every short link. Only create and read are offered: a link never changes or disappears.
 */
public interface LinkStore {

    /**
     * Atomically stores the mapping unless {@code shortId} is already taken.
     *
     * @return {@code true} if the mapping was stored, {@code false} if the id exists (store unchanged)
     * @throws com.codefarm.shortlink.service.exception.StorageUnavailableException if the backend fails
     */
    boolean putIfAbsent(String shortId, String longUrl);

    /**
     * Exact, case-sensitive lookup.
     *
     * @throws com.codefarm.shortlink.service.exception.StorageUnavailableException if the backend fails
     */
    Optional<String> get(String shortId);
}
