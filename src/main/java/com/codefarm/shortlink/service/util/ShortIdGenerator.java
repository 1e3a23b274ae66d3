package com.codefarm.shortlink.service.util;

/**
 * Produces candidate identifiers. Candidates may collide; the store decides uniqueness.
 */
@FunctionalInterface
public interface ShortIdGenerator {

    String generate();
}
