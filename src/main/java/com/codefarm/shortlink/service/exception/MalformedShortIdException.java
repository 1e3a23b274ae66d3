package com.codefarm.shortlink.service.exception;

/**
 * A lookup key that could never have been generated. Rejected before the store is queried.
 */
public class MalformedShortIdException extends InvalidInputException {

    public MalformedShortIdException() {
        super("short_id", "Malformed short ID.");
    }
}
