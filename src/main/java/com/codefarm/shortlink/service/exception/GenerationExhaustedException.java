package com.codefarm.shortlink.service.exception;

/**
 * Every candidate identifier collided with an existing one. Transient under contention;
 * if it keeps happening the identifier length or alphabet needs widening.
 */
public class GenerationExhaustedException extends ShortLinkException {

    private final int attempts;

    public GenerationExhaustedException(int attempts) {
        super(ErrorCode.GENERATION_EXHAUSTED,
                "Could not generate a unique short ID after " + attempts + " attempts. Please try again.");
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
