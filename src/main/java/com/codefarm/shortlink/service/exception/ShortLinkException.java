package com.codefarm.shortlink.service.exception;

/**
 * Base of every failure the service reports to clients. The code ends up in the
 * {@code error} field of the response body.
 */
public abstract class ShortLinkException extends RuntimeException {

    private final ErrorCode code;

    protected ShortLinkException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected ShortLinkException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
