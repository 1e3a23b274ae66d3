package com.codefarm.shortlink.service.exception;

public class ShortLinkNotFoundException extends ShortLinkException {

    public ShortLinkNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
