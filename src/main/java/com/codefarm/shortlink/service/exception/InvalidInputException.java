package com.codefarm.shortlink.service.exception;

public class InvalidInputException extends ShortLinkException {

    private final String field;

    public InvalidInputException(String field, String message) {
        super(ErrorCode.INVALID_INPUT, message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
