package com.codefarm.shortlink.service.exception;

public enum ErrorCode {
    INVALID_INPUT,
    NOT_FOUND,
    GENERATION_EXHAUSTED,
    STORAGE_UNAVAILABLE,
    UNSUPPORTED_METHOD
}
