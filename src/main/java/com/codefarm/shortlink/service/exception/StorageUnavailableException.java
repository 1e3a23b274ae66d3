package com.codefarm.shortlink.service.exception;

public class StorageUnavailableException extends ShortLinkException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_UNAVAILABLE, message, cause);
    }
}
