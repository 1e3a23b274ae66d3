package com.codefarm.shortlink.service.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // A lookup key that can't exist is answered like an unknown one.
    @ExceptionHandler(MalformedShortIdException.class)
    public ResponseEntity<Map<String, Object>> handleMalformedShortId(MalformedShortIdException ex) {
        return body(HttpStatus.NOT_FOUND, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidInput(InvalidInputException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", ex.getCode().name(), "message", ex.getMessage(), "field", ex.getField()));
    }

    @ExceptionHandler(ShortLinkNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ShortLinkNotFoundException ex) {
        return body(HttpStatus.NOT_FOUND, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(GenerationExhaustedException.class)
    public ResponseEntity<Map<String, Object>> handleGenerationExhausted(GenerationExhaustedException ex) {
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleStorageUnavailable(StorageUnavailableException ex) {
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Invalid JSON in request body: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_INPUT, "Invalid JSON in request body.");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleUnsupportedMethod(HttpRequestMethodNotSupportedException ex) {
        return body(HttpStatus.METHOD_NOT_ALLOWED, ErrorCode.UNSUPPORTED_METHOD, "Unsupported method or path.");
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, ErrorCode code, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("error", code.name(), "message", message));
    }
}
