package com.hooky.adapter.in.web;

import com.hooky.infrastructure.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestNotUsableException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Global exception handler for unexpected errors.
 * Expected outcomes (unknown or expired receiver, malformed id) are handled via Result types in controllers.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ErrorResponse.of(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request body is not valid JSON");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex) {
        return ErrorResponse.of(HttpStatus.NOT_FOUND, "NOT_FOUND", "No route for " + ex.getResourcePath());
    }

    @ExceptionHandler(StreamRejectedException.class)
    public ResponseEntity<ErrorResponse> handleStreamRejected(StreamRejectedException ex) {
        log.debug("Live stream rejected: {}", ex.getMessage());
        return ex.getResponse();
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(StoreUnavailableException ex) {
        log.error("Store failure: {}", ex.getMessage(), ex);
        return ErrorResponse.of(HttpStatus.SERVICE_UNAVAILABLE, ex.getErrorCode(), "Storage backend is unavailable");
    }

    @ExceptionHandler(AsyncRequestNotUsableException.class)
    public void handleDisconnectedStream(AsyncRequestNotUsableException ex) {
        // Client of a live stream went away; nothing can be written back
        log.debug("Live stream client disconnected: {}", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ErrorResponse.of(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
    }
}
