package com.hooky.adapter.in.web;

import org.springframework.http.ResponseEntity;

/**
 * Raised by the live stream endpoint when it cannot open a stream; carries the error response to send instead.
 */
public class StreamRejectedException extends RuntimeException {

    private final transient ResponseEntity<ErrorResponse> response;

    public StreamRejectedException(ResponseEntity<ErrorResponse> response) {
        super(response.getBody() != null ? response.getBody().message() : "Live stream rejected");
        this.response = response;
    }

    public ResponseEntity<ErrorResponse> getResponse() {
        return response;
    }
}
