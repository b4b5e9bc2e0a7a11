package com.hooky.adapter.in.web;

import com.hooky.domain.error.ReceiverError;
import com.hooky.domain.error.ValidationError;
import com.hooky.infrastructure.context.RequestContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

public record ErrorResponse(
    String error,
    String message,
    String requestId
) {

    static ResponseEntity<ErrorResponse> of(HttpStatus status, String code, String message) {
        // Content type is fixed so error bodies still render when the client asked for an event stream
        return ResponseEntity.status(status)
            .contentType(MediaType.APPLICATION_JSON)
            .body(new ErrorResponse(code, message, RequestContext.getRequestId()));
    }

    static ResponseEntity<ErrorResponse> from(ReceiverError error) {
        HttpStatus status = error instanceof ReceiverError.Expired ? HttpStatus.GONE : HttpStatus.NOT_FOUND;
        return of(status, error.code(), error.message());
    }

    static ResponseEntity<ErrorResponse> from(ValidationError error) {
        return of(HttpStatus.BAD_REQUEST, error.code(), error.message());
    }
}
