package com.hooky.domain.model;

import com.hooky.domain.error.ValidationError.ReceiverIdError;

import java.util.regex.Pattern;

/**
 * Value Object for receiver identity: the opaque, URL-safe token that appears in the hook address.
 */
public record ReceiverId(String value) {

    public static final int MAX_LENGTH = 64;

    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9_-]+");

    public ReceiverId {
        // Compact constructor for internal use - assumes validated input
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("ReceiverId value cannot be blank - use parse() for validation");
        }
    }

    /**
     * Parses a path segment into a ReceiverId, returning a Result for malformed input.
     */
    public static Result<ReceiverId, ReceiverIdError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(ReceiverIdError.Empty.INSTANCE);
        }
        if (value.length() > MAX_LENGTH || !ALLOWED.matcher(value).matches()) {
            return Result.failure(new ReceiverIdError.InvalidFormat(value));
        }
        return Result.success(new ReceiverId(value));
    }

    /**
     * Wraps an id read back from our own store.
     */
    public static ReceiverId fromTrusted(String value) {
        return new ReceiverId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
