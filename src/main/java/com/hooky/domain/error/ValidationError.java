package com.hooky.domain.error;

/**
 * Sealed type representing input validation errors.
 * These are expected outcomes, not exceptional cases.
 */
public sealed interface ValidationError {

    String message();

    String code();

    sealed interface ReceiverIdError extends ValidationError {

        record Empty() implements ReceiverIdError {
            public static final Empty INSTANCE = new Empty();
            @Override
            public String message() {
                return "Receiver ID cannot be empty";
            }

            @Override
            public String code() {
                return "RECEIVER_ID_EMPTY";
            }
        }

        record InvalidFormat(String value) implements ReceiverIdError {
            @Override
            public String message() {
                return "Receiver ID must be 1-64 characters of [A-Za-z0-9_-]: " + value;
            }

            @Override
            public String code() {
                return "RECEIVER_ID_INVALID_FORMAT";
            }
        }
    }
}
