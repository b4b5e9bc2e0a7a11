package com.hooky.infrastructure.exception;

/**
 * The durable store failed mid-operation. The process stays on its chosen backend; the
 * request fails instead of silently falling back to memory.
 */
public class StoreUnavailableException extends RuntimeException {

    private final String errorCode = "STORE_UNAVAILABLE";

    public StoreUnavailableException(String operation, Throwable cause) {
        super("Store unavailable during " + operation + ": " + cause.getMessage(), cause);
    }

    public String getErrorCode() {
        return errorCode;
    }
}
