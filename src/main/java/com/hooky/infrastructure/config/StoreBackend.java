package com.hooky.infrastructure.config;

/**
 * Where receivers and events live for this process. Decided once at startup.
 */
public enum StoreBackend {
    REDIS,
    MEMORY
}
