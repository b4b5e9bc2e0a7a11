package com.hooky.application.port.out;

import com.hooky.domain.model.ReceiverId;

import java.util.UUID;

/**
 * Port for generating unique identifiers.
 * Abstracts ID generation strategy from application services.
 */
public interface IdGenerator {

    /**
     * Generates a short, URL-safe receiver token. Not a security boundary, but random enough
     * that ids cannot be enumerated casually.
     */
    ReceiverId newReceiverId();

    /**
     * Generates a time-ordered event identifier (UUIDv7).
     */
    UUID newEventId();
}
