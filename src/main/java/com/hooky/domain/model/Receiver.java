package com.hooky.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * A temporary webhook address. Immutable; {@code expiresAt} is the only authority on liveness.
 */
public record Receiver(
    ReceiverId id,
    Instant createdAt,
    Instant expiresAt
) {
    public Receiver {
        if (!expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("expiresAt must be after createdAt for receiver " + id);
        }
    }

    public static Receiver create(ReceiverId id, Instant now, Duration ttl) {
        return new Receiver(id, now, now.plus(ttl));
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    /**
     * Time left before expiry, never negative.
     */
    public Duration remaining(Instant now) {
        Duration left = Duration.between(now, expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public Duration ttl() {
        return Duration.between(createdAt, expiresAt);
    }
}
