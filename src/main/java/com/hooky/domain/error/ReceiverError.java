package com.hooky.domain.error;

import com.hooky.domain.model.ReceiverId;

import java.time.Instant;

/**
 * Expected reasons a receiver cannot be used. Both deny the operation, but they tell the
 * caller different things: the address never existed (or was deleted), or its time ran out.
 */
public sealed interface ReceiverError {

    record NotFound(ReceiverId id) implements ReceiverError {
        @Override
        public String message() {
            return "Receiver not found: " + id;
        }

        @Override
        public String code() {
            return "RECEIVER_NOT_FOUND";
        }
    }

    record Expired(ReceiverId id, Instant expiredAt) implements ReceiverError {
        @Override
        public String message() {
            return "Receiver " + id + " expired at " + expiredAt;
        }

        @Override
        public String code() {
            return "RECEIVER_EXPIRED";
        }
    }

    String message();

    String code();
}
