package com.hooky.application.port.in;

import com.hooky.domain.model.Receiver;

public interface CreateReceiverUseCase {
    /**
     * @param ttlSeconds requested lifetime; null or non-positive falls back to the configured default,
     *                   anything above the configured maximum is clamped to it
     */
    Receiver createReceiver(Long ttlSeconds);
}
