package com.hooky.application.port.in;

public interface SweepExpiredReceiversUseCase {
    /**
     * @return number of receivers whose bookkeeping was removed
     */
    int sweepExpired();
}
