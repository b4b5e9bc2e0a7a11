package com.hooky.application.port.out;

/**
 * Port for recording application metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void incrementReceiversCreated();

    void incrementReceiversDeleted();

    void incrementReceiversReaped(int count);

    void incrementEventsCaptured();

    void incrementCapturesRejected(String reason);
}
