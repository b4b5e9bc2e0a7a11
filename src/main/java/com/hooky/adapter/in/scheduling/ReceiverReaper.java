package com.hooky.adapter.in.scheduling;

import com.hooky.application.port.in.SweepExpiredReceiversUseCase;
import com.hooky.infrastructure.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic backstop for expiry. Reads already treat expired receivers as gone; this removes
 * what they leave behind and ends their live streams.
 */
@Component
public class ReceiverReaper {

    private static final Logger log = LoggerFactory.getLogger(ReceiverReaper.class);

    private final SweepExpiredReceiversUseCase sweepExpiredReceiversUseCase;

    public ReceiverReaper(SweepExpiredReceiversUseCase sweepExpiredReceiversUseCase) {
        this.sweepExpiredReceiversUseCase = sweepExpiredReceiversUseCase;
    }

    @Scheduled(
        initialDelayString = "${app.reaper.interval-ms:60000}",
        fixedDelayString = "${app.reaper.interval-ms:60000}")
    public void sweep() {
        try {
            int removed = sweepExpiredReceiversUseCase.sweepExpired();
            log.debug("Reaper pass complete: removed={}", removed);
        } catch (StoreUnavailableException e) {
            // Next pass retries; reads stay correct meanwhile
            log.warn("Reaper pass skipped: {}", e.getMessage());
        }
    }
}
