package com.hooky.application.port.out;

import com.hooky.domain.model.CapturedEvent;
import com.hooky.domain.model.Receiver;
import com.hooky.domain.model.ReceiverId;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for receivers and their capped, newest-first event logs.
 *
 * <p>One implementation is chosen at startup and kept for the life of the process. Both must
 * behave identically: expired records are still returned here (callers compare against
 * {@code expiresAt}), the log never holds more than the configured cap, and {@link #delete}
 * removes the record and its log as one step.
 */
public interface ReceiverStore {

    /**
     * Stores a new receiver.
     *
     * @return false if the id is already taken
     */
    boolean save(Receiver receiver);

    Optional<Receiver> find(ReceiverId id);

    List<Receiver> findAll();

    /**
     * Removes the record, its event log and any index entry.
     *
     * @return whether a record existed
     */
    boolean delete(ReceiverId id);

    /**
     * Prepends the event, trims the log to the cap and publishes the event to live
     * subscribers, all atomically with respect to {@link #delete}.
     *
     * @return false if the receiver no longer exists, in which case nothing was written
     */
    boolean append(ReceiverId id, CapturedEvent event);

    List<CapturedEvent> findEvents(ReceiverId id);

    long countEvents(ReceiverId id);

    /**
     * Drops bookkeeping for receivers that are gone or past expiry.
     *
     * @return ids that were removed
     */
    List<ReceiverId> sweep();
}
