package com.hooky.adapter.out.memory;

import com.hooky.application.port.out.EventBroadcaster;
import com.hooky.application.port.out.ReceiverStore;
import com.hooky.domain.model.CapturedEvent;
import com.hooky.domain.model.Receiver;
import com.hooky.domain.model.ReceiverId;
import com.hooky.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local fallback used when Redis is unreachable at startup.
 *
 * <p>Each receiver's record and event log live in one {@link Entry}. All writes to an entry
 * happen under its monitor, and an entry is marked removed under the same monitor, so an
 * append either lands before a delete or observes it. Unrelated receivers never share a lock.
 */
public class InMemoryReceiverStore implements ReceiverStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InMemoryReceiverStore.class);

    private final Map<ReceiverId, Entry> entries = new ConcurrentHashMap<>();
    private final EventBroadcaster broadcaster;
    private final AppProperties appProperties;
    private final Clock clock;

    public InMemoryReceiverStore(EventBroadcaster broadcaster, AppProperties appProperties, Clock clock) {
        this.broadcaster = broadcaster;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    @Override
    public boolean save(Receiver receiver) {
        return entries.putIfAbsent(receiver.id(), new Entry(receiver)) == null;
    }

    @Override
    public Optional<Receiver> find(ReceiverId id) {
        return Optional.ofNullable(entries.get(id)).map(entry -> entry.receiver);
    }

    @Override
    public List<Receiver> findAll() {
        return entries.values().stream()
            .map(entry -> entry.receiver)
            .toList();
    }

    @Override
    public boolean delete(ReceiverId id) {
        Entry entry = entries.remove(id);
        if (entry == null) {
            return false;
        }
        entry.discard();
        return true;
    }

    @Override
    public boolean append(ReceiverId id, CapturedEvent event) {
        Entry entry = entries.get(id);
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            if (entry.removed) {
                return false;
            }
            entry.events.addFirst(event);
            int maxEvents = appProperties.getReceiver().getMaxEvents();
            while (entry.events.size() > maxEvents) {
                entry.events.removeLast();
            }
            // Publishing under the lock keeps live order identical to log order
            broadcaster.publish(id, event);
        }
        return true;
    }

    @Override
    public List<CapturedEvent> findEvents(ReceiverId id) {
        Entry entry = entries.get(id);
        if (entry == null) {
            return List.of();
        }
        synchronized (entry) {
            return List.copyOf(entry.events);
        }
    }

    @Override
    public long countEvents(ReceiverId id) {
        Entry entry = entries.get(id);
        if (entry == null) {
            return 0;
        }
        synchronized (entry) {
            return entry.events.size();
        }
    }

    @Override
    public List<ReceiverId> sweep() {
        Instant now = clock.instant();
        List<ReceiverId> removed = new ArrayList<>();
        entries.forEach((id, entry) -> {
            // remove(key, value) so a concurrent delete of the same entry is not counted twice
            if (entry.receiver.isExpired(now) && entries.remove(id, entry)) {
                entry.discard();
                removed.add(id);
            }
        });
        if (!removed.isEmpty()) {
            log.debug("Removed expired receivers from memory: {}", removed);
        }
        return removed;
    }

    /**
     * Drops everything. Called when the application context shuts down.
     */
    @Override
    public void close() {
        entries.values().forEach(Entry::discard);
        entries.clear();
    }

    private static final class Entry {
        private final Receiver receiver;
        private final Deque<CapturedEvent> events = new ArrayDeque<>();
        private boolean removed;

        private Entry(Receiver receiver) {
            this.receiver = receiver;
        }

        private synchronized void discard() {
            removed = true;
            events.clear();
        }
    }
}
