package com.hooky.adapter.out.broadcast;

import com.hooky.application.port.out.EventBroadcaster;
import com.hooky.domain.model.CapturedEvent;
import com.hooky.domain.model.ReceiverId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans captured events out to the live subscribers attached to this process.
 *
 * <p>Each subscription owns a bounded buffer drained by at most one task at a time on the
 * dispatch executor, so a subscriber sees events in publish order and a slow subscriber only
 * ever delays itself. In Redis mode the publisher is the Redis relay rather than the store.
 */
public class LocalEventBroadcaster implements EventBroadcaster, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LocalEventBroadcaster.class);

    private final Map<ReceiverId, Set<QueuedSubscription>> subscriptions = new ConcurrentHashMap<>();
    private final AtomicInteger active = new AtomicInteger();
    private final Executor dispatchExecutor;
    private final int bufferSize;

    public LocalEventBroadcaster(Executor dispatchExecutor, int bufferSize) {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
        }
        this.dispatchExecutor = dispatchExecutor;
        this.bufferSize = bufferSize;
    }

    @Override
    public Subscription subscribe(ReceiverId id, EventListener listener) {
        QueuedSubscription subscription = new QueuedSubscription(id, listener);
        active.incrementAndGet();
        subscriptions.compute(id, (key, current) -> {
            Set<QueuedSubscription> set = current != null ? current : ConcurrentHashMap.newKeySet();
            set.add(subscription);
            return set;
        });
        log.debug("Subscribed to receiver {}: active={}", id, active.get());
        return subscription;
    }

    @Override
    public void publish(ReceiverId id, CapturedEvent event) {
        Set<QueuedSubscription> current = subscriptions.get(id);
        if (current == null) {
            return;
        }
        for (QueuedSubscription subscription : current) {
            subscription.offer(event);
        }
    }

    @Override
    public int closeAll(ReceiverId id) {
        Set<QueuedSubscription> removed = subscriptions.remove(id);
        if (removed == null) {
            return 0;
        }
        int closed = 0;
        for (QueuedSubscription subscription : removed) {
            if (subscription.terminate()) {
                closed++;
            }
        }
        return closed;
    }

    @Override
    public int activeSubscriptions() {
        return active.get();
    }

    /**
     * Ends every subscription. Called when the application context shuts down.
     */
    @Override
    public void close() {
        for (ReceiverId id : Set.copyOf(subscriptions.keySet())) {
            closeAll(id);
        }
    }

    private void detach(QueuedSubscription subscription) {
        subscriptions.computeIfPresent(subscription.receiverId(), (key, set) -> {
            set.remove(subscription);
            return set.isEmpty() ? null : set;
        });
    }

    private final class QueuedSubscription implements Subscription {

        private final ReceiverId receiverId;
        private final EventListener listener;
        private final BlockingQueue<CapturedEvent> pending = new ArrayBlockingQueue<>(bufferSize);
        private final AtomicBoolean draining = new AtomicBoolean();
        private final AtomicBoolean closed = new AtomicBoolean();

        private QueuedSubscription(ReceiverId receiverId, EventListener listener) {
            this.receiverId = receiverId;
            this.listener = listener;
        }

        @Override
        public ReceiverId receiverId() {
            return receiverId;
        }

        @Override
        public boolean isActive() {
            return !closed.get();
        }

        @Override
        public void cancel() {
            if (release()) {
                detach(this);
                log.debug("Unsubscribed from receiver {}: active={}", receiverId, active.get());
            }
        }

        /**
         * Broadcaster-initiated end: the caller has already removed this from the registry.
         */
        private boolean terminate() {
            if (!release()) {
                return false;
            }
            try {
                listener.onClose();
            } catch (RuntimeException e) {
                log.warn("Listener for receiver {} failed on close: {}", receiverId, e.getMessage());
            }
            return true;
        }

        private boolean release() {
            if (!closed.compareAndSet(false, true)) {
                return false;
            }
            pending.clear();
            active.decrementAndGet();
            return true;
        }

        private void offer(CapturedEvent event) {
            if (closed.get()) {
                return;
            }
            if (!pending.offer(event)) {
                log.warn("Live stream buffer full for receiver {}, dropping event {}", receiverId, event.id());
                return;
            }
            scheduleDrain();
        }

        private void scheduleDrain() {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                dispatchExecutor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                draining.set(false);
                log.warn("Dispatch rejected for receiver {}, closing subscription", receiverId);
                cancel();
            }
        }

        private void drain() {
            try {
                CapturedEvent event;
                while (!closed.get() && (event = pending.poll()) != null) {
                    listener.onEvent(event);
                }
            } catch (Exception e) {
                log.debug("Live stream listener for receiver {} failed, detaching: {}", receiverId, e.getMessage());
                cancel();
            } finally {
                draining.set(false);
            }
            // An offer may have raced with the end of the loop above
            if (!closed.get() && !pending.isEmpty()) {
                scheduleDrain();
            }
        }
    }
}
