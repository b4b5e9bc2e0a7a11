package com.hooky.application.port.out;

import com.hooky.domain.model.CapturedEvent;
import com.hooky.domain.model.ReceiverId;

import java.io.IOException;

/**
 * In-process publish/subscribe of captured events, keyed by receiver id.
 */
public interface EventBroadcaster {

    /**
     * Registers a listener for events published after this call. Every call yields an
     * independent subscription.
     */
    Subscription subscribe(ReceiverId id, EventListener listener);

    /**
     * Hands the event to every current subscriber of {@code id} and returns without waiting
     * for delivery. Subscriber failures never reach the caller.
     */
    void publish(ReceiverId id, CapturedEvent event);

    /**
     * Terminates all subscriptions of a receiver, notifying each listener via {@link EventListener#onClose()}.
     *
     * @return number of subscriptions closed
     */
    int closeAll(ReceiverId id);

    int activeSubscriptions();

    interface EventListener {

        void onEvent(CapturedEvent event) throws IOException;

        /**
         * Called once when the broadcaster ends the subscription (receiver deleted or expired).
         */
        default void onClose() {
        }
    }

    interface Subscription {

        ReceiverId receiverId();

        boolean isActive();

        /**
         * Detaches the listener. Idempotent.
         */
        void cancel();
    }
}
