package com.hooky.application.port.in;

import com.hooky.application.port.out.EventBroadcaster.EventListener;
import com.hooky.application.port.out.EventBroadcaster.Subscription;
import com.hooky.domain.error.ReceiverError;
import com.hooky.domain.model.Receiver;
import com.hooky.domain.model.ReceiverId;
import com.hooky.domain.model.Result;

public interface SubscribeUseCase {
    Result<LiveSubscription, ReceiverError> subscribe(ReceiverId id, EventListener listener);

    /**
     * The attached subscription together with the receiver it belongs to, so the transport can
     * bound the connection by the receiver's remaining lifetime.
     */
    record LiveSubscription(Receiver receiver, Subscription subscription) {}
}
