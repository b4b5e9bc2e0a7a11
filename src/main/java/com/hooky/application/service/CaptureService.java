package com.hooky.application.service;

import com.hooky.application.port.in.CaptureEventUseCase;
import com.hooky.application.port.in.GetReceiverUseCase;
import com.hooky.application.port.in.ListEventsUseCase;
import com.hooky.application.port.in.SubscribeUseCase;
import com.hooky.application.port.out.EventBroadcaster;
import com.hooky.application.port.out.EventBroadcaster.EventListener;
import com.hooky.application.port.out.EventBroadcaster.Subscription;
import com.hooky.application.port.out.IdGenerator;
import com.hooky.application.port.out.MetricsPort;
import com.hooky.application.port.out.ReceiverStore;
import com.hooky.domain.error.ReceiverError;
import com.hooky.domain.model.CapturedEvent;
import com.hooky.domain.model.ReceiverId;
import com.hooky.domain.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Service
public class CaptureService implements CaptureEventUseCase, ListEventsUseCase, SubscribeUseCase {

    private static final Logger log = LoggerFactory.getLogger(CaptureService.class);

    private final GetReceiverUseCase getReceiverUseCase;
    private final ReceiverStore receiverStore;
    private final EventBroadcaster broadcaster;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;
    private final Clock clock;

    public CaptureService(
            GetReceiverUseCase getReceiverUseCase,
            ReceiverStore receiverStore,
            EventBroadcaster broadcaster,
            IdGenerator idGenerator,
            MetricsPort metrics,
            Clock clock) {
        this.getReceiverUseCase = getReceiverUseCase;
        this.receiverStore = receiverStore;
        this.broadcaster = broadcaster;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Result<CapturedEvent, ReceiverError> captureEvent(ReceiverId id, CaptureRequest request) {
        var receiverResult = getReceiverUseCase.getReceiver(id);
        if (receiverResult.isFailure()) {
            return reject(receiverResult.errorOrNull());
        }

        CapturedEvent event = new CapturedEvent(
            idGenerator.newEventId(),
            clock.instant(),
            request.method(),
            request.path(),
            request.query(),
            request.headers(),
            request.body()
        );

        // append re-checks existence atomically, so a delete that lands after the lookup wins
        if (!receiverStore.append(id, event)) {
            return reject(new ReceiverError.NotFound(id));
        }

        metrics.incrementEventsCaptured();
        log.debug("Captured event: receiverId={}, eventId={}, method={}", id, event.id(), event.method());
        return Result.success(event);
    }

    @Override
    public Result<List<CapturedEvent>, ReceiverError> listEvents(ReceiverId id) {
        return getReceiverUseCase.getReceiver(id)
            .map(receiver -> receiverStore.findEvents(receiver.id()));
    }

    @Override
    public Result<LiveSubscription, ReceiverError> subscribe(ReceiverId id, EventListener listener) {
        var receiverResult = getReceiverUseCase.getReceiver(id);
        if (receiverResult.isFailure()) {
            return Result.failure(receiverResult.errorOrNull());
        }

        Subscription subscription = broadcaster.subscribe(id, listener);
        // A delete between lookup and subscribe has already run closeAll; do not leave this one behind
        if (receiverStore.find(id).isEmpty()) {
            subscription.cancel();
            return Result.failure(new ReceiverError.NotFound(id));
        }

        log.debug("Live stream attached: receiverId={}, active={}", id, broadcaster.activeSubscriptions());
        return Result.success(new LiveSubscription(receiverResult.getOrThrow(), subscription));
    }

    private Result<CapturedEvent, ReceiverError> reject(ReceiverError error) {
        metrics.incrementCapturesRejected(error.code());
        log.warn("Capture rejected: {}", error.message());
        return Result.failure(error);
    }
}
