package com.hooky.adapter.in.web;

import com.hooky.application.port.in.GetReceiverUseCase;
import com.hooky.application.port.in.SubscribeUseCase;
import com.hooky.application.port.out.EventBroadcaster.EventListener;
import com.hooky.application.port.out.EventBroadcaster.Subscription;
import com.hooky.domain.model.CapturedEvent;
import com.hooky.domain.model.Receiver;
import com.hooky.domain.model.ReceiverId;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Clock;

/**
 * Server-sent event stream of captures. Each event is written as {@code event:webhook} plus one
 * JSON {@code data:} line. The connection ends when the client goes away (noticed at the latest
 * by the next heartbeat), the receiver is deleted, or its TTL runs out.
 */
@RestController
@Tag(name = "Endpoints")
public class EventStreamController {

    private static final Logger log = LoggerFactory.getLogger(EventStreamController.class);

    public static final String EVENT_NAME = "webhook";

    private final GetReceiverUseCase getReceiverUseCase;
    private final SubscribeUseCase subscribeUseCase;
    private final StreamHeartbeat heartbeat;
    private final Clock clock;

    public EventStreamController(
            GetReceiverUseCase getReceiverUseCase,
            SubscribeUseCase subscribeUseCase,
            StreamHeartbeat heartbeat,
            Clock clock) {
        this.getReceiverUseCase = getReceiverUseCase;
        this.subscribeUseCase = subscribeUseCase;
        this.heartbeat = heartbeat;
        this.clock = clock;
    }

    @GetMapping("/api/endpoints/{id}/stream")
    @Operation(summary = "Stream captured events", description = "Server-sent events, one 'webhook' event per capture")
    public ResponseEntity<SseEmitter> stream(
            @Parameter(description = "Receiver ID") @PathVariable String id) throws IOException {
        var idResult = ReceiverId.parse(id);
        if (idResult.isFailure()) {
            throw new StreamRejectedException(ErrorResponse.from(idResult.errorOrNull()));
        }
        ReceiverId receiverId = idResult.getOrThrow();

        var receiverResult = getReceiverUseCase.getReceiver(receiverId);
        if (receiverResult.isFailure()) {
            throw new StreamRejectedException(ErrorResponse.from(receiverResult.errorOrNull()));
        }
        Receiver receiver = receiverResult.getOrThrow();

        SseEmitter emitter = new SseEmitter(Math.max(1L, receiver.remaining(clock.instant()).toMillis()));
        var subscribeResult = subscribeUseCase.subscribe(receiverId, new SseEventListener(emitter));
        if (subscribeResult.isFailure()) {
            throw new StreamRejectedException(ErrorResponse.from(subscribeResult.errorOrNull()));
        }

        Subscription subscription = subscribeResult.getOrThrow().subscription();
        emitter.onCompletion(() -> release(emitter, subscription));
        emitter.onTimeout(() -> {
            log.debug("Live stream for receiver {} reached expiry", receiverId);
            release(emitter, subscription);
            emitter.complete();
        });
        emitter.onError(e -> release(emitter, subscription));
        heartbeat.register(emitter, subscription);

        // Comment line so headers reach the client before the first capture
        emitter.send(SseEmitter.event().comment("connected"));
        return ResponseEntity.ok()
            .header("Cache-Control", "no-cache")
            .body(emitter);
    }

    private void release(SseEmitter emitter, Subscription subscription) {
        heartbeat.unregister(emitter);
        subscription.cancel();
    }

    static final class SseEventListener implements EventListener {

        private final SseEmitter emitter;

        SseEventListener(SseEmitter emitter) {
            this.emitter = emitter;
        }

        @Override
        public void onEvent(CapturedEvent event) throws IOException {
            emitter.send(SseEmitter.event().name(EVENT_NAME).data(event, MediaType.APPLICATION_JSON));
        }

        @Override
        public void onClose() {
            emitter.complete();
        }
    }
}
