package com.hooky.adapter.in.web;

import com.hooky.application.port.out.EventBroadcaster.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes a comment line to every open live stream on a fixed interval. A client that vanished
 * without closing its connection is only noticed on a write, so a failed ping releases the
 * stream's subscription even when the receiver is idle.
 */
@Component
public class StreamHeartbeat {

    private static final Logger log = LoggerFactory.getLogger(StreamHeartbeat.class);

    static final String PING = "ping";

    private final Map<SseEmitter, Subscription> streams = new ConcurrentHashMap<>();

    public void register(SseEmitter emitter, Subscription subscription) {
        streams.put(emitter, subscription);
    }

    public void unregister(SseEmitter emitter) {
        streams.remove(emitter);
    }

    int trackedStreams() {
        return streams.size();
    }

    @Scheduled(
        initialDelayString = "${app.stream.heartbeat-ms:15000}",
        fixedDelayString = "${app.stream.heartbeat-ms:15000}")
    public void ping() {
        streams.forEach((emitter, subscription) -> {
            if (!subscription.isActive()) {
                streams.remove(emitter);
                return;
            }
            try {
                emitter.send(SseEmitter.event().comment(PING));
            } catch (IOException | IllegalStateException e) {
                log.debug("Live stream for receiver {} lost its client: {}", subscription.receiverId(), e.getMessage());
                streams.remove(emitter);
                subscription.cancel();
            }
        });
    }
}
