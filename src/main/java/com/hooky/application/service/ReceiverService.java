package com.hooky.application.service;

import com.hooky.application.port.in.CreateReceiverUseCase;
import com.hooky.application.port.in.DeleteReceiverUseCase;
import com.hooky.application.port.in.GetReceiverUseCase;
import com.hooky.application.port.in.ListReceiversUseCase;
import com.hooky.application.port.in.SweepExpiredReceiversUseCase;
import com.hooky.application.port.out.EventBroadcaster;
import com.hooky.application.port.out.IdGenerator;
import com.hooky.application.port.out.MetricsPort;
import com.hooky.application.port.out.ReceiverStore;
import com.hooky.domain.error.ReceiverError;
import com.hooky.domain.model.Receiver;
import com.hooky.domain.model.ReceiverId;
import com.hooky.domain.model.Result;
import com.hooky.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Service
public class ReceiverService implements CreateReceiverUseCase, GetReceiverUseCase, ListReceiversUseCase,
        DeleteReceiverUseCase, SweepExpiredReceiversUseCase {

    private static final Logger log = LoggerFactory.getLogger(ReceiverService.class);

    static final int MAX_ID_ATTEMPTS = 5;

    private final ReceiverStore receiverStore;
    private final EventBroadcaster broadcaster;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;
    private final AppProperties appProperties;
    private final Clock clock;

    public ReceiverService(
            ReceiverStore receiverStore,
            EventBroadcaster broadcaster,
            IdGenerator idGenerator,
            MetricsPort metrics,
            AppProperties appProperties,
            Clock clock) {
        this.receiverStore = receiverStore;
        this.broadcaster = broadcaster;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    @Override
    public Receiver createReceiver(Long ttlSeconds) {
        Duration ttl = effectiveTtl(ttlSeconds);
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);

        for (int attempt = 1; attempt <= MAX_ID_ATTEMPTS; attempt++) {
            Receiver receiver = Receiver.create(idGenerator.newReceiverId(), now, ttl);
            if (receiverStore.save(receiver)) {
                metrics.incrementReceiversCreated();
                log.info("Receiver created: id={}, ttlSeconds={}, expiresAt={}",
                    receiver.id(), ttl.toSeconds(), receiver.expiresAt());
                return receiver;
            }
            log.warn("Receiver id collision on attempt {}: id={}", attempt, receiver.id());
        }
        throw new IllegalStateException("Could not allocate a unique receiver id after " + MAX_ID_ATTEMPTS + " attempts");
    }

    @Override
    public Result<Receiver, ReceiverError> getReceiver(ReceiverId id) {
        Optional<Receiver> found = receiverStore.find(id);
        if (found.isEmpty()) {
            return Result.failure(new ReceiverError.NotFound(id));
        }
        Receiver receiver = found.get();
        // The sweep runs far less often than requests arrive, so expiry is decided here
        if (receiver.isExpired(clock.instant())) {
            return Result.failure(new ReceiverError.Expired(id, receiver.expiresAt()));
        }
        return Result.success(receiver);
    }

    @Override
    public List<ReceiverOverview> listReceivers() {
        Instant now = clock.instant();
        return receiverStore.findAll().stream()
            .filter(receiver -> !receiver.isExpired(now))
            .sorted(Comparator.comparing(Receiver::createdAt))
            .map(receiver -> new ReceiverOverview(receiver, receiverStore.countEvents(receiver.id())))
            .toList();
    }

    @Override
    public boolean deleteReceiver(ReceiverId id) {
        boolean removed = receiverStore.delete(id);
        int closed = broadcaster.closeAll(id);
        if (removed) {
            metrics.incrementReceiversDeleted();
            log.info("Receiver deleted: id={}, closedStreams={}", id, closed);
        } else {
            log.debug("Delete requested for unknown receiver: id={}", id);
        }
        return removed;
    }

    @Override
    public int sweepExpired() {
        List<ReceiverId> removed = receiverStore.sweep();
        if (removed.isEmpty()) {
            return 0;
        }
        int closed = removed.stream().mapToInt(broadcaster::closeAll).sum();
        metrics.incrementReceiversReaped(removed.size());
        log.info("Swept {} expired receivers, closed {} live streams", removed.size(), closed);
        return removed.size();
    }

    private Duration effectiveTtl(Long ttlSeconds) {
        AppProperties.Receiver limits = appProperties.getReceiver();
        if (ttlSeconds == null || ttlSeconds < 1) {
            return Duration.ofSeconds(limits.getDefaultTtlSeconds());
        }
        if (ttlSeconds > limits.getMaxTtlSeconds()) {
            log.debug("Requested ttl {}s clamped to {}s", ttlSeconds, limits.getMaxTtlSeconds());
            return Duration.ofSeconds(limits.getMaxTtlSeconds());
        }
        return Duration.ofSeconds(ttlSeconds);
    }
}
