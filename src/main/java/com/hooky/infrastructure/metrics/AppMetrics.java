package com.hooky.infrastructure.metrics;

import com.hooky.application.port.out.EventBroadcaster;
import com.hooky.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class AppMetrics implements MetricsPort {

    private final MeterRegistry registry;
    private final Counter receiversCreated;
    private final Counter receiversDeleted;
    private final Counter receiversReaped;
    private final Counter eventsCaptured;

    public AppMetrics(MeterRegistry registry, EventBroadcaster broadcaster) {
        this.registry = registry;

        this.receiversCreated = Counter.builder("receivers_created_total")
            .description("Total number of receivers created")
            .register(registry);

        this.receiversDeleted = Counter.builder("receivers_deleted_total")
            .description("Total number of receivers deleted explicitly")
            .register(registry);

        this.receiversReaped = Counter.builder("receivers_reaped_total")
            .description("Total number of expired receivers removed by the sweep")
            .register(registry);

        this.eventsCaptured = Counter.builder("events_captured_total")
            .description("Total number of requests captured")
            .register(registry);

        Gauge.builder("stream_subscriptions_active", broadcaster, EventBroadcaster::activeSubscriptions)
            .description("Live stream subscriptions attached to this process")
            .register(registry);
    }

    @Override
    public void incrementReceiversCreated() {
        receiversCreated.increment();
    }

    @Override
    public void incrementReceiversDeleted() {
        receiversDeleted.increment();
    }

    @Override
    public void incrementReceiversReaped(int count) {
        receiversReaped.increment(count);
    }

    @Override
    public void incrementEventsCaptured() {
        eventsCaptured.increment();
    }

    @Override
    public void incrementCapturesRejected(String reason) {
        Counter.builder("captures_rejected_total")
            .description("Captures refused because the receiver was missing or expired")
            .tag("reason", reason)
            .register(registry)
            .increment();
    }
}
