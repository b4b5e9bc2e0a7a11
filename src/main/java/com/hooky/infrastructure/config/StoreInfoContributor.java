package com.hooky.infrastructure.config;

import org.springframework.boot.actuate.info.Info;
import org.springframework.boot.actuate.info.InfoContributor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Exposes the chosen store backend on {@code /actuator/info}.
 */
@Component
public class StoreInfoContributor implements InfoContributor {

    private final StoreBackend storeBackend;
    private final AppProperties appProperties;

    public StoreInfoContributor(StoreBackend storeBackend, AppProperties appProperties) {
        this.storeBackend = storeBackend;
        this.appProperties = appProperties;
    }

    @Override
    public void contribute(Info.Builder builder) {
        builder.withDetail("store", Map.of(
            "backend", storeBackend.name(),
            "maxEventsPerReceiver", appProperties.getReceiver().getMaxEvents(),
            "defaultTtlSeconds", appProperties.getReceiver().getDefaultTtlSeconds()));
    }
}
