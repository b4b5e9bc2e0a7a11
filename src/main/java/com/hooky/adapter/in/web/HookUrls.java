package com.hooky.adapter.in.web;

import com.hooky.domain.model.ReceiverId;
import com.hooky.infrastructure.config.AppProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/**
 * Builds the public address of a receiver: {@code app.public-base-url} when configured,
 * otherwise the scheme and host of the current request.
 */
@Component
public class HookUrls {

    private final AppProperties appProperties;

    public HookUrls(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    public String hookUrl(ReceiverId id) {
        return baseUrl() + "/hook/" + id.value();
    }

    private String baseUrl() {
        String configured = appProperties.getPublicBaseUrl();
        if (configured != null && !configured.isBlank()) {
            return configured.trim().replaceAll("/+$", "");
        }
        return ServletUriComponentsBuilder.fromCurrentContextPath().build().toUriString();
    }
}
