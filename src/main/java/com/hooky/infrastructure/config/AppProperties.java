package com.hooky.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private String publicBaseUrl;
    private Store store = new Store();
    private Receiver receiver = new Receiver();
    private Reaper reaper = new Reaper();
    private Stream stream = new Stream();

    public String getPublicBaseUrl() {
        return publicBaseUrl;
    }

    public void setPublicBaseUrl(String publicBaseUrl) {
        this.publicBaseUrl = publicBaseUrl;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Receiver getReceiver() {
        return receiver;
    }

    public void setReceiver(Receiver receiver) {
        this.receiver = receiver;
    }

    public Reaper getReaper() {
        return reaper;
    }

    public void setReaper(Reaper reaper) {
        this.reaper = reaper;
    }

    public Stream getStream() {
        return stream;
    }

    public void setStream(Stream stream) {
        this.stream = stream;
    }

    public static class Store {
        private boolean forceMemory;
        // Redis keeps records this long past expiresAt so late captures report "expired", not "not found"
        private long expiryGraceSeconds = 60;

        public boolean isForceMemory() {
            return forceMemory;
        }

        public void setForceMemory(boolean forceMemory) {
            this.forceMemory = forceMemory;
        }

        public long getExpiryGraceSeconds() {
            return expiryGraceSeconds;
        }

        public void setExpiryGraceSeconds(long expiryGraceSeconds) {
            this.expiryGraceSeconds = expiryGraceSeconds;
        }
    }

    public static class Receiver {
        private long defaultTtlSeconds = 3600;
        // Longer requests are clamped to this
        private long maxTtlSeconds = 31_536_000;
        private int maxEvents = 100;

        public long getDefaultTtlSeconds() {
            return defaultTtlSeconds;
        }

        public void setDefaultTtlSeconds(long defaultTtlSeconds) {
            this.defaultTtlSeconds = defaultTtlSeconds;
        }

        public long getMaxTtlSeconds() {
            return maxTtlSeconds;
        }

        public void setMaxTtlSeconds(long maxTtlSeconds) {
            this.maxTtlSeconds = maxTtlSeconds;
        }

        public int getMaxEvents() {
            return maxEvents;
        }

        public void setMaxEvents(int maxEvents) {
            this.maxEvents = maxEvents;
        }
    }

    public static class Reaper {
        private long intervalMs = 60_000;

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }

    public static class Stream {
        private int bufferSize = 256;
        private long heartbeatMs = 15_000;

        public int getBufferSize() {
            return bufferSize;
        }

        public void setBufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
        }

        public long getHeartbeatMs() {
            return heartbeatMs;
        }

        public void setHeartbeatMs(long heartbeatMs) {
            this.heartbeatMs = heartbeatMs;
        }
    }
}
