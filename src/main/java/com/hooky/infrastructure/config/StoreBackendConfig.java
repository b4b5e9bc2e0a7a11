package com.hooky.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hooky.adapter.out.broadcast.LocalEventBroadcaster;
import com.hooky.adapter.out.memory.InMemoryReceiverStore;
import com.hooky.adapter.out.redis.RedisReceiverStore;
import com.hooky.application.port.out.ReceiverStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Chooses the store backend once per process and wires the matching {@link ReceiverStore}.
 */
@Configuration
public class StoreBackendConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreBackendConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StoreBackend storeBackend(AppProperties appProperties, ObjectProvider<RedisConnectionFactory> connectionFactory) {
        return select(appProperties.getStore().isForceMemory(), connectionFactory.getIfAvailable());
    }

    /**
     * Makes exactly one connectivity attempt. Any failure commits the process to memory;
     * there is no retry and no switching later on.
     */
    static StoreBackend select(boolean forceMemory, RedisConnectionFactory connectionFactory) {
        if (forceMemory) {
            log.info("Store backend: MEMORY (forced by app.store.force-memory)");
            return StoreBackend.MEMORY;
        }
        if (connectionFactory == null) {
            log.warn("No Redis connection factory configured; using in-memory storage");
            return StoreBackend.MEMORY;
        }
        try (RedisConnection connection = connectionFactory.getConnection()) {
            connection.ping();
            log.info("Store backend: REDIS");
            return StoreBackend.REDIS;
        } catch (RuntimeException e) {
            log.warn("Redis unavailable ({}); using in-memory storage", e.getMessage());
            return StoreBackend.MEMORY;
        }
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService streamDispatchExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("hooky-stream-"));
    }

    @Bean
    public LocalEventBroadcaster eventBroadcaster(ExecutorService streamDispatchExecutor, AppProperties appProperties) {
        return new LocalEventBroadcaster(streamDispatchExecutor, appProperties.getStream().getBufferSize());
    }

    @Bean
    public ReceiverStore receiverStore(
            StoreBackend storeBackend,
            ObjectProvider<StringRedisTemplate> redisTemplate,
            ObjectMapper objectMapper,
            LocalEventBroadcaster eventBroadcaster,
            AppProperties appProperties,
            Clock clock) {
        return switch (storeBackend) {
            case REDIS -> new RedisReceiverStore(redisTemplate.getObject(), objectMapper, appProperties);
            case MEMORY -> new InMemoryReceiverStore(eventBroadcaster, appProperties, clock);
        };
    }
}
