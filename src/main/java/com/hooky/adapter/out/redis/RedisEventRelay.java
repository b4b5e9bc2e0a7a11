package com.hooky.adapter.out.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hooky.application.port.out.EventBroadcaster;
import com.hooky.domain.model.CapturedEvent;
import com.hooky.domain.model.ReceiverId;
import com.hooky.infrastructure.config.StoreBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Feeds events published on the Redis {@code pub:*} channels into the local broadcaster, so a
 * subscriber attached to any instance sharing the Redis sees every capture. Inactive in memory mode.
 */
@Component
public class RedisEventRelay implements MessageListener, SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RedisEventRelay.class);

    private final StoreBackend storeBackend;
    private final ObjectProvider<RedisConnectionFactory> connectionFactory;
    private final EventBroadcaster broadcaster;
    private final ObjectMapper objectMapper;

    private volatile RedisMessageListenerContainer container;

    public RedisEventRelay(
            StoreBackend storeBackend,
            ObjectProvider<RedisConnectionFactory> connectionFactory,
            EventBroadcaster broadcaster,
            ObjectMapper objectMapper) {
        this.storeBackend = storeBackend;
        this.connectionFactory = connectionFactory;
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String channel = new String(message.getChannel(), StandardCharsets.UTF_8);
        if (!channel.startsWith(RedisReceiverStore.CHANNEL_PREFIX)) {
            return;
        }
        ReceiverId id = ReceiverId.fromTrusted(channel.substring(RedisReceiverStore.CHANNEL_PREFIX.length()));
        try {
            CapturedEvent event = objectMapper.readValue(message.getBody(), CapturedEvent.class);
            broadcaster.publish(id, event);
        } catch (IOException e) {
            log.warn("Discarding unreadable event on channel {}: {}", channel, e.getMessage());
        }
    }

    @Override
    public void start() {
        if (storeBackend != StoreBackend.REDIS) {
            return;
        }
        RedisMessageListenerContainer listenerContainer = new RedisMessageListenerContainer();
        listenerContainer.setConnectionFactory(connectionFactory.getObject());
        // Deliver on the subscription thread so per-channel order reaches the broadcaster intact
        listenerContainer.setTaskExecutor(new SyncTaskExecutor());
        listenerContainer.addMessageListener(this, new PatternTopic(RedisReceiverStore.CHANNEL_PREFIX + "*"));
        listenerContainer.afterPropertiesSet();
        listenerContainer.start();
        container = listenerContainer;
        log.info("Relaying Redis channels {}* to live streams", RedisReceiverStore.CHANNEL_PREFIX);
    }

    @Override
    public void stop() {
        RedisMessageListenerContainer listenerContainer = container;
        if (listenerContainer == null) {
            return;
        }
        container = null;
        try {
            listenerContainer.destroy();
        } catch (Exception e) {
            log.warn("Failed to stop Redis relay cleanly: {}", e.getMessage());
        }
    }

    @Override
    public boolean isRunning() {
        return container != null;
    }
}
