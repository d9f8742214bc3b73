package com.z254.hivemind.dispatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.hivemind.dispatch.messaging.BroadcastChannel;
import com.z254.hivemind.dispatch.messaging.DurableQueue;
import com.z254.hivemind.dispatch.messaging.impl.InMemoryDurableQueue;
import com.z254.hivemind.dispatch.messaging.impl.RedisBroadcastChannel;
import com.z254.hivemind.dispatch.messaging.impl.RedisDurableQueue;
import com.z254.hivemind.dispatch.messaging.impl.SinkBroadcastChannel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveRedisTemplate;

/**
 * Durable queue and broadcast channel backends, selected by {@code dispatch.messaging.backend}.
 */
@Configuration
public class MessagingConfig {

    @Configuration
    @ConditionalOnProperty(prefix = "dispatch.messaging", name = "backend",
            havingValue = "in-memory", matchIfMissing = true)
    static class InMemoryMessaging {

        @Bean
        public DurableQueue durableQueue(DispatchProperties properties) {
            return new InMemoryDurableQueue(properties.getMessaging().getMaxProcessedRetained());
        }

        @Bean
        public BroadcastChannel broadcastChannel() {
            return new SinkBroadcastChannel();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "dispatch.messaging", name = "backend", havingValue = "redis")
    static class RedisMessaging {

        @Bean
        public DurableQueue durableQueue(ReactiveRedisTemplate<String, String> redisTemplate,
                                         ObjectMapper objectMapper,
                                         DispatchProperties properties) {
            return new RedisDurableQueue(redisTemplate, objectMapper, properties);
        }

        @Bean
        public BroadcastChannel broadcastChannel(ReactiveRedisTemplate<String, String> redisTemplate,
                                                 ObjectMapper objectMapper) {
            return new RedisBroadcastChannel(redisTemplate, objectMapper);
        }
    }
}
