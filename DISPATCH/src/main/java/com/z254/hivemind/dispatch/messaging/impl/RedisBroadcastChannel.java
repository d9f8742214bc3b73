package com.z254.hivemind.dispatch.messaging.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.hivemind.dispatch.domain.model.AgentMessage;
import com.z254.hivemind.dispatch.messaging.BroadcastChannel;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Redis pub/sub {@link BroadcastChannel}.
 */
@Slf4j
public class RedisBroadcastChannel implements BroadcastChannel {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisBroadcastChannel(ReactiveRedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @CircuitBreaker(name = "broadcast")
    public Mono<Void> publish(String topic, AgentMessage message) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(message))
                .flatMap(json -> redisTemplate.convertAndSend(topic, json))
                .doOnSuccess(receivers -> log.debug("Published message {} on {} to {} listeners",
                        message.getId(), topic, receivers))
                .then();
    }

    @Override
    public Flux<AgentMessage> subscribe(String topic) {
        return redisTemplate.listenToChannel(topic)
                .flatMap(m -> deserialize(m.getMessage()));
    }

    private Mono<AgentMessage> deserialize(String json) {
        try {
            return Mono.just(objectMapper.readValue(json, AgentMessage.class));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable broadcast: {}", e.getMessage());
            return Mono.empty();
        }
    }
}
