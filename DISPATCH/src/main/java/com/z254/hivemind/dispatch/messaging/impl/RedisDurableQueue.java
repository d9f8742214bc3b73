package com.z254.hivemind.dispatch.messaging.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.AgentMessage;
import com.z254.hivemind.dispatch.messaging.DurableQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Redis-backed {@link DurableQueue}.
 * <p>
 * Key layout: pending messages in the list {@code {keyPrefix}{recipient}}, read messages in
 * {@code {keyPrefix}{recipient}{processedSuffix}}. A Lua script moves the whole pending list
 * to the archive and returns it, so concurrent readers never see the same message twice.
 * An entry that cannot be read back is pushed to the head of the inbox again, so it stays
 * pending rather than being lost.
 */
@Slf4j
public class RedisDurableQueue implements DurableQueue {

    @SuppressWarnings("unchecked")
    static final RedisScript<List<Object>> DRAIN_SCRIPT = RedisScript.of("""
            local items = redis.call('LRANGE', KEYS[1], 0, -1)
            if #items > 0 then
              for i = 1, #items do
                redis.call('RPUSH', KEYS[2], items[i])
              end
              redis.call('DEL', KEYS[1])
              redis.call('LTRIM', KEYS[2], -tonumber(ARGV[1]), -1)
            end
            return items
            """, (Class<List<Object>>) (Class<?>) List.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final DispatchProperties.MessagingProperties config;

    public RedisDurableQueue(ReactiveRedisTemplate<String, String> redisTemplate,
                             ObjectMapper objectMapper,
                             DispatchProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.config = properties.getMessaging();
    }

    @Override
    public Mono<Void> append(String recipient, AgentMessage message) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(message))
                .flatMap(json -> redisTemplate.opsForList().rightPush(inboxKey(recipient), json))
                .doOnSuccess(size -> log.debug("Queued message {} for {} ({} pending)",
                        message.getId(), recipient, size))
                .then();
    }

    @Override
    public Mono<List<AgentMessage>> drain(String recipient) {
        List<String> keys = List.of(inboxKey(recipient), processedKey(recipient));
        List<String> args = List.of(String.valueOf(config.getMaxProcessedRetained()));
        return redisTemplate.execute(DRAIN_SCRIPT, keys, args)
                .flatMapIterable(RedisDurableQueue::flatten)
                .map(item -> String.valueOf(item))
                .collectList()
                .flatMap(raw -> {
                    List<AgentMessage> messages = new ArrayList<>(raw.size());
                    List<String> unreadable = new ArrayList<>();
                    for (String json : raw) {
                        try {
                            messages.add(objectMapper.readValue(json, AgentMessage.class));
                        } catch (JsonProcessingException e) {
                            log.error("Unreadable message in inbox of {}: {}", recipient, e.getMessage());
                            unreadable.add(json);
                        }
                    }
                    return requeue(recipient, unreadable).thenReturn(messages);
                });
    }

    @Override
    public Mono<Long> pendingCount(String recipient) {
        return redisTemplate.opsForList().size(inboxKey(recipient));
    }

    @Override
    public Mono<Boolean> isAvailable() {
        return redisTemplate.hasKey(config.getKeyPrefix() + "health")
                .map(exists -> true)
                .onErrorResume(e -> {
                    log.warn("Redis durable queue unavailable: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    String inboxKey(String recipient) {
        return config.getKeyPrefix() + recipient;
    }

    String processedKey(String recipient) {
        return config.getKeyPrefix() + recipient + config.getProcessedSuffix();
    }

    // Depending on the driver, a list reply arrives as one List element or element by element.
    private static List<?> flatten(Object reply) {
        if (reply instanceof List<?> list) {
            return list;
        }
        return reply == null ? List.of() : List.of(reply);
    }

    // Pushed head-first in reverse so the entries keep their original order ahead of newer ones.
    private Mono<Void> requeue(String recipient, List<String> unreadable) {
        if (unreadable.isEmpty()) {
            return Mono.empty();
        }
        List<String> reversed = new ArrayList<>(unreadable);
        Collections.reverse(reversed);
        return redisTemplate.opsForList().leftPushAll(inboxKey(recipient), reversed)
                .doOnSuccess(size -> log.warn("Returned {} unreadable messages to the inbox of {}",
                        unreadable.size(), recipient))
                .then();
    }
}
