package com.z254.hivemind.dispatch.domain.repository.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.hivemind.dispatch.domain.repository.DocumentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Redis-backed {@link DocumentRepository}. One hash per collection; field is the document
 * id, value is the Jackson JSON of the document.
 */
@Slf4j
public class RedisDocumentRepository<T> implements DocumentRepository<T> {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String hashKey;
    private final Class<T> type;

    public RedisDocumentRepository(ReactiveRedisTemplate<String, String> redisTemplate,
                                   ObjectMapper objectMapper,
                                   String hashKey,
                                   Class<T> type) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.hashKey = hashKey;
        this.type = type;
    }

    @Override
    public Mono<T> save(String id, T document) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(document))
                .flatMap(json -> redisTemplate.<String, String>opsForHash().put(hashKey, id, json))
                .doOnSuccess(ok -> log.debug("Saved {} {} to {}", type.getSimpleName(), id, hashKey))
                .thenReturn(document);
    }

    @Override
    public Mono<T> findById(String id) {
        return redisTemplate.<String, String>opsForHash().get(hashKey, id)
                .flatMap(this::deserialize);
    }

    @Override
    public Flux<T> findAll() {
        return redisTemplate.<String, String>opsForHash().values(hashKey)
                .flatMap(this::deserialize);
    }

    @Override
    public Mono<Void> deleteById(String id) {
        return redisTemplate.<String, String>opsForHash().remove(hashKey, id).then();
    }

    @Override
    public Mono<Boolean> isAvailable() {
        return redisTemplate.hasKey(hashKey)
                .map(exists -> true)
                .onErrorResume(e -> {
                    log.warn("Redis unavailable for {}: {}", hashKey, e.getMessage());
                    return Mono.just(false);
                });
    }

    private Mono<T> deserialize(String json) {
        try {
            return Mono.just(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Skipping unreadable {} in {}: {}", type.getSimpleName(), hashKey, e.getMessage());
            return Mono.empty();
        }
    }
}
