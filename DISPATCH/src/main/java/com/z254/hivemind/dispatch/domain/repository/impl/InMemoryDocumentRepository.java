package com.z254.hivemind.dispatch.domain.repository.impl;

import com.z254.hivemind.dispatch.domain.repository.DocumentRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simple in-memory implementation of {@link DocumentRepository}.
 * State is lost on restart; use the Redis backend where that matters.
 */
public class InMemoryDocumentRepository<T> implements DocumentRepository<T> {

    private final Map<String, T> store = new ConcurrentHashMap<>();

    @Override
    public Mono<T> save(String id, T document) {
        store.put(id, document);
        return Mono.just(document);
    }

    @Override
    public Mono<T> findById(String id) {
        return Mono.justOrEmpty(store.get(id));
    }

    @Override
    public Flux<T> findAll() {
        return Flux.fromIterable(store.values());
    }

    @Override
    public Mono<Void> deleteById(String id) {
        store.remove(id);
        return Mono.empty();
    }

    @Override
    public Mono<Boolean> isAvailable() {
        return Mono.just(true);
    }

    public int size() {
        return store.size();
    }
}
