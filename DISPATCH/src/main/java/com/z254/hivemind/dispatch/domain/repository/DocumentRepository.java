package com.z254.hivemind.dispatch.domain.repository;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Keyed document store for persisted dispatch state.
 * <p>
 * Saving under an existing id overwrites the previous document, so re-saves are idempotent.
 *
 * @param <T> document type
 */
public interface DocumentRepository<T> {

    /**
     * Save a document under a stable id.
     *
     * @param id       the document id
     * @param document the document
     * @return the saved document
     */
    Mono<T> save(String id, T document);

    /**
     * Find a document by id.
     *
     * @param id the document id
     * @return the document or empty
     */
    Mono<T> findById(String id);

    /**
     * Find all documents in the collection.
     */
    Flux<T> findAll();

    /**
     * Delete a document. Completes normally when the id is absent.
     */
    Mono<Void> deleteById(String id);

    /**
     * Ping the underlying store.
     *
     * @return true if the store is reachable
     */
    Mono<Boolean> isAvailable();
}
