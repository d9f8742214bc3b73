package com.z254.hivemind.dispatch.domain.repository;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Write-behind front for a {@link DocumentRepository} that keeps the stored document for an
 * id in step with the order in which changes were made.
 * <p>
 * Callers {@link #stage} a snapshot (or {@link #stageDelete} a removal) while still holding
 * the lock that ordered the change, then {@link #flush} once the lock is released. At most
 * one write per id is in flight; when it completes, the newest staged change for that id
 * is written next. Intermediate snapshots may be skipped, a stale one never overwrites a
 * newer one.
 *
 * @param <T> document type
 */
@Slf4j
public class OrderedDocumentWriter<T> {

    private final DocumentRepository<T> repository;
    private final String collection;

    private final Map<String, Optional<T>> staged = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public OrderedDocumentWriter(DocumentRepository<T> repository, String collection) {
        this.repository = repository;
        this.collection = collection;
    }

    /**
     * Record the latest state of a document. Must be called inside the critical section
     * that produced it.
     */
    public void stage(String id, T snapshot) {
        staged.put(id, Optional.of(snapshot));
    }

    /**
     * Record the removal of a document. Must be called inside the critical section that
     * removed it.
     */
    public void stageDelete(String id) {
        staged.put(id, Optional.empty());
    }

    /**
     * Start writing the staged change for an id unless a write for it is already running.
     */
    public void flush(String id) {
        if (!inFlight.add(id)) {
            return;
        }
        Optional<T> next = staged.remove(id);
        if (next == null) {
            release(id);
            return;
        }
        Mono<?> write = next.isPresent()
                ? repository.save(id, next.get())
                : repository.deleteById(id);
        write.doFinally(signal -> release(id))
                .subscribe(null, e -> log.warn("Failed to write {} {}: {}", collection, id, e.getMessage()));
    }

    /**
     * True while a change for the id is staged or being written.
     */
    public boolean isPending(String id) {
        return staged.containsKey(id) || inFlight.contains(id);
    }

    private void release(String id) {
        inFlight.remove(id);
        if (staged.containsKey(id)) {
            flush(id);
        }
    }
}
