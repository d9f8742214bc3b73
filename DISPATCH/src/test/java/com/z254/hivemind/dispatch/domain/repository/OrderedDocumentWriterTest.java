package com.z254.hivemind.dispatch.domain.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OrderedDocumentWriterTest {

    private ManualRepository repository;
    private OrderedDocumentWriter<String> writer;

    @BeforeEach
    void setUp() {
        repository = new ManualRepository();
        writer = new OrderedDocumentWriter<>(repository, "agent");
    }

    @Test
    @DisplayName("should hold later snapshots until the running write completes, then write only the newest")
    void newestSnapshotWins() {
        // Given
        writer.stage("a", "load=1");
        writer.flush("a");
        writer.stage("a", "load=2");
        writer.flush("a");
        writer.stage("a", "load=3");
        writer.flush("a");

        // Then
        assertThat(repository.writes).containsExactly("save a load=1");

        // When
        repository.completeNext();

        // Then
        assertThat(repository.writes).containsExactly("save a load=1", "save a load=3");
        repository.completeNext();
        assertThat(repository.writes).hasSize(2);
        assertThat(writer.isPending("a")).isFalse();
    }

    @Test
    @DisplayName("should write a staged removal after an earlier save")
    void deleteAfterSave() {
        writer.stage("a", "load=1");
        writer.flush("a");
        writer.stageDelete("a");
        writer.flush("a");

        repository.completeNext();

        assertThat(repository.writes).containsExactly("save a load=1", "delete a");
    }

    @Test
    @DisplayName("should keep writing newer changes after a failed write")
    void continuesAfterFailure() {
        writer.stage("a", "load=1");
        writer.flush("a");
        writer.stage("a", "load=2");
        writer.flush("a");

        repository.failNext(new IllegalStateException("connection reset"));

        assertThat(repository.writes).containsExactly("save a load=1", "save a load=2");
    }

    @Test
    @DisplayName("should write different ids independently")
    void independentIds() {
        writer.stage("a", "load=1");
        writer.flush("a");
        writer.stage("b", "load=5");
        writer.flush("b");

        assertThat(repository.writes).containsExactly("save a load=1", "save b load=5");
    }

    /**
     * Repository whose writes stay open until the test completes them, oldest first.
     */
    private static final class ManualRepository implements DocumentRepository<String> {

        private final List<String> writes = new ArrayList<>();
        private final List<Sinks.Empty<Void>> open = new ArrayList<>();

        @Override
        public Mono<String> save(String id, String document) {
            writes.add("save " + id + " " + document);
            return pending().thenReturn(document);
        }

        @Override
        public Mono<String> findById(String id) {
            return Mono.empty();
        }

        @Override
        public Flux<String> findAll() {
            return Flux.empty();
        }

        @Override
        public Mono<Void> deleteById(String id) {
            writes.add("delete " + id);
            return pending();
        }

        @Override
        public Mono<Boolean> isAvailable() {
            return Mono.just(true);
        }

        void completeNext() {
            open.remove(0).tryEmitEmpty();
        }

        void failNext(Throwable error) {
            open.remove(0).tryEmitError(error);
        }

        private Mono<Void> pending() {
            Sinks.Empty<Void> sink = Sinks.empty();
            open.add(sink);
            return sink.asMono();
        }
    }
}
