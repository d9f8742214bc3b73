package com.z254.hivemind.dispatch.messaging.impl;

import com.z254.hivemind.dispatch.domain.model.AgentMessage;
import com.z254.hivemind.dispatch.messaging.DurableQueue;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link DurableQueue}. Appends and drains for one recipient are serialized
 * through {@link ConcurrentHashMap#compute}; recipients do not contend with each other.
 */
@Slf4j
public class InMemoryDurableQueue implements DurableQueue {

    private final Map<String, List<AgentMessage>> inboxes = new ConcurrentHashMap<>();
    private final Map<String, List<AgentMessage>> processed = new ConcurrentHashMap<>();
    private final int maxProcessedRetained;

    public InMemoryDurableQueue(int maxProcessedRetained) {
        this.maxProcessedRetained = maxProcessedRetained;
    }

    @Override
    public Mono<Void> append(String recipient, AgentMessage message) {
        return Mono.fromRunnable(() -> inboxes.compute(recipient, (key, inbox) -> {
            List<AgentMessage> next = inbox == null ? new ArrayList<>() : inbox;
            next.add(message);
            return next;
        }));
    }

    @Override
    public Mono<List<AgentMessage>> drain(String recipient) {
        return Mono.fromCallable(() -> {
            List<AgentMessage> drained = new ArrayList<>();
            inboxes.computeIfPresent(recipient, (key, inbox) -> {
                drained.addAll(inbox);
                return null;
            });
            if (!drained.isEmpty()) {
                archive(recipient, drained);
            }
            return Collections.unmodifiableList(drained);
        });
    }

    @Override
    public Mono<Long> pendingCount(String recipient) {
        return Mono.fromCallable(() -> {
            List<AgentMessage> inbox = inboxes.get(recipient);
            return inbox == null ? 0L : (long) inbox.size();
        });
    }

    @Override
    public Mono<Boolean> isAvailable() {
        return Mono.just(true);
    }

    /**
     * Messages already read by a recipient, oldest first.
     */
    public List<AgentMessage> processed(String recipient) {
        List<AgentMessage> archive = processed.get(recipient);
        return archive == null ? List.of() : List.copyOf(archive);
    }

    private void archive(String recipient, List<AgentMessage> drained) {
        processed.compute(recipient, (key, archive) -> {
            List<AgentMessage> next = archive == null ? new ArrayList<>() : archive;
            next.addAll(drained);
            int overflow = next.size() - maxProcessedRetained;
            if (overflow > 0) {
                next.subList(0, overflow).clear();
            }
            return next;
        });
        log.debug("Archived {} messages for {}", drained.size(), recipient);
    }
}
