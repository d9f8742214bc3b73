package com.z254.hivemind.dispatch.messaging;

import com.z254.hivemind.dispatch.domain.model.AgentMessage;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Per-recipient append-only inbox that survives restarts.
 * <p>
 * {@link #drain(String)} returns every pending message and moves it to the recipient's
 * archive in one atomic step, so each message is returned by exactly one drain.
 */
public interface DurableQueue {

    Mono<Void> append(String recipient, AgentMessage message);

    /**
     * Return and archive all pending messages for a recipient, oldest first.
     */
    Mono<List<AgentMessage>> drain(String recipient);

    Mono<Long> pendingCount(String recipient);

    Mono<Boolean> isAvailable();
}
