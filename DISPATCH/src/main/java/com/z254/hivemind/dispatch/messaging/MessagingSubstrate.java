package com.z254.hivemind.dispatch.messaging;

import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.AgentMessage;
import com.z254.hivemind.dispatch.domain.model.MessageType;
import com.z254.hivemind.dispatch.observability.DispatchMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Delivers every message through two independent paths: a durable per-recipient inbox and
 * a best-effort broadcast for live listeners.
 * <p>
 * The durable write is retried with exponential backoff and fails the send when retries
 * run out. Broadcast failures are logged and counted, never propagated.
 */
@Service
@Slf4j
public class MessagingSubstrate {

    private final DurableQueue durableQueue;
    private final BroadcastChannel broadcastChannel;
    private final DispatchMetrics metrics;
    private final DispatchProperties.MessagingProperties config;
    private final Clock clock;

    public MessagingSubstrate(DurableQueue durableQueue,
                              BroadcastChannel broadcastChannel,
                              DispatchMetrics metrics,
                              DispatchProperties properties,
                              Clock clock) {
        this.durableQueue = durableQueue;
        this.broadcastChannel = broadcastChannel;
        this.metrics = metrics;
        this.config = properties.getMessaging();
        this.clock = clock;
    }

    /**
     * Send a message to its recipient.
     *
     * @return the message as stored, with id and timestamp assigned
     */
    public Mono<AgentMessage> send(AgentMessage message) {
        if (message.getTo() == null || message.getTo().isBlank()) {
            return Mono.error(new IllegalArgumentException("Message recipient is required"));
        }
        if (message.getId() == null) {
            message.setId(UUID.randomUUID().toString());
        }
        if (message.getTimestamp() == null) {
            message.setTimestamp(clock.instant());
        }

        return writeDurable(message)
                .then(broadcast(topicFor(message.getTo()), message))
                .thenReturn(message)
                .doOnSuccess(m -> log.debug("Sent {} message {} from {} to {}",
                        m.getType(), m.getId(), m.getFrom(), m.getTo()));
    }

    public Mono<AgentMessage> send(String from, String to, MessageType type, Map<String, Object> content) {
        return send(AgentMessage.builder()
                .from(from)
                .to(to)
                .type(type)
                .content(content)
                .build());
    }

    /**
     * Return and archive every pending durable message for a recipient.
     */
    public Mono<List<AgentMessage>> read(String recipient) {
        return durableQueue.drain(recipient)
                .doOnSuccess(messages -> log.debug("Read {} messages for {}",
                        messages == null ? 0 : messages.size(), recipient));
    }

    public Mono<Long> pending(String recipient) {
        return durableQueue.pendingCount(recipient);
    }

    /**
     * Live messages for a recipient. Only messages sent after subscription are seen.
     */
    public Flux<AgentMessage> listen(String recipient) {
        return broadcastChannel.subscribe(topicFor(recipient));
    }

    public Flux<AgentMessage> listenEmergency() {
        return broadcastChannel.subscribe(config.getEmergencyChannel());
    }

    /**
     * Best-effort publish on the emergency channel.
     */
    public Mono<Void> publishEmergency(AgentMessage message) {
        if (message.getTimestamp() == null) {
            message.setTimestamp(clock.instant());
        }
        return broadcast(config.getEmergencyChannel(), message);
    }

    public Mono<Boolean> isDurableStoreAvailable() {
        return durableQueue.isAvailable();
    }

    private Mono<Void> writeDurable(AgentMessage message) {
        return Mono.defer(() -> durableQueue.append(message.getTo(), message))
                .retryWhen(Retry.backoff(config.getDurableWriteRetries(), config.getDurableWriteBackoff())
                        .doBeforeRetry(signal -> log.warn("Retrying durable write of {} to {} (attempt {}): {}",
                                message.getId(), message.getTo(), signal.totalRetries() + 1,
                                signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> new MessageDeliveryException(
                                message.getTo(), message.getId(), signal.totalRetries() + 1, signal.failure())))
                .doOnSuccess(v -> metrics.recordMessageSent())
                .doOnError(MessageDeliveryException.class, e -> {
                    metrics.recordDurableFailure();
                    log.error(e.getMessage(), e.getCause());
                });
    }

    private Mono<Void> broadcast(String topic, AgentMessage message) {
        return Mono.defer(() -> broadcastChannel.publish(topic, message))
                .timeout(config.getBroadcastTimeout())
                .onErrorResume(e -> {
                    metrics.recordBroadcastFailure();
                    log.warn("Broadcast of message {} on {} failed: {}", message.getId(), topic, e.toString());
                    return Mono.empty();
                });
    }

    private String topicFor(String recipient) {
        return config.getChannelPrefix() + recipient;
    }
}
