package com.z254.hivemind.dispatch.messaging.impl;

import com.z254.hivemind.dispatch.domain.model.AgentMessage;
import com.z254.hivemind.dispatch.messaging.BroadcastChannel;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process {@link BroadcastChannel} backed by one Reactor sink per topic.
 * Messages reach only the subscribers present at publish time.
 */
@Slf4j
public class SinkBroadcastChannel implements BroadcastChannel {

    private static final Duration EMIT_CONTENTION_WINDOW = Duration.ofMillis(100);

    private final Map<String, Sinks.Many<AgentMessage>> topicSinks = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> publish(String topic, AgentMessage message) {
        return Mono.fromRunnable(() -> {
            Sinks.Many<AgentMessage> sink = topicSinks.get(topic);
            if (sink == null || sink.currentSubscriberCount() == 0) {
                log.debug("No listeners on {}, dropping broadcast of {}", topic, message.getId());
                return;
            }
            sink.emitNext(message, Sinks.EmitFailureHandler.busyLooping(EMIT_CONTENTION_WINDOW));
            log.debug("Broadcast message {} on {}", message.getId(), topic);
        });
    }

    @Override
    public Flux<AgentMessage> subscribe(String topic) {
        return topicSinks
                .computeIfAbsent(topic, t -> Sinks.many().multicast().directBestEffort())
                .asFlux();
    }

    public int subscriberCount(String topic) {
        Sinks.Many<AgentMessage> sink = topicSinks.get(topic);
        return sink == null ? 0 : sink.currentSubscriberCount();
    }
}
