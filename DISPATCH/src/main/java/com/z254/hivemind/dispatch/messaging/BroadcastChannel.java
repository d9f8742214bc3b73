package com.z254.hivemind.dispatch.messaging;

import com.z254.hivemind.dispatch.domain.model.AgentMessage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Ephemeral publish/subscribe path. A message published while nobody listens on the
 * topic is lost.
 */
public interface BroadcastChannel {

    /**
     * Publish a message to the current subscribers of a topic.
     *
     * @param topic   the topic
     * @param message the message
     * @return Mono that completes once handed to the transport
     */
    Mono<Void> publish(String topic, AgentMessage message);

    /**
     * Live messages on a topic, from subscription onwards.
     */
    Flux<AgentMessage> subscribe(String topic);
}
