package com.z254.hivemind.dispatch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A message delivered to a single recipient through the messaging substrate.
 * Durable copies are consumed once per recipient; broadcast copies are fire-and-forget.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentMessage {

    private String id;

    /**
     * Sender id. The dispatcher itself sends as {@code dispatcher}.
     */
    private String from;

    private String to;

    private MessageType type;

    @Builder.Default
    private Map<String, Object> content = new HashMap<>();

    private Instant timestamp;
}
