package com.z254.hivemind.dispatch.registry;

import lombok.Getter;

@Getter
public class AgentNotFoundException extends RuntimeException {

    private final String agentId;

    public AgentNotFoundException(String agentId) {
        super("Agent not found: " + agentId);
        this.agentId = agentId;
    }
}
