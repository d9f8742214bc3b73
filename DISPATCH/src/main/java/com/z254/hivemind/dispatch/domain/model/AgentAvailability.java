package com.z254.hivemind.dispatch.domain.model;

/**
 * Whether an agent can accept another task right now.
 */
public enum AgentAvailability {
    AVAILABLE,
    BUSY
}
