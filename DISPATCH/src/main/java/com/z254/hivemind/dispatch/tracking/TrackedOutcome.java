package com.z254.hivemind.dispatch.tracking;

import com.z254.hivemind.dispatch.domain.model.Agent;

/**
 * Result of folding one outcome into an agent's statistics.
 *
 * @param agent       snapshot after the update
 * @param loadAtReport the agent's load before its slot was released
 */
public record TrackedOutcome(Agent agent, int loadAtReport) {
}
