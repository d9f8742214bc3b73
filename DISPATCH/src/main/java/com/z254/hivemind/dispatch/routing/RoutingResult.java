package com.z254.hivemind.dispatch.routing;

import java.util.List;

/**
 * Outcome of routing one task. Not finding an agent is a normal result, not an error.
 *
 * @param taskId     the routed task
 * @param agentId    chosen agent, or null when unassigned
 * @param reason     why no agent was chosen, or null when assigned
 * @param score      the chosen agent's score
 * @param candidates every capable agent's score, best first
 */
public record RoutingResult(
        String taskId,
        String agentId,
        Reason reason,
        double score,
        List<CandidateScore> candidates
) {

    public enum Reason {
        NO_CAPABLE_AGENT,
        ALL_CAPABLE_AGENTS_AT_CAPACITY
    }

    public static RoutingResult assigned(String taskId, CandidateScore chosen, List<CandidateScore> candidates) {
        return new RoutingResult(taskId, chosen.agentId(), null, chosen.score(), List.copyOf(candidates));
    }

    public static RoutingResult unassigned(String taskId, Reason reason, List<CandidateScore> candidates) {
        return new RoutingResult(taskId, null, reason, 0.0, List.copyOf(candidates));
    }

    public boolean isAssigned() {
        return agentId != null;
    }
}
