package com.z254.hivemind.dispatch.routing;

/**
 * Score breakdown for one capable agent.
 */
public record CandidateScore(
        String agentId,
        double proficiencyScore,
        double loadPenalty,
        double score,
        int currentLoad,
        int maxConcurrentTasks,
        double averageCompletionSeconds
) {

    public boolean hasCapacity() {
        return currentLoad < maxConcurrentTasks;
    }
}
