package com.z254.hivemind.dispatch.registry;

import lombok.Getter;

/**
 * A load increment would take an agent past its concurrency limit.
 * Signals that routing and tracking disagree; the operation must not be retried.
 */
@Getter
public class CapacityExceededException extends RuntimeException {

    private final String agentId;
    private final int currentLoad;
    private final int maxConcurrentTasks;

    public CapacityExceededException(String agentId, int currentLoad, int maxConcurrentTasks) {
        super("Agent " + agentId + " at capacity: load " + currentLoad + " of " + maxConcurrentTasks);
        this.agentId = agentId;
        this.currentLoad = currentLoad;
        this.maxConcurrentTasks = maxConcurrentTasks;
    }
}
