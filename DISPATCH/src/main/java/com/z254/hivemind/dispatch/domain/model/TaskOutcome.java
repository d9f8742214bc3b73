package com.z254.hivemind.dispatch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * A completion record fed to the tracker and the pattern miner.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskOutcome {

    private String agentId;
    private String taskId;
    private boolean success;
    private Duration completionTime;

    @Builder.Default
    private TaskContext context = new TaskContext();

    /**
     * Agent load at report time, before the tracker releases the slot.
     */
    private int agentLoad;

    private int agentCapacity;

    private Instant reportedAt;
}
