package com.z254.hivemind.dispatch.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * A unit of work to be routed to exactly one agent.
 * <p>
 * Immutable. Priority changes produce a copy through {@link #withPriority(TaskPriority)},
 * which never lowers the priority.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TaskRequest {

    String id;

    String type;

    String description;

    @Builder.Default
    Set<Capability> requiredCapabilities = Set.of();

    /**
     * Per-capability weight; absent capabilities weigh 1.0.
     */
    @Builder.Default
    Map<Capability, Double> weights = Map.of();

    @Builder.Default
    TaskPriority priority = TaskPriority.MEDIUM;

    Duration estimatedDuration;

    Instant deadline;

    Instant createdAt;

    @Builder.Default
    Map<String, Object> metadata = Map.of();

    public double weight(Capability capability) {
        Double weight = weights == null ? null : weights.get(capability);
        return weight == null ? 1.0 : weight;
    }

    public TaskRequest withPriority(TaskPriority newPriority) {
        TaskPriority raised = priority.atLeast(newPriority);
        if (raised == priority) {
            return this;
        }
        return toBuilder().priority(raised).build();
    }
}
