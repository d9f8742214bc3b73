package com.z254.hivemind.dispatch.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * A worker that executes tasks, described by the capabilities it declares.
 * <p>
 * Instances handed out by the registry are snapshots; changing them has no effect on
 * registry state.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Agent {

    private String id;

    private String name;

    /**
     * Declared capabilities with proficiency in [0, 1].
     */
    @Builder.Default
    private Map<Capability, Double> capabilities = new HashMap<>();

    @Builder.Default
    private int maxConcurrentTasks = 1;

    /**
     * Tasks currently assigned and not yet reported. Never exceeds maxConcurrentTasks.
     */
    private int currentLoad;

    @Builder.Default
    private PerformanceMetrics metrics = PerformanceMetrics.empty();

    private Instant registeredAt;

    private Instant lastAssignedAt;

    public double proficiency(Capability capability) {
        Double value = capabilities.get(capability);
        return value == null ? 0.0 : value;
    }

    public boolean hasCapabilities(Collection<Capability> required) {
        return capabilities.keySet().containsAll(required);
    }

    public boolean hasCapacity() {
        return currentLoad < maxConcurrentTasks;
    }

    /**
     * Load as a fraction of capacity, in [0, 1].
     */
    @JsonIgnore
    public double getUtilization() {
        return maxConcurrentTasks <= 0 ? 1.0 : (double) currentLoad / maxConcurrentTasks;
    }

    @JsonIgnore
    public AgentAvailability getAvailability() {
        return hasCapacity() ? AgentAvailability.AVAILABLE : AgentAvailability.BUSY;
    }

    public Agent copy() {
        return Agent.builder()
                .id(id)
                .name(name)
                .capabilities(new HashMap<>(capabilities))
                .maxConcurrentTasks(maxConcurrentTasks)
                .currentLoad(currentLoad)
                .metrics(metrics == null ? PerformanceMetrics.empty() : metrics.copy())
                .registeredAt(registeredAt)
                .lastAssignedAt(lastAssignedAt)
                .build();
    }
}
