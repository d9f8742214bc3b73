package com.z254.hivemind.dispatch.service;

import com.z254.hivemind.dispatch.domain.model.AgentAvailability;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkloadReport {

    private Instant timestamp;

    @Builder.Default
    private Map<String, AgentWorkload> agents = new LinkedHashMap<>();

    private double systemLoadPercent;
    private int totalAgents;
    private int availableAgents;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AgentWorkload {
        private double utilizationPercent;
        private int currentLoad;
        private int maxConcurrentTasks;
        private AgentAvailability availability;
        private double successRate;
        private double averageCompletionSeconds;
    }
}
