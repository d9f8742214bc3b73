package com.z254.hivemind.dispatch.learning.report;

import com.z254.hivemind.dispatch.domain.model.TaskPattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What is working: well-supported patterns, per capability set and per agent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuccessPatternReport {

    private Instant timestamp;
    private int totalPatterns;

    @Builder.Default
    private List<TaskPattern> highConfidencePatterns = new ArrayList<>();

    /**
     * Keyed by the comma-separated capability set.
     */
    @Builder.Default
    private Map<String, CapabilitySetSummary> capabilityAnalysis = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, AgentSummary> agentAnalysis = new LinkedHashMap<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CapabilitySetSummary {
        private double successRate;
        private double averageCompletionSeconds;
        private int sampleSize;
        private double confidence;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AgentSummary {
        private double averageSuccessRate;
        private double averageCompletionSeconds;
        private int totalTasksAnalyzed;
        private int patternCount;
    }
}
