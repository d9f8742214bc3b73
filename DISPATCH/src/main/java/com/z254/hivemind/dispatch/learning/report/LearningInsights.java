package com.z254.hivemind.dispatch.learning.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LearningInsights {

    private Instant timestamp;
    private String healthStatus;
    private double successRate;
    private int patternsLearned;
    private int failurePatternsIdentified;
    private int improvementsSuggested;
    private int dataPointsAnalyzed;
    private SystemHealth health;

    @Builder.Default
    private List<String> topInsights = new ArrayList<>();

    @Builder.Default
    private List<String> recommendedActions = new ArrayList<>();

    @Builder.Default
    private Map<String, Double> confidenceMetrics = new LinkedHashMap<>();
}
