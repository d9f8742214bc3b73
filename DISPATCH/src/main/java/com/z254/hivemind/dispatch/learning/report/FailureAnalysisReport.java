package com.z254.hivemind.dispatch.learning.report;

import com.z254.hivemind.dispatch.domain.model.FailurePattern;
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
 * What is failing: per-category breakdown, most affected agents and the mitigations
 * suggested most often.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailureAnalysisReport {

    private Instant timestamp;
    private int totalFailurePatterns;

    @Builder.Default
    private Map<String, CategoryBreakdown> breakdown = new LinkedHashMap<>();

    /**
     * Agent id to total failure frequency, highest first.
     */
    @Builder.Default
    private Map<String, Integer> mostAffectedAgents = new LinkedHashMap<>();

    @Builder.Default
    private List<FailurePattern> criticalIssues = new ArrayList<>();

    /**
     * Mitigation to the number of patterns suggesting it, most common first.
     */
    @Builder.Default
    private Map<String, Long> mitigationSummary = new LinkedHashMap<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CategoryBreakdown {
        private int patternCount;
        private int totalFrequency;
        private double averageImpactScore;
        private int affectedAgents;
    }
}
