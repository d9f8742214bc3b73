package com.z254.hivemind.dispatch.domain.model;

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
 * A structured suggestion produced by an improvement run.
 * <p>
 * {@code improvementId} is stable per rule outcome, so a later run replaces rather than
 * duplicates an earlier suggestion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArchitectureImprovement {

    private String improvementId;

    /**
     * e.g. {@code reliability}, {@code load_balancing}, {@code skill_distribution}.
     */
    private String category;

    private String title;

    private String description;

    private String rationale;

    @Builder.Default
    private List<String> expectedBenefits = new ArrayList<>();

    @Builder.Default
    private List<String> recommendedActions = new ArrayList<>();

    private ImplementationEffort implementationEffort;

    private ImprovementPriority priority;

    @Builder.Default
    private List<String> affectedComponents = new ArrayList<>();

    @Builder.Default
    private List<String> metricsToTrack = new ArrayList<>();

    private String suggestedTimeline;

    private double confidence;

    /**
     * Observed values that triggered the rule.
     */
    @Builder.Default
    private Map<String, Object> evidence = new LinkedHashMap<>();

    private Instant generatedAt;
}
