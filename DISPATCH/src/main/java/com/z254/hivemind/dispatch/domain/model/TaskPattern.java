package com.z254.hivemind.dispatch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A learned correlation between task conditions and successful completion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskPattern {

    /**
     * Stable key derived from the conditions, so re-observation updates in place.
     */
    private String patternId;

    private PatternType type;

    private String description;

    /**
     * e.g. {@code requiredCapabilities}, or {@code agentId} plus {@code taskType}.
     */
    @Builder.Default
    private Map<String, Object> conditions = new HashMap<>();

    /**
     * Successful observations. Drives confidence.
     */
    private int sampleSize;

    /**
     * Failed observations under the same conditions.
     */
    private int failureCount;

    private double confidence;

    private double successRate;

    /**
     * Running mean over successful observations, in seconds.
     */
    private double averageCompletionSeconds;

    @Builder.Default
    private List<String> examples = new ArrayList<>();

    private Instant discoveredAt;

    private Instant lastUpdated;

    /**
     * Last time confidence was decayed for lack of reinforcement.
     */
    private Instant lastDecayedAt;

    public TaskPattern copy() {
        return TaskPattern.builder()
                .patternId(patternId)
                .type(type)
                .description(description)
                .conditions(new HashMap<>(conditions))
                .sampleSize(sampleSize)
                .failureCount(failureCount)
                .confidence(confidence)
                .successRate(successRate)
                .averageCompletionSeconds(averageCompletionSeconds)
                .examples(new ArrayList<>(examples))
                .discoveredAt(discoveredAt)
                .lastUpdated(lastUpdated)
                .lastDecayedAt(lastDecayedAt)
                .build();
    }
}
