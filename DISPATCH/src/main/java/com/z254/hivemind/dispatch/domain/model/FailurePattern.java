package com.z254.hivemind.dispatch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Recurring failures of one category for one agent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailurePattern {

    private String patternId;

    private FailureCategory category;

    private String description;

    private int frequency;

    /**
     * Bounded severity in [0, 1], grows with frequency.
     */
    private double impactScore;

    @Builder.Default
    private Set<String> affectedAgents = new LinkedHashSet<>();

    @Builder.Default
    private Set<Capability> affectedCapabilities = new LinkedHashSet<>();

    @Builder.Default
    private List<String> mitigationSuggestions = new ArrayList<>();

    @Builder.Default
    private List<String> examples = new ArrayList<>();

    private Instant discoveredAt;

    private Instant lastSeen;

    public FailurePattern copy() {
        return FailurePattern.builder()
                .patternId(patternId)
                .category(category)
                .description(description)
                .frequency(frequency)
                .impactScore(impactScore)
                .affectedAgents(new LinkedHashSet<>(affectedAgents))
                .affectedCapabilities(new LinkedHashSet<>(affectedCapabilities))
                .mitigationSuggestions(new ArrayList<>(mitigationSuggestions))
                .examples(new ArrayList<>(examples))
                .discoveredAt(discoveredAt)
                .lastSeen(lastSeen)
                .build();
    }
}
