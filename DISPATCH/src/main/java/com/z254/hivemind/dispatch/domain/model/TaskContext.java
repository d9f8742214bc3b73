package com.z254.hivemind.dispatch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * What the caller knows about a finished task when it reports the outcome.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskContext {

    private String taskType;

    @Builder.Default
    private Set<Capability> requiredCapabilities = new HashSet<>();

    private TaskPriority priority;

    /**
     * Category reported by the caller. When present it wins over classification.
     */
    private FailureCategory failureCategory;

    private String errorMessage;

    @Builder.Default
    private Map<String, Object> attributes = new HashMap<>();

    public Set<Capability> getRequiredCapabilities() {
        return requiredCapabilities == null ? Set.of() : requiredCapabilities;
    }
}
