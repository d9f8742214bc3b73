package com.z254.hivemind.dispatch.api.dto;

import com.z254.hivemind.dispatch.domain.model.Capability;
import com.z254.hivemind.dispatch.domain.model.TaskPriority;
import com.z254.hivemind.dispatch.domain.model.TaskRequest;
import com.z254.hivemind.dispatch.registry.CapabilityCatalog;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Request DTO for submitting a task.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskSubmissionRequest {

    private String id;

    @NotBlank(message = "Task type is required")
    private String type;

    @Size(max = 10000, message = "Description must be less than 10000 characters")
    private String description;

    private Set<String> requiredCapabilities;

    private Map<String, Double> weights;

    private TaskPriority priority;

    private Duration estimatedDuration;

    private Instant deadline;

    private Instant createdAt;

    private Map<String, Object> metadata;

    /**
     * Convert to domain model, resolving tags against the catalog.
     */
    public TaskRequest toTask(CapabilityCatalog catalog) {
        Map<Capability, Double> resolvedWeights = new HashMap<>();
        if (weights != null) {
            weights.forEach((tag, weight) -> resolvedWeights.put(catalog.resolve(tag), weight));
        }
        return TaskRequest.builder()
                .id(id)
                .type(type)
                .description(description)
                .requiredCapabilities(requiredCapabilities != null
                        ? catalog.resolveAll(requiredCapabilities) : Set.of())
                .weights(resolvedWeights)
                .priority(priority != null ? priority : TaskPriority.MEDIUM)
                .estimatedDuration(estimatedDuration)
                .deadline(deadline)
                .createdAt(createdAt)
                .metadata(metadata != null ? metadata : Map.of())
                .build();
    }
}
