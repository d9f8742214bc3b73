package com.z254.hivemind.dispatch.api.dto;

import com.z254.hivemind.dispatch.domain.model.FailureCategory;
import com.z254.hivemind.dispatch.domain.model.TaskContext;
import com.z254.hivemind.dispatch.domain.model.TaskPriority;
import com.z254.hivemind.dispatch.registry.CapabilityCatalog;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Request DTO for reporting a finished task.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutcomeRequest {

    @NotBlank(message = "Agent id is required")
    private String agentId;

    @NotNull(message = "Success flag is required")
    private Boolean success;

    /**
     * ISO-8601 duration, e.g. {@code PT45M}.
     */
    @NotNull(message = "Completion time is required")
    private Duration completionTime;

    private String taskType;

    private Set<String> requiredCapabilities;

    private TaskPriority priority;

    /**
     * Category known to the caller, e.g. {@code dependency_failure}.
     */
    private FailureCategory failureCategory;

    private String errorMessage;

    private Map<String, Object> attributes;

    public TaskContext toContext(CapabilityCatalog catalog) {
        return TaskContext.builder()
                .taskType(taskType)
                .requiredCapabilities(requiredCapabilities != null
                        ? new HashSet<>(catalog.resolveAll(requiredCapabilities)) : new HashSet<>())
                .priority(priority)
                .failureCategory(failureCategory)
                .errorMessage(errorMessage)
                .attributes(attributes != null ? attributes : new HashMap<>())
                .build();
    }
}
