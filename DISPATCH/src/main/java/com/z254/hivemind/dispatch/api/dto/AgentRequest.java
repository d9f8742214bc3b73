package com.z254.hivemind.dispatch.api.dto;

import com.z254.hivemind.dispatch.domain.model.Agent;
import com.z254.hivemind.dispatch.domain.model.Capability;
import com.z254.hivemind.dispatch.registry.CapabilityCatalog;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Request DTO for registering or re-registering an agent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRequest {

    @NotBlank(message = "Agent id is required")
    @Size(max = 255, message = "Agent id must be less than 255 characters")
    private String id;

    @Size(max = 255, message = "Agent name must be less than 255 characters")
    private String name;

    /**
     * Capability tag to proficiency in [0, 1].
     */
    @NotEmpty(message = "At least one capability is required")
    private Map<String, Double> capabilities;

    @Builder.Default
    @Min(value = 1, message = "Agent must accept at least one concurrent task")
    private int maxConcurrentTasks = 1;

    /**
     * Convert to domain model, resolving tags against the catalog.
     */
    public Agent toAgent(CapabilityCatalog catalog) {
        Map<Capability, Double> resolved = new HashMap<>();
        capabilities.forEach((tag, proficiency) -> resolved.put(catalog.resolve(tag), proficiency));
        return Agent.builder()
                .id(id)
                .name(name != null ? name : id)
                .capabilities(resolved)
                .maxConcurrentTasks(maxConcurrentTasks)
                .build();
    }
}
