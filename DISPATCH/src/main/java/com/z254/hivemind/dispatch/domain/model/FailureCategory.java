package com.z254.hivemind.dispatch.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Why a task failed. Each category carries the mitigations and the system components
 * an improvement for it would touch.
 */
public enum FailureCategory {

    SKILL_MISMATCH(
            List.of("Review and update agent skill definitions",
                    "Implement cross-training between agents",
                    "Add skill validation before task assignment"),
            List.of("skill_system", "task_routing", "agent_capabilities")),

    OVERLOAD(
            List.of("Increase agent capacity limits",
                    "Implement better load balancing",
                    "Add more agents with similar skills"),
            List.of("load_balancer", "capacity_management", "scaling_system")),

    TIMEOUT(
            List.of("Break down large tasks into smaller chunks",
                    "Implement timeout warnings and checkpoints",
                    "Review task complexity estimation"),
            List.of("task_management", "timeout_handling", "progress_monitoring")),

    /** Catch-all when nothing more specific applies. */
    QUALITY_ISSUE(
            List.of("Implement code review processes",
                    "Add automated quality checks",
                    "Provide additional training materials"),
            List.of("quality_assurance", "testing_system", "code_review")),

    DEPENDENCY_FAILURE(
            List.of("Implement retry mechanisms with exponential backoff",
                    "Add health checks for external dependencies",
                    "Create fallback mechanisms"),
            List.of("dependency_management", "external_integrations")),

    RESOURCE_CONSTRAINT(
            List.of("Monitor resource usage and set alerts",
                    "Implement resource throttling",
                    "Scale system resources"),
            List.of("resource_management", "system_monitoring")),

    COORDINATION_FAILURE(
            List.of("Improve inter-agent communication protocols",
                    "Add coordination timeouts and retries",
                    "Implement conflict resolution mechanisms"),
            List.of("agent_communication", "coordination_protocols"));

    private final List<String> mitigations;
    private final List<String> affectedComponents;

    FailureCategory(List<String> mitigations, List<String> affectedComponents) {
        this.mitigations = mitigations;
        this.affectedComponents = affectedComponents;
    }

    public List<String> getMitigations() {
        return mitigations;
    }

    public List<String> getAffectedComponents() {
        return affectedComponents;
    }

    /**
     * Wire form, e.g. {@code timeout}, {@code skill_mismatch}.
     */
    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String getDisplayName() {
        String[] words = getCode().split("_");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }

    @JsonCreator
    public static FailureCategory fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return FailureCategory.valueOf(normalized);
    }
}
