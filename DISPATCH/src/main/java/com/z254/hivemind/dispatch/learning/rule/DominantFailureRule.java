package com.z254.hivemind.dispatch.learning.rule;

import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.ArchitectureImprovement;
import com.z254.hivemind.dispatch.domain.model.FailureCategory;
import com.z254.hivemind.dispatch.domain.model.ImplementationEffort;
import com.z254.hivemind.dispatch.domain.model.ImprovementPriority;
import com.z254.hivemind.dispatch.learning.AnalysisContext;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The most frequent failure category, once it is frequent enough to be systemic.
 * Ties go to the category declared first.
 */
@Component
public class DominantFailureRule implements ImprovementRule {

    private final DispatchProperties.ImprovementProperties config;

    public DominantFailureRule(DispatchProperties properties) {
        this.config = properties.getImprovements();
    }

    @Override
    public String getName() {
        return "dominant-failure";
    }

    @Override
    public Optional<ArchitectureImprovement> evaluate(AnalysisContext context) {
        FailureCategory dominant = null;
        int count = 0;
        for (Map.Entry<FailureCategory, Integer> entry : context.failureTotals().entrySet()) {
            if (dominant == null || entry.getValue() > count
                    || (entry.getValue() == count && entry.getKey().ordinal() < dominant.ordinal())) {
                dominant = entry.getKey();
                count = entry.getValue();
            }
        }
        if (dominant == null || count <= config.getDominantFailureMinFrequency()) {
            return Optional.empty();
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("failureCategory", dominant.getCode());
        evidence.put("frequency", count);

        return Optional.of(ArchitectureImprovement.builder()
                .improvementId("address_" + dominant.getCode() + "_failures")
                .category("reliability")
                .title("Address " + dominant.getDisplayName() + " Issues")
                .description("System experiencing " + count + " instances of " + dominant.getCode() + " failures")
                .rationale(dominant.getCode() + " is the most common failure type, indicating systemic issues")
                .expectedBenefits(List.of("Reduced failure rate", "Improved system reliability",
                        "Better user experience"))
                .recommendedActions(dominant.getMitigations())
                .implementationEffort(ImplementationEffort.HIGH)
                .priority(ImprovementPriority.CRITICAL)
                .affectedComponents(dominant.getAffectedComponents())
                .metricsToTrack(List.of("failure_rate", "system_uptime", "task_success_rate"))
                .suggestedTimeline("3-4 weeks")
                .confidence(0.9)
                .evidence(evidence)
                .generatedAt(context.generatedAt())
                .build());
    }
}
