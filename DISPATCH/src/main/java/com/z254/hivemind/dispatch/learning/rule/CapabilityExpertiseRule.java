package com.z254.hivemind.dispatch.learning.rule;

import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.ArchitectureImprovement;
import com.z254.hivemind.dispatch.domain.model.ImplementationEffort;
import com.z254.hivemind.dispatch.domain.model.ImprovementPriority;
import com.z254.hivemind.dispatch.learning.AnalysisContext;
import com.z254.hivemind.dispatch.learning.DistributionAnalysis;
import com.z254.hivemind.dispatch.learning.SkillGap;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Capabilities that are covered but whose best proficiency is below the configured floor.
 */
@Component
public class CapabilityExpertiseRule implements ImprovementRule {

    public static final String IMPROVEMENT_ID = "skill_expertise_improvement";

    private final DispatchProperties.ImprovementProperties config;

    public CapabilityExpertiseRule(DispatchProperties properties) {
        this.config = properties.getImprovements();
    }

    @Override
    public String getName() {
        return "capability-expertise";
    }

    @Override
    public Optional<ArchitectureImprovement> evaluate(AnalysisContext context) {
        List<SkillGap> gaps = DistributionAnalysis.skillGaps(context.agents(),
                DistributionAnalysis.demandedCapabilities(
                        context.agents(), context.taskPatterns(), context.failurePatterns()),
                config.getMinCapabilityCoverage(), config.getMinBestProficiency())
                .stream()
                .filter(gap -> gap.reason() == SkillGap.Reason.LOW_EXPERTISE)
                .collect(Collectors.toList());
        if (gaps.isEmpty()) {
            return Optional.empty();
        }

        List<String> tags = gaps.stream().map(gap -> gap.capability().getTag()).collect(Collectors.toList());
        Map<String, Double> bestProficiency = new LinkedHashMap<>();
        gaps.forEach(gap -> bestProficiency.put(gap.capability().getTag(), gap.bestProficiency()));

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("capabilities", tags);
        evidence.put("bestProficiency", bestProficiency);
        evidence.put("minBestProficiency", config.getMinBestProficiency());

        return Optional.of(ArchitectureImprovement.builder()
                .improvementId(IMPROVEMENT_ID)
                .category("skill_development")
                .title("Improve Agent Skill Expertise")
                .description("System has " + gaps.size() + " capabilities with low expertise ratings: "
                        + String.join(", ", tags))
                .rationale("Low proficiency ratings indicate agents need additional training or experience")
                .expectedBenefits(List.of("Higher task success rates", "Faster completion times",
                        "Better quality outcomes"))
                .recommendedActions(List.of("Provide training for " + String.join(", ", tags),
                        "Onboard an agent specialised in " + tags.get(0)))
                .implementationEffort(ImplementationEffort.HIGH)
                .priority(ImprovementPriority.HIGH)
                .affectedComponents(List.of("agent_training", "skill_ratings"))
                .metricsToTrack(List.of("average_skill_rating", "task_success_rate"))
                .suggestedTimeline("4-6 weeks")
                .confidence(0.7)
                .evidence(evidence)
                .generatedAt(context.generatedAt())
                .build());
    }
}
