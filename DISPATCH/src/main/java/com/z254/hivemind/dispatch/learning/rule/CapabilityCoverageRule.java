package com.z254.hivemind.dispatch.learning.rule;

import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.ArchitectureImprovement;
import com.z254.hivemind.dispatch.domain.model.ImplementationEffort;
import com.z254.hivemind.dispatch.domain.model.ImprovementPriority;
import com.z254.hivemind.dispatch.learning.AnalysisContext;
import com.z254.hivemind.dispatch.learning.DistributionAnalysis;
import com.z254.hivemind.dispatch.learning.SkillGap;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Capabilities held by fewer agents than the configured minimum.
 */
@Component
public class CapabilityCoverageRule implements ImprovementRule {

    public static final String IMPROVEMENT_ID = "skill_coverage_enhancement";

    private final DispatchProperties.ImprovementProperties config;

    public CapabilityCoverageRule(DispatchProperties properties) {
        this.config = properties.getImprovements();
    }

    @Override
    public String getName() {
        return "capability-coverage";
    }

    @Override
    public Optional<ArchitectureImprovement> evaluate(AnalysisContext context) {
        List<SkillGap> gaps = DistributionAnalysis.skillGaps(context.agents(),
                DistributionAnalysis.demandedCapabilities(
                        context.agents(), context.taskPatterns(), context.failurePatterns()),
                config.getMinCapabilityCoverage(), config.getMinBestProficiency())
                .stream()
                .filter(gap -> gap.reason() == SkillGap.Reason.LOW_COVERAGE)
                .collect(Collectors.toList());
        if (gaps.isEmpty()) {
            return Optional.empty();
        }

        List<String> tags = gaps.stream().map(gap -> gap.capability().getTag()).collect(Collectors.toList());
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("capabilities", tags);
        evidence.put("minCoverage", config.getMinCapabilityCoverage());
        Map<String, Integer> coverage = new LinkedHashMap<>();
        gaps.forEach(gap -> coverage.put(gap.capability().getTag(), gap.coverage()));
        evidence.put("coverage", coverage);

        List<String> actions = new ArrayList<>();
        for (String tag : tags) {
            actions.add("Register another agent declaring " + tag);
        }

        return Optional.of(ArchitectureImprovement.builder()
                .improvementId(IMPROVEMENT_ID)
                .category("skill_distribution")
                .title("Address Critical Skill Coverage Gaps")
                .description("System has " + gaps.size() + " capabilities with insufficient coverage: "
                        + String.join(", ", tags))
                .rationale("Capabilities held by fewer than " + config.getMinCapabilityCoverage()
                        + " agents are single points of failure")
                .expectedBenefits(List.of("Improved system resilience", "Better task distribution",
                        "Reduced bottlenecks"))
                .recommendedActions(actions)
                .implementationEffort(ImplementationEffort.MEDIUM)
                .priority(ImprovementPriority.HIGH)
                .affectedComponents(List.of("agent_skills", "task_routing"))
                .metricsToTrack(List.of("skill_coverage_percentage", "task_assignment_success_rate"))
                .suggestedTimeline("2-3 weeks")
                .confidence(0.8)
                .evidence(evidence)
                .generatedAt(context.generatedAt())
                .build());
    }
}
