package com.z254.hivemind.dispatch.learning.rule;

import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.ArchitectureImprovement;
import com.z254.hivemind.dispatch.domain.model.ImplementationEffort;
import com.z254.hivemind.dispatch.domain.model.ImprovementPriority;
import com.z254.hivemind.dispatch.learning.AnalysisContext;
import com.z254.hivemind.dispatch.learning.DistributionAnalysis;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Uneven utilization across agents, or a pool that is mostly idle.
 * A mostly idle pool yields a capacity suggestion in place of a load-balancing one.
 */
@Component
public class LoadImbalanceRule implements ImprovementRule {

    public static final String LOAD_BALANCING_ID = "load_balancing_optimization";
    public static final String CAPACITY_ID = "capacity_optimization";

    private final DispatchProperties.ImprovementProperties config;

    public LoadImbalanceRule(DispatchProperties properties) {
        this.config = properties.getImprovements();
    }

    @Override
    public String getName() {
        return "load-imbalance";
    }

    @Override
    public Optional<ArchitectureImprovement> evaluate(AnalysisContext context) {
        if (context.agents().isEmpty()) {
            return Optional.empty();
        }
        Map<String, Double> utilization = DistributionAnalysis.utilizationPercent(context.agents());
        double average = DistributionAnalysis.mean(utilization.values());
        double variance = DistributionAnalysis.variance(utilization.values());

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("averageUtilizationPercent", average);
        evidence.put("utilizationVariance", variance);
        evidence.put("utilizationPercent", utilization);

        if (average < config.getLowUtilizationPercent()) {
            return Optional.of(ArchitectureImprovement.builder()
                    .improvementId(CAPACITY_ID)
                    .category("capacity_management")
                    .title("Optimize System Capacity")
                    .description(String.format("Low average utilization (%.1f%%) suggests over-provisioning", average))
                    .rationale("Low utilization indicates potential for capacity reduction or increased workload")
                    .expectedBenefits(List.of("Better resource efficiency", "Cost optimization",
                            "Right-sized system capacity"))
                    .recommendedActions(List.of("Reduce concurrency limits or retire idle agents",
                            "Route additional workload to this pool"))
                    .implementationEffort(ImplementationEffort.LOW)
                    .priority(ImprovementPriority.MEDIUM)
                    .affectedComponents(List.of("agent_capacity", "system_scaling"))
                    .metricsToTrack(List.of("average_utilization", "cost_per_task"))
                    .suggestedTimeline("1-2 weeks")
                    .confidence(0.6)
                    .evidence(evidence)
                    .generatedAt(context.generatedAt())
                    .build());
        }

        if (variance > config.getUtilizationVarianceThreshold()) {
            return Optional.of(ArchitectureImprovement.builder()
                    .improvementId(LOAD_BALANCING_ID)
                    .category("load_balancing")
                    .title("Optimize Load Distribution")
                    .description(String.format("High variance in agent utilization (variance: %.1f)", variance))
                    .rationale("Uneven load distribution leads to bottlenecks and inefficient resource usage")
                    .expectedBenefits(List.of("More even resource utilization", "Reduced system bottlenecks",
                            "Improved overall throughput"))
                    .recommendedActions(List.of("Raise the routing load penalty",
                            "Broaden capabilities of under-used agents"))
                    .implementationEffort(ImplementationEffort.MEDIUM)
                    .priority(ImprovementPriority.HIGH)
                    .affectedComponents(List.of("task_routing", "load_balancer"))
                    .metricsToTrack(List.of("utilization_variance", "average_response_time"))
                    .suggestedTimeline("2-3 weeks")
                    .confidence(0.8)
                    .evidence(evidence)
                    .generatedAt(context.generatedAt())
                    .build());
        }
        return Optional.empty();
    }
}
