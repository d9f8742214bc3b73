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
 * Mean completion time of the latest window of successes against the window before it.
 */
@Component
public class PerformanceTrendRule implements ImprovementRule {

    public static final String IMPROVEMENT_ID = "performance_degradation_investigation";

    private final DispatchProperties.ImprovementProperties config;

    public PerformanceTrendRule(DispatchProperties properties) {
        this.config = properties.getImprovements();
    }

    @Override
    public String getName() {
        return "performance-trend";
    }

    @Override
    public Optional<ArchitectureImprovement> evaluate(AnalysisContext context) {
        List<Double> history = context.recentSuccessSeconds();
        if (history.size() < config.getTrendMinSamples()) {
            return Optional.empty();
        }
        int window = config.getTrendWindow();
        int size = history.size();
        List<Double> recent = history.subList(Math.max(0, size - window), size);
        List<Double> older = history.subList(Math.max(0, size - 2 * window), Math.max(0, size - window));
        if (older.isEmpty()) {
            return Optional.empty();
        }

        double recentAverage = DistributionAnalysis.mean(recent);
        double olderAverage = DistributionAnalysis.mean(older);
        if (recentAverage <= olderAverage * config.getTrendDegradationRatio()) {
            return Optional.empty();
        }

        double increasePercent = olderAverage == 0.0 ? 100.0 : (recentAverage / olderAverage - 1) * 100;
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("recentAverageSeconds", recentAverage);
        evidence.put("previousAverageSeconds", olderAverage);
        evidence.put("increasePercent", increasePercent);

        return Optional.of(ArchitectureImprovement.builder()
                .improvementId(IMPROVEMENT_ID)
                .category("performance")
                .title("Investigate Performance Degradation")
                .description(String.format("Average completion time increased by %.1f%%", increasePercent))
                .rationale("Increasing completion times indicate potential performance bottlenecks")
                .expectedBenefits(List.of("Restored system performance", "Better user experience",
                        "Increased throughput"))
                .recommendedActions(List.of("Profile the slowest recent tasks",
                        "Compare agent completion times before and after the change point"))
                .implementationEffort(ImplementationEffort.MEDIUM)
                .priority(ImprovementPriority.HIGH)
                .affectedComponents(List.of("performance_monitoring", "bottleneck_analysis"))
                .metricsToTrack(List.of("average_completion_time", "system_throughput"))
                .suggestedTimeline("2-3 weeks")
                .confidence(0.7)
                .evidence(evidence)
                .generatedAt(context.generatedAt())
                .build());
    }
}
