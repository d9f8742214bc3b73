package com.z254.hivemind.dispatch.learning;

import com.z254.hivemind.dispatch.domain.model.ArchitectureImprovement;
import com.z254.hivemind.dispatch.domain.model.FailurePattern;
import com.z254.hivemind.dispatch.domain.model.PatternType;
import com.z254.hivemind.dispatch.domain.model.TaskPattern;
import com.z254.hivemind.dispatch.learning.report.FailureAnalysisReport;
import com.z254.hivemind.dispatch.learning.report.LearningInsights;
import com.z254.hivemind.dispatch.learning.report.SuccessPatternReport;
import com.z254.hivemind.dispatch.learning.report.SystemHealth;
import com.z254.hivemind.dispatch.tracking.CompletionRecord;
import com.z254.hivemind.dispatch.tracking.PerformanceTracker;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only reports over the learned state.
 */
@Component
public class LearningReporter {

    private static final double HIGH_CONFIDENCE = 0.7;
    private static final int HIGH_CONFIDENCE_MIN_SAMPLES = 5;
    private static final double INSIGHT_MIN_CONFIDENCE = 0.5;
    private static final double CRITICAL_IMPACT = 0.7;
    private static final int CRITICAL_MIN_FREQUENCY = 3;
    private static final int MAX_RECOMMENDED_ACTIONS = 5;

    private final PatternMiner patternMiner;
    private final PerformanceTracker tracker;
    private final ImprovementGenerator improvementGenerator;
    private final Clock clock;

    public LearningReporter(PatternMiner patternMiner,
                            PerformanceTracker tracker,
                            ImprovementGenerator improvementGenerator,
                            Clock clock) {
        this.patternMiner = patternMiner;
        this.tracker = tracker;
        this.improvementGenerator = improvementGenerator;
        this.clock = clock;
    }

    /**
     * Score is {@code 0.7 * successRate + 0.3 / (1 + averageMinutes / 60)}.
     */
    public SystemHealth health() {
        List<CompletionRecord> successes = tracker.successHistory();
        int failures = tracker.failureCount();
        int total = successes.size() + failures;
        if (total == 0) {
            return SystemHealth.builder()
                    .status(SystemHealth.INSUFFICIENT_DATA)
                    .score(0.5)
                    .build();
        }

        double successRate = (double) successes.size() / total;
        double averageMinutes = successes.stream()
                .mapToDouble(CompletionRecord::completionSeconds)
                .average()
                .orElse(0.0) / 60.0;
        double score = successRate * 0.7 + (1.0 / (1.0 + averageMinutes / 60.0)) * 0.3;

        String status;
        if (score > 0.8) {
            status = "excellent";
        } else if (score > 0.6) {
            status = "good";
        } else if (score > 0.4) {
            status = "fair";
        } else {
            status = "poor";
        }

        return SystemHealth.builder()
                .status(status)
                .score(score)
                .successRate(successRate)
                .averageCompletionMinutes(averageMinutes)
                .totalTasksAnalyzed(total)
                .build();
    }

    public LearningInsights insights() {
        SystemHealth health = health();
        List<TaskPattern> patterns = patternMiner.taskPatterns();
        List<FailurePattern> failures = patternMiner.failurePatterns();
        List<ArchitectureImprovement> improvements = improvementGenerator.latest();

        return LearningInsights.builder()
                .timestamp(clock.instant())
                .healthStatus(health.getStatus())
                .successRate(health.getSuccessRate())
                .patternsLearned(patterns.size())
                .failurePatternsIdentified(failures.size())
                .improvementsSuggested(improvements.size())
                .dataPointsAnalyzed(tracker.successCount() + tracker.failureCount())
                .health(health)
                .topInsights(topInsights(patterns, failures))
                .recommendedActions(recommendedActions(improvements, failures))
                .confidenceMetrics(confidenceMetrics(patterns))
                .build();
    }

    public SuccessPatternReport successReport() {
        List<TaskPattern> patterns = patternMiner.taskPatterns();

        List<TaskPattern> highConfidence = patterns.stream()
                .filter(p -> p.getConfidence() > HIGH_CONFIDENCE && p.getSampleSize() >= HIGH_CONFIDENCE_MIN_SAMPLES)
                .collect(Collectors.toList());

        Map<String, SuccessPatternReport.CapabilitySetSummary> capabilityAnalysis = new TreeMap<>();
        for (TaskPattern pattern : patterns) {
            Object tags = pattern.getConditions().get("requiredCapabilities");
            if (pattern.getType() == PatternType.SKILL && tags instanceof Collection<?> collection) {
                String key = collection.stream().map(String::valueOf).sorted().collect(Collectors.joining(", "));
                capabilityAnalysis.put(key, SuccessPatternReport.CapabilitySetSummary.builder()
                        .successRate(pattern.getSuccessRate())
                        .averageCompletionSeconds(pattern.getAverageCompletionSeconds())
                        .sampleSize(pattern.getSampleSize())
                        .confidence(pattern.getConfidence())
                        .build());
            }
        }

        Map<String, List<TaskPattern>> byAgent = patterns.stream()
                .filter(p -> p.getType() == PatternType.SUCCESS && p.getConditions().get("agentId") != null)
                .collect(Collectors.groupingBy(p -> String.valueOf(p.getConditions().get("agentId")),
                        TreeMap::new, Collectors.toList()));
        Map<String, SuccessPatternReport.AgentSummary> agentAnalysis = new LinkedHashMap<>();
        byAgent.forEach((agentId, agentPatterns) -> agentAnalysis.put(agentId,
                SuccessPatternReport.AgentSummary.builder()
                        .averageSuccessRate(average(agentPatterns, TaskPattern::getSuccessRate))
                        .averageCompletionSeconds(average(agentPatterns, TaskPattern::getAverageCompletionSeconds))
                        .totalTasksAnalyzed(agentPatterns.stream().mapToInt(TaskPattern::getSampleSize).sum())
                        .patternCount(agentPatterns.size())
                        .build()));

        return SuccessPatternReport.builder()
                .timestamp(clock.instant())
                .totalPatterns(patterns.size())
                .highConfidencePatterns(highConfidence)
                .capabilityAnalysis(capabilityAnalysis)
                .agentAnalysis(agentAnalysis)
                .build();
    }

    public FailureAnalysisReport failureReport() {
        List<FailurePattern> failures = patternMiner.failurePatterns();

        Map<String, FailureAnalysisReport.CategoryBreakdown> breakdown = new LinkedHashMap<>();
        failures.stream()
                .collect(Collectors.groupingBy(FailurePattern::getCategory, TreeMap::new, Collectors.toList()))
                .forEach((category, patterns) -> {
                    Set<String> agents = new HashSet<>();
                    patterns.forEach(p -> agents.addAll(p.getAffectedAgents()));
                    breakdown.put(category.getCode(), FailureAnalysisReport.CategoryBreakdown.builder()
                            .patternCount(patterns.size())
                            .totalFrequency(patterns.stream().mapToInt(FailurePattern::getFrequency).sum())
                            .averageImpactScore(patterns.stream()
                                    .mapToDouble(FailurePattern::getImpactScore).average().orElse(0.0))
                            .affectedAgents(agents.size())
                            .build());
                });

        Map<String, Integer> agentCounts = new TreeMap<>();
        for (FailurePattern pattern : failures) {
            for (String agent : pattern.getAffectedAgents()) {
                agentCounts.merge(agent, pattern.getFrequency(), Integer::sum);
            }
        }
        Map<String, Integer> mostAffected = new LinkedHashMap<>();
        agentCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(5)
                .forEach(e -> mostAffected.put(e.getKey(), e.getValue()));

        List<FailurePattern> critical = failures.stream()
                .filter(p -> p.getImpactScore() > CRITICAL_IMPACT && p.getFrequency() > CRITICAL_MIN_FREQUENCY)
                .collect(Collectors.toList());

        Map<String, Long> suggestionCounts = new TreeMap<>();
        for (FailurePattern pattern : failures) {
            for (String suggestion : pattern.getMitigationSuggestions()) {
                suggestionCounts.merge(suggestion, 1L, Long::sum);
            }
        }
        Map<String, Long> mitigationSummary = new LinkedHashMap<>();
        suggestionCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(10)
                .forEach(e -> mitigationSummary.put(e.getKey(), e.getValue()));

        return FailureAnalysisReport.builder()
                .timestamp(clock.instant())
                .totalFailurePatterns(failures.size())
                .breakdown(breakdown)
                .mostAffectedAgents(mostAffected)
                .criticalIssues(critical)
                .mitigationSummary(mitigationSummary)
                .build();
    }

    List<String> topInsights(List<TaskPattern> patterns, List<FailurePattern> failures) {
        List<String> insights = new ArrayList<>();
        patterns.stream()
                .filter(p -> p.getConfidence() > INSIGHT_MIN_CONFIDENCE)
                .sorted(Comparator.comparingDouble((TaskPattern p) -> p.getSuccessRate() * p.getConfidence())
                        .reversed()
                        .thenComparing(TaskPattern::getPatternId))
                .limit(3)
                .forEach(p -> insights.add(String.format(
                        "High-performing pattern: %s (success rate: %.1f%%, confidence: %.1f%%)",
                        p.getDescription(), p.getSuccessRate() * 100, p.getConfidence() * 100)));

        failures.stream()
                .sorted(Comparator.comparingDouble((FailurePattern f) -> f.getImpactScore() * f.getFrequency())
                        .reversed()
                        .thenComparing(FailurePattern::getPatternId))
                .limit(2)
                .forEach(f -> insights.add(String.format(
                        "Critical issue: %s (frequency: %d, impact: %.1f%%)",
                        f.getDescription(), f.getFrequency(), f.getImpactScore() * 100)));
        return insights;
    }

    List<String> recommendedActions(List<ArchitectureImprovement> improvements, List<FailurePattern> failures) {
        List<String> actions = new ArrayList<>();
        improvements.stream()
                .filter(i -> i.getPriority() != null && i.getPriority().isUrgent())
                .limit(3)
                .forEach(i -> actions.add(i.getTitle() + ": " + i.getDescription()));

        failures.stream()
                .max(Comparator.comparingInt(FailurePattern::getFrequency)
                        .thenComparing(FailurePattern::getPatternId, Comparator.reverseOrder()))
                .ifPresent(f -> actions.add("Address " + f.getCategory().getCode() + ": "
                        + (f.getMitigationSuggestions().isEmpty()
                        ? "Investigate further"
                        : f.getMitigationSuggestions().get(0))));

        return actions.size() > MAX_RECOMMENDED_ACTIONS ? actions.subList(0, MAX_RECOMMENDED_ACTIONS) : actions;
    }

    private Map<String, Double> confidenceMetrics(List<TaskPattern> patterns) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        if (patterns.isEmpty()) {
            metrics.put("overallConfidence", 0.0);
            return metrics;
        }
        double average = average(patterns, TaskPattern::getConfidence);
        metrics.put("overallConfidence", average);
        metrics.put("maxPatternConfidence",
                patterns.stream().mapToDouble(TaskPattern::getConfidence).max().orElse(0.0));
        metrics.put("averageSampleSize", average(patterns, p -> (double) p.getSampleSize()));
        metrics.put("totalDataPoints", (double) patterns.stream().mapToInt(TaskPattern::getSampleSize).sum());
        return metrics;
    }

    private static double average(List<TaskPattern> patterns, Function<TaskPattern, Double> value) {
        return patterns.stream().mapToDouble(value::apply).average().orElse(0.0);
    }
}
