package com.z254.hivemind.dispatch.learning.rule;

import com.z254.hivemind.dispatch.DispatchTestFixtures;
import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.Agent;
import com.z254.hivemind.dispatch.domain.model.ArchitectureImprovement;
import com.z254.hivemind.dispatch.domain.model.Capability;
import com.z254.hivemind.dispatch.domain.model.FailureCategory;
import com.z254.hivemind.dispatch.domain.model.ImprovementPriority;
import com.z254.hivemind.dispatch.domain.model.PatternType;
import com.z254.hivemind.dispatch.domain.model.TaskPattern;
import com.z254.hivemind.dispatch.learning.AnalysisContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ImprovementRulesTest {

    private static final Capability X = Capability.CODE_ANALYSIS;
    private static final Capability Y = Capability.API_INTEGRATION;

    private DispatchProperties properties;

    @BeforeEach
    void setUp() {
        properties = new DispatchProperties();
    }

    private static Agent agent(String id, int load, int capacity, Map<Capability, Double> capabilities) {
        return Agent.builder()
                .id(id)
                .capabilities(new HashMap<>(capabilities))
                .maxConcurrentTasks(capacity)
                .currentLoad(load)
                .build();
    }

    private static AnalysisContext context(List<Agent> agents, List<TaskPattern> patterns,
                                           Map<FailureCategory, Integer> failureTotals,
                                           List<Double> recentSuccessSeconds) {
        return new AnalysisContext(agents, patterns, List.of(), failureTotals, recentSuccessSeconds,
                DispatchTestFixtures.NOW);
    }

    private static AnalysisContext agentsOnly(Agent... agents) {
        return context(List.of(agents), List.of(), Map.of(), List.of());
    }

    @Nested
    @DisplayName("Capability coverage")
    class CoverageTests {

        @Test
        @DisplayName("should list demanded capabilities held by too few agents")
        void lowCoverage() {
            TaskPattern demandsY = TaskPattern.builder()
                    .patternId("skill:api-integration")
                    .type(PatternType.SKILL)
                    .conditions(Map.of("requiredCapabilities", List.of("api-integration")))
                    .build();
            AnalysisContext context = context(List.of(agent("a", 0, 1, Map.of(X, 0.9))),
                    List.of(demandsY), Map.of(), List.of());

            ArchitectureImprovement improvement = new CapabilityCoverageRule(properties).evaluate(context).orElseThrow();

            assertThat(improvement.getImprovementId()).isEqualTo(CapabilityCoverageRule.IMPROVEMENT_ID);
            assertThat(improvement.getPriority()).isEqualTo(ImprovementPriority.HIGH);
            assertThat(improvement.getEvidence().get("capabilities"))
                    .isEqualTo(List.of("api-integration", "code-analysis"));
        }

        @Test
        @DisplayName("should not fire when every capability is covered")
        void covered() {
            AnalysisContext context = agentsOnly(
                    agent("a", 0, 1, Map.of(X, 0.9)), agent("b", 0, 1, Map.of(X, 0.8)));

            assertThat(new CapabilityCoverageRule(properties).evaluate(context)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Capability expertise")
    class ExpertiseTests {

        @Test
        @DisplayName("should flag covered capabilities whose best proficiency is low")
        void lowExpertise() {
            AnalysisContext context = agentsOnly(
                    agent("a", 0, 1, Map.of(Y, 0.5)), agent("b", 0, 1, Map.of(Y, 0.6)));

            ArchitectureImprovement improvement = new CapabilityExpertiseRule(properties).evaluate(context).orElseThrow();

            assertThat(improvement.getImprovementId()).isEqualTo(CapabilityExpertiseRule.IMPROVEMENT_ID);
            @SuppressWarnings("unchecked")
            Map<String, Double> best = (Map<String, Double>) improvement.getEvidence().get("bestProficiency");
            assertThat(best).containsEntry("api-integration", 0.6);
        }

        @Test
        @DisplayName("should leave low-coverage capabilities to the coverage rule")
        void coverageGapIsNotExpertiseGap() {
            AnalysisContext context = agentsOnly(agent("a", 0, 1, Map.of(Y, 0.2)));

            assertThat(new CapabilityExpertiseRule(properties).evaluate(context)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Load imbalance")
    class LoadTests {

        @Test
        @DisplayName("should suggest load balancing when utilization varies widely")
        void imbalance() {
            AnalysisContext context = agentsOnly(agent("a", 10, 10, Map.of(X, 0.9)), agent("b", 0, 10, Map.of(X, 0.9)));

            ArchitectureImprovement improvement = new LoadImbalanceRule(properties).evaluate(context).orElseThrow();

            assertThat(improvement.getImprovementId()).isEqualTo(LoadImbalanceRule.LOAD_BALANCING_ID);
            assertThat((Double) improvement.getEvidence().get("utilizationVariance")).isCloseTo(5000.0, within(1e-9));
        }

        @Test
        @DisplayName("should suggest capacity changes when the pool is mostly idle")
        void idle() {
            AnalysisContext context = agentsOnly(agent("a", 0, 10, Map.of(X, 0.9)), agent("b", 1, 10, Map.of(X, 0.9)));

            ArchitectureImprovement improvement = new LoadImbalanceRule(properties).evaluate(context).orElseThrow();

            assertThat(improvement.getImprovementId()).isEqualTo(LoadImbalanceRule.CAPACITY_ID);
            assertThat(improvement.getPriority()).isEqualTo(ImprovementPriority.MEDIUM);
        }

        @Test
        @DisplayName("should stay quiet for an evenly loaded pool")
        void balanced() {
            AnalysisContext context = agentsOnly(agent("a", 5, 10, Map.of(X, 0.9)), agent("b", 5, 10, Map.of(X, 0.9)));

            assertThat(new LoadImbalanceRule(properties).evaluate(context)).isEmpty();
            assertThat(new LoadImbalanceRule(properties).evaluate(agentsOnly())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Performance trend")
    class TrendTests {

        @BeforeEach
        void setUp() {
            properties.getImprovements().setTrendWindow(10);
        }

        private List<Double> history(double older, double recent) {
            List<Double> values = new ArrayList<>();
            IntStream.range(0, 10).forEach(i -> values.add(older));
            IntStream.range(0, 10).forEach(i -> values.add(recent));
            return values;
        }

        @Test
        @DisplayName("should flag a slowdown beyond the degradation ratio")
        void degradation() {
            AnalysisContext context = context(List.of(), List.of(), Map.of(), history(10.0, 15.0));

            ArchitectureImprovement improvement = new PerformanceTrendRule(properties).evaluate(context).orElseThrow();

            assertThat(improvement.getImprovementId()).isEqualTo(PerformanceTrendRule.IMPROVEMENT_ID);
            assertThat((Double) improvement.getEvidence().get("increasePercent")).isCloseTo(50.0, within(1e-9));
        }

        @Test
        @DisplayName("should tolerate a slowdown within the ratio")
        void withinRatio() {
            AnalysisContext context = context(List.of(), List.of(), Map.of(), history(10.0, 11.0));

            assertThat(new PerformanceTrendRule(properties).evaluate(context)).isEmpty();
        }

        @Test
        @DisplayName("should wait for enough samples")
        void tooFewSamples() {
            List<Double> fewSamples = IntStream.range(0, 9).mapToObj(i -> (double) i * 100).collect(Collectors.toList());
            AnalysisContext context = context(List.of(), List.of(), Map.of(), fewSamples);

            assertThat(new PerformanceTrendRule(properties).evaluate(context)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Dominant failure")
    class DominantFailureTests {

        @Test
        @DisplayName("should break frequency ties by category order")
        void tieBreak() {
            Map<FailureCategory, Integer> totals = new LinkedHashMap<>();
            totals.put(FailureCategory.TIMEOUT, 6);
            totals.put(FailureCategory.OVERLOAD, 6);
            AnalysisContext context = context(List.of(), List.of(), totals, List.of());

            ArchitectureImprovement improvement = new DominantFailureRule(properties).evaluate(context).orElseThrow();

            assertThat(improvement.getImprovementId()).isEqualTo("address_overload_failures");
            assertThat(improvement.getPriority()).isEqualTo(ImprovementPriority.CRITICAL);
            assertThat(improvement.getAffectedComponents()).isEqualTo(FailureCategory.OVERLOAD.getAffectedComponents());
        }

        @Test
        @DisplayName("should require more than the minimum frequency")
        void threshold() {
            AnalysisContext context = context(List.of(), List.of(), Map.of(FailureCategory.TIMEOUT, 5), List.of());

            assertThat(new DominantFailureRule(properties).evaluate(context)).isEmpty();
        }
    }
}
