package com.z254.hivemind.dispatch.routing;

import com.z254.hivemind.dispatch.DispatchTestFixtures;
import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.Agent;
import com.z254.hivemind.dispatch.domain.model.Capability;
import com.z254.hivemind.dispatch.domain.model.TaskRequest;
import com.z254.hivemind.dispatch.registry.AgentRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.z254.hivemind.dispatch.DispatchTestFixtures.agent;
import static com.z254.hivemind.dispatch.DispatchTestFixtures.task;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TaskRouterTest {

    private static final Capability X = Capability.DATA_PROCESSING;
    private static final Capability Y = Capability.API_INTEGRATION;

    private AgentRegistry registry;
    private TaskRouter router;

    @BeforeEach
    void setUp() {
        DispatchProperties properties = new DispatchProperties();
        registry = DispatchTestFixtures.registry(properties, DispatchTestFixtures.clock());
        router = new TaskRouter(registry, properties);
    }

    @Nested
    @DisplayName("Scoring")
    class ScoringTests {

        @Test
        @DisplayName("should apply a gentle penalty up to saturation and a steep one beyond")
        void loadPenaltyCurve() {
            assertThat(router.loadPenalty(0.0)).isZero();
            assertThat(router.loadPenalty(0.5)).isCloseTo(0.1, within(1e-9));
            assertThat(router.loadPenalty(0.8)).isCloseTo(0.16, within(1e-9));
            assertThat(router.loadPenalty(1.0)).isCloseTo(0.56, within(1e-9));
        }

        @Test
        @DisplayName("should weight proficiency per capability, defaulting to 1.0")
        void weightedScore() {
            Agent agent = agent("a", 4, Map.of(X, 0.5, Y, 0.8));
            TaskRequest task = task("t1", X, Y).toBuilder()
                    .weights(Map.of(X, 2.0))
                    .build();

            CandidateScore score = router.score(task, agent);

            assertThat(score.proficiencyScore()).isCloseTo(1.8, within(1e-9));
            assertThat(score.loadPenalty()).isZero();
            assertThat(score.score()).isCloseTo(1.8, within(1e-9));
        }

        @Test
        @DisplayName("should rank only agents declaring every required capability")
        void rankFiltersCapability() {
            registry.register(agent("a", 1, Map.of(X, 0.9)));
            registry.register(agent("b", 1, Map.of(X, 0.5, Y, 0.5)));

            List<CandidateScore> ranked = router.rank(task("t1", X, Y));

            assertThat(ranked).extracting(CandidateScore::agentId).containsExactly("b");
        }

        @Test
        @DisplayName("should break score ties by lower load, then faster completion, then id")
        void tieBreaking() {
            registry.register(agent("c", 4, Map.of(X, 0.7)));
            registry.register(agent("b", 4, Map.of(X, 0.7)));
            registry.register(agent("a", 4, Map.of(X, 0.7)));
            registry.update("a", agent -> agent.getMetrics()
                    .record(true, Duration.ofMinutes(30), DispatchTestFixtures.NOW));
            registry.update("b", agent -> agent.getMetrics()
                    .record(true, Duration.ofMinutes(10), DispatchTestFixtures.NOW));

            assertThat(router.rank(task("t1", X))).extracting(CandidateScore::agentId)
                    .containsExactly("c", "b", "a");
        }
    }

    @Nested
    @DisplayName("Routing")
    class RoutingTests {

        @Test
        @DisplayName("should send the first two tasks to the expert and the third to the generalist")
        void expertThenGeneralist() {
            registry.register(agent("A", 2, Map.of(X, 0.9)));
            registry.register(agent("B", 5, Map.of(X, 0.5)));

            List<String> assigned = router.assignBatch(List.of(task("t1", X), task("t2", X), task("t3", X)))
                    .stream()
                    .map(RoutingResult::agentId)
                    .collect(Collectors.toList());

            assertThat(assigned).containsExactly("A", "A", "B");
            assertThat(registry.require("A").getCurrentLoad()).isEqualTo(2);
            assertThat(registry.require("B").getCurrentLoad()).isEqualTo(1);
        }

        @Test
        @DisplayName("should report no capable agent as a normal result")
        void noCapableAgent() {
            registry.register(agent("A", 2, Map.of(Y, 0.9)));

            RoutingResult result = router.route(task("t1", X));

            assertThat(result.isAssigned()).isFalse();
            assertThat(result.reason()).isEqualTo(RoutingResult.Reason.NO_CAPABLE_AGENT);
            assertThat(result.candidates()).isEmpty();
        }

        @Test
        @DisplayName("should report saturation when every capable agent is full")
        void allAtCapacity() {
            registry.register(agent("A", 1, Map.of(X, 0.9)));
            router.route(task("t1", X));

            RoutingResult result = router.route(task("t2", X));

            assertThat(result.isAssigned()).isFalse();
            assertThat(result.reason()).isEqualTo(RoutingResult.Reason.ALL_CAPABLE_AGENTS_AT_CAPACITY);
            assertThat(result.candidates()).extracting(CandidateScore::agentId).containsExactly("A");
            assertThat(registry.require("A").getCurrentLoad()).isEqualTo(1);
        }

        @Test
        @DisplayName("should choose the same agent for the same state")
        void deterministic() {
            registry.register(agent("a", 3, Map.of(X, 0.7)));
            registry.register(agent("b", 3, Map.of(X, 0.7)));

            List<CandidateScore> first = router.rank(task("t1", X));
            List<CandidateScore> second = router.rank(task("t1", X));

            assertThat(first).isEqualTo(second);
            assertThat(first.get(0).agentId()).isEqualTo("a");
        }

        @Test
        @DisplayName("should alternate between equally skilled agents")
        void loadBalancing() {
            registry.register(agent("a", 3, Map.of(X, 0.8)));
            registry.register(agent("b", 3, Map.of(X, 0.8)));

            List<TaskRequest> tasks = IntStream.range(0, 7)
                    .mapToObj(i -> task("t" + i, X))
                    .collect(Collectors.toList());
            List<RoutingResult> results = router.assignBatch(tasks);

            assertThat(results.subList(0, 6)).extracting(RoutingResult::agentId)
                    .containsExactly("a", "b", "a", "b", "a", "b");
            assertThat(results.get(6).reason()).isEqualTo(RoutingResult.Reason.ALL_CAPABLE_AGENTS_AT_CAPACITY);
        }
    }

    @Test
    @DisplayName("should never exceed capacity under concurrent routing")
    void concurrentRouting() throws InterruptedException {
        registry.register(agent("a", 5, Map.of(X, 0.9)));
        registry.register(agent("b", 3, Map.of(X, 0.6)));

        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        ConcurrentLinkedQueue<RoutingResult> results = new ConcurrentLinkedQueue<>();
        List<Runnable> jobs = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            String id = "t" + i;
            jobs.add(() -> {
                try {
                    start.await();
                    results.add(router.route(task(id, X)));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        jobs.forEach(executor::submit);
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(results).hasSize(50);
        assertThat(results.stream().filter(RoutingResult::isAssigned)).hasSize(8);
        assertThat(registry.require("a").getCurrentLoad()).isEqualTo(5);
        assertThat(registry.require("b").getCurrentLoad()).isEqualTo(3);
    }
}
