package com.z254.hivemind.dispatch.routing;

import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.Agent;
import com.z254.hivemind.dispatch.domain.model.Capability;
import com.z254.hivemind.dispatch.domain.model.TaskRequest;
import com.z254.hivemind.dispatch.registry.AgentRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Selects the agent for a task by skill-weighted score less a load penalty.
 * <p>
 * Ordering: highest score, then lowest current load, then lowest average completion time,
 * then agent id. Scoring, selection and the load increment happen under one lock so two
 * concurrent routes can never both take an agent's last free slot.
 */
@Component
@Slf4j
public class TaskRouter {

    // Scores are compared at this resolution so float noise cannot break ties differently.
    private static final double SCORE_RESOLUTION = 1e9;

    private static final Comparator<CandidateScore> RANKING = Comparator
            .comparingLong((CandidateScore c) -> -Math.round(c.score() * SCORE_RESOLUTION))
            .thenComparingInt(CandidateScore::currentLoad)
            .thenComparingDouble(CandidateScore::averageCompletionSeconds)
            .thenComparing(CandidateScore::agentId);

    private final AgentRegistry registry;
    private final DispatchProperties.RoutingProperties config;
    private final ReentrantLock routingLock = new ReentrantLock();

    public TaskRouter(AgentRegistry registry, DispatchProperties properties) {
        this.registry = registry;
        this.config = properties.getRouting();
    }

    /**
     * Route a task and reserve a slot on the chosen agent.
     */
    public RoutingResult route(TaskRequest task) {
        routingLock.lock();
        try {
            List<CandidateScore> candidates = rank(task);
            if (candidates.isEmpty()) {
                log.info("No agent declares {} for task {}", task.getRequiredCapabilities(), task.getId());
                return RoutingResult.unassigned(task.getId(), RoutingResult.Reason.NO_CAPABLE_AGENT, candidates);
            }

            CandidateScore chosen = candidates.stream()
                    .filter(CandidateScore::hasCapacity)
                    .findFirst()
                    .orElse(null);
            if (chosen == null) {
                log.info("All {} capable agents at capacity for task {}", candidates.size(), task.getId());
                return RoutingResult.unassigned(task.getId(),
                        RoutingResult.Reason.ALL_CAPABLE_AGENTS_AT_CAPACITY, candidates);
            }

            registry.updateLoad(chosen.agentId(), 1);
            log.info("Routed task {} to agent {} (score {})",
                    task.getId(), chosen.agentId(), String.format("%.3f", chosen.score()));
            return RoutingResult.assigned(task.getId(), chosen, candidates);
        } finally {
            routingLock.unlock();
        }
    }

    /**
     * Route tasks in the given order. Each pick sees the load left by earlier picks.
     */
    public List<RoutingResult> assignBatch(List<TaskRequest> tasks) {
        List<RoutingResult> results = new ArrayList<>(tasks.size());
        for (TaskRequest task : tasks) {
            results.add(route(task));
        }
        return results;
    }

    /**
     * Score every capable agent without reserving anything. Agents at capacity are
     * included so callers can see why nothing was assigned.
     */
    public List<CandidateScore> rank(TaskRequest task) {
        return registry.list().stream()
                .filter(agent -> agent.hasCapabilities(task.getRequiredCapabilities()))
                .map(agent -> score(task, agent))
                .sorted(RANKING)
                .collect(Collectors.toList());
    }

    CandidateScore score(TaskRequest task, Agent agent) {
        double proficiencyScore = 0.0;
        for (Capability capability : task.getRequiredCapabilities()) {
            proficiencyScore += agent.proficiency(capability) * task.weight(capability);
        }
        double penalty = loadPenalty(agent.getUtilization());
        CandidateScore candidate = new CandidateScore(
                agent.getId(),
                proficiencyScore,
                penalty,
                proficiencyScore - penalty,
                agent.getCurrentLoad(),
                agent.getMaxConcurrentTasks(),
                agent.getMetrics().getAverageCompletionSeconds());
        log.debug("Task {} candidate {}: proficiency={} penalty={} load={}/{}",
                task.getId(), agent.getId(), proficiencyScore, penalty,
                agent.getCurrentLoad(), agent.getMaxConcurrentTasks());
        return candidate;
    }

    /**
     * Gentle linear slope up to the saturation threshold, steep beyond it.
     */
    double loadPenalty(double utilization) {
        double threshold = config.getSaturationThreshold();
        if (utilization <= threshold) {
            return config.getLoadPenaltyFactor() * utilization;
        }
        return config.getLoadPenaltyFactor() * threshold
                + config.getSaturationPenaltyFactor() * (utilization - threshold);
    }
}
