package com.z254.hivemind.dispatch.registry;

import com.z254.hivemind.dispatch.domain.model.Agent;
import com.z254.hivemind.dispatch.domain.model.Capability;
import com.z254.hivemind.dispatch.domain.model.PerformanceMetrics;
import com.z254.hivemind.dispatch.domain.repository.DocumentRepository;
import com.z254.hivemind.dispatch.domain.repository.OrderedDocumentWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Holds every registered agent with its declared capabilities, capacity and live load.
 * <p>
 * All mutation goes through {@link ConcurrentHashMap#compute}, so updates to one agent are
 * atomic. Reads return copies. Each change is staged for write-behind inside the same
 * update, so the repository never ends up holding an older snapshot than memory.
 */
@Component
@Slf4j
public class AgentRegistry {

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final CapabilityCatalog catalog;
    private final DocumentRepository<Agent> repository;
    private final OrderedDocumentWriter<Agent> writer;
    private final Clock clock;

    public AgentRegistry(CapabilityCatalog catalog, DocumentRepository<Agent> agentRepository, Clock clock) {
        this.catalog = catalog;
        this.repository = agentRepository;
        this.writer = new OrderedDocumentWriter<>(agentRepository, "agent");
        this.clock = clock;
    }

    /**
     * Register an agent, or replace the declared capabilities and capacity of an existing
     * one. Accumulated metrics and in-flight load survive re-registration.
     *
     * @return a snapshot of the registered agent
     */
    public Agent register(Agent agent) {
        validate(agent);
        Agent stored = agents.compute(agent.getId(), (id, existing) -> {
            Agent next = agent.copy();
            if (existing == null) {
                next.setCurrentLoad(0);
                next.setMetrics(PerformanceMetrics.empty());
                next.setRegisteredAt(clock.instant());
                log.info("Registered agent {} with capabilities {}", id, next.getCapabilities().keySet());
            } else {
                if (existing.getCurrentLoad() > next.getMaxConcurrentTasks()) {
                    throw new CapacityExceededException(id, existing.getCurrentLoad(), next.getMaxConcurrentTasks());
                }
                next.setCurrentLoad(existing.getCurrentLoad());
                next.setMetrics(existing.getMetrics().copy());
                next.setRegisteredAt(existing.getRegisteredAt());
                next.setLastAssignedAt(existing.getLastAssignedAt());
                log.info("Re-registered agent {} with capabilities {}", id, next.getCapabilities().keySet());
            }
            writer.stage(id, next.copy());
            return next;
        });
        writer.flush(agent.getId());
        return stored.copy();
    }

    /**
     * @return true if an agent was removed
     */
    public boolean deregister(String id) {
        if (id == null) {
            return false;
        }
        boolean[] removed = new boolean[1];
        agents.computeIfPresent(id, (key, existing) -> {
            log.info("Deregistered agent {} (load {})", key, existing.getCurrentLoad());
            writer.stageDelete(key);
            removed[0] = true;
            return null;
        });
        if (removed[0]) {
            writer.flush(id);
        }
        return removed[0];
    }

    public Optional<Agent> get(String id) {
        Agent agent = id == null ? null : agents.get(id);
        return Optional.ofNullable(agent).map(Agent::copy);
    }

    public Agent require(String id) {
        return get(id).orElseThrow(() -> new AgentNotFoundException(id));
    }

    public boolean contains(String id) {
        return agents.containsKey(id);
    }

    /**
     * Snapshot of all agents ordered by id.
     */
    public List<Agent> list() {
        return agents.values().stream()
                .map(Agent::copy)
                .sorted(Comparator.comparing(Agent::getId))
                .collect(Collectors.toList());
    }

    public int size() {
        return agents.size();
    }

    /**
     * Atomically adjust an agent's load. Decrements floor at zero.
     *
     * @return the new load
     * @throws CapacityExceededException if the result would exceed the agent's limit
     * @throws AgentNotFoundException    if the agent is not registered
     */
    public int updateLoad(String id, int delta) {
        Agent updated = update(id, agent -> {
            int next = agent.getCurrentLoad() + delta;
            if (next > agent.getMaxConcurrentTasks()) {
                throw new CapacityExceededException(id, agent.getCurrentLoad(), agent.getMaxConcurrentTasks());
            }
            agent.setCurrentLoad(Math.max(0, next));
            if (delta > 0) {
                agent.setLastAssignedAt(clock.instant());
            }
        });
        log.debug("Agent {} load now {}/{}", id, updated.getCurrentLoad(), updated.getMaxConcurrentTasks());
        return updated.getCurrentLoad();
    }

    /**
     * Apply a mutation to one agent atomically with respect to every other update of it.
     *
     * @return a snapshot taken after the mutation
     */
    public Agent update(String id, Consumer<Agent> mutation) {
        Agent[] result = new Agent[1];
        agents.compute(id, (key, existing) -> {
            if (existing == null) {
                throw new AgentNotFoundException(id);
            }
            Agent working = existing.copy();
            mutation.accept(working);
            result[0] = working.copy();
            writer.stage(key, working.copy());
            return working;
        });
        writer.flush(id);
        return result[0];
    }

    /**
     * Total load over total capacity, as a percentage.
     */
    public double systemLoadPercent() {
        int load = 0;
        int capacity = 0;
        for (Agent agent : agents.values()) {
            load += agent.getCurrentLoad();
            capacity += agent.getMaxConcurrentTasks();
        }
        return capacity == 0 ? 0.0 : load * 100.0 / capacity;
    }

    /**
     * Number of agents declaring each capability.
     */
    public Map<Capability, Integer> capabilityCoverage() {
        Map<Capability, Integer> coverage = new HashMap<>();
        for (Agent agent : agents.values()) {
            for (Capability capability : agent.getCapabilities().keySet()) {
                coverage.merge(capability, 1, Integer::sum);
            }
        }
        return coverage;
    }

    /**
     * Reload agents saved by a previous run. Agents already registered are kept.
     *
     * @return the number of agents restored
     */
    public Mono<Integer> restore() {
        return repository.findAll()
                .filter(agent -> agent.getId() != null)
                .map(agent -> agents.putIfAbsent(agent.getId(), agent.copy()) == null ? 1 : 0)
                .reduce(0, Integer::sum)
                .doOnSuccess(count -> log.info("Restored {} agents from persisted state", count));
    }

    private void validate(Agent agent) {
        if (agent == null || agent.getId() == null || agent.getId().isBlank()) {
            throw new IllegalArgumentException("Agent id is required");
        }
        if (agent.getMaxConcurrentTasks() < 1) {
            throw new IllegalArgumentException("maxConcurrentTasks must be at least 1");
        }
        for (Map.Entry<Capability, Double> entry : agent.getCapabilities().entrySet()) {
            catalog.requireKnown(entry.getKey());
            Double proficiency = entry.getValue();
            if (proficiency == null || proficiency < 0.0 || proficiency > 1.0) {
                throw new IllegalArgumentException(
                        "Proficiency for " + entry.getKey() + " must be within [0, 1]");
            }
        }
    }
}
