package com.z254.hivemind.dispatch.learning;

import com.z254.hivemind.dispatch.domain.model.ArchitectureImprovement;
import com.z254.hivemind.dispatch.domain.repository.DocumentRepository;
import com.z254.hivemind.dispatch.domain.repository.OrderedDocumentWriter;
import com.z254.hivemind.dispatch.learning.rule.ImprovementRule;
import com.z254.hivemind.dispatch.registry.AgentRegistry;
import com.z254.hivemind.dispatch.tracking.PerformanceTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs every {@link ImprovementRule} against current tracker and miner state.
 * <p>
 * Each run replaces the previous run's output: an improvement id produced again is
 * overwritten, one no longer produced is dropped.
 */
@Component
@Slf4j
public class ImprovementGenerator {

    private static final Comparator<ArchitectureImprovement> RANKING = Comparator
            .comparing(ArchitectureImprovement::getPriority)
            .thenComparing(ArchitectureImprovement::getConfidence, Comparator.reverseOrder())
            .thenComparing(ArchitectureImprovement::getImprovementId);

    private final List<ImprovementRule> rules;
    private final AgentRegistry registry;
    private final PatternMiner patternMiner;
    private final PerformanceTracker tracker;
    private final DocumentRepository<ArchitectureImprovement> repository;
    private final OrderedDocumentWriter<ArchitectureImprovement> writer;
    private final Clock clock;

    private final Map<String, ArchitectureImprovement> latest = new LinkedHashMap<>();
    private volatile Instant lastRunAt;

    public ImprovementGenerator(List<ImprovementRule> rules,
                                AgentRegistry registry,
                                PatternMiner patternMiner,
                                PerformanceTracker tracker,
                                DocumentRepository<ArchitectureImprovement> improvementRepository,
                                Clock clock) {
        this.rules = List.copyOf(rules);
        this.registry = registry;
        this.patternMiner = patternMiner;
        this.tracker = tracker;
        this.repository = improvementRepository;
        this.writer = new OrderedDocumentWriter<>(improvementRepository, "improvement");
        this.clock = clock;
        log.info("Initialized ImprovementGenerator with {} rules", rules.size());
    }

    /**
     * Evaluate all rules and return the ranked improvements: most urgent first, then
     * highest confidence, then id.
     */
    public synchronized List<ArchitectureImprovement> generate() {
        AnalysisContext context = snapshot();
        List<ArchitectureImprovement> improvements = new ArrayList<>();
        for (ImprovementRule rule : rules) {
            Optional<ArchitectureImprovement> result = rule.evaluate(context);
            result.ifPresent(improvement -> {
                log.debug("Rule {} produced {}", rule.getName(), improvement.getImprovementId());
                improvements.add(improvement);
            });
        }
        improvements.sort(RANKING);

        Set<String> touched = new HashSet<>();
        for (ArchitectureImprovement improvement : improvements) {
            touched.add(improvement.getImprovementId());
            writer.stage(improvement.getImprovementId(), improvement);
        }
        for (String stale : latest.keySet()) {
            if (touched.add(stale)) {
                writer.stageDelete(stale);
            }
        }
        touched.forEach(writer::flush);

        latest.clear();
        improvements.forEach(improvement -> latest.put(improvement.getImprovementId(), improvement));
        lastRunAt = context.generatedAt();
        log.info("Improvement run produced {} suggestions from {} rules", improvements.size(), rules.size());
        return List.copyOf(improvements);
    }

    /**
     * Output of the most recent run, ranked.
     */
    public synchronized List<ArchitectureImprovement> latest() {
        return List.copyOf(latest.values());
    }

    public Optional<Instant> lastRunAt() {
        return Optional.ofNullable(lastRunAt);
    }

    /**
     * Reload the output of the last run persisted before a restart.
     */
    public Mono<Integer> restore() {
        return repository.findAll()
                .filter(improvement -> improvement.getImprovementId() != null)
                .sort(RANKING)
                .collectList()
                .map(restored -> {
                    synchronized (this) {
                        if (latest.isEmpty()) {
                            restored.forEach(improvement -> latest.put(improvement.getImprovementId(), improvement));
                        }
                        return latest.size();
                    }
                })
                .doOnSuccess(count -> log.info("Restored {} architecture improvements", count));
    }

    AnalysisContext snapshot() {
        return new AnalysisContext(
                registry.list(),
                patternMiner.taskPatterns(),
                patternMiner.failurePatterns(),
                patternMiner.failureFrequencyByCategory(),
                tracker.recentSuccessSeconds(),
                clock.instant());
    }
}
