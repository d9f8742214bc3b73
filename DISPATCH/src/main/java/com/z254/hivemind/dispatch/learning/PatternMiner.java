package com.z254.hivemind.dispatch.learning;

import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.Agent;
import com.z254.hivemind.dispatch.domain.model.Capability;
import com.z254.hivemind.dispatch.domain.model.FailureCategory;
import com.z254.hivemind.dispatch.domain.model.FailurePattern;
import com.z254.hivemind.dispatch.domain.model.PatternType;
import com.z254.hivemind.dispatch.domain.model.TaskContext;
import com.z254.hivemind.dispatch.domain.model.TaskOutcome;
import com.z254.hivemind.dispatch.domain.model.TaskPattern;
import com.z254.hivemind.dispatch.domain.repository.DocumentRepository;
import com.z254.hivemind.dispatch.domain.repository.OrderedDocumentWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Builds confidence-weighted patterns from completion records.
 * <p>
 * Successes reinforce a pattern keyed by the required capability set and one keyed by
 * (agent, task type). Failures are classified and counted per (category, agent).
 * <p>
 * Every update runs inside {@link ConcurrentHashMap#compute} on a fresh copy of the stored
 * pattern and replaces it. A pattern in the map is never mutated after it is published, so
 * readers can copy it without holding the entry lock.
 */
@Component
@Slf4j
public class PatternMiner {

    private final Map<String, TaskPattern> taskPatterns = new ConcurrentHashMap<>();
    private final Map<String, FailurePattern> failurePatterns = new ConcurrentHashMap<>();

    private final FailureClassifier classifier;
    private final DocumentRepository<TaskPattern> taskPatternRepository;
    private final DocumentRepository<FailurePattern> failurePatternRepository;
    private final OrderedDocumentWriter<TaskPattern> taskPatternWriter;
    private final OrderedDocumentWriter<FailurePattern> failurePatternWriter;
    private final DispatchProperties.LearningProperties config;
    private final Clock clock;

    public PatternMiner(FailureClassifier classifier,
                        DocumentRepository<TaskPattern> taskPatternRepository,
                        DocumentRepository<FailurePattern> failurePatternRepository,
                        DispatchProperties properties,
                        Clock clock) {
        this.classifier = classifier;
        this.taskPatternRepository = taskPatternRepository;
        this.failurePatternRepository = failurePatternRepository;
        this.taskPatternWriter = new OrderedDocumentWriter<>(taskPatternRepository, "task pattern");
        this.failurePatternWriter = new OrderedDocumentWriter<>(failurePatternRepository, "failure pattern");
        this.config = properties.getLearning();
        this.clock = clock;
    }

    /**
     * Fold one outcome into the pattern set.
     *
     * @param outcome the completion record
     * @param agent   the agent snapshot, or null if it has been deregistered
     * @return the failure category for failed outcomes, empty for successes
     */
    public Optional<FailureCategory> observe(TaskOutcome outcome, Agent agent) {
        if (outcome.isSuccess()) {
            observeSuccess(outcome);
            return Optional.empty();
        }
        return Optional.of(observeFailure(outcome, agent));
    }

    private void observeSuccess(TaskOutcome outcome) {
        TaskContext context = contextOf(outcome);
        double seconds = secondsOf(outcome.getCompletionTime());
        Instant now = clock.instant();

        if (!context.getRequiredCapabilities().isEmpty()) {
            List<String> tags = sortedTags(context.getRequiredCapabilities());
            String id = skillPatternId(tags);
            taskPatterns.compute(id, (key, existing) -> {
                TaskPattern pattern = existing != null ? existing.copy() : newPattern(key, PatternType.SKILL,
                        "Successful completion with capabilities: " + String.join(", ", tags),
                        Map.of("requiredCapabilities", tags), now);
                reinforce(pattern, seconds, outcome.getTaskId(), now);
                taskPatternWriter.stage(key, pattern);
                return pattern;
            });
            taskPatternWriter.flush(id);
        }

        if (context.getTaskType() != null) {
            String id = agentTaskPatternId(outcome.getAgentId(), context.getTaskType());
            taskPatterns.compute(id, (key, existing) -> {
                TaskPattern pattern = existing != null ? existing.copy() : newPattern(key, PatternType.SUCCESS,
                        "Agent " + outcome.getAgentId() + " successfully handles " + context.getTaskType() + " tasks",
                        Map.of("agentId", outcome.getAgentId(), "taskType", context.getTaskType()), now);
                reinforce(pattern, seconds, outcome.getTaskId(), now);
                taskPatternWriter.stage(key, pattern);
                return pattern;
            });
            taskPatternWriter.flush(id);
        }
    }

    private FailureCategory observeFailure(TaskOutcome outcome, Agent agent) {
        TaskContext context = contextOf(outcome);
        Instant now = clock.instant();
        FailureCategory category = classifier.classify(outcome,
                agent == null ? null : agent.getCapabilities().keySet());

        // Failures lower the success rate of matching success patterns without adding confidence.
        if (!context.getRequiredCapabilities().isEmpty()) {
            recordMiss(skillPatternId(sortedTags(context.getRequiredCapabilities())));
        }
        if (context.getTaskType() != null) {
            recordMiss(agentTaskPatternId(outcome.getAgentId(), context.getTaskType()));
        }

        String id = "failure:" + category.getCode() + ":" + outcome.getAgentId();
        FailurePattern updated = failurePatterns.compute(id, (key, existing) -> {
            FailurePattern pattern = existing != null ? existing.copy() : null;
            if (pattern == null) {
                pattern = FailurePattern.builder()
                        .patternId(key)
                        .category(category)
                        .description("Agent " + outcome.getAgentId() + " experiencing "
                                + category.getCode() + " failures")
                        .mitigationSuggestions(new ArrayList<>(category.getMitigations()))
                        .discoveredAt(now)
                        .build();
            }
            pattern.setFrequency(pattern.getFrequency() + 1);
            pattern.setImpactScore(Math.min(1.0, (double) pattern.getFrequency() / config.getFailureImpactSamples()));
            pattern.getAffectedAgents().add(outcome.getAgentId());
            pattern.getAffectedCapabilities().addAll(context.getRequiredCapabilities());
            addExample(pattern.getExamples(), outcome.getTaskId());
            pattern.setLastSeen(now);
            failurePatternWriter.stage(key, pattern);
            return pattern;
        });
        failurePatternWriter.flush(id);
        log.info("Classified failure of task {} on agent {} as {} (frequency {})",
                outcome.getTaskId(), outcome.getAgentId(), category.getCode(), updated.getFrequency());
        return category;
    }

    /**
     * Decay patterns not reinforced within the decay window and prune the ones that have
     * become both weak and thinly supported.
     */
    public SweepResult sweep() {
        Instant now = clock.instant();
        int decayed = 0;
        List<String> pruned = new ArrayList<>();

        for (String id : new ArrayList<>(taskPatterns.keySet())) {
            boolean[] wasDecayed = new boolean[1];
            TaskPattern result = taskPatterns.computeIfPresent(id, (key, current) -> {
                TaskPattern pattern = current;
                Instant reference = latest(current.getLastUpdated(), current.getLastDecayedAt());
                if (reference != null && Duration.between(reference, now).compareTo(config.getDecayAfter()) > 0) {
                    pattern = current.copy();
                    pattern.setConfidence(pattern.getConfidence() * config.getDecayFactor());
                    pattern.setLastDecayedAt(now);
                    wasDecayed[0] = true;
                }
                if (pattern.getConfidence() < config.getPruneConfidenceBelow()
                        && pattern.getSampleSize() < config.getPruneSampleSizeBelow()) {
                    taskPatternWriter.stageDelete(key);
                    return null;
                }
                if (wasDecayed[0]) {
                    taskPatternWriter.stage(key, pattern);
                }
                return pattern;
            });
            if (wasDecayed[0]) {
                decayed++;
            }
            if (result == null) {
                pruned.add(id);
            }
            taskPatternWriter.flush(id);
        }

        SweepResult result = new SweepResult(decayed, pruned.size(), taskPatterns.size());
        log.info("Pattern sweep: {} decayed, {} pruned, {} remaining",
                result.decayed(), result.pruned(), result.remaining());
        return result;
    }

    public List<TaskPattern> taskPatterns() {
        return taskPatterns.values().stream()
                .map(TaskPattern::copy)
                .sorted(Comparator.comparing(TaskPattern::getPatternId))
                .collect(Collectors.toList());
    }

    public List<FailurePattern> failurePatterns() {
        return failurePatterns.values().stream()
                .map(FailurePattern::copy)
                .sorted(Comparator.comparing(FailurePattern::getPatternId))
                .collect(Collectors.toList());
    }

    public Optional<TaskPattern> taskPattern(String patternId) {
        return Optional.ofNullable(taskPatterns.get(patternId)).map(TaskPattern::copy);
    }

    /**
     * Total failure frequency per category, in category declaration order.
     */
    public Map<FailureCategory, Integer> failureFrequencyByCategory() {
        Map<FailureCategory, Integer> totals = new LinkedHashMap<>();
        for (FailureCategory category : FailureCategory.values()) {
            int total = failurePatterns.values().stream()
                    .filter(p -> p.getCategory() == category)
                    .mapToInt(FailurePattern::getFrequency)
                    .sum();
            if (total > 0) {
                totals.put(category, total);
            }
        }
        return totals;
    }

    /**
     * Reload patterns persisted by a previous run.
     */
    public Mono<Integer> restore() {
        Mono<Integer> tasks = taskPatternRepository.findAll()
                .filter(p -> p.getPatternId() != null)
                .map(p -> taskPatterns.putIfAbsent(p.getPatternId(), p) == null ? 1 : 0)
                .reduce(0, Integer::sum);
        Mono<Integer> failures = failurePatternRepository.findAll()
                .filter(p -> p.getPatternId() != null)
                .map(p -> failurePatterns.putIfAbsent(p.getPatternId(), p) == null ? 1 : 0)
                .reduce(0, Integer::sum);
        return Mono.zip(tasks, failures, Integer::sum)
                .doOnSuccess(count -> log.info("Restored {} learned patterns", count));
    }

    static String skillPatternId(List<String> sortedTags) {
        return "skill:" + String.join("+", sortedTags);
    }

    static String agentTaskPatternId(String agentId, String taskType) {
        return "agent-task:" + agentId + ":" + taskType;
    }

    private TaskPattern newPattern(String id, PatternType type, String description,
                                   Map<String, Object> conditions, Instant now) {
        return TaskPattern.builder()
                .patternId(id)
                .type(type)
                .description(description)
                .conditions(new HashMap<>(conditions))
                .discoveredAt(now)
                .lastUpdated(now)
                .build();
    }

    private void reinforce(TaskPattern pattern, double seconds, String taskId, Instant now) {
        int samples = pattern.getSampleSize() + 1;
        pattern.setSampleSize(samples);
        pattern.setAverageCompletionSeconds(
                pattern.getAverageCompletionSeconds() + (seconds - pattern.getAverageCompletionSeconds()) / samples);
        pattern.setConfidence(Math.min(1.0, (double) samples / config.getConfidenceSamples()));
        pattern.setSuccessRate((double) samples / (samples + pattern.getFailureCount()));
        addExample(pattern.getExamples(), taskId);
        pattern.setLastUpdated(now);
        pattern.setLastDecayedAt(null);
    }

    private void recordMiss(String patternId) {
        taskPatterns.computeIfPresent(patternId, (key, current) -> {
            TaskPattern pattern = current.copy();
            pattern.setFailureCount(pattern.getFailureCount() + 1);
            pattern.setSuccessRate((double) pattern.getSampleSize()
                    / (pattern.getSampleSize() + pattern.getFailureCount()));
            taskPatternWriter.stage(key, pattern);
            return pattern;
        });
        taskPatternWriter.flush(patternId);
    }

    private void addExample(List<String> examples, String taskId) {
        if (taskId == null) {
            return;
        }
        examples.add(taskId);
        while (examples.size() > config.getMaxExamples()) {
            examples.remove(0);
        }
    }

    private static TaskContext contextOf(TaskOutcome outcome) {
        return outcome.getContext() == null ? new TaskContext() : outcome.getContext();
    }

    private static List<String> sortedTags(Set<Capability> capabilities) {
        return capabilities.stream().map(Capability::getTag).sorted().collect(Collectors.toList());
    }

    private static double secondsOf(Duration duration) {
        return duration == null ? 0.0 : duration.toMillis() / 1000.0;
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }
}
