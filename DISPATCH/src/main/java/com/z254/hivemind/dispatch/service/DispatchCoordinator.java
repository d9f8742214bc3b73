package com.z254.hivemind.dispatch.service;

import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.Agent;
import com.z254.hivemind.dispatch.domain.model.AgentMessage;
import com.z254.hivemind.dispatch.domain.model.ArchitectureImprovement;
import com.z254.hivemind.dispatch.domain.model.Capability;
import com.z254.hivemind.dispatch.domain.model.FailureCategory;
import com.z254.hivemind.dispatch.domain.model.MessageType;
import com.z254.hivemind.dispatch.domain.model.TaskContext;
import com.z254.hivemind.dispatch.domain.model.TaskOutcome;
import com.z254.hivemind.dispatch.domain.model.TaskRequest;
import com.z254.hivemind.dispatch.kafka.DispatchEventProducer;
import com.z254.hivemind.dispatch.learning.DistributionAnalysis;
import com.z254.hivemind.dispatch.learning.ImprovementGenerator;
import com.z254.hivemind.dispatch.learning.LearningReporter;
import com.z254.hivemind.dispatch.learning.PatternMiner;
import com.z254.hivemind.dispatch.learning.SkillGap;
import com.z254.hivemind.dispatch.learning.SweepResult;
import com.z254.hivemind.dispatch.learning.report.FailureAnalysisReport;
import com.z254.hivemind.dispatch.learning.report.LearningInsights;
import com.z254.hivemind.dispatch.learning.report.SuccessPatternReport;
import com.z254.hivemind.dispatch.messaging.MessageDeliveryException;
import com.z254.hivemind.dispatch.messaging.MessagingSubstrate;
import com.z254.hivemind.dispatch.observability.DispatchMetrics;
import com.z254.hivemind.dispatch.observability.DispatchStructuredLogger;
import com.z254.hivemind.dispatch.registry.AgentNotFoundException;
import com.z254.hivemind.dispatch.registry.AgentRegistry;
import com.z254.hivemind.dispatch.registry.CapabilityCatalog;
import com.z254.hivemind.dispatch.routing.PriorityAdjuster;
import com.z254.hivemind.dispatch.routing.RoutingResult;
import com.z254.hivemind.dispatch.routing.TaskRouter;
import com.z254.hivemind.dispatch.tracking.PerformanceTracker;
import com.z254.hivemind.dispatch.tracking.TrackedOutcome;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Entry point for every collaborator: task originators, agents reporting outcomes, and
 * operators reading reports.
 * <p>
 * Routing and outcome reporting are the only paths that touch agent load. Learning runs
 * after the tracker has committed an outcome and never fails the report.
 */
@Service
@Slf4j
public class DispatchCoordinator {

    static final double OVERLOADED_PERCENT = 80.0;
    static final double UNDERUTILIZED_PERCENT = 20.0;
    static final String DEFAULT_EMERGENCY_ACTION = "STOP_ALL_WORK";

    private final AgentRegistry registry;
    private final CapabilityCatalog catalog;
    private final TaskRouter router;
    private final PriorityAdjuster priorityAdjuster;
    private final MessagingSubstrate messaging;
    private final PerformanceTracker tracker;
    private final PatternMiner patternMiner;
    private final ImprovementGenerator improvementGenerator;
    private final LearningReporter reporter;
    private final DispatchMetrics metrics;
    private final DispatchStructuredLogger structuredLogger;
    private final ObjectProvider<DispatchEventProducer> eventProducer;
    private final DispatchProperties properties;
    private final Clock clock;

    public DispatchCoordinator(AgentRegistry registry,
                               CapabilityCatalog catalog,
                               TaskRouter router,
                               PriorityAdjuster priorityAdjuster,
                               MessagingSubstrate messaging,
                               PerformanceTracker tracker,
                               PatternMiner patternMiner,
                               ImprovementGenerator improvementGenerator,
                               LearningReporter reporter,
                               DispatchMetrics metrics,
                               DispatchStructuredLogger structuredLogger,
                               ObjectProvider<DispatchEventProducer> eventProducer,
                               DispatchProperties properties,
                               Clock clock) {
        this.registry = registry;
        this.catalog = catalog;
        this.router = router;
        this.priorityAdjuster = priorityAdjuster;
        this.messaging = messaging;
        this.tracker = tracker;
        this.patternMiner = patternMiner;
        this.improvementGenerator = improvementGenerator;
        this.reporter = reporter;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.eventProducer = eventProducer;
        this.properties = properties;
        this.clock = clock;
    }

    // --- Agents ---

    public Agent registerAgent(Agent agent) {
        Agent registered = registry.register(agent);
        metrics.updateSystemLoad(registry.systemLoadPercent());
        return registered;
    }

    public boolean deregisterAgent(String agentId) {
        boolean removed = registry.deregister(agentId);
        metrics.updateSystemLoad(registry.systemLoadPercent());
        return removed;
    }

    public Optional<Agent> getAgent(String agentId) {
        return registry.get(agentId);
    }

    public List<Agent> listAgents() {
        return registry.list();
    }

    // --- Tasks ---

    /**
     * Adjust priority, route, and notify the chosen agent.
     * <p>
     * An unassigned result is a normal outcome. If the assignment message cannot be stored
     * durably the agent's slot is released and the error propagates.
     */
    public Mono<SubmissionResult> submit(TaskRequest request) {
        return Mono.fromCallable(() -> prepare(request))
                .flatMap(this::routeAndNotify);
    }

    /**
     * Submit tasks one after another, in order.
     */
    public Flux<SubmissionResult> submitBatch(List<TaskRequest> requests) {
        return Flux.fromIterable(requests).concatMap(this::submit);
    }

    /**
     * What priority a task would be routed with right now.
     */
    public TaskRequest previewPriority(TaskRequest request) {
        return priorityAdjuster.adjust(prepare(request));
    }

    private TaskRequest prepare(TaskRequest request) {
        TaskRequest.TaskRequestBuilder builder = request.toBuilder();
        if (request.getId() == null || request.getId().isBlank()) {
            builder.id(UUID.randomUUID().toString());
        }
        if (request.getCreatedAt() == null) {
            builder.createdAt(clock.instant());
        }
        TaskRequest task = builder.build();
        task.getRequiredCapabilities().forEach(catalog::requireKnown);
        return task;
    }

    private Mono<SubmissionResult> routeAndNotify(TaskRequest prepared) {
        TaskRequest task = priorityAdjuster.adjust(prepared);
        Timer.Sample sample = metrics.startRoutingTimer();
        RoutingResult routing = router.route(task);
        SubmissionResult result = new SubmissionResult(task, routing);

        if (!routing.isAssigned()) {
            metrics.recordUnroutable(sample);
            structuredLogger.logTaskUnroutable(task.getId(), routing.reason().name(), routing.candidates().size());
            log.info("Task {} not assigned: {}", task.getId(), routing.reason());
            return Mono.just(result);
        }

        metrics.recordRouted(sample);
        metrics.updateSystemLoad(registry.systemLoadPercent());
        structuredLogger.logTaskRouted(task.getId(), routing.agentId(), task.getPriority(), routing.score());

        return messaging.send(properties.getMessaging().getDispatcherId(), routing.agentId(),
                        MessageType.TASK_ASSIGNMENT, assignmentContent(task))
                .onErrorResume(MessageDeliveryException.class, e -> {
                    releaseSlot(routing.agentId(), task.getId());
                    return Mono.error(e);
                })
                .thenReturn(result)
                .doOnSuccess(r -> eventProducer.ifAvailable(producer -> producer.publishAssignment(r)));
    }

    private Map<String, Object> assignmentContent(TaskRequest task) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("taskId", task.getId());
        content.put("type", task.getType());
        content.put("description", task.getDescription());
        content.put("priority", task.getPriority().name());
        content.put("requiredCapabilities", task.getRequiredCapabilities().stream()
                .map(Capability::getTag)
                .sorted()
                .collect(Collectors.toList()));
        content.put("deadline", task.getDeadline() == null ? null : task.getDeadline().toString());
        content.put("metadata", task.getMetadata());
        return content;
    }

    private void releaseSlot(String agentId, String taskId) {
        try {
            registry.updateLoad(agentId, -1);
            metrics.updateSystemLoad(registry.systemLoadPercent());
            log.warn("Released slot on agent {} after failed assignment of task {}", agentId, taskId);
        } catch (AgentNotFoundException e) {
            log.warn("Agent {} deregistered before slot for task {} could be released", agentId, taskId);
        }
    }

    // --- Outcomes ---

    /**
     * Record a finished task. Statistics and load are updated before this returns; the
     * learning update is best-effort.
     *
     * @throws AgentNotFoundException if the agent is not registered
     */
    public OutcomeReceipt reportOutcome(String agentId, String taskId, boolean success,
                                        Duration completionTime, TaskContext context) {
        TrackedOutcome tracked = tracker.recordOutcome(agentId, taskId, success, completionTime);
        Agent agent = tracked.agent();
        metrics.updateSystemLoad(registry.systemLoadPercent());

        FailureCategory category = null;
        boolean learned = true;
        try {
            TaskOutcome outcome = TaskOutcome.builder()
                    .agentId(agentId)
                    .taskId(taskId)
                    .success(success)
                    .completionTime(completionTime)
                    .context(context == null ? new TaskContext() : context)
                    .agentLoad(tracked.loadAtReport())
                    .agentCapacity(agent.getMaxConcurrentTasks())
                    .reportedAt(clock.instant())
                    .build();
            category = patternMiner.observe(outcome, agent).orElse(null);
            if (category != null) {
                structuredLogger.logFailureClassified(taskId, agentId, category);
            }
        } catch (RuntimeException e) {
            learned = false;
            metrics.recordLearningError();
            log.warn("Skipped learning update for task {} on agent {}: {}", taskId, agentId, e.getMessage(), e);
        }

        metrics.recordOutcome(success, category);
        structuredLogger.logOutcomeRecorded(taskId, agentId, success,
                completionTime == null ? 0L : completionTime.toMillis());

        return new OutcomeReceipt(agentId, taskId, success, category, agent.getMetrics(),
                agent.getCurrentLoad(), learned);
    }

    // --- Reports ---

    public WorkloadReport workloadReport() {
        List<Agent> agents = registry.list();
        Map<String, WorkloadReport.AgentWorkload> workloads = new LinkedHashMap<>();
        int available = 0;
        for (Agent agent : agents) {
            if (agent.hasCapacity()) {
                available++;
            }
            workloads.put(agent.getId(), WorkloadReport.AgentWorkload.builder()
                    .utilizationPercent(agent.getUtilization() * 100.0)
                    .currentLoad(agent.getCurrentLoad())
                    .maxConcurrentTasks(agent.getMaxConcurrentTasks())
                    .availability(agent.getAvailability())
                    .successRate(agent.getMetrics().getSuccessRate())
                    .averageCompletionSeconds(agent.getMetrics().getAverageCompletionSeconds())
                    .build());
        }
        double systemLoad = registry.systemLoadPercent();
        metrics.updateSystemLoad(systemLoad);

        return WorkloadReport.builder()
                .timestamp(clock.instant())
                .agents(workloads)
                .systemLoadPercent(systemLoad)
                .totalAgents(agents.size())
                .availableAgents(available)
                .build();
    }

    public LearningInsights learningInsights() {
        return reporter.insights();
    }

    public List<ArchitectureImprovement> generateImprovements() {
        List<ArchitectureImprovement> improvements = improvementGenerator.generate();
        metrics.recordImprovementsGenerated(improvements.size());
        structuredLogger.logImprovementsGenerated(improvements.stream()
                .map(ArchitectureImprovement::getImprovementId)
                .collect(Collectors.toList()));
        eventProducer.ifAvailable(producer -> producer.publishImprovements(improvements));
        return improvements;
    }

    public List<ArchitectureImprovement> latestImprovements() {
        return improvementGenerator.latest();
    }

    public SuccessPatternReport successPatternReport() {
        return reporter.successReport();
    }

    public FailureAnalysisReport failureAnalysisReport() {
        return reporter.failureReport();
    }

    public SweepResult sweepPatterns() {
        return patternMiner.sweep();
    }

    /**
     * Skill gaps plus agents that are overloaded or sitting idle.
     */
    public DistributionReport optimizeDistribution() {
        List<Agent> agents = registry.list();
        DispatchProperties.ImprovementProperties config = properties.getImprovements();
        List<SkillGap> gaps = DistributionAnalysis.skillGaps(agents,
                DistributionAnalysis.demandedCapabilities(agents,
                        patternMiner.taskPatterns(), patternMiner.failurePatterns()),
                config.getMinCapabilityCoverage(), config.getMinBestProficiency());

        List<String> overloaded = new ArrayList<>();
        List<String> underutilized = new ArrayList<>();
        DistributionAnalysis.utilizationPercent(agents).forEach((agentId, percent) -> {
            if (percent >= OVERLOADED_PERCENT) {
                overloaded.add(agentId);
            } else if (percent <= UNDERUTILIZED_PERCENT) {
                underutilized.add(agentId);
            }
        });

        List<String> recommendations = new ArrayList<>();
        for (SkillGap gap : gaps) {
            if (gap.reason() == SkillGap.Reason.LOW_COVERAGE) {
                recommendations.add(String.format("Add agents with %s: only %d of %d needed",
                        gap.capability(), gap.coverage(), config.getMinCapabilityCoverage()));
            } else {
                recommendations.add(String.format("Train agents in %s: best proficiency %.2f",
                        gap.capability(), gap.bestProficiency()));
            }
        }
        if (!overloaded.isEmpty() && !underutilized.isEmpty()) {
            recommendations.add("Shift work from " + String.join(", ", overloaded)
                    + " to " + String.join(", ", underutilized));
        } else if (!overloaded.isEmpty()) {
            recommendations.add("Add capacity for " + String.join(", ", overloaded));
        }

        return DistributionReport.builder()
                .timestamp(clock.instant())
                .skillGaps(gaps)
                .overloadedAgents(overloaded)
                .underutilizedAgents(underutilized)
                .recommendations(recommendations)
                .build();
    }

    // --- Messaging ---

    public Mono<AgentMessage> sendMessage(AgentMessage message) {
        return messaging.send(message);
    }

    public Mono<List<AgentMessage>> readMessages(String recipient) {
        return messaging.read(recipient);
    }

    public Flux<AgentMessage> listen(String recipient) {
        return messaging.listen(recipient);
    }

    /**
     * Alert every registered agent except the sender through both delivery paths, then
     * publish once on the emergency channel.
     */
    public Mono<EmergencyBroadcastResult> emergencyBroadcast(String from, String component,
                                                             String status, String actionRequest) {
        String alertId = UUID.randomUUID().toString();
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("alertId", alertId);
        content.put("severity", "CRITICAL");
        content.put("component", component);
        content.put("status", status);
        content.put("actionRequest", actionRequest == null || actionRequest.isBlank()
                ? DEFAULT_EMERGENCY_ACTION : actionRequest);

        List<String> recipients = registry.list().stream()
                .map(Agent::getId)
                .filter(id -> !id.equals(from))
                .collect(Collectors.toList());

        log.warn("Emergency alert {} from {} on {}: {} ({} recipients)",
                alertId, from, component, status, recipients.size());

        return Flux.fromIterable(recipients)
                .concatMap(to -> messaging.send(from, to, MessageType.EMERGENCY_ALERT, new LinkedHashMap<>(content)))
                .then(messaging.publishEmergency(AgentMessage.builder()
                        .id(alertId)
                        .from(from)
                        .to("*")
                        .type(MessageType.EMERGENCY_ALERT)
                        .content(content)
                        .build()))
                .thenReturn(new EmergencyBroadcastResult(alertId, recipients));
    }

    // --- Lifecycle ---

    @EventListener(ApplicationReadyEvent.class)
    public void restoreState() {
        registry.restore()
                .then(patternMiner.restore())
                .then(improvementGenerator.restore())
                .doOnSuccess(count -> metrics.updateSystemLoad(registry.systemLoadPercent()))
                .subscribe(null, e -> log.error("Failed to restore persisted state: {}", e.getMessage(), e));
    }
}
