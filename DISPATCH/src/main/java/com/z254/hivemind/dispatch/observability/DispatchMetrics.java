package com.z254.hivemind.dispatch.observability;

import com.z254.hivemind.dispatch.domain.model.FailureCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for the DISPATCH service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Routing (routed, unroutable, latency)</li>
 *     <li>Outcomes (success, failure by category)</li>
 *     <li>Messaging (sent, broadcast and durable failures)</li>
 *     <li>Learning and improvement runs</li>
 * </ul>
 */
@Component
public class DispatchMetrics {

    private final MeterRegistry meterRegistry;

    @Getter
    private final Counter tasksRouted;
    @Getter
    private final Counter tasksUnroutable;
    private final Timer routingLatency;

    @Getter
    private final Counter outcomesSuccess;
    @Getter
    private final Counter outcomesFailure;
    private final Map<FailureCategory, Counter> failuresByCategory = new ConcurrentHashMap<>();

    @Getter
    private final Counter messagesSent;
    @Getter
    private final Counter broadcastFailures;
    @Getter
    private final Counter durableFailures;

    @Getter
    private final Counter learningErrors;
    @Getter
    private final Counter improvementsGenerated;

    private final AtomicInteger systemLoadPercent;

    public DispatchMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.tasksRouted = Counter.builder("dispatch.tasks.routed")
                .description("Tasks assigned to an agent")
                .register(meterRegistry);
        this.tasksUnroutable = Counter.builder("dispatch.tasks.unroutable")
                .description("Tasks for which no agent was available")
                .register(meterRegistry);
        this.routingLatency = Timer.builder("dispatch.routing.latency")
                .description("Time to score and select an agent")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        this.outcomesSuccess = Counter.builder("dispatch.outcomes.success")
                .description("Successful task outcomes reported")
                .register(meterRegistry);
        this.outcomesFailure = Counter.builder("dispatch.outcomes.failure")
                .description("Failed task outcomes reported")
                .register(meterRegistry);

        this.messagesSent = Counter.builder("dispatch.messages.sent")
                .description("Messages durably delivered")
                .register(meterRegistry);
        this.broadcastFailures = Counter.builder("dispatch.messages.broadcast.failed")
                .description("Best-effort broadcasts that failed")
                .register(meterRegistry);
        this.durableFailures = Counter.builder("dispatch.messages.durable.failed")
                .description("Durable writes that failed after retries")
                .register(meterRegistry);

        this.learningErrors = Counter.builder("dispatch.learning.errors")
                .description("Outcome observations skipped by the learning system")
                .register(meterRegistry);
        this.improvementsGenerated = Counter.builder("dispatch.improvements.generated")
                .description("Architecture improvements emitted")
                .register(meterRegistry);

        this.systemLoadPercent = meterRegistry.gauge("dispatch.system.load", new AtomicInteger(0));
    }

    public Timer.Sample startRoutingTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordRouted(Timer.Sample sample) {
        sample.stop(routingLatency);
        tasksRouted.increment();
    }

    public void recordUnroutable(Timer.Sample sample) {
        sample.stop(routingLatency);
        tasksUnroutable.increment();
    }

    public void recordOutcome(boolean success, FailureCategory category) {
        if (success) {
            outcomesSuccess.increment();
            return;
        }
        outcomesFailure.increment();
        if (category != null) {
            failuresByCategory.computeIfAbsent(category, c -> Counter.builder("dispatch.outcomes.failure.category")
                    .description("Failed outcomes by category")
                    .tag("category", c.getCode())
                    .register(meterRegistry)).increment();
        }
    }

    public void recordMessageSent() {
        messagesSent.increment();
    }

    public void recordBroadcastFailure() {
        broadcastFailures.increment();
    }

    public void recordDurableFailure() {
        durableFailures.increment();
    }

    public void recordLearningError() {
        learningErrors.increment();
    }

    public void recordImprovementsGenerated(int count) {
        improvementsGenerated.increment(count);
    }

    public void updateSystemLoad(double percent) {
        systemLoadPercent.set((int) Math.round(percent));
    }
}
