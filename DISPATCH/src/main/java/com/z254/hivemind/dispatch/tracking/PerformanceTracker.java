package com.z254.hivemind.dispatch.tracking;

import com.z254.hivemind.dispatch.config.DispatchProperties;
import com.z254.hivemind.dispatch.domain.model.Agent;
import com.z254.hivemind.dispatch.registry.AgentRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Per-agent rolling statistics, updated on every reported outcome.
 * <p>
 * The counter, running-mean and load release for one outcome are applied in a single
 * atomic registry update. Bounded histories of recent successes and failures feed the
 * trend and health calculations.
 */
@Component
@Slf4j
public class PerformanceTracker {

    private final AgentRegistry registry;
    private final Clock clock;
    private final int performanceHistorySize;
    private final int failureHistorySize;

    private final Deque<CompletionRecord> successHistory = new ArrayDeque<>();
    private final Deque<CompletionRecord> failureHistory = new ArrayDeque<>();

    public PerformanceTracker(AgentRegistry registry, Clock clock, DispatchProperties properties) {
        this.registry = registry;
        this.clock = clock;
        this.performanceHistorySize = properties.getLearning().getPerformanceHistorySize();
        this.failureHistorySize = properties.getLearning().getFailureHistorySize();
    }

    /**
     * Record an outcome and release the agent's slot.
     *
     * @throws com.z254.hivemind.dispatch.registry.AgentNotFoundException if the agent is unknown
     */
    public TrackedOutcome recordOutcome(String agentId, String taskId, boolean success, Duration completionTime) {
        Instant now = clock.instant();
        int[] loadAtReport = new int[1];
        Agent updated = registry.update(agentId, agent -> {
            loadAtReport[0] = agent.getCurrentLoad();
            agent.getMetrics().record(success, completionTime, now);
            agent.setCurrentLoad(Math.max(0, agent.getCurrentLoad() - 1));
        });

        double seconds = completionTime == null ? 0.0 : completionTime.toMillis() / 1000.0;
        CompletionRecord record = new CompletionRecord(taskId, agentId, success, seconds, now);
        if (success) {
            append(successHistory, record, performanceHistorySize);
        } else {
            append(failureHistory, record, failureHistorySize);
        }

        log.info("Recorded {} outcome for agent {} task {}: success rate {}, load {}/{}",
                success ? "successful" : "failed", agentId, taskId,
                String.format("%.2f", updated.getMetrics().getSuccessRate()),
                updated.getCurrentLoad(), updated.getMaxConcurrentTasks());
        return new TrackedOutcome(updated, loadAtReport[0]);
    }

    /**
     * Completion times of recent successes in seconds, oldest first.
     */
    public List<Double> recentSuccessSeconds() {
        synchronized (successHistory) {
            List<Double> result = new ArrayList<>(successHistory.size());
            for (CompletionRecord record : successHistory) {
                result.add(record.completionSeconds());
            }
            return result;
        }
    }

    public List<CompletionRecord> successHistory() {
        synchronized (successHistory) {
            return List.copyOf(successHistory);
        }
    }

    public List<CompletionRecord> failureHistory() {
        synchronized (failureHistory) {
            return List.copyOf(failureHistory);
        }
    }

    public int successCount() {
        synchronized (successHistory) {
            return successHistory.size();
        }
    }

    public int failureCount() {
        synchronized (failureHistory) {
            return failureHistory.size();
        }
    }

    private static void append(Deque<CompletionRecord> history, CompletionRecord record, int limit) {
        synchronized (history) {
            history.addLast(record);
            while (history.size() > limit) {
                history.removeFirst();
            }
        }
    }
}
