package com.z254.hivemind.dispatch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Rolling per-agent statistics. Mutated only by the performance tracker.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceMetrics {

    private long tasksCompleted;
    private long tasksFailed;

    /**
     * completed / (completed + failed); 0 before the first outcome.
     */
    private double successRate;

    /**
     * Running mean over every reported outcome, in seconds.
     */
    private double averageCompletionSeconds;

    private Instant lastOutcomeAt;

    public static PerformanceMetrics empty() {
        return new PerformanceMetrics();
    }

    public long getTotalTasks() {
        return tasksCompleted + tasksFailed;
    }

    public Duration getAverageCompletionTime() {
        return Duration.ofMillis(Math.round(averageCompletionSeconds * 1000));
    }

    /**
     * Fold one outcome into the counters and running averages.
     */
    public void record(boolean success, Duration completionTime, Instant at) {
        if (success) {
            tasksCompleted++;
        } else {
            tasksFailed++;
        }
        long total = getTotalTasks();
        successRate = (double) tasksCompleted / total;
        double seconds = completionTime == null ? 0.0 : completionTime.toMillis() / 1000.0;
        averageCompletionSeconds = averageCompletionSeconds + (seconds - averageCompletionSeconds) / total;
        lastOutcomeAt = at;
    }

    public PerformanceMetrics copy() {
        return new PerformanceMetrics(tasksCompleted, tasksFailed, successRate,
                averageCompletionSeconds, lastOutcomeAt);
    }
}
