package com.z254.hivemind.dispatch.learning;

import com.z254.hivemind.dispatch.domain.model.Agent;
import com.z254.hivemind.dispatch.domain.model.FailureCategory;
import com.z254.hivemind.dispatch.domain.model.FailurePattern;
import com.z254.hivemind.dispatch.domain.model.TaskPattern;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of tracker and miner state that improvement rules evaluate.
 *
 * @param agents               registered agents, ordered by id
 * @param taskPatterns         learned success patterns
 * @param failurePatterns      learned failure patterns
 * @param failureTotals        total failure frequency per category
 * @param recentSuccessSeconds completion times of recent successes, oldest first
 * @param generatedAt          evaluation time
 */
public record AnalysisContext(
        List<Agent> agents,
        List<TaskPattern> taskPatterns,
        List<FailurePattern> failurePatterns,
        Map<FailureCategory, Integer> failureTotals,
        List<Double> recentSuccessSeconds,
        Instant generatedAt
) {
}
