package com.z254.hivemind.dispatch.service;

import com.z254.hivemind.dispatch.domain.model.FailureCategory;
import com.z254.hivemind.dispatch.domain.model.PerformanceMetrics;

/**
 * Acknowledgement of a reported outcome.
 *
 * @param failureCategory category assigned by the learning system, null for successes or
 *                        when learning skipped the observation
 * @param learned         false when the learning update failed and was skipped
 */
public record OutcomeReceipt(
        String agentId,
        String taskId,
        boolean success,
        FailureCategory failureCategory,
        PerformanceMetrics metrics,
        int currentLoad,
        boolean learned
) {
}
