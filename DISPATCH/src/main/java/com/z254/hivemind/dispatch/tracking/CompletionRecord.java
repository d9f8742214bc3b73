package com.z254.hivemind.dispatch.tracking;

import java.time.Instant;

/**
 * One entry of the bounded outcome history.
 */
public record CompletionRecord(
        String taskId,
        String agentId,
        boolean success,
        double completionSeconds,
        Instant recordedAt
) {
}
